package midend;

import midend.analysis.SethiUllmanLabeler;
import midend.dag.Node;
import midend.dag.OperationDAG;
import midend.pass.DAGRearranger;

public class MidendRunner {
    private int labelBefore = 0;
    private int labelAfter = 0;
    private int rewriteCount = 0;

    public Node run(OperationDAG dag, boolean rearrange) {
        Node root = dag.getRoot();
        labelBefore = new SethiUllmanLabeler().label(dag, root);
        labelAfter = labelBefore;
        rewriteCount = 0;
        if (rearrange && root != null) {
            DAGRearranger rearranger = new DAGRearranger();
            root = rearranger.rearrange(dag, root);
            dag.setRoot(root.getId());
            rewriteCount = rearranger.getRewriteCount();
            labelAfter = root.getLabel();
            assert labelAfter <= labelBefore : "rearrangement increased the label from " + labelBefore + " to " + labelAfter;
        }
        return root;
    }

    public int getLabelBefore() {
        return labelBefore;
    }

    public int getLabelAfter() {
        return labelAfter;
    }

    public int getRewriteCount() {
        return rewriteCount;
    }
}
