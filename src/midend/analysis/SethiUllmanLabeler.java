package midend.analysis;

import midend.dag.Node;
import midend.dag.OperationDAG;

/**
 * Sethi-Ullman labels. A leaf costs a register only when it is the leftmost operand of its
 * parent (or the whole expression); any other leaf is used directly as a memory operand.
 * Whether a node is leftmost is a property of the visit, not of the node.
 */
public class SethiUllmanLabeler {
    public int label(OperationDAG dag, Node root) {
        if (root == null) {
            return 0;
        }
        dag.clearLabels();
        return labelSubtree(dag, root, true);
    }

    public int label(OperationDAG dag) {
        return label(dag, dag.getRoot());
    }

    public int labelSubtree(OperationDAG dag, Node node, boolean leftmost) {
        int res;
        switch (node.getTag()) {
            case Variable:
                res = leafLabel(leftmost);
                break;
            case Operation:
                res = labelOperation(dag, node, leftmost);
                break;
            default:
                throw new RuntimeException("Unsupported NodeTag " + node.getTag());
        }
        node.setLabel(res);
        return res;
    }

    private int labelOperation(OperationDAG dag, Node node, boolean leftmost) {
        switch (node.getChildNum()) {
            case 0:
                return leafLabel(leftmost);
            case 1:
                return labelSubtree(dag, dag.getNode(node.getChild(0)), true);
            case 2: {
                int l = labelSubtree(dag, dag.getNode(node.getChild(0)), true);
                int r = labelSubtree(dag, dag.getNode(node.getChild(1)), false);
                return combine(l, r);
            }
            default:
                throw new RuntimeException("operation " + node + " has " + node.getChildNum() + " operands");
        }
    }

    private int leafLabel(boolean leftmost) {
        return leftmost ? 1 : 0;
    }

    public static int combine(int l, int r) {
        return l == r ? l + 1 : Math.max(l, r);
    }
}
