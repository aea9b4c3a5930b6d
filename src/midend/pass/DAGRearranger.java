package midend.pass;

import midend.analysis.SethiUllmanLabeler;
import midend.dag.Node;
import midend.dag.OperationDAG;

/**
 * Greedy local rewrite of commutative and associative operators guided by Sethi-Ullman labels.
 * Each node gets at most one regrouping per pass and only through its left operand, so the
 * result is not guaranteed to be register-optimal.
 */
public class DAGRearranger {
    private final SethiUllmanLabeler labeler = new SethiUllmanLabeler();
    private int rewriteCount = 0;

    public Node rearrange(OperationDAG dag, Node root) {
        rewriteCount = 0;
        if (root == null) {
            return null;
        }
        labeler.label(dag, root);
        visit(dag, root, true);
        labeler.label(dag, root);
        return root;
    }

    public Node rearrange(OperationDAG dag) {
        return rearrange(dag, dag.getRoot());
    }

    public int getRewriteCount() {
        return rewriteCount;
    }

    private void visit(OperationDAG dag, Node node, boolean leftmost) {
        for (int i = 0; i < node.getChildNum(); ++i) {
            visit(dag, dag.getNode(node.getChild(i)), i == 0);
        }
        if (node.getTag() != Node.NodeTag.Operation || node.getChildNum() != 2
                || !(node.getValue().equals("+") || node.getValue().equals("*"))) {
            return;
        }
        Node lhs = dag.getNode(node.getChild(0));
        Node rhs = dag.getNode(node.getChild(1));
        if (rhs.getLabel() > lhs.getLabel()) {
            node.swapChildren();
            ++rewriteCount;
            labeler.labelSubtree(dag, node, leftmost);
            lhs = dag.getNode(node.getChild(0));
            rhs = dag.getNode(node.getChild(1));
        }
        if (lhs.getTag() == Node.NodeTag.Operation && lhs.getChildNum() == 2
                && lhs.getValue().equals(node.getValue())) {
            regroup(dag, node, lhs, rhs, leftmost);
        }
    }

    // (A op B) op C  =>  A op (B op C)
    private void regroup(OperationDAG dag, Node node, Node lhs, Node rhs, boolean leftmost) {
        Node a = dag.getNode(lhs.getChild(0));
        Node b = dag.getNode(lhs.getChild(1));
        Node candidate = dag.newOperation(node.getValue(), b.getId(), rhs.getId());
        int candidateLabel = labeler.labelSubtree(dag, candidate, false);
        int before = Math.max(lhs.getLabel(), rhs.getLabel());
        int after = Math.max(a.getLabel(), candidateLabel);
        if (after < before) {
            node.setChild(0, a.getId());
            node.setChild(1, candidate.getId());
            ++rewriteCount;
        }
        // a rejected candidate stays in the arena unreferenced but has overwritten the label of B
        labeler.labelSubtree(dag, node, leftmost);
    }
}
