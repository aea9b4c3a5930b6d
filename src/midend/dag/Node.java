package midend.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public abstract class Node {
    private final int id;
    private String value;
    private final ArrayList<Integer> children = new ArrayList<>();
    private Integer label = null;
    public final NodeTag tag;

    protected Node(int id, String value, NodeTag tag) {
        this.id = id;
        this.value = value;
        this.tag = tag;
    }

    public enum NodeTag {
        Variable("variable"), Operation("operation");

        private final String category;

        NodeTag(String category) {
            this.category = category;
        }

        public String getCategory() {
            return category;
        }
    }

    public int getId() {
        return id;
    }

    public String getValue() {
        return value;
    }

    void setValue(String value) {
        this.value = value;
    }

    public NodeTag getTag() {
        return tag;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildNum() {
        return children.size();
    }

    public int getChild(int index) {
        if (index < 0 || index >= children.size()) {
            throw new RuntimeException("getChild index out of bounds");
        }
        return children.get(index);
    }

    public void setChild(int index, int childId) {
        if (index < 0 || index >= children.size()) {
            throw new RuntimeException("setChild index out of bounds");
        }
        children.set(index, childId);
    }

    void addChild(int childId) {
        children.add(childId);
    }

    public void swapChildren() {
        if (children.size() != 2) {
            throw new RuntimeException("swapChildren on a node with " + children.size() + " children");
        }
        int left = children.get(0);
        children.set(0, children.get(1));
        children.set(1, left);
    }

    public boolean isLabeled() {
        return label != null;
    }

    /**
     * Sethi-Ullman label of the subtree rooted here; fails if the labeler has not visited this node yet.
     */
    public int getLabel() {
        if (label == null) {
            throw new RuntimeException("node " + id + " has not been labeled");
        }
        return label;
    }

    public void setLabel(int label) {
        this.label = label;
    }

    public void clearLabel() {
        this.label = null;
    }

    public String getDisplayLabel() {
        return value == null ? String.valueOf(id) : value;
    }

    @Override
    public String toString() {
        return tag + "#" + id + "(" + getDisplayLabel() + ")";
    }

    public static class Variable extends Node {
        public Variable(int id, String name) {
            super(id, name, NodeTag.Variable);
        }
    }

    public static class Operation extends Node {
        public Operation(int id, String symbol) {
            super(id, symbol, NodeTag.Operation);
        }
    }
}
