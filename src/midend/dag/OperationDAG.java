package midend.dag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Arena of {@link Node}s keyed by id. Children are stored as ids, so a rewrite only overwrites
 * an index slot of the parent.
 * <p>
 * The expression path builds trees (one parent per node) and sets a root. The generic path adds
 * nodes and dependency edges directly and may share nodes between several parents.
 */
public class OperationDAG {
    private final LinkedHashMap<Integer, Node> nodes = new LinkedHashMap<>();
    private int nextId = 0;
    private Integer root = null;

    private int allocateId() {
        return nextId++;
    }

    public Node.Variable newVariable(String name) {
        Node.Variable variable = new Node.Variable(allocateId(), name);
        nodes.put(variable.getId(), variable);
        return variable;
    }

    public Node.Operation newOperation(String symbol, int... children) {
        for (int child : children) {
            if (!nodes.containsKey(child)) {
                throw new RuntimeException("operand " + child + " does not belong to this dag");
            }
        }
        Node.Operation operation = new Node.Operation(allocateId(), symbol);
        for (int child : children) {
            operation.addChild(child);
        }
        nodes.put(operation.getId(), operation);
        return operation;
    }

    /**
     * Adds a caller-numbered node for the generic path. Re-adding an existing id keeps the node
     * and its edges, and fills in the value if the node was created by {@link #addEdge} without one.
     */
    public Node addNode(int id, String value) {
        if (id < 0) {
            throw new IllegalArgumentException("node id must be non-negative: " + id);
        }
        Node existing = nodes.get(id);
        if (existing != null) {
            if (existing.getValue() == null && value != null) {
                existing.setValue(value);
            }
            return existing;
        }
        Node.Variable node = new Node.Variable(id, value);
        nodes.put(id, node);
        nextId = Math.max(nextId, id + 1);
        return node;
    }

    public void addEdge(int from, int to) {
        Node fromNode = nodes.containsKey(from) ? nodes.get(from) : addNode(from, null);
        if (!nodes.containsKey(to)) {
            addNode(to, null);
        }
        if (!fromNode.getChildren().contains(to)) {
            fromNode.addChild(to);
        }
    }

    public Node getNode(int id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new RuntimeException("no node with id " + id);
        }
        return node;
    }

    public Collection<Node> getNodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Node> getChildren(Node node) {
        ArrayList<Node> res = new ArrayList<>();
        for (int child : node.getChildren()) {
            res.add(getNode(child));
        }
        return res;
    }

    public List<Node> getSuccessors(int id) {
        return getChildren(getNode(id));
    }

    public List<Node> getPredecessors(int id) {
        ArrayList<Node> res = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.getChildren().contains(id)) {
                res.add(node);
            }
        }
        return res;
    }

    public Node getRoot() {
        return root == null ? null : getNode(root);
    }

    public boolean hasRoot() {
        return root != null;
    }

    public void setRoot(int id) {
        getNode(id);
        this.root = id;
    }

    public void clearLabels() {
        for (Node node : nodes.values()) {
            node.clearLabel();
        }
    }

    /**
     * Nodes reachable from the root in pre-order, left operand first.
     */
    public List<Node> reachableFromRoot() {
        LinkedHashSet<Node> res = new LinkedHashSet<>();
        if (root != null) {
            collect(getNode(root), res);
        }
        return new ArrayList<>(res);
    }

    private void collect(Node node, LinkedHashSet<Node> res) {
        if (!res.add(node)) {
            return;
        }
        for (int child : node.getChildren()) {
            collect(getNode(child), res);
        }
    }

    private Collection<Node> exportScope() {
        return root == null ? nodes.values() : reachableFromRoot();
    }

    public List<ExportedNode> exportNodes() {
        ArrayList<ExportedNode> res = new ArrayList<>();
        for (Node node : exportScope()) {
            res.add(new ExportedNode(node.getId(), node.getDisplayLabel(), node.getTag().getCategory()));
        }
        return res;
    }

    public List<ExportedEdge> exportEdges() {
        ArrayList<ExportedEdge> res = new ArrayList<>();
        HashSet<Integer> scope = new HashSet<>();
        for (Node node : exportScope()) {
            scope.add(node.getId());
        }
        for (Node node : exportScope()) {
            for (int child : node.getChildren()) {
                if (scope.contains(child)) {
                    res.add(new ExportedEdge(node.getId(), child));
                }
            }
        }
        return res;
    }

    public static class ExportedNode {
        private final int id;
        private final String displayLabel;
        private final String category;

        public ExportedNode(int id, String displayLabel, String category) {
            this.id = id;
            this.displayLabel = displayLabel;
            this.category = category;
        }

        public int getId() {
            return id;
        }

        public String getDisplayLabel() {
            return displayLabel;
        }

        public String getCategory() {
            return category;
        }

        @Override
        public String toString() {
            return "{id=" + id + ", label=" + displayLabel + ", category=" + category + "}";
        }
    }

    public static class ExportedEdge {
        private final int from;
        private final int to;

        public ExportedEdge(int from, int to) {
            this.from = from;
            this.to = to;
        }

        public int getFrom() {
            return from;
        }

        public int getTo() {
            return to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            ExportedEdge that = (ExportedEdge) o;
            return from == that.from && to == that.to;
        }

        @Override
        public int hashCode() {
            return 31 * from + to;
        }

        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }
}
