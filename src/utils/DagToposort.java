package utils;

import frontend.ErrorHandler;
import midend.dag.Node;
import midend.dag.OperationDAG;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.Queue;
import java.util.StringJoiner;

public class DagToposort {
    /**
     * Kahn's algorithm over the child edges, seeded with the in-degree-zero nodes in creation
     * order. Fails with {@code CyclicGraphError} when some nodes can never be released.
     */
    public static ArrayList<Node> dagToposort(OperationDAG dag) {
        HashMap<Integer, Integer> inDegree = new HashMap<>();
        for (Node node : dag.getNodes()) {
            inDegree.putIfAbsent(node.getId(), 0);
            for (int child : node.getChildren()) {
                inDegree.merge(child, 1, Integer::sum);
            }
        }
        ArrayList<Node> res = new ArrayList<>();
        Queue<Node> q = new LinkedList<>();
        for (Node node : dag.getNodes()) {
            if (inDegree.get(node.getId()) == 0) {
                q.add(node);
            }
        }
        while (!q.isEmpty()) {
            Node node = q.poll();
            res.add(node);
            for (int child : node.getChildren()) {
                int degree = inDegree.merge(child, -1, Integer::sum);
                if (degree == 0) {
                    q.add(dag.getNode(child));
                }
            }
        }
        if (res.size() != dag.size()) {
            StringJoiner stuck = new StringJoiner(", ");
            for (Node node : dag.getNodes()) {
                if (inDegree.get(node.getId()) > 0) {
                    stuck.add(String.valueOf(node.getId()));
                }
            }
            throw new ErrorHandler.AnalysisException(new ErrorHandler.Error(
                    ErrorHandler.Error.ErrorType.CyclicGraphError, stuck.toString(), "graph contains a cycle"));
        }
        return res;
    }
}
