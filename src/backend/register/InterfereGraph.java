package backend.register;

import java.util.HashMap;
import java.util.HashSet;

/**
 * Undirected conflict graph over node ids: two nodes are linked when their live ranges overlap.
 */
public class InterfereGraph {
    private final HashMap<Integer, HashSet<Integer>> edge = new HashMap<>();
    private int edgeNum = 0;

    public void init() {
        edge.clear();
        edgeNum = 0;
    }

    public void addVertex(int u) {
        edge.computeIfAbsent(u, key -> new HashSet<>());
    }

    public void addEdge(int u, int v) {
        if (u == v || isLinked(u, v)) {
            return;
        }
        edge.computeIfAbsent(u, key -> new HashSet<>()).add(v);
        edge.computeIfAbsent(v, key -> new HashSet<>()).add(u);
        ++edgeNum;
    }

    public HashSet<Integer> getAllAdjacent(int k) {
        return edge.getOrDefault(k, new HashSet<>());
    }

    public HashSet<Integer> getVertices() {
        return new HashSet<>(edge.keySet());
    }

    public int getDegree(int k) {
        return getAllAdjacent(k).size();
    }

    public int getEdgeNum() {
        return edgeNum;
    }

    public boolean isLinked(int a, int b) {
        return edge.containsKey(a) && edge.get(a).contains(b);
    }
}
