package utils;

import midend.dag.OperationDAG;

import java.util.Random;

public class DagSamples {
    /**
     * Dependency graph of
     * <pre>
     * a = 5; b = 7; c = a + b; d = a * c; e = b + d; f = c - e
     * </pre>
     * with an edge from every operand to the value computed from it.
     */
    public static OperationDAG codeFragment() {
        OperationDAG dag = new OperationDAG();
        String[] names = {"a", "b", "c", "d", "e", "f"};
        for (int i = 0; i < names.length; ++i) {
            dag.addNode(i, names[i]);
        }
        dag.addEdge(0, 2);
        dag.addEdge(1, 2);
        dag.addEdge(0, 3);
        dag.addEdge(2, 3);
        dag.addEdge(1, 4);
        dag.addEdge(3, 4);
        dag.addEdge(2, 5);
        dag.addEdge(4, 5);
        return dag;
    }

    public static String[] codeFragmentSource() {
        return new String[]{"a = 5", "b = 7", "c = a + b", "d = a * c", "e = b + d", "f = c - e"};
    }

    /**
     * Random graph on nodes {@code var_0 .. var_{n-1}}; edges only run from lower to higher ids,
     * so the result is acyclic.
     */
    public static OperationDAG random(int numNodes, double edgeProbability, long seed) {
        if (numNodes < 0) {
            throw new IllegalArgumentException("numNodes must be non-negative: " + numNodes);
        }
        if (edgeProbability < 0 || edgeProbability > 1) {
            throw new IllegalArgumentException("edgeProbability must be in [0, 1]: " + edgeProbability);
        }
        Random random = new Random(seed);
        OperationDAG dag = new OperationDAG();
        for (int i = 0; i < numNodes; ++i) {
            dag.addNode(i, "var_" + i);
        }
        for (int i = 0; i < numNodes; ++i) {
            for (int j = i + 1; j < numNodes; ++j) {
                if (random.nextDouble() < edgeProbability) {
                    dag.addEdge(i, j);
                }
            }
        }
        return dag;
    }
}
