package backend.register;

import midend.dag.Node;
import midend.dag.OperationDAG;
import utils.DagToposort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Register allocation for an arbitrary dependency graph. Every node lives from its topological
 * level to the deepest level among its descendants; nodes are then coloured first-fit in order
 * of range start. Operator and variable semantics are ignored.
 */
public class LiveRangeAllocator {
    private final InterfereGraph graph = new InterfereGraph();

    public Result allocate(OperationDAG dag) {
        graph.init();
        LinkedHashMap<Integer, Integer> levels = computeLevels(dag);
        LinkedHashMap<Integer, LiveRange> ranges = computeLiveRanges(dag, levels);
        ArrayList<LiveRange> sorted = new ArrayList<>(ranges.values());
        Collections.sort(sorted);

        LinkedHashMap<Integer, Integer> registers = new LinkedHashMap<>();
        ArrayList<String> steps = new ArrayList<>();
        ArrayList<LiveRange> assigned = new ArrayList<>();
        int maxRegister = -1;
        for (LiveRange range : sorted) {
            graph.addVertex(range.getId());
            HashSet<Integer> busy = new HashSet<>();
            for (LiveRange other : assigned) {
                if (range.overlaps(other)) {
                    graph.addEdge(range.getId(), other.getId());
                    busy.add(registers.get(other.getId()));
                }
            }
            int reg = 0;
            while (reg <= maxRegister && busy.contains(reg)) {
                ++reg;
            }
            if (reg > maxRegister) {
                maxRegister = reg;
                steps.add("Node " + range.getId() + " " + range + ": no free register, open R" + reg);
            } else {
                steps.add("Node " + range.getId() + " " + range + ": reuse R" + reg);
            }
            registers.put(range.getId(), reg);
            assigned.add(range);
        }
        return new Result(levels, ranges, registers, maxRegister + 1, steps);
    }

    public InterfereGraph getInterfereGraph() {
        return graph;
    }

    // level = longest path from any source
    public static LinkedHashMap<Integer, Integer> computeLevels(OperationDAG dag) {
        LinkedHashMap<Integer, Integer> levels = new LinkedHashMap<>();
        for (Node node : dag.getNodes()) {
            levels.put(node.getId(), 0);
        }
        for (Node node : DagToposort.dagToposort(dag)) {
            int level = levels.get(node.getId());
            for (int child : node.getChildren()) {
                if (levels.get(child) < level + 1) {
                    levels.put(child, level + 1);
                }
            }
        }
        return levels;
    }

    public static LinkedHashMap<Integer, LiveRange> computeLiveRanges(OperationDAG dag, Map<Integer, Integer> levels) {
        // deepest descendant level per node, -1 when there is no descendant
        HashMap<Integer, Integer> deepest = new HashMap<>();
        ArrayList<Node> order = DagToposort.dagToposort(dag);
        for (int i = order.size() - 1; i >= 0; --i) {
            Node node = order.get(i);
            int res = -1;
            for (int child : node.getChildren()) {
                res = Math.max(res, levels.get(child));
                res = Math.max(res, deepest.get(child));
            }
            deepest.put(node.getId(), res);
        }
        LinkedHashMap<Integer, LiveRange> ranges = new LinkedHashMap<>();
        for (Node node : dag.getNodes()) {
            int start = levels.get(node.getId());
            int end = Math.max(start, deepest.get(node.getId()));
            ranges.put(node.getId(), new LiveRange(node.getId(), start, end));
        }
        return ranges;
    }

    public static class Result {
        private final Map<Integer, Integer> levels;
        private final Map<Integer, LiveRange> liveRanges;
        private final Map<Integer, Integer> registers;
        private final int registerCount;
        private final List<String> steps;

        public Result(Map<Integer, Integer> levels, Map<Integer, LiveRange> liveRanges,
                      Map<Integer, Integer> registers, int registerCount, List<String> steps) {
            this.levels = levels;
            this.liveRanges = liveRanges;
            this.registers = registers;
            this.registerCount = registerCount;
            this.steps = steps;
        }

        public Map<Integer, Integer> getLevels() {
            return levels;
        }

        public Map<Integer, LiveRange> getLiveRanges() {
            return liveRanges;
        }

        public Map<Integer, Integer> getRegisters() {
            return registers;
        }

        public int getRegisterCount() {
            return registerCount;
        }

        public List<String> getSteps() {
            return steps;
        }
    }
}
