package utils;

import backend.CodeGenerator;
import backend.register.LiveRange;
import backend.register.LiveRangeAllocator;
import frontend.ErrorHandler;
import midend.dag.Node;
import midend.dag.OperationDAG;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class Logger {
    public static ArrayList<String> allocationReport(LiveRangeAllocator.Result result) {
        ArrayList<String> res = new ArrayList<>();
        res.add("Node Levels:");
        for (Map.Entry<Integer, Integer> e : new TreeMap<>(result.getLevels()).entrySet()) {
            res.add("Node " + e.getKey() + ": Level " + e.getValue());
        }
        res.add("");
        res.add("Live Ranges:");
        for (Map.Entry<Integer, LiveRange> e : new TreeMap<>(result.getLiveRanges()).entrySet()) {
            res.add("Node " + e.getKey() + ": Start at level " + e.getValue().getStart()
                    + ", End at level " + e.getValue().getEnd());
        }
        res.add("");
        res.add("Allocation Steps:");
        res.addAll(result.getSteps());
        res.add("");
        res.add("Register Allocation:");
        for (Map.Entry<Integer, Integer> e : new TreeMap<>(result.getRegisters()).entrySet()) {
            res.add("Node " + e.getKey() + " -> Register R" + e.getValue());
        }
        res.add("");
        res.add("Minimum number of registers required: " + result.getRegisterCount());
        return res;
    }

    public static ArrayList<String> expressionReport(OperationDAG dag, int labelBefore, int rewrites,
                                                     CodeGenerator.Result code) {
        ArrayList<String> res = new ArrayList<>();
        res.add("Labels:");
        for (Node node : dag.reachableFromRoot()) {
            res.add(node + ": " + node.getLabel());
        }
        res.add("");
        res.add("Three-Address Code:");
        res.addAll(code.getThreeAddressCode());
        res.add("");
        res.add("Register Trace:");
        res.addAll(code.getRegisterTrace());
        res.add("");
        if (rewrites > 0) {
            res.add("Rearrangement: " + rewrites + " rewrite(s), label " + labelBefore + " -> " + dag.getRoot().getLabel());
        }
        res.add("Minimum number of registers required: " + dag.getRoot().getLabel());
        return res;
    }

    public static void printLines(List<String> lines) {
        for (String s : lines) {
            System.out.println(s);
        }
    }

    public static void printLines(String path, List<String> lines) {
        File file = new File(path);
        try {
            FileOutputStream fos = new FileOutputStream(file);
            OutputStreamWriter osw = new OutputStreamWriter(fos, StandardCharsets.UTF_8);
            BufferedWriter writer = new BufferedWriter(osw);
            for (String s : lines) {
                writer.append(s).append("\n");
            }
            writer.flush();
            writer.close();
            osw.close();
            fos.close();
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    public static void printError(String path, ErrorHandler.Error error) {
        System.err.println(error);
        ArrayList<String> lines = new ArrayList<>();
        lines.add(error.toString());
        printLines(path, lines);
    }
}
