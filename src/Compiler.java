import backend.CodeGenerator;
import backend.register.LiveRangeAllocator;
import frontend.ErrorHandler;
import frontend.ExpressionParser;
import frontend.GraphReader;
import midend.MidendRunner;
import midend.dag.EmitDag;
import midend.dag.Node;
import midend.dag.OperationDAG;
import utils.Config;
import utils.DagSamples;
import utils.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;

public class Compiler {
    private static String expression = null;
    private static String graphFile = null;
    private static boolean example = false;
    private static int randomNodes = -1;
    private static double randomEdgeProbability = Config.randomDagEdgeProbability;
    private static boolean rearrange = Config.rearrange;
    private static String outputFile = Config.outputFileName;

    public static void main(String[] args) throws IOException {
        ErrorHandler.Error argError = parseArgs(args);
        if (argError != null) {
            Logger.printError(Config.errorOutputFileName, argError);
            System.exit(1);
        }
        try {
            if (graphFile != null || example || randomNodes >= 0) {
                runGraph();
            } else {
                runExpression();
            }
        } catch (ErrorHandler.AnalysisException e) {
            Logger.printError(Config.errorOutputFileName, e.getError());
            System.exit(1);
        }
    }

    private static void runExpression() throws IOException {
        String text = expression != null ? expression : readFirstLine(Config.inputFileName);
        ExpressionParser.Result parsed = new ExpressionParser().parse(text);
        if (!parsed.isOk()) {
            Logger.printError(Config.errorOutputFileName, parsed.getError());
            System.exit(1);
        }
        OperationDAG dag = parsed.getDag();
        MidendRunner midend = new MidendRunner();
        Node root = midend.run(dag, rearrange);
        CodeGenerator.Result code = new CodeGenerator().generate(dag, root);
        report(Logger.expressionReport(dag, midend.getLabelBefore(), midend.getRewriteCount(), code), dag, null);
    }

    private static void runGraph() throws IOException {
        OperationDAG dag;
        if (graphFile != null) {
            try (InputStream is = new BufferedInputStream(new FileInputStream(graphFile))) {
                dag = new GraphReader(is).read();
            }
        } else if (example) {
            dag = DagSamples.codeFragment();
        } else {
            dag = DagSamples.random(randomNodes, randomEdgeProbability, Config.randomDagSeed);
        }
        LiveRangeAllocator.Result result = new LiveRangeAllocator().allocate(dag);
        ArrayList<String> lines = new ArrayList<>();
        if (example) {
            lines.add("Code fragment:");
            for (String s : DagSamples.codeFragmentSource()) {
                lines.add(s);
            }
            lines.add("");
        }
        lines.addAll(Logger.allocationReport(result));
        report(lines, dag, result.getRegisters());
    }

    private static void report(ArrayList<String> lines, OperationDAG dag, Map<Integer, Integer> registers) throws IOException {
        Logger.printLines(lines);
        Logger.printLines(outputFile, lines);
        if (Config.emitDag) {
            new EmitDag(Config.dagFileName).run(dag, registers);
        }
    }

    private static String readFirstLine(String path) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            return line == null ? "" : line;
        }
    }

    // returns the first malformed argument as an error, or null
    static ErrorHandler.Error parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-e") && i + 1 < args.length) {
                expression = args[++i];
            } else if (arg.equals("-g") && i + 1 < args.length) {
                graphFile = args[++i];
            } else if (arg.equals("-example")) {
                example = true;
            } else if (arg.equals("-random")) {
                randomNodes = Config.randomDagNodes;
                if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    String value = args[++i];
                    try {
                        randomNodes = Integer.parseInt(value);
                        if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                            value = args[++i];
                            randomEdgeProbability = Double.parseDouble(value);
                        }
                    } catch (NumberFormatException e) {
                        return new ErrorHandler.Error(ErrorHandler.Error.ErrorType.SyntaxError, value,
                                "-random expects <nodes> <probability>");
                    }
                    if (randomNodes < 0 || !(randomEdgeProbability >= 0 && randomEdgeProbability <= 1)) {
                        return new ErrorHandler.Error(ErrorHandler.Error.ErrorType.SyntaxError, value,
                                "-random expects a non-negative node count and a probability in [0, 1]");
                    }
                }
            } else if (arg.equals("-no-rearrange")) {
                rearrange = false;
            } else if (arg.equals("-o") && i + 1 < args.length) {
                outputFile = args[++i];
            } else {
                System.err.println("ignoring unknown argument " + arg);
            }
        }
        return null;
    }
}
