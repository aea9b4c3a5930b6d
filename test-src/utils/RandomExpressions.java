package utils;

import midend.dag.Node;
import midend.dag.OperationDAG;

import java.util.Map;
import java.util.Random;

/**
 * Random infix expressions over the variables {@code a..f} and an evaluator for the parsed form.
 */
public class RandomExpressions {
    public static final String VARIABLES = "abcdef";

    public static String generate(Random random, int depth, String operators) {
        if (depth == 0 || random.nextInt(4) == 0) {
            return String.valueOf(VARIABLES.charAt(random.nextInt(VARIABLES.length())));
        }
        char op = operators.charAt(random.nextInt(operators.length()));
        return "(" + generate(random, depth - 1, operators) + op + generate(random, depth - 1, operators) + ")";
    }

    public static long evaluate(OperationDAG dag, Node node, Map<String, Long> env) {
        if (node.getChildNum() == 0) {
            return env.get(node.getValue());
        }
        long l = evaluate(dag, dag.getNode(node.getChild(0)), env);
        long r = evaluate(dag, dag.getNode(node.getChild(1)), env);
        switch (node.getValue()) {
            case "+":
                return l + r;
            case "-":
                return l - r;
            case "*":
                return l * r;
            default:
                throw new RuntimeException("unsupported operator " + node.getValue());
        }
    }
}
