package frontend;

import frontend.ErrorHandler.Error;
import midend.dag.Node;
import midend.dag.OperationDAG;
import utils.Config;

/**
 * Splits an infix expression at its rightmost top-level operator, lowest precedence first, so
 * that {@code a-b-c} becomes {@code (a-b)-c}. Every split creates one operation node with the
 * left operand as child 0. Equal subexpressions are not merged.
 * <p>
 * Nesting depth grows with the number of operators, so input longer than
 * {@link Config#maxExpressionLength} characters (after whitespace removal) is rejected.
 */
public class ExpressionParser {
    private static final String MULTIPLICATION_GLYPHS = "×·∗⋅";

    private OperationDAG dag;
    private Error error;
    private String text;

    public Result parse(String input) {
        dag = new OperationDAG();
        error = null;
        if (input == null || input.trim().isEmpty()) {
            return Result.failure(new Error(Error.ErrorType.EmptyInputError, "", "empty expression"));
        }
        text = normalize(input);
        if (text.length() > Config.maxExpressionLength) {
            return Result.failure(new Error(Error.ErrorType.SyntaxError, text.substring(0, 16) + "...",
                    "expression longer than " + Config.maxExpressionLength + " characters"));
        }
        Error unbalanced = ErrorHandler.checkBalancedParentheses(text);
        if (unbalanced != null) {
            return Result.failure(unbalanced);
        }
        Node root = parseRange(0, text.length());
        if (root == null) {
            return Result.failure(error);
        }
        dag.setRoot(root.getId());
        return Result.success(dag);
    }

    static String normalize(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); ++i) {
            char ci = text.charAt(i);
            if (Character.isWhitespace(ci)) {
                continue;
            }
            sb.append(MULTIPLICATION_GLYPHS.indexOf(ci) >= 0 ? '*' : ci);
        }
        return sb.toString();
    }

    // parses text[begin, end)
    private Node parseRange(int begin, int end) {
        if (begin == end) {
            error = new Error(Error.ErrorType.SyntaxError, "", "missing operand");
            return null;
        }
        int split = findSplit(begin, end, '+', '-');
        if (split < 0) {
            split = findSplit(begin, end, '*', '/');
        }
        if (split >= 0) {
            return parseOperation(begin, end, split);
        }
        if (text.charAt(begin) == '(' && matchingClose(begin, end) == end - 1) {
            if (end - begin == 2) {
                error = new Error(Error.ErrorType.SyntaxError, text.substring(begin, end), "empty parentheses");
                return null;
            }
            return parseRange(begin + 1, end - 1);
        }
        if (isToken(begin, end)) {
            return dag.newVariable(text.substring(begin, end));
        }
        error = ErrorHandler.unrecognizedToken(text.substring(begin, end));
        return null;
    }

    private Node parseOperation(int begin, int end, int split) {
        char operator = text.charAt(split);
        if (split == begin || split == end - 1) {
            error = ErrorHandler.missingOperand(text.substring(begin, end), operator);
            return null;
        }
        Node left = parseRange(begin, split);
        if (left == null) {
            return null;
        }
        Node right = parseRange(split + 1, end);
        if (right == null) {
            return null;
        }
        return dag.newOperation(String.valueOf(operator), left.getId(), right.getId());
    }

    private int findSplit(int begin, int end, char op1, char op2) {
        int depth = 0;
        for (int i = end - 1; i >= begin; --i) {
            char ci = text.charAt(i);
            if (ci == ')') {
                ++depth;
            } else if (ci == '(') {
                --depth;
            } else if (depth == 0 && (ci == op1 || ci == op2)) {
                return i;
            }
        }
        return -1;
    }

    private int matchingClose(int begin, int end) {
        int depth = 0;
        for (int i = begin; i < end; ++i) {
            char ci = text.charAt(i);
            if (ci == '(') {
                ++depth;
            } else if (ci == ')') {
                --depth;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private boolean isToken(int begin, int end) {
        if (end - begin == 1) {
            return true;
        }
        for (int i = begin; i < end; ++i) {
            if (!isIdent(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean isIdent(char c) {
        return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || ('0' <= c && c <= '9') || c == '_';
    }

    public static class Result {
        private final OperationDAG dag;
        private final Error error;

        private Result(OperationDAG dag, Error error) {
            this.dag = dag;
            this.error = error;
        }

        static Result success(OperationDAG dag) {
            return new Result(dag, null);
        }

        static Result failure(Error error) {
            return new Result(null, error);
        }

        public boolean isOk() {
            return error == null;
        }

        public OperationDAG getDag() {
            return dag;
        }

        public Node getRoot() {
            return dag == null ? null : dag.getRoot();
        }

        public Error getError() {
            return error;
        }

        public OperationDAG getOrThrow() {
            if (error != null) {
                throw new ErrorHandler.AnalysisException(error);
            }
            return dag;
        }
    }
}
