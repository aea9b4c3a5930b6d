package frontend;

public class ErrorHandler {
    static Error checkBalancedParentheses(String text) {
        int depth = 0;
        int lastOpen = -1;
        for (int i = 0; i < text.length(); ++i) {
            char ci = text.charAt(i);
            if (ci == '(') {
                if (depth == 0) {
                    lastOpen = i;
                }
                ++depth;
            } else if (ci == ')') {
                if (depth == 0) {
                    return new Error(Error.ErrorType.SyntaxError, text.substring(0, i + 1),
                            "unmatched ')' at position " + i);
                }
                --depth;
            }
        }
        if (depth != 0) {
            return new Error(Error.ErrorType.SyntaxError, text.substring(lastOpen),
                    "unclosed '(' at position " + lastOpen);
        }
        return null;
    }

    static Error missingOperand(String context, char operator) {
        return new Error(Error.ErrorType.SyntaxError, context, "missing operand for '" + operator + "'");
    }

    static Error unrecognizedToken(String token) {
        return new Error(Error.ErrorType.SyntaxError, token, "unrecognized token");
    }

    public static class Error {
        public enum ErrorType {
            SyntaxError, EmptyInputError, CyclicGraphError
        }

        private final ErrorType type;
        private final String offending;
        private final String message;

        public Error(ErrorType type, String offending, String message) {
            this.type = type;
            this.offending = offending;
            this.message = message;
        }

        public ErrorType getType() {
            return type;
        }

        /**
         * The substring (or node list, for cycles) that triggered the error. Empty when there is
         * nothing to point at.
         */
        public String getOffending() {
            return offending;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            if (offending == null || offending.isEmpty()) {
                return type + ": " + message;
            }
            return type + ": " + message + " in \"" + offending + "\"";
        }
    }

    public static class AnalysisException extends RuntimeException {
        private final Error error;

        public AnalysisException(Error error) {
            super(error.toString());
            this.error = error;
        }

        public Error getError() {
            return error;
        }

        public Error.ErrorType getType() {
            return error.getType();
        }
    }
}
