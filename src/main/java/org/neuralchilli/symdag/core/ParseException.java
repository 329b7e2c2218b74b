package org.neuralchilli.symdag.core;

/**
 * Thrown when expression text cannot be turned into a graph.
 * The graph that was parsing is left cleared, never half-built.
 */
public class ParseException extends ExpressionException {

    public enum Reason {
        /**
         * Token is neither a numeral, a variable name, an operator nor a parenthesis,
         * or parentheses do not balance
         */
        UNKNOWN_TOKEN,

        /**
         * Operator reached with too few operands on the stack
         */
        MISSING_OPERAND,

        /**
         * Input folds to zero or several disconnected expressions
         */
        MULTIPLE_ROOTS
    }

    private final Reason reason;
    private final String token;

    public ParseException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ParseException(Reason reason, String message, String token) {
        super(message);
        this.reason = reason;
        this.token = token;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Offending token, if the failure is tied to one
     */
    public String token() {
        return token;
    }
}
