package org.neuralchilli.symdag.core;

/**
 * Thrown when an expression nests deeper than the configured limit.
 */
public class ExpressionDepthException extends ExpressionException {

    private final int limit;

    public ExpressionDepthException(int limit) {
        super("Expression nesting exceeds maximum depth of " + limit);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
