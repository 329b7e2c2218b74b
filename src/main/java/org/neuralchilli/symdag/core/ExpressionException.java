package org.neuralchilli.symdag.core;

/**
 * Base class for failures while building or evaluating an expression graph.
 * Provides clear error messages with context.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
