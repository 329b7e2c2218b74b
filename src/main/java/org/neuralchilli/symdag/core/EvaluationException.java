package org.neuralchilli.symdag.core;

/**
 * Thrown when an expression graph cannot be evaluated.
 * Evaluation never mutates the graph, so the instance stays usable.
 */
public class EvaluationException extends ExpressionException {

    public enum Reason {
        EMPTY_EXPRESSION,
        UNBOUND_VARIABLE,
        DIVISION_BY_ZERO,
        MALFORMED_OPERATOR,
        UNKNOWN_OPERATOR
    }

    private final Reason reason;
    private final String symbol;

    public EvaluationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public EvaluationException(Reason reason, String message, String symbol) {
        super(message);
        this.reason = reason;
        this.symbol = symbol;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Variable name or operator symbol involved, may be null
     */
    public String symbol() {
        return symbol;
    }

    static EvaluationException emptyExpression() {
        return new EvaluationException(Reason.EMPTY_EXPRESSION, "No expression parsed");
    }

    static EvaluationException unboundVariable(String name) {
        return new EvaluationException(
                Reason.UNBOUND_VARIABLE,
                "Variable '" + name + "' not found in evaluation context",
                name
        );
    }

    static EvaluationException divisionByZero() {
        return new EvaluationException(Reason.DIVISION_BY_ZERO, "Division by zero", "/");
    }

    static EvaluationException malformed(String symbol, String expected, int actual) {
        return new EvaluationException(
                Reason.MALFORMED_OPERATOR,
                "Operator '" + symbol + "' requires " + expected + " operand(s), got " + actual,
                symbol
        );
    }
}
