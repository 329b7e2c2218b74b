package org.neuralchilli.symdag.domain;

/**
 * Thrown when exact rational arithmetic cannot produce a representable result.
 * Extends ArithmeticException so callers already guarding numeric code keep working.
 */
public class RationalArithmeticException extends ArithmeticException {

    public enum Reason {
        ARITHMETIC_OVERFLOW,
        DIVISION_BY_ZERO
    }

    private final Reason reason;

    public RationalArithmeticException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RationalArithmeticException(Reason reason, String message, Throwable cause) {
        super(message);
        this.reason = reason;
        initCause(cause);
    }

    public Reason reason() {
        return reason;
    }

    static RationalArithmeticException overflow(String operation, Throwable cause) {
        return new RationalArithmeticException(
                Reason.ARITHMETIC_OVERFLOW,
                "Overflow in rational " + operation,
                cause
        );
    }

    static RationalArithmeticException divisionByZero() {
        return new RationalArithmeticException(Reason.DIVISION_BY_ZERO, "Division by zero");
    }
}
