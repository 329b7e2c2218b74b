package org.neuralchilli.symdag.domain;

import java.math.BigDecimal;

/**
 * Numeric value carried by constant nodes and produced by exact evaluation.
 * Exactly one of integer, exact rational, or floating point.
 * <p>
 * Promotion: two exact operands give an exact result, any {@link Real}
 * operand makes the result a {@link Real}.
 */
public sealed interface NumericValue permits NumericValue.Int, NumericValue.Exact, NumericValue.Real {

    static NumericValue of(long value) {
        return new Int(value);
    }

    static NumericValue of(Rational value) {
        return new Exact(value).normalize();
    }

    static NumericValue of(double value) {
        return new Real(value);
    }

    double doubleValue();

    boolean isExact();

    /**
     * Exact value as a rational.
     *
     * @throws IllegalStateException for floating-point values
     */
    Rational toRational();

    boolean isZero();

    /**
     * Collapse integral rationals back to {@link Int}.
     */
    NumericValue normalize();

    /**
     * Canonical decimal rendering, used in interning keys.
     */
    String render();

    record Int(long value) implements NumericValue {

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean isExact() {
            return true;
        }

        @Override
        public Rational toRational() {
            return Rational.of(value);
        }

        @Override
        public boolean isZero() {
            return value == 0;
        }

        @Override
        public NumericValue normalize() {
            return this;
        }

        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    record Exact(Rational value) implements NumericValue {

        public Exact {
            if (value == null) {
                throw new IllegalArgumentException("Rational value cannot be null");
            }
        }

        @Override
        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public boolean isExact() {
            return true;
        }

        @Override
        public Rational toRational() {
            return value;
        }

        @Override
        public boolean isZero() {
            return value.isZero();
        }

        @Override
        public NumericValue normalize() {
            return value.isInteger() ? new Int(value.numerator()) : this;
        }

        @Override
        public String render() {
            return value.isInteger() ? Long.toString(value.numerator()) : value.toString();
        }
    }

    record Real(double value) implements NumericValue {

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean isExact() {
            return false;
        }

        @Override
        public Rational toRational() {
            throw new IllegalStateException("Floating-point value " + value + " has no exact form");
        }

        @Override
        public boolean isZero() {
            return value == 0.0;
        }

        @Override
        public NumericValue normalize() {
            return this;
        }

        @Override
        public String render() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            // 0.0 and -0.0 intern to the same constant
            if (value == 0.0) {
                return "0.0";
            }
            String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
    }
}
