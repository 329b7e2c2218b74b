package org.neuralchilli.symdag.core;

import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.OperatorKind;
import org.neuralchilli.symdag.domain.Rational;

import java.util.List;
import java.util.Optional;

/**
 * Operator semantics over {@link NumericValue}.
 * Exact operands stay exact where a closed form exists; a floating-point
 * operand, or an operator without an exact form (sin, log, ...), gives a double.
 * Rational overflow is not caught here and propagates to the caller.
 */
final class NumericOperations {

    private NumericOperations() {
    }

    /**
     * Apply an operator to already-evaluated operands, in order.
     *
     * @throws EvaluationException on arity mismatch, division by zero or unknown operator
     */
    static NumericValue apply(OperatorKind op, List<NumericValue> operands) {
        checkArity(op, operands.size());

        switch (op) {
            case ADD: {
                NumericValue sum = operands.get(0);
                for (int i = 1; i < operands.size(); i++) {
                    sum = add(sum, operands.get(i));
                }
                return sum;
            }
            case MULTIPLY: {
                NumericValue product = operands.get(0);
                for (int i = 1; i < operands.size(); i++) {
                    product = multiply(product, operands.get(i));
                }
                return product;
            }
            case SUBTRACT:
                return subtract(operands.get(0), operands.get(1));
            case DIVIDE:
                return divide(operands.get(0), operands.get(1));
            case POWER:
                return power(operands.get(0), operands.get(1));
            case NEGATE:
                return negate(operands.get(0));
            case ABS:
                return abs(operands.get(0));
            case SQRT:
                return sqrt(operands.get(0));
            case SIN:
            case COS:
            case TAN:
            case LOG:
            case EXP:
                return NumericValue.of(applyDouble(op, new double[]{operands.get(0).doubleValue()}));
            default:
                throw unknownOperator(op);
        }
    }

    /**
     * Floating-point counterpart of {@link #apply}. ADD and MULTIPLY fold left to right.
     */
    static double applyDouble(OperatorKind op, double[] operands) {
        checkArity(op, operands.length);

        switch (op) {
            case ADD: {
                double sum = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    sum += operands[i];
                }
                return sum;
            }
            case MULTIPLY: {
                double product = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    product *= operands[i];
                }
                return product;
            }
            case SUBTRACT:
                return operands[0] - operands[1];
            case DIVIDE:
                if (operands[1] == 0.0) {
                    throw EvaluationException.divisionByZero();
                }
                return operands[0] / operands[1];
            case POWER:
                return Math.pow(operands[0], operands[1]);
            case NEGATE:
                return -operands[0];
            case SIN:
                return Math.sin(operands[0]);
            case COS:
                return Math.cos(operands[0]);
            case TAN:
                return Math.tan(operands[0]);
            case LOG:
                return Math.log(operands[0]);
            case EXP:
                return Math.exp(operands[0]);
            case SQRT:
                return Math.sqrt(operands[0]);
            case ABS:
                return Math.abs(operands[0]);
            default:
                throw unknownOperator(op);
        }
    }

    static NumericValue add(NumericValue a, NumericValue b) {
        if (a.isExact() && b.isExact()) {
            return NumericValue.of(a.toRational().add(b.toRational()));
        }
        return NumericValue.of(a.doubleValue() + b.doubleValue());
    }

    static NumericValue subtract(NumericValue a, NumericValue b) {
        if (a.isExact() && b.isExact()) {
            return NumericValue.of(a.toRational().subtract(b.toRational()));
        }
        return NumericValue.of(a.doubleValue() - b.doubleValue());
    }

    static NumericValue multiply(NumericValue a, NumericValue b) {
        if (a.isExact() && b.isExact()) {
            return NumericValue.of(a.toRational().multiply(b.toRational()));
        }
        return NumericValue.of(a.doubleValue() * b.doubleValue());
    }

    static NumericValue divide(NumericValue a, NumericValue b) {
        if (b.isZero()) {
            throw EvaluationException.divisionByZero();
        }
        if (a.isExact() && b.isExact()) {
            return NumericValue.of(a.toRational().divide(b.toRational()));
        }
        return NumericValue.of(a.doubleValue() / b.doubleValue());
    }

    /**
     * Exact when the base is exact and the exponent is an exact integer,
     * except 0 to a negative power, which has no exact value.
     */
    static NumericValue power(NumericValue base, NumericValue exponent) {
        NumericValue e = exponent.normalize();
        if (base.isExact() && e instanceof NumericValue.Int integer) {
            if (!(base.isZero() && integer.value() < 0)) {
                return NumericValue.of(base.toRational().pow(integer.value()));
            }
        }
        return NumericValue.of(Math.pow(base.doubleValue(), exponent.doubleValue()));
    }

    static NumericValue negate(NumericValue value) {
        if (value.isExact()) {
            return NumericValue.of(value.toRational().negate());
        }
        return NumericValue.of(-value.doubleValue());
    }

    static NumericValue abs(NumericValue value) {
        if (value.isExact()) {
            return NumericValue.of(value.toRational().abs());
        }
        return NumericValue.of(Math.abs(value.doubleValue()));
    }

    static NumericValue sqrt(NumericValue value) {
        if (value.isExact()) {
            Optional<Rational> root = value.toRational().sqrtExact();
            if (root.isPresent()) {
                return NumericValue.of(root.get());
            }
        }
        return NumericValue.of(Math.sqrt(value.doubleValue()));
    }

    private static void checkArity(OperatorKind op, int operands) {
        if (op == OperatorKind.NONE) {
            throw unknownOperator(op);
        }
        if (!op.acceptsArity(operands)) {
            String expected = op.isUnary() ? "1" : op.isBinary() ? "2" : "at least 1";
            throw EvaluationException.malformed(op.symbol(), expected, operands);
        }
    }

    private static EvaluationException unknownOperator(OperatorKind op) {
        return new EvaluationException(
                EvaluationException.Reason.UNKNOWN_OPERATOR,
                "Unknown operator: " + op,
                op.symbol()
        );
    }
}
