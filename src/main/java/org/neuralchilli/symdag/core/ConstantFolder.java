package org.neuralchilli.symdag.core;

import org.neuralchilli.symdag.domain.ExpressionNode;
import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.OperatorKind;
import org.neuralchilli.symdag.domain.RationalArithmeticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Copies an expression graph into a fresh one, folding constant subexpressions
 * and applying the neutral-element identities (x+0, x*1, x*0, x-0, x/1, 0/x,
 * x^1, x^0). Exact values stay exact.
 * <p>
 * A constant division by zero is never folded, so evaluating the result still
 * reports it.
 */
class ConstantFolder {

    private static final Logger log = LoggerFactory.getLogger(ConstantFolder.class);

    private static final NumericValue ZERO = NumericValue.of(0L);
    private static final NumericValue ONE = NumericValue.of(1L);

    private final ExpressionGraph source;
    private final ExpressionGraph out;
    private final Map<String, String> folded = new HashMap<>();

    ConstantFolder(ExpressionGraph source, ExpressionGraph out) {
        this.source = source;
        this.out = out;
    }

    /**
     * Fold the subexpression rooted at a source id.
     *
     * @return id of the folded node in the output graph
     */
    String fold(String id) {
        String done = folded.get(id);
        if (done != null) {
            return done;
        }

        ExpressionNode node = source.requireNode(id);
        String result;

        if (node.isVariable()) {
            result = out.internVariable(node.symbol());
        } else if (node.isConstant()) {
            result = out.internConstant(node.symbol(), node.value());
        } else {
            List<String> operands = new ArrayList<>();
            for (String child : source.childrenOf(id)) {
                operands.add(fold(child));
            }
            result = foldOperator(node.operator(), operands);
        }

        folded.put(id, result);
        return result;
    }

    private String foldOperator(OperatorKind op, List<String> operands) {
        switch (op) {
            case ADD:
                return foldVariadic(op, operands, ZERO);
            case MULTIPLY:
                return foldVariadic(op, operands, ONE);
            case SUBTRACT:
                return foldSubtract(operands);
            case DIVIDE:
                return foldDivide(operands);
            case POWER:
                return foldPower(operands);
            default:
                if (allConstant(operands)) {
                    return constant(op, operands);
                }
                return out.internOperator(op, operands);
        }
    }

    /**
     * ADD / MULTIPLY: combine every constant operand into one, appended after the
     * remaining operands; drop it when it is the neutral element.
     */
    private String foldVariadic(OperatorKind op, List<String> operands, NumericValue neutral) {
        List<String> flat = new ArrayList<>();
        for (String operand : operands) {
            ExpressionNode node = out.requireNode(operand);
            if (node.operator() == op) {
                flat.addAll(out.childrenOf(operand));
            } else {
                flat.add(operand);
            }
        }

        List<String> rest = new ArrayList<>();
        List<NumericValue> constants = new ArrayList<>();
        for (String operand : flat) {
            NumericValue value = valueOf(operand);
            if (value != null) {
                constants.add(value);
            } else {
                rest.add(operand);
            }
        }

        NumericValue combined = constants.isEmpty() ? neutral : compute(op, constants);

        if (op == OperatorKind.MULTIPLY && combined.isZero()) {
            return out.internConstant(combined);
        }
        if (!isNeutral(combined, neutral)) {
            rest.add(out.internConstant(combined));
        }
        if (rest.isEmpty()) {
            return out.internConstant(combined);
        }
        if (rest.size() == 1) {
            return rest.get(0);
        }
        return out.internOperator(op, rest);
    }

    private String foldSubtract(List<String> operands) {
        NumericValue right = valueOf(operands.get(1));
        if (right != null && right.isZero()) {
            return operands.get(0);
        }
        if (allConstant(operands)) {
            return constant(OperatorKind.SUBTRACT, operands);
        }
        return out.internOperator(OperatorKind.SUBTRACT, operands);
    }

    private String foldDivide(List<String> operands) {
        NumericValue left = valueOf(operands.get(0));
        NumericValue right = valueOf(operands.get(1));

        if (right != null && right.isZero()) {
            return out.internOperator(OperatorKind.DIVIDE, operands);
        }
        if (right != null && isOne(right)) {
            return operands.get(0);
        }
        if (left != null && left.isZero()) {
            return out.internConstant(left);
        }
        if (left != null && right != null) {
            return constant(OperatorKind.DIVIDE, operands);
        }
        return out.internOperator(OperatorKind.DIVIDE, operands);
    }

    private String foldPower(List<String> operands) {
        NumericValue exponent = valueOf(operands.get(1));

        if (exponent != null && isOne(exponent)) {
            return operands.get(0);
        }
        if (exponent != null && exponent.isZero()) {
            return out.internConstant(ONE);
        }
        if (allConstant(operands)) {
            return constant(OperatorKind.POWER, operands);
        }
        return out.internOperator(OperatorKind.POWER, operands);
    }

    private String constant(OperatorKind op, List<String> operands) {
        List<NumericValue> values = operands.stream()
                .map(this::valueOf)
                .toList();
        return out.internConstant(compute(op, values));
    }

    /**
     * Exact where possible. On rational overflow, fold to the value a
     * floating-point evaluation would produce instead.
     */
    private NumericValue compute(OperatorKind op, List<NumericValue> values) {
        try {
            return NumericOperations.apply(op, values).normalize();
        } catch (RationalArithmeticException e) {
            log.debug("Exact folding of {} overflowed, folding in floating point", op);
            double[] doubles = values.stream()
                    .mapToDouble(NumericValue::doubleValue)
                    .toArray();
            return NumericValue.of(NumericOperations.applyDouble(op, doubles));
        }
    }

    private boolean allConstant(List<String> operands) {
        return operands.stream().allMatch(id -> valueOf(id) != null);
    }

    // null when the node is not a constant
    private NumericValue valueOf(String id) {
        ExpressionNode node = out.requireNode(id);
        return node.isConstant() ? node.value() : null;
    }

    private static boolean isOne(NumericValue value) {
        return isNeutral(value, ONE);
    }

    private static boolean isNeutral(NumericValue value, NumericValue neutral) {
        if (value.isExact()) {
            return value.toRational().equals(neutral.toRational());
        }
        return value.doubleValue() == neutral.doubleValue();
    }
}
