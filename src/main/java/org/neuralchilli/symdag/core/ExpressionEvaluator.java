package org.neuralchilli.symdag.core;

import org.neuralchilli.symdag.domain.ExpressionNode;
import org.neuralchilli.symdag.domain.NodeType;
import org.neuralchilli.symdag.domain.NumericValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates expression graphs depth-first from the root.
 * Operands are visited in each node's stored order, never the DAG's edge order.
 * A shared subexpression is evaluated once per call.
 * <p>
 * Variables resolve against the built-in constants first (pi, PI, e, tau, TAU),
 * then against the caller's bindings.
 */
public class ExpressionEvaluator {

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "PI", Math.PI,
            "e", Math.E,
            "tau", 2 * Math.PI,
            "TAU", 2 * Math.PI
    );

    /**
     * Check if a name is a built-in constant, which bindings cannot override
     */
    public static boolean isBuiltinConstant(String name) {
        return CONSTANTS.containsKey(name);
    }

    public double evaluate(ExpressionGraph graph, Map<String, Double> bindings) {
        String root = graph.requireRoot();
        Map<String, Double> vars = bindings != null ? bindings : Map.of();
        return evaluateNode(graph, root, vars, new HashMap<>());
    }

    public NumericValue evaluateExact(ExpressionGraph graph, Map<String, NumericValue> bindings) {
        String root = graph.requireRoot();
        Map<String, NumericValue> vars = bindings != null ? bindings : Map.of();
        return evaluateNodeExact(graph, root, vars, new HashMap<>()).normalize();
    }

    private double evaluateNode(
            ExpressionGraph graph,
            String id,
            Map<String, Double> bindings,
            Map<String, Double> memo
    ) {
        Double cached = memo.get(id);
        if (cached != null) {
            return cached;
        }

        ExpressionNode node = graph.requireNode(id);
        double result;

        if (node.type() == NodeType.VARIABLE) {
            result = resolve(node.symbol(), bindings);
        } else if (node.type() == NodeType.CONSTANT) {
            result = node.value().doubleValue();
        } else {
            checkOperator(node);
            List<String> children = graph.childrenOf(id);
            double[] operands = new double[children.size()];
            for (int i = 0; i < operands.length; i++) {
                operands[i] = evaluateNode(graph, children.get(i), bindings, memo);
            }
            result = NumericOperations.applyDouble(node.operator(), operands);
        }

        memo.put(id, result);
        return result;
    }

    private NumericValue evaluateNodeExact(
            ExpressionGraph graph,
            String id,
            Map<String, NumericValue> bindings,
            Map<String, NumericValue> memo
    ) {
        NumericValue cached = memo.get(id);
        if (cached != null) {
            return cached;
        }

        ExpressionNode node = graph.requireNode(id);
        NumericValue result;

        if (node.type() == NodeType.VARIABLE) {
            result = resolveExact(node.symbol(), bindings);
        } else if (node.type() == NodeType.CONSTANT) {
            result = node.value();
        } else {
            checkOperator(node);
            List<NumericValue> operands = graph.childrenOf(id).stream()
                    .map(child -> evaluateNodeExact(graph, child, bindings, memo))
                    .toList();
            result = NumericOperations.apply(node.operator(), operands);
        }

        memo.put(id, result);
        return result;
    }

    private double resolve(String name, Map<String, Double> bindings) {
        Double constant = CONSTANTS.get(name);
        if (constant != null) {
            return constant;
        }
        Double bound = bindings.get(name);
        if (bound == null) {
            throw EvaluationException.unboundVariable(name);
        }
        return bound;
    }

    private NumericValue resolveExact(String name, Map<String, NumericValue> bindings) {
        Double constant = CONSTANTS.get(name);
        if (constant != null) {
            return NumericValue.of(constant);
        }
        NumericValue bound = bindings.get(name);
        if (bound == null) {
            throw EvaluationException.unboundVariable(name);
        }
        return bound;
    }

    private void checkOperator(ExpressionNode node) {
        if (node.type() != NodeType.OPERATOR) {
            throw new EvaluationException(
                    EvaluationException.Reason.UNKNOWN_OPERATOR,
                    "Cannot evaluate node of type " + node.type() + ": " + node.symbol(),
                    node.symbol()
            );
        }
    }
}
