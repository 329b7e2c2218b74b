package org.neuralchilli.symdag.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.symdag.config.EngineConfig;
import org.neuralchilli.symdag.core.ExpressionException;
import org.neuralchilli.symdag.core.ExpressionGraph;
import org.neuralchilli.symdag.domain.DagStatistics;
import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Function;

/**
 * Entry point for callers that want configured expression graphs.
 * Every call builds its own graph, so the service holds no mutable state
 * and can be shared.
 */
@ApplicationScoped
public class ExpressionService {

    private static final Logger log = LoggerFactory.getLogger(ExpressionService.class);

    @Inject
    EngineConfig config;

    /**
     * Parse text into a new graph using the configured depth limit.
     *
     * @throws org.neuralchilli.symdag.core.ParseException if the text is malformed
     */
    public ExpressionGraph parse(String expression) {
        return withGraph(expression, graph -> graph);
    }

    /**
     * Parse and evaluate in floating point.
     */
    public double evaluate(String expression, Map<String, Double> bindings) {
        return withGraph(expression, graph -> graph.evaluate(bindings));
    }

    /**
     * Parse and evaluate, keeping exact values exact.
     */
    public NumericValue evaluateExact(String expression, Map<String, NumericValue> bindings) {
        return withGraph(expression, graph -> graph.evaluateExact(bindings));
    }

    public ExpressionGraph canonicalize(String expression) {
        return withGraph(expression, ExpressionGraph::canonicalize);
    }

    public ExpressionGraph simplify(String expression) {
        return withGraph(expression, ExpressionGraph::simplify);
    }

    public DagStatistics statistics(String expression) {
        return withGraph(expression, ExpressionGraph::getStatistics);
    }

    /**
     * Approximate a double with the configured tolerance and denominator bound.
     */
    public Rational toRational(double value) {
        return Rational.fromDouble(
                value,
                config.rational().epsilon(),
                config.rational().maxDenominator()
        );
    }

    private <T> T withGraph(String expression, Function<ExpressionGraph, T> action) {
        log.debug("Processing expression: {}", expression);

        try {
            ExpressionGraph graph = new ExpressionGraph(config.maxDepth());
            graph.parse(expression);
            return action.apply(graph);
        } catch (ExpressionException | ArithmeticException e) {
            log.warn("Expression '{}' failed: {}", expression, e.getMessage());
            throw e;
        }
    }
}
