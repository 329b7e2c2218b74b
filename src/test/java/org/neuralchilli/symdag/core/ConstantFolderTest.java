package org.neuralchilli.symdag.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.symdag.domain.ExpressionNode;
import org.neuralchilli.symdag.domain.NodeType;
import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.Rational;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConstantFolderTest {

    private static ExpressionGraph simplify(String expression) {
        return ExpressionGraph.of(expression).simplify();
    }

    private static ExpressionNode rootNode(ExpressionGraph graph) {
        return graph.getNode(graph.getRoot().orElseThrow()).orElseThrow();
    }

    @Test
    void shouldFoldConstantExpressionToSingleNode() {
        ExpressionGraph simplified = simplify("2 + 3 * 4");

        assertThat(simplified.size()).isEqualTo(1);
        assertThat(simplified.getConstants()).containsExactly("14");
        assertThat(simplified.evaluate()).isEqualTo(14.0);
    }

    @Test
    void shouldKeepFoldedFractionsExact() {
        ExpressionGraph simplified = simplify("1 / 3 + 1 / 6");

        assertThat(simplified.getConstants()).containsExactly("1/2");
        assertThat(simplified.evaluateExact()).isEqualTo(NumericValue.of(Rational.of(1, 2)));
    }

    @Test
    void shouldFoldNegation() {
        ExpressionGraph simplified = simplify("-(2)");

        assertThat(simplified.getConstants()).containsExactly("-2");
    }

    @Test
    void shouldDropNeutralElements() {
        assertThat(rootNode(simplify("x + 0")).symbol()).isEqualTo("x");
        assertThat(rootNode(simplify("x * 1")).symbol()).isEqualTo("x");
        assertThat(rootNode(simplify("x - 0")).symbol()).isEqualTo("x");
        assertThat(rootNode(simplify("x / 1")).symbol()).isEqualTo("x");
        assertThat(rootNode(simplify("x ^ 1")).symbol()).isEqualTo("x");

        assertThat(simplify("x + 0").size()).isEqualTo(1);
        assertThat(rootNode(simplify("x + 0")).type()).isEqualTo(NodeType.VARIABLE);
    }

    @Test
    void shouldCollapseAbsorbingElements() {
        assertThat(simplify("x * 0").evaluate()).isEqualTo(0.0);
        assertThat(simplify("0 / x").evaluate()).isEqualTo(0.0);
        assertThat(simplify("x ^ 0").evaluate()).isEqualTo(1.0);

        assertThat(rootNode(simplify("x * 0")).isConstant()).isTrue();
    }

    @Test
    void shouldCombineConstantsAcrossFlattenedSums() {
        ExpressionGraph simplified = simplify("(x + 1) + 2");

        assertThat(simplified.getOperators()).containsExactly("+");
        assertThat(simplified.getConstants()).containsExactly("3");
        assertThat(simplified.evaluate(Map.of("x", 1.0))).isEqualTo(4.0);
    }

    @Test
    void shouldAppendCombinedConstantAfterRemainingOperands() {
        ExpressionGraph simplified = simplify("2 * x * 3");
        String root = simplified.getRoot().orElseThrow();

        assertThat(simplified.childrenOf(root))
                .extracting(id -> simplified.getNode(id).orElseThrow().symbol())
                .containsExactly("x", "6");
    }

    @Test
    void shouldLeaveDivisionByZeroInPlace() {
        ExpressionGraph simplified = simplify("1 / 0");

        assertThat(simplified.getOperators()).containsExactly("/");
        assertThatThrownBy(simplified::evaluate)
                .isInstanceOf(EvaluationException.class)
                .satisfies(e -> assertThat(((EvaluationException) e).reason())
                        .isEqualTo(EvaluationException.Reason.DIVISION_BY_ZERO));
    }

    @Test
    void shouldTreatFloatingPointZeroAsNeutral() {
        ExpressionGraph simplified = simplify("sin(0) + x");

        assertThat(simplified.size()).isEqualTo(1);
        assertThat(rootNode(simplified).symbol()).isEqualTo("x");
    }

    @Test
    void shouldFallBackToDoubleOnExactOverflow() {
        ExpressionGraph simplified = simplify("2 ^ 100 * x");

        assertThat(simplified.getConstants()).hasSize(1);
        assertThat(simplified.evaluate(Map.of("x", 1.0))).isEqualTo(Math.pow(2, 100));
    }

    @Test
    void shouldPreserveSharing() {
        ExpressionGraph simplified = simplify("(x + 1) * (x + 1)");

        assertThat(simplified.size()).isEqualTo(4);
        assertThat(simplified.evaluate(Map.of("x", 2.0))).isEqualTo(9.0);
    }

    @Test
    void shouldLeaveSourceGraphUntouched() {
        ExpressionGraph graph = ExpressionGraph.of("x * 1 + 2 * 3");
        int before = graph.size();

        ExpressionGraph simplified = graph.simplify();

        assertThat(graph.size()).isEqualTo(before);
        assertThat(simplified).isNotSameAs(graph);
        assertThat(simplified.evaluate(Map.of("x", 5.0))).isEqualTo(graph.evaluate(Map.of("x", 5.0)));
    }

    @Test
    void shouldRefuseToSimplifyEmptyGraph() {
        assertThatThrownBy(() -> new ExpressionGraph().simplify())
                .isInstanceOf(EvaluationException.class)
                .satisfies(e -> assertThat(((EvaluationException) e).reason())
                        .isEqualTo(EvaluationException.Reason.EMPTY_EXPRESSION));
    }
}
