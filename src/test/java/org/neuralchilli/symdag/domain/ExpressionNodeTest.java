package org.neuralchilli.symdag.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExpressionNodeTest {

    @Test
    void shouldCreateVariable() {
        ExpressionNode node = ExpressionNode.variable("x");

        assertThat(node.type()).isEqualTo(NodeType.VARIABLE);
        assertThat(node.symbol()).isEqualTo("x");
        assertThat(node.value()).isNull();
        assertThat(node.operator()).isEqualTo(OperatorKind.NONE);
        assertThat(node.isLeaf()).isTrue();
        assertThat(node.isVariable()).isTrue();
    }

    @Test
    void shouldCreateConstant() {
        ExpressionNode node = ExpressionNode.constant("0.5", NumericValue.of(Rational.of(1, 2)));

        assertThat(node.isConstant()).isTrue();
        assertThat(node.isLeaf()).isTrue();
        assertThat(node.symbol()).isEqualTo("0.5");
        assertThat(node.value().toRational()).isEqualTo(Rational.of(1, 2));
        assertThat(node).hasToString("ExpressionNode[const:1/2]");
    }

    @Test
    void shouldCopyOperatorMetadata() {
        ExpressionNode node = ExpressionNode.operator(OperatorKind.NEGATE);

        assertThat(node.isOperator()).isTrue();
        assertThat(node.isLeaf()).isFalse();
        assertThat(node.symbol()).isEqualTo("-");
        assertThat(node.precedence()).isEqualTo(4);
        assertThat(node.unary()).isTrue();
        assertThat(node).hasToString("ExpressionNode[op:NEGATE]");
    }

    @Test
    void shouldRejectInvalidNodes() {
        assertThatThrownBy(() -> new ExpressionNode(null, "x", null, null, 0, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("type");

        assertThatThrownBy(() -> ExpressionNode.variable(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("symbol");

        assertThatThrownBy(() -> ExpressionNode.constant("1", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a value");
    }

    @Test
    void shouldDefaultMissingOperatorToNone() {
        ExpressionNode node = new ExpressionNode(NodeType.VARIABLE, "y", null, null, 0, false);

        assertThat(node.operator()).isEqualTo(OperatorKind.NONE);
    }
}
