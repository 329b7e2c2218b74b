package org.neuralchilli.symdag.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorKindTest {

    @Test
    void shouldResolvePostfixTokens() {
        assertThat(OperatorKind.fromToken("+")).isEqualTo(OperatorKind.ADD);
        assertThat(OperatorKind.fromToken("-")).isEqualTo(OperatorKind.SUBTRACT);
        assertThat(OperatorKind.fromToken("neg")).isEqualTo(OperatorKind.NEGATE);
        assertThat(OperatorKind.fromToken("^")).isEqualTo(OperatorKind.POWER);
        assertThat(OperatorKind.fromToken("sqrt")).isEqualTo(OperatorKind.SQRT);
    }

    @Test
    void shouldReturnNoneForUnknownTokens() {
        assertThat(OperatorKind.fromToken("SIN")).isEqualTo(OperatorKind.NONE);
        assertThat(OperatorKind.fromToken("foo")).isEqualTo(OperatorKind.NONE);
        assertThat(OperatorKind.fromToken("")).isEqualTo(OperatorKind.NONE);
        assertThat(OperatorKind.fromToken(null)).isEqualTo(OperatorKind.NONE);
        assertThat(OperatorKind.isOperatorToken("x")).isFalse();
        assertThat(OperatorKind.isOperatorToken("cos")).isTrue();
    }

    @Test
    void shouldOrderPrecedence() {
        assertThat(OperatorKind.ADD.precedence()).isEqualTo(1);
        assertThat(OperatorKind.SUBTRACT.precedence()).isEqualTo(1);
        assertThat(OperatorKind.MULTIPLY.precedence()).isEqualTo(2);
        assertThat(OperatorKind.DIVIDE.precedence()).isEqualTo(2);
        assertThat(OperatorKind.POWER.precedence()).isEqualTo(3);
        assertThat(OperatorKind.NEGATE.precedence()).isEqualTo(4);
        assertThat(OperatorKind.LOG.precedence()).isEqualTo(4);
    }

    @Test
    void shouldDescribeAssociativity() {
        assertThat(OperatorKind.POWER.isRightAssociative()).isTrue();
        assertThat(OperatorKind.POWER.isLeftAssociative()).isFalse();
        assertThat(OperatorKind.SUBTRACT.isLeftAssociative()).isTrue();
        assertThat(OperatorKind.NEGATE.isLeftAssociative()).isFalse();

        assertThat(OperatorKind.ADD.isCommutative()).isTrue();
        assertThat(OperatorKind.MULTIPLY.isAssociative()).isTrue();
        assertThat(OperatorKind.SUBTRACT.isCommutative()).isFalse();
        assertThat(OperatorKind.POWER.isAssociative()).isFalse();
    }

    @Test
    void shouldCheckArity() {
        assertThat(OperatorKind.ADD.acceptsArity(3)).isTrue();
        assertThat(OperatorKind.ADD.acceptsArity(0)).isFalse();
        assertThat(OperatorKind.DIVIDE.acceptsArity(2)).isTrue();
        assertThat(OperatorKind.DIVIDE.acceptsArity(3)).isFalse();
        assertThat(OperatorKind.SIN.acceptsArity(1)).isTrue();
        assertThat(OperatorKind.SIN.acceptsArity(2)).isFalse();
        assertThat(OperatorKind.NONE.acceptsArity(1)).isFalse();
    }

    @Test
    void shouldDisplayNegationAsMinus() {
        assertThat(OperatorKind.NEGATE.symbol()).isEqualTo("-");
        assertThat(OperatorKind.NEGATE.token()).isEqualTo("neg");
        assertThat(OperatorKind.NEGATE.isUnary()).isTrue();
    }
}
