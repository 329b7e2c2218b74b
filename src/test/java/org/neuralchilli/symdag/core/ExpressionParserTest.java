package org.neuralchilli.symdag.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    private List<String> postfix(String expression) {
        return parser.toPostfix(parser.tokenize(expression));
    }

    @Test
    void shouldSplitOnOperatorsAndWhitespace() {
        assertThat(parser.tokenize("2+3*x")).containsExactly("2", "+", "3", "*", "x");
        assertThat(parser.tokenize(" sin( theta ) ")).containsExactly("sin", "(", "theta", ")");
        assertThat(parser.tokenize("3.14 * r ^ 2")).containsExactly("3.14", "*", "r", "^", "2");
        assertThat(parser.tokenize("")).isEmpty();
        assertThat(parser.tokenize("   ")).isEmpty();
    }

    @Test
    void shouldKeepUnknownCharactersInsideTokens() {
        assertThat(parser.tokenize("2 $ 3")).containsExactly("2", "$", "3");
        assertThat(parser.tokenize("2x+1")).containsExactly("2x", "+", "1");
    }

    @Test
    void shouldRespectPrecedence() {
        assertThat(postfix("2 + 3 * 4")).containsExactly("2", "3", "4", "*", "+");
        assertThat(postfix("2 * 3 + 4 * 5")).containsExactly("2", "3", "*", "4", "5", "*", "+");
        assertThat(postfix("(2 + 3) * 4")).containsExactly("2", "3", "+", "4", "*");
    }

    @Test
    void shouldAssociateSubtractionLeft() {
        assertThat(postfix("a - b - c")).containsExactly("a", "b", "-", "c", "-");
        assertThat(postfix("a / b / c")).containsExactly("a", "b", "/", "c", "/");
    }

    @Test
    void shouldAssociatePowerRight() {
        assertThat(postfix("2 ^ 3 ^ 2")).containsExactly("2", "3", "2", "^", "^");
    }

    @Test
    void shouldRecognizeUnaryMinus() {
        assertThat(postfix("-x")).containsExactly("x", "neg");
        assertThat(postfix("2 - -3")).containsExactly("2", "3", "neg", "-");
        assertThat(postfix("(-x)")).containsExactly("x", "neg");
        assertThat(postfix("2 * -x")).containsExactly("2", "x", "neg", "*");
    }

    @Test
    void shouldTreatMinusAfterClosingParenthesisAsBinary() {
        assertThat(postfix("(a) - b")).containsExactly("a", "b", "-");
    }

    @Test
    void shouldApplyFunctionsAfterTheirArgument() {
        assertThat(postfix("sin(x) + 1")).containsExactly("x", "sin", "1", "+");
        assertThat(postfix("sin x")).containsExactly("x", "sin");
        assertThat(postfix("sqrt(9 / 4)")).containsExactly("9", "4", "/", "sqrt");
        assertThat(postfix("abs(x + y) ^ 2 ^ 3"))
                .containsExactly("x", "y", "+", "abs", "2", "3", "^", "^");
    }

    @Test
    void shouldRejectUnknownTokens() {
        assertThatThrownBy(() -> postfix("2 $ 3"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.reason()).isEqualTo(ParseException.Reason.UNKNOWN_TOKEN);
                    assertThat(pe.token()).isEqualTo("$");
                });

        assertThatThrownBy(() -> postfix("2x + 1"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("2x");
    }

    @Test
    void shouldRejectUnbalancedParentheses() {
        assertThatThrownBy(() -> postfix("(2 + 3"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("never closed")
                .satisfies(e -> assertThat(((ParseException) e).reason())
                        .isEqualTo(ParseException.Reason.UNKNOWN_TOKEN));

        assertThatThrownBy(() -> postfix("2 + 3)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("without matching")
                .satisfies(e -> assertThat(((ParseException) e).reason())
                        .isEqualTo(ParseException.Reason.UNKNOWN_TOKEN));
    }

    @Test
    void shouldProduceEmptyOutputForEmptyParentheses() {
        assertThat(postfix("()")).isEmpty();
    }
}
