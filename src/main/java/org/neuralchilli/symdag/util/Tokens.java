package org.neuralchilli.symdag.util;

import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.Rational;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Lexical classification of expression tokens.
 */
public final class Tokens {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?(?=[.]?\\d)\\d*(\\.\\d*)?");
    private static final Pattern VARIABLE_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // Decimal numerals up to this many digits (and scale) become exact rationals
    private static final int MAX_EXACT_DIGITS = 18;

    private Tokens() {
    }

    /**
     * Optional leading '-', digits and at most one '.', with at least one digit.
     * Example: "3", "-2.5", ".5", "5."
     */
    public static boolean isNumber(String token) {
        return token != null && NUMBER_PATTERN.matcher(token).matches();
    }

    /**
     * Letter or underscore followed by letters, digits or underscores
     */
    public static boolean isVariable(String token) {
        return token != null && VARIABLE_PATTERN.matcher(token).matches();
    }

    public static boolean isOperatorChar(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '^';
    }

    public static boolean isParenthesis(char c) {
        return c == '(' || c == ')';
    }

    /**
     * Convert a numeral to its constant value.
     * Integers that fit a long stay integers, short decimals become exact
     * rationals ("0.1" is 1/10), anything else falls back to a double.
     *
     * @throws NumberFormatException if the token is not a numeral
     */
    public static NumericValue parseNumber(String token) {
        if (!isNumber(token)) {
            throw new NumberFormatException("Not a numeral: " + token);
        }

        if (token.indexOf('.') < 0) {
            try {
                return NumericValue.of(Long.parseLong(token));
            } catch (NumberFormatException e) {
                return NumericValue.of(Double.parseDouble(token));
            }
        }

        BigDecimal decimal = new BigDecimal(token);
        if (decimal.precision() <= MAX_EXACT_DIGITS
                && decimal.scale() >= 0
                && decimal.scale() <= MAX_EXACT_DIGITS) {
            long numerator = decimal.unscaledValue().longValueExact();
            long denominator = BigInteger.TEN.pow(decimal.scale()).longValueExact();
            return NumericValue.of(Rational.of(numerator, denominator));
        }

        return NumericValue.of(decimal.doubleValue());
    }
}
