package org.neuralchilli.symdag.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operators understood by the expression engine.
 * Precedence: additive 1, multiplicative 2, power 3, unary 4. Higher binds tighter.
 */
public enum OperatorKind {
    ADD("+", "+", 1, false),
    SUBTRACT("-", "-", 1, false),
    MULTIPLY("*", "*", 2, false),
    DIVIDE("/", "/", 2, false),
    POWER("^", "^", 3, false),
    NEGATE("-", "neg", 4, true),
    SIN("sin", "sin", 4, true),
    COS("cos", "cos", 4, true),
    TAN("tan", "tan", 4, true),
    LOG("log", "log", 4, true),
    EXP("exp", "exp", 4, true),
    SQRT("sqrt", "sqrt", 4, true),
    ABS("abs", "abs", 4, true),
    NONE("?", "", 0, false);

    private static final Map<String, OperatorKind> BY_TOKEN = Arrays.stream(values())
            .filter(op -> op != NONE)
            .collect(Collectors.toUnmodifiableMap(OperatorKind::token, Function.identity()));

    private final String symbol;
    private final String token;
    private final int precedence;
    private final boolean unary;

    OperatorKind(String symbol, String token, int precedence, boolean unary) {
        this.symbol = symbol;
        this.token = token;
        this.precedence = precedence;
        this.unary = unary;
    }

    /**
     * Operator for a postfix token, or NONE. Unary minus is the token "neg".
     */
    public static OperatorKind fromToken(String token) {
        if (token == null) {
            return NONE;
        }
        return BY_TOKEN.getOrDefault(token, NONE);
    }

    public static boolean isOperatorToken(String token) {
        return fromToken(token) != NONE;
    }

    /**
     * Display symbol (NEGATE shows as "-")
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Lexical token as it appears in postfix output
     */
    public String token() {
        return token;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isUnary() {
        return unary;
    }

    public boolean isBinary() {
        return this == SUBTRACT || this == DIVIDE || this == POWER;
    }

    /**
     * ADD and MULTIPLY accept any number of operands after flattening
     */
    public boolean isVariadic() {
        return this == ADD || this == MULTIPLY;
    }

    public boolean isLeftAssociative() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public boolean isCommutative() {
        return this == ADD || this == MULTIPLY;
    }

    public boolean isAssociative() {
        return this == ADD || this == MULTIPLY;
    }

    /**
     * Check an operand count against this operator's arity.
     */
    public boolean acceptsArity(int operands) {
        if (unary) {
            return operands == 1;
        }
        if (isBinary()) {
            return operands == 2;
        }
        if (isVariadic()) {
            return operands >= 1;
        }
        return false;
    }
}
