package org.neuralchilli.symdag.domain;

import javax.annotation.Nonnull;

/**
 * Node record stored in an expression graph.
 * Nodes are addressed by id, never by value; the graph owns them exclusively.
 *
 * @param value set only for constants, null otherwise
 */
public record ExpressionNode(
        NodeType type,
        String symbol,
        NumericValue value,
        OperatorKind operator,
        int precedence,
        boolean unary
) {

    public ExpressionNode {
        if (type == null) {
            throw new IllegalArgumentException("Node type cannot be null");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Node symbol cannot be null or empty");
        }
        if (type == NodeType.CONSTANT && value == null) {
            throw new IllegalArgumentException("Constant node requires a value");
        }
        if (operator == null) {
            operator = OperatorKind.NONE;
        }
    }

    public static ExpressionNode variable(String name) {
        return new ExpressionNode(NodeType.VARIABLE, name, null, OperatorKind.NONE, 0, false);
    }

    public static ExpressionNode constant(String symbol, NumericValue value) {
        return new ExpressionNode(NodeType.CONSTANT, symbol, value, OperatorKind.NONE, 0, false);
    }

    public static ExpressionNode operator(OperatorKind op) {
        return new ExpressionNode(
                NodeType.OPERATOR,
                op.symbol(),
                null,
                op,
                op.precedence(),
                op.isUnary()
        );
    }

    public boolean isLeaf() {
        return type.isLeaf();
    }

    public boolean isOperator() {
        return type == NodeType.OPERATOR;
    }

    public boolean isVariable() {
        return type == NodeType.VARIABLE;
    }

    public boolean isConstant() {
        return type == NodeType.CONSTANT;
    }

    @Nonnull
    @Override
    public String toString() {
        return switch (type) {
            case VARIABLE -> "ExpressionNode[var:" + symbol + "]";
            case CONSTANT -> "ExpressionNode[const:" + value.render() + "]";
            case OPERATOR -> "ExpressionNode[op:" + operator + "]";
            case FUNCTION -> "ExpressionNode[fn:" + symbol + "()]";
        };
    }
}
