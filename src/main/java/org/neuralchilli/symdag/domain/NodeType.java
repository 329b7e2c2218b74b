package org.neuralchilli.symdag.domain;

/**
 * Kind of node in an expression graph.
 */
public enum NodeType {
    /**
     * Named variable, resolved at evaluation time (x, theta)
     */
    VARIABLE,

    /**
     * Numeric literal (2, 0.5)
     */
    CONSTANT,

    /**
     * Operator applied to ordered operands (+, neg, sin)
     */
    OPERATOR,

    /**
     * Reserved for user-defined functions, never produced by the parser
     */
    FUNCTION;

    public boolean isLeaf() {
        return this == VARIABLE || this == CONSTANT;
    }
}
