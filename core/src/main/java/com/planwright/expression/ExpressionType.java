package com.planwright.expression;

/**
 * Type tag of an expression node.
 *
 * <p>The constant names are written into serialized documents and must not be
 * renamed.
 */
public enum ExpressionType {

    /** Reference to a column of a base table. */
    COLUMN_VALUE("column"),

    /** Literal constant. */
    VALUE_CONSTANT("constant"),

    // Comparison operators
    COMPARE_EQUAL("="),
    COMPARE_NOT_EQUAL("!="),
    COMPARE_LESS_THAN("<"),
    COMPARE_LESS_THAN_OR_EQUAL_TO("<="),
    COMPARE_GREATER_THAN(">"),
    COMPARE_GREATER_THAN_OR_EQUAL_TO(">="),

    // Conjunctions
    CONJUNCTION_AND("AND"),
    CONJUNCTION_OR("OR"),

    // Arithmetic operators
    OPERATOR_PLUS("+"),
    OPERATOR_MINUS("-"),
    OPERATOR_MULTIPLY("*"),
    OPERATOR_DIVIDE("/"),

    // Unary operators
    OPERATOR_NOT("NOT"),
    OPERATOR_IS_NULL("IS NULL"),
    OPERATOR_IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    ExpressionType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this == COMPARE_EQUAL || this == COMPARE_NOT_EQUAL || this == COMPARE_LESS_THAN ||
               this == COMPARE_LESS_THAN_OR_EQUAL_TO || this == COMPARE_GREATER_THAN ||
               this == COMPARE_GREATER_THAN_OR_EQUAL_TO;
    }

    public boolean isConjunction() {
        return this == CONJUNCTION_AND || this == CONJUNCTION_OR;
    }

    public boolean isArithmetic() {
        return this == OPERATOR_PLUS || this == OPERATOR_MINUS ||
               this == OPERATOR_MULTIPLY || this == OPERATOR_DIVIDE;
    }

    public boolean isUnaryOperator() {
        return this == OPERATOR_NOT || this == OPERATOR_IS_NULL || this == OPERATOR_IS_NOT_NULL;
    }

    /**
     * Resolves a serialized expression type name.
     *
     * @param name the constant name
     * @return the expression type, or null if the name is unknown
     */
    public static ExpressionType fromName(String name) {
        for (ExpressionType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return null;
    }
}
