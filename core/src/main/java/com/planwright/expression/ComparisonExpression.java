package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.types.DataType;
import java.util.List;

/**
 * Binary comparison ({@code =, !=, <, <=, >, >=}) producing a BOOLEAN.
 */
public final class ComparisonExpression extends AbstractExpression {

    /**
     * Creates a comparison.
     *
     * @param comparisonType one of the {@code COMPARE_*} types
     * @param left the left operand
     * @param right the right operand
     */
    public ComparisonExpression(ExpressionType comparisonType, AbstractExpression left, AbstractExpression right) {
        this(comparisonType, List.of(left, right));
    }

    private ComparisonExpression(ExpressionType comparisonType, List<AbstractExpression> operands) {
        super(checkType(comparisonType), DataType.BOOLEAN, operands);
        if (operands.size() != 2) {
            throw new IllegalArgumentException(comparisonType + " requires exactly 2 operands, got " + operands.size());
        }
    }

    private static ExpressionType checkType(ExpressionType type) {
        if (type == null || !type.isComparison()) {
            throw new IllegalArgumentException("not a comparison type: " + type);
        }
        return type;
    }

    public AbstractExpression getLeft() {
        return getChild(0);
    }

    public AbstractExpression getRight() {
        return getChild(1);
    }

    /**
     * Reconstructs a comparison from a document.
     *
     * @param doc the document
     * @return the expression
     */
    public static ComparisonExpression fromJson(JsonNode doc) {
        ExpressionType type = readType(doc, ExpressionType::isComparison, "comparison");
        String nodeType = type.name();
        if (readReturnType(doc, nodeType) != DataType.BOOLEAN) {
            throw PlanDeserializationException.invalidField(nodeType, RETURN_VALUE_TYPE, "boolean");
        }
        List<AbstractExpression> operands = readChildren(doc, nodeType);
        try {
            return new ComparisonExpression(type, operands);
        } catch (IllegalArgumentException e) {
            throw invalid(nodeType, e);
        }
    }

    @Override
    public String toString() {
        return "(%s %s %s)".formatted(getLeft(), getExpressionType().symbol(), getRight());
    }

    // ==================== Factory Methods ====================

    public static ComparisonExpression equal(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_EQUAL, left, right);
    }

    public static ComparisonExpression notEqual(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_NOT_EQUAL, left, right);
    }

    public static ComparisonExpression lessThan(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_LESS_THAN, left, right);
    }

    public static ComparisonExpression lessThanOrEqual(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_LESS_THAN_OR_EQUAL_TO, left, right);
    }

    public static ComparisonExpression greaterThan(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_GREATER_THAN, left, right);
    }

    public static ComparisonExpression greaterThanOrEqual(AbstractExpression left, AbstractExpression right) {
        return new ComparisonExpression(ExpressionType.COMPARE_GREATER_THAN_OR_EQUAL_TO, left, right);
    }
}
