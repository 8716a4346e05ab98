package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.types.DataType;
import java.util.List;

/**
 * Arithmetic ({@code + - * /}) and unary ({@code NOT}, {@code IS NULL},
 * {@code IS NOT NULL}) operators.
 *
 * <p>The return type of an arithmetic operator is normally supplied by whoever
 * built the expression; the factory methods derive it from the operands (the
 * widest numeric operand type, or INVALID if an operand is not numeric). Unary
 * operators always return BOOLEAN.
 */
public final class OperatorExpression extends AbstractExpression {

    /**
     * Creates an operator expression.
     *
     * @param operatorType an {@code OPERATOR_*} type
     * @param returnValueType the result type
     * @param operands one operand for unary operators, two for arithmetic
     */
    public OperatorExpression(ExpressionType operatorType, DataType returnValueType,
                              List<AbstractExpression> operands) {
        super(checkType(operatorType), returnValueType, operands);
        int expected = operatorType.isUnaryOperator() ? 1 : 2;
        if (operands.size() != expected) {
            throw new IllegalArgumentException(
                "%s requires %d operand(s), got %d".formatted(operatorType, expected, operands.size()));
        }
        if (operatorType.isUnaryOperator() && returnValueType != DataType.BOOLEAN) {
            throw new IllegalArgumentException(operatorType + " must return boolean");
        }
    }

    private static ExpressionType checkType(ExpressionType type) {
        if (type == null || !(type.isArithmetic() || type.isUnaryOperator())) {
            throw new IllegalArgumentException("not an operator type: " + type);
        }
        return type;
    }

    public static OperatorExpression fromJson(JsonNode doc) {
        ExpressionType type = readType(doc, t -> t.isArithmetic() || t.isUnaryOperator(), "operator");
        String nodeType = type.name();
        DataType returnType = readReturnType(doc, nodeType);
        List<AbstractExpression> operands = readChildren(doc, nodeType);
        try {
            return new OperatorExpression(type, returnType, operands);
        } catch (IllegalArgumentException e) {
            throw invalid(nodeType, e);
        }
    }

    @Override
    public String toString() {
        ExpressionType type = getExpressionType();
        if (type == ExpressionType.OPERATOR_NOT) {
            return "(NOT " + getChild(0) + ")";
        }
        if (type.isUnaryOperator()) {
            return "(" + getChild(0) + " " + type.symbol() + ")";
        }
        return "(%s %s %s)".formatted(getChild(0), type.symbol(), getChild(1));
    }

    /**
     * Derives the result type of an arithmetic operator from its operands.
     */
    private static DataType arithmeticType(AbstractExpression left, AbstractExpression right) {
        DataType l = left.getReturnValueType();
        DataType r = right.getReturnValueType();
        if (!l.isNumeric() || !r.isNumeric()) {
            return DataType.INVALID;
        }
        if (l == DataType.DOUBLE || r == DataType.DOUBLE) return DataType.DOUBLE;
        if (l == DataType.BIGINT || r == DataType.BIGINT) return DataType.BIGINT;
        return DataType.INTEGER;
    }

    // ==================== Factory Methods ====================

    public static OperatorExpression arithmetic(ExpressionType operatorType, AbstractExpression left,
                                                AbstractExpression right) {
        return new OperatorExpression(operatorType, arithmeticType(left, right), List.of(left, right));
    }

    public static OperatorExpression plus(AbstractExpression left, AbstractExpression right) {
        return arithmetic(ExpressionType.OPERATOR_PLUS, left, right);
    }

    public static OperatorExpression multiply(AbstractExpression left, AbstractExpression right) {
        return arithmetic(ExpressionType.OPERATOR_MULTIPLY, left, right);
    }

    public static OperatorExpression not(AbstractExpression operand) {
        return new OperatorExpression(ExpressionType.OPERATOR_NOT, DataType.BOOLEAN, List.of(operand));
    }

    public static OperatorExpression isNull(AbstractExpression operand) {
        return new OperatorExpression(ExpressionType.OPERATOR_IS_NULL, DataType.BOOLEAN, List.of(operand));
    }

    public static OperatorExpression isNotNull(AbstractExpression operand) {
        return new OperatorExpression(ExpressionType.OPERATOR_IS_NOT_NULL, DataType.BOOLEAN, List.of(operand));
    }
}
