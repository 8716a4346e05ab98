package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.types.DataType;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * N-ary AND / OR over two or more boolean operands.
 */
public final class ConjunctionExpression extends AbstractExpression {

    /**
     * Creates a conjunction.
     *
     * @param conjunctionType {@code CONJUNCTION_AND} or {@code CONJUNCTION_OR}
     * @param operands the operands, at least two
     */
    public ConjunctionExpression(ExpressionType conjunctionType, List<AbstractExpression> operands) {
        super(checkType(conjunctionType), DataType.BOOLEAN, operands);
        if (operands.size() < 2) {
            throw new IllegalArgumentException(conjunctionType + " requires at least 2 operands, got " + operands.size());
        }
    }

    private static ExpressionType checkType(ExpressionType type) {
        if (type == null || !type.isConjunction()) {
            throw new IllegalArgumentException("not a conjunction type: " + type);
        }
        return type;
    }

    public static ConjunctionExpression fromJson(JsonNode doc) {
        ExpressionType type = readType(doc, ExpressionType::isConjunction, "conjunction");
        String nodeType = type.name();
        if (readReturnType(doc, nodeType) != DataType.BOOLEAN) {
            throw PlanDeserializationException.invalidField(nodeType, RETURN_VALUE_TYPE, "boolean");
        }
        List<AbstractExpression> operands = readChildren(doc, nodeType);
        try {
            return new ConjunctionExpression(type, operands);
        } catch (IllegalArgumentException e) {
            throw invalid(nodeType, e);
        }
    }

    @Override
    public String toString() {
        return getChildren().stream()
            .map(AbstractExpression::toString)
            .collect(Collectors.joining(" " + getExpressionType().symbol() + " ", "(", ")"));
    }

    // ==================== Factory Methods ====================

    public static ConjunctionExpression and(AbstractExpression... operands) {
        return new ConjunctionExpression(ExpressionType.CONJUNCTION_AND, Arrays.asList(operands));
    }

    public static ConjunctionExpression or(AbstractExpression... operands) {
        return new ConjunctionExpression(ExpressionType.CONJUNCTION_OR, Arrays.asList(operands));
    }
}
