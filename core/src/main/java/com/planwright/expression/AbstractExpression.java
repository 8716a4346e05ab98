package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.json.JsonDocuments;
import com.planwright.types.DataType;
import com.planwright.util.HashUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Base class for all expressions referenced by plan nodes.
 *
 * <p>Expressions are immutable trees. Each node carries an {@link ExpressionType}
 * tag, the {@link DataType} of the value it produces and an ordered list of
 * children. Plan nodes hold expressions by shared reference: the same predicate
 * tree may be referenced by a cached plan and a running execution at once.
 *
 * <p>The family is closed. Consumers that need variant-specific data check
 * {@link #getExpressionType()} and downcast; the only leaf variant plan nodes
 * inspect is {@link ColumnValueExpression}.
 *
 * <p>Identity operations ({@link #hash()}, {@link #equals(Object)},
 * {@link #toJson()}) are structural and cover the tag, the return type, every
 * child and the variant's own fields.
 */
public abstract sealed class AbstractExpression
    permits ColumnValueExpression, ConstantValueExpression, ComparisonExpression,
            ConjunctionExpression, OperatorExpression {

    /** Reserved discriminant field of an expression document. */
    public static final String EXPRESSION_TYPE = "expression_type";
    static final String RETURN_VALUE_TYPE = "return_value_type";
    static final String CHILDREN = "children";

    private final ExpressionType expressionType;
    private final DataType returnValueType;
    private final List<AbstractExpression> children;

    /**
     * Creates an expression node.
     *
     * @param expressionType the type tag
     * @param returnValueType the type of the produced value
     * @param children the child expressions (copied)
     */
    protected AbstractExpression(ExpressionType expressionType, DataType returnValueType,
                                 List<AbstractExpression> children) {
        this.expressionType = Objects.requireNonNull(expressionType, "expressionType must not be null");
        this.returnValueType = Objects.requireNonNull(returnValueType, "returnValueType must not be null");
        Objects.requireNonNull(children, "children must not be null");
        for (AbstractExpression child : children) {
            Objects.requireNonNull(child, "child expression must not be null");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public ExpressionType getExpressionType() {
        return expressionType;
    }

    public DataType getReturnValueType() {
        return returnValueType;
    }

    /**
     * Returns the child expressions.
     *
     * @return an unmodifiable list of children
     */
    public List<AbstractExpression> getChildren() {
        return children;
    }

    public AbstractExpression getChild(int index) {
        return children.get(index);
    }

    public int getChildrenSize() {
        return children.size();
    }

    // ==================== Identity ====================

    /**
     * Computes a deterministic structural hash of this expression tree.
     *
     * @return the hash
     */
    public long hash() {
        long h = HashUtil.hash(expressionType);
        h = HashUtil.combine(h, HashUtil.hash(returnValueType));
        h = HashUtil.combineAll(h, children, AbstractExpression::hash);
        return hashFields(h);
    }

    /**
     * Folds variant-specific fields into the hash.
     *
     * @param seed the hash of the common fields
     * @return the combined hash
     */
    protected long hashFields(long seed) {
        return seed;
    }

    /**
     * Compares variant-specific fields. Called only when {@code other} has the same
     * expression type, return type and children as this expression.
     *
     * @param other the other expression
     * @return true if the variant fields are equal
     */
    protected boolean fieldsEqual(AbstractExpression other) {
        return true;
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AbstractExpression)) return false;
        AbstractExpression that = (AbstractExpression) obj;
        return expressionType == that.expressionType &&
               returnValueType == that.returnValueType &&
               getClass() == that.getClass() &&
               children.equals(that.children) &&
               fieldsEqual(that);
    }

    @Override
    public final int hashCode() {
        return Long.hashCode(hash());
    }

    // ==================== Serialization ====================

    /**
     * Serializes this expression tree into a document.
     *
     * @return the document
     */
    public ObjectNode toJson() {
        ObjectNode doc = JsonDocuments.newDocument();
        doc.put(EXPRESSION_TYPE, expressionType.name());
        doc.put(RETURN_VALUE_TYPE, returnValueType.typeName());
        ArrayNode childDocs = doc.putArray(CHILDREN);
        for (AbstractExpression child : children) {
            childDocs.add(child.toJson());
        }
        writeFields(doc);
        return doc;
    }

    /**
     * Writes variant-specific fields after the common ones.
     *
     * @param doc the document being built
     */
    protected void writeFields(ObjectNode doc) {
    }

    /**
     * Reconstructs an expression tree from a document, dispatching on its
     * {@value #EXPRESSION_TYPE} field.
     *
     * @param doc the document
     * @return the expression
     * @throws PlanDeserializationException if the document is not a valid expression
     */
    public static AbstractExpression fromJson(JsonNode doc) {
        String typeName = JsonDocuments.requireText(doc, EXPRESSION_TYPE, "expression");
        ExpressionType type = ExpressionType.fromName(typeName);
        if (type == null) {
            throw PlanDeserializationException.unknownType(typeName, EXPRESSION_TYPE);
        }
        return switch (type) {
            case COLUMN_VALUE -> ColumnValueExpression.fromJson(doc);
            case VALUE_CONSTANT -> ConstantValueExpression.fromJson(doc);
            case COMPARE_EQUAL, COMPARE_NOT_EQUAL, COMPARE_LESS_THAN, COMPARE_LESS_THAN_OR_EQUAL_TO,
                 COMPARE_GREATER_THAN, COMPARE_GREATER_THAN_OR_EQUAL_TO -> ComparisonExpression.fromJson(doc);
            case CONJUNCTION_AND, CONJUNCTION_OR -> ConjunctionExpression.fromJson(doc);
            case OPERATOR_PLUS, OPERATOR_MINUS, OPERATOR_MULTIPLY, OPERATOR_DIVIDE,
                 OPERATOR_NOT, OPERATOR_IS_NULL, OPERATOR_IS_NOT_NULL -> OperatorExpression.fromJson(doc);
        };
    }

    /**
     * Reads and validates the common header of a variant document.
     *
     * @param doc the document
     * @param accepted predicate on the tag for the variant being reconstructed
     * @param variant the variant name used in error messages
     * @return the expression type
     */
    static ExpressionType readType(JsonNode doc, Predicate<ExpressionType> accepted,
                                   String variant) {
        String typeName = JsonDocuments.requireText(doc, EXPRESSION_TYPE, variant);
        ExpressionType type = ExpressionType.fromName(typeName);
        if (type == null) {
            throw PlanDeserializationException.unknownType(typeName, EXPRESSION_TYPE);
        }
        if (!accepted.test(type)) {
            throw PlanDeserializationException.typeMismatch(variant, typeName, EXPRESSION_TYPE);
        }
        return type;
    }

    static DataType readReturnType(JsonNode doc, String nodeType) {
        String name = JsonDocuments.requireText(doc, RETURN_VALUE_TYPE, nodeType);
        try {
            return DataType.fromTypeName(name);
        } catch (IllegalArgumentException e) {
            throw new PlanDeserializationException(PlanDeserializationException.Reason.INVALID_FIELD,
                nodeType, RETURN_VALUE_TYPE, "unsupported data type '" + name + "'", e);
        }
    }

    static List<AbstractExpression> readChildren(JsonNode doc, String nodeType) {
        ArrayNode childDocs = JsonDocuments.requireArray(doc, CHILDREN, nodeType);
        List<AbstractExpression> result = new ArrayList<>(childDocs.size());
        for (JsonNode childDoc : childDocs) {
            result.add(fromJson(childDoc));
        }
        return result;
    }

    /**
     * Wraps a constructor failure while decoding into a deserialization error.
     */
    static PlanDeserializationException invalid(String nodeType, IllegalArgumentException cause) {
        return new PlanDeserializationException(PlanDeserializationException.Reason.INVALID_FIELD,
            nodeType, CHILDREN, cause.getMessage(), cause);
    }
}
