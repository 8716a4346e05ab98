package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.types.DataType;
import com.planwright.util.HashUtil;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>The value's Java class must match the declared type (see {@link DataType});
 * a null value is the SQL NULL of that type. Note that a constant {@code TRUE}
 * used as a scan predicate is still a predicate: plan nodes distinguish it from
 * having no predicate at all.
 *
 * <p>Serialized values: booleans and numbers as JSON scalars, VARCHAR as a string,
 * DATE and TIMESTAMP as ISO-8601 strings, NULL as JSON null.
 */
public final class ConstantValueExpression extends AbstractExpression {

    private static final String VALUE = "value";

    private static final List<String> NON_FINITE_DOUBLES = List.of("NaN", "Infinity", "-Infinity");

    private final Object value;

    /**
     * Creates a constant.
     *
     * @param dataType the type of the constant
     * @param value the value (may be null)
     * @throws IllegalArgumentException if the value does not match the type
     */
    public ConstantValueExpression(DataType dataType, Object value) {
        super(ExpressionType.VALUE_CONSTANT, dataType, List.of());
        if (dataType == DataType.INVALID) {
            throw new IllegalArgumentException("constant must have a valid type");
        }
        if (!dataType.accepts(value)) {
            throw new IllegalArgumentException(
                "value of class %s cannot be a %s constant".formatted(value.getClass().getSimpleName(), dataType));
        }
        this.value = value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for SQL NULL
     */
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    protected long hashFields(long seed) {
        if (value == null) {
            return HashUtil.combine(seed, HashUtil.ABSENT);
        }
        return switch (getReturnValueType()) {
            case BOOLEAN -> HashUtil.combine(seed, HashUtil.hash((Boolean) value));
            case INTEGER -> HashUtil.combine(seed, (Integer) value);
            case BIGINT -> HashUtil.combine(seed, (Long) value);
            case DOUBLE -> HashUtil.combine(seed, HashUtil.hash((Double) value));
            case VARCHAR, DATE, TIMESTAMP -> HashUtil.combine(seed, HashUtil.hash(value.toString()));
            case INVALID -> seed;
        };
    }

    @Override
    protected boolean fieldsEqual(AbstractExpression other) {
        return Objects.equals(value, ((ConstantValueExpression) other).value);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        if (value == null) {
            doc.putNull(VALUE);
            return;
        }
        switch (getReturnValueType()) {
            case BOOLEAN -> doc.put(VALUE, (Boolean) value);
            case INTEGER -> doc.put(VALUE, (Integer) value);
            case BIGINT -> doc.put(VALUE, (Long) value);
            case DOUBLE -> doc.put(VALUE, (Double) value);
            case VARCHAR, DATE, TIMESTAMP -> doc.put(VALUE, value.toString());
            case INVALID -> throw new IllegalStateException("constant with invalid type");
        }
    }

    /**
     * Reconstructs a constant from a document. The {@value #VALUE} field is required;
     * an explicit JSON null decodes to SQL NULL.
     *
     * @param doc the document
     * @return the expression
     */
    public static ConstantValueExpression fromJson(JsonNode doc) {
        String nodeType = ExpressionType.VALUE_CONSTANT.name();
        readType(doc, type -> type == ExpressionType.VALUE_CONSTANT, nodeType);
        DataType dataType = readReturnType(doc, nodeType);
        if (dataType == DataType.INVALID) {
            throw PlanDeserializationException.invalidField(nodeType, RETURN_VALUE_TYPE, "a concrete type");
        }
        if (!doc.has(VALUE)) {
            throw PlanDeserializationException.missingField(nodeType, VALUE);
        }
        JsonNode node = doc.get(VALUE);
        if (node.isNull()) {
            return new ConstantValueExpression(dataType, null);
        }
        return new ConstantValueExpression(dataType, decodeValue(node, dataType, nodeType));
    }

    private static Object decodeValue(JsonNode node, DataType dataType, String nodeType) {
        switch (dataType) {
            case BOOLEAN:
                if (node.isBoolean()) return node.booleanValue();
                break;
            case INTEGER:
                if (node.isIntegralNumber() && node.canConvertToInt()) return node.intValue();
                break;
            case BIGINT:
                if (node.isIntegralNumber() && node.canConvertToLong()) return node.longValue();
                break;
            case DOUBLE:
                if (node.isNumber()) return node.doubleValue();
                // Jackson writes non-finite doubles as these tokens
                if (node.isTextual() && NON_FINITE_DOUBLES.contains(node.textValue())) {
                    return Double.valueOf(node.textValue());
                }
                break;
            case VARCHAR:
                if (node.isTextual()) return node.textValue();
                break;
            case DATE:
            case TIMESTAMP:
                if (node.isTextual()) {
                    try {
                        return dataType == DataType.DATE
                            ? LocalDate.parse(node.textValue())
                            : Instant.parse(node.textValue());
                    } catch (DateTimeParseException e) {
                        throw new PlanDeserializationException(PlanDeserializationException.Reason.INVALID_FIELD,
                            nodeType, VALUE, "not an ISO-8601 " + dataType + ": " + node.textValue(), e);
                    }
                }
                break;
            default:
                break;
        }
        throw PlanDeserializationException.invalidField(nodeType, VALUE, "a " + dataType + " value");
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (getReturnValueType() == DataType.VARCHAR) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (getReturnValueType() == DataType.BOOLEAN) {
            return value.toString().toUpperCase();
        }
        return value.toString();
    }

    // ==================== Factory Methods ====================

    public static ConstantValueExpression of(boolean value) {
        return new ConstantValueExpression(DataType.BOOLEAN, value);
    }

    public static ConstantValueExpression of(int value) {
        return new ConstantValueExpression(DataType.INTEGER, value);
    }

    public static ConstantValueExpression of(long value) {
        return new ConstantValueExpression(DataType.BIGINT, value);
    }

    public static ConstantValueExpression of(double value) {
        return new ConstantValueExpression(DataType.DOUBLE, value);
    }

    public static ConstantValueExpression of(String value) {
        return new ConstantValueExpression(DataType.VARCHAR, Objects.requireNonNull(value, "value must not be null"));
    }

    public static ConstantValueExpression of(LocalDate value) {
        return new ConstantValueExpression(DataType.DATE, Objects.requireNonNull(value, "value must not be null"));
    }

    public static ConstantValueExpression of(Instant value) {
        return new ConstantValueExpression(DataType.TIMESTAMP, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Creates a NULL constant of the given type.
     *
     * @param dataType the data type
     * @return the NULL constant
     */
    public static ConstantValueExpression nullValue(DataType dataType) {
        return new ConstantValueExpression(dataType, null);
    }
}
