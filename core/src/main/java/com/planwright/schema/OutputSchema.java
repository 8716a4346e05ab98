package com.planwright.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.expression.AbstractExpression;
import com.planwright.json.JsonDocuments;
import com.planwright.types.DataType;
import com.planwright.util.HashUtil;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Describes the columns a plan node produces.
 *
 * <p>Each output column has a name, a type and the expression that computes it
 * from the node's input. Column order is significant: it is the physical order of
 * the node's output tuples.
 */
public final class OutputSchema {

    private static final String NODE_TYPE = "output_schema";
    private static final String COLUMNS = "columns";
    private static final String NAME = "name";
    private static final String TYPE = "type";
    private static final String EXPR = "expr";

    /**
     * One output column.
     *
     * @param name the column name
     * @param type the column type
     * @param expr the expression producing the column
     */
    public record Column(String name, DataType type, AbstractExpression expr) {

        public Column {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(expr, "expr must not be null");
        }

        /**
         * Creates a column whose type is the expression's return type.
         *
         * @param name the column name
         * @param expr the expression producing the column
         */
        public Column(String name, AbstractExpression expr) {
            this(name, expr.getReturnValueType(), expr);
        }

        long hash() {
            long h = HashUtil.hash(name);
            h = HashUtil.combine(h, HashUtil.hash(type));
            return HashUtil.combine(h, expr.hash());
        }

        @Override
        public String toString() {
            return name + ": " + type + " = " + expr;
        }
    }

    private final List<Column> columns;

    /**
     * Creates an output schema.
     *
     * @param columns the output columns, in output order
     */
    public OutputSchema(List<Column> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public OutputSchema(Column... columns) {
        this(Arrays.asList(columns));
    }

    /**
     * Returns the output columns.
     *
     * @return an unmodifiable list of columns
     */
    public List<Column> getColumns() {
        return columns;
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public int size() {
        return columns.size();
    }

    /**
     * Returns the expressions of all columns, in column order.
     *
     * @return the column expressions
     */
    public List<AbstractExpression> getExpressions() {
        return columns.stream().map(Column::expr).collect(Collectors.toList());
    }

    /**
     * Returns the index of the column with the given name, or -1 if not found.
     *
     * @param name the column name
     * @return the column index, or -1 if not found
     */
    public int columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Computes a deterministic hash over every column in order.
     *
     * @return the hash
     */
    public long hash() {
        return HashUtil.combineAll(HashUtil.hash(NODE_TYPE), columns, Column::hash);
    }

    public ObjectNode toJson() {
        ObjectNode doc = JsonDocuments.newDocument();
        ArrayNode columnDocs = doc.putArray(COLUMNS);
        for (Column column : columns) {
            ObjectNode columnDoc = columnDocs.addObject();
            columnDoc.put(NAME, column.name());
            columnDoc.put(TYPE, column.type().typeName());
            columnDoc.set(EXPR, column.expr().toJson());
        }
        return doc;
    }

    /**
     * Reconstructs an output schema from a document.
     *
     * @param doc the document
     * @return the schema
     * @throws PlanDeserializationException if a column is incomplete
     */
    public static OutputSchema fromJson(JsonNode doc) {
        ArrayNode columnDocs = JsonDocuments.requireArray(doc, COLUMNS, NODE_TYPE);
        List<Column> columns = new ArrayList<>(columnDocs.size());
        for (JsonNode columnDoc : columnDocs) {
            String name = JsonDocuments.requireText(columnDoc, NAME, NODE_TYPE);
            String typeName = JsonDocuments.requireText(columnDoc, TYPE, NODE_TYPE);
            DataType type;
            try {
                type = DataType.fromTypeName(typeName);
            } catch (IllegalArgumentException e) {
                throw new PlanDeserializationException(PlanDeserializationException.Reason.INVALID_FIELD,
                    NODE_TYPE, TYPE, "unsupported data type '" + typeName + "'", e);
            }
            AbstractExpression expr = AbstractExpression.fromJson(JsonDocuments.requireObject(columnDoc, EXPR, NODE_TYPE));
            columns.add(new Column(name, type, expr));
        }
        return new OutputSchema(columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputSchema that = (OutputSchema) o;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hash());
    }

    @Override
    public String toString() {
        return "OutputSchema(" + columns + ")";
    }
}
