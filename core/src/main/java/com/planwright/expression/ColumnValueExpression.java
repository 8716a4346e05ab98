package com.planwright.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.TableOid;
import com.planwright.json.JsonDocuments;
import com.planwright.types.DataType;
import com.planwright.util.HashUtil;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a reference to a column of a base table.
 *
 * <p>Column value expressions are the leaves that dependency analysis looks for:
 * {@link ExpressionUtils#collectColumnOids} records the {@link #getColumnOid()
 * column OID} of every one it reaches.
 *
 * <p>The column name is informational (it survives serialization and takes part in
 * equality) but execution only uses the OIDs.
 */
public final class ColumnValueExpression extends AbstractExpression {

    private static final String TABLE_OID = "table_oid";
    private static final String COLUMN_OID = "column_oid";
    private static final String COLUMN_NAME = "column_name";

    private final TableOid tableOid;
    private final ColumnOid columnOid;
    private final String columnName; // Optional, may be null

    /**
     * Creates a column reference.
     *
     * @param tableOid the table the column belongs to
     * @param columnOid the column
     * @param columnName the column name (may be null)
     * @param dataType the type of the column
     */
    public ColumnValueExpression(TableOid tableOid, ColumnOid columnOid, String columnName, DataType dataType) {
        super(ExpressionType.COLUMN_VALUE, dataType, List.of());
        this.tableOid = Objects.requireNonNull(tableOid, "tableOid must not be null");
        this.columnOid = Objects.requireNonNull(columnOid, "columnOid must not be null");
        this.columnName = columnName;
    }

    /**
     * Creates an unnamed column reference.
     *
     * @param tableOid the table the column belongs to
     * @param columnOid the column
     * @param dataType the type of the column
     */
    public ColumnValueExpression(TableOid tableOid, ColumnOid columnOid, DataType dataType) {
        this(tableOid, columnOid, null, dataType);
    }

    public TableOid getTableOid() {
        return tableOid;
    }

    public ColumnOid getColumnOid() {
        return columnOid;
    }

    /**
     * Returns the column name.
     *
     * @return the name, or null if not recorded
     */
    public String getColumnName() {
        return columnName;
    }

    @Override
    protected long hashFields(long seed) {
        long h = HashUtil.combine(seed, tableOid.value());
        h = HashUtil.combine(h, columnOid.value());
        return HashUtil.combine(h, HashUtil.hash(columnName));
    }

    @Override
    protected boolean fieldsEqual(AbstractExpression other) {
        ColumnValueExpression that = (ColumnValueExpression) other;
        return tableOid.equals(that.tableOid) &&
               columnOid.equals(that.columnOid) &&
               Objects.equals(columnName, that.columnName);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        doc.put(TABLE_OID, tableOid.value());
        doc.put(COLUMN_OID, columnOid.value());
        if (columnName != null) {
            doc.put(COLUMN_NAME, columnName);
        } else {
            doc.putNull(COLUMN_NAME);
        }
    }

    /**
     * Reconstructs a column reference from a document.
     *
     * @param doc the document
     * @return the expression
     */
    public static ColumnValueExpression fromJson(JsonNode doc) {
        String nodeType = ExpressionType.COLUMN_VALUE.name();
        readType(doc, type -> type == ExpressionType.COLUMN_VALUE, nodeType);
        DataType dataType = readReturnType(doc, nodeType);
        TableOid tableOid = TableOid.of(JsonDocuments.requireInt(doc, TABLE_OID, nodeType));
        ColumnOid columnOid = ColumnOid.of(JsonDocuments.requireInt(doc, COLUMN_OID, nodeType));
        JsonNode name = doc.get(COLUMN_NAME);
        String columnName = null;
        if (name != null && !name.isNull()) {
            columnName = JsonDocuments.requireText(doc, COLUMN_NAME, nodeType);
        }
        return new ColumnValueExpression(tableOid, columnOid, columnName, dataType);
    }

    @Override
    public String toString() {
        return columnName != null ? columnName : "col#" + Integer.toUnsignedString(columnOid.value());
    }

    // ==================== Factory Methods ====================

    public static ColumnValueExpression of(TableOid tableOid, ColumnOid columnOid, DataType dataType) {
        return new ColumnValueExpression(tableOid, columnOid, dataType);
    }

    public static ColumnValueExpression named(TableOid tableOid, ColumnOid columnOid, String columnName,
                                              DataType dataType) {
        return new ColumnValueExpression(tableOid, columnOid, columnName, dataType);
    }
}
