package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.TableOid;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.json.JsonDocuments;
import com.planwright.util.HashUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plan node that reads every tuple of a table in storage order.
 *
 * <p>The node lists the columns it materializes ({@link #getColumnOids()}) in the
 * order the optimizer chose. That list is the declared projection and is kept
 * exactly as given, duplicates included. The columns the node's expressions
 * actually read are reported separately by {@link #collectInputOids()}.
 *
 * <p>Example:
 * <pre>
 *   SeqScanPlanNode scan = SeqScanPlanNode.builder()
 *       .setDatabaseOid(DatabaseOid.of(1))
 *       .setNamespaceOid(NamespaceOid.of(2))
 *       .setTableOid(TableOid.of(10))
 *       .setColumnOids(List.of(ColumnOid.of(1), ColumnOid.of(2)))
 *       .setScanPredicate(ComparisonExpression.greaterThan(amount, ConstantValueExpression.of(100)))
 *       .setOutputSchema(schema)
 *       .build();
 * </pre>
 */
public final class SeqScanPlanNode extends AbstractScanPlanNode {

    static final String COLUMN_OIDS = "column_oids";
    static final String TABLE_OID = "table_oid";

    private final List<ColumnOid> columnOids;
    private final TableOid tableOid;

    private SeqScanPlanNode(Builder builder) {
        super(builder.children, builder.outputSchema, builder.scanPredicate, builder.isForUpdate,
            builder.databaseOid, builder.namespaceOid);
        this.columnOids = Collections.unmodifiableList(new ArrayList<>(builder.columnOids));
        this.tableOid = Objects.requireNonNull(builder.tableOid, "tableOid must not be null");
    }

    /**
     * Returns a new builder.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PlanNodeType getPlanNodeType() {
        return PlanNodeType.SEQSCAN;
    }

    /**
     * Returns the columns this scan materializes, in declared order.
     *
     * @return an unmodifiable list of column OIDs
     */
    public List<ColumnOid> getColumnOids() {
        return columnOids;
    }

    public TableOid getTableOid() {
        return tableOid;
    }

    @Override
    public long hash() {
        long h = super.hash();
        h = HashUtil.combine(h, tableOid.value());
        return HashUtil.combineAll(h, columnOids, oid -> oid.value());
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        if (!(obj instanceof SeqScanPlanNode)) return false;
        SeqScanPlanNode that = (SeqScanPlanNode) obj;
        return tableOid.equals(that.tableOid) &&
               columnOids.equals(that.columnOids);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        super.writeFields(doc);
        writeColumnOids(doc, columnOids);
        doc.put(TABLE_OID, tableOid.value());
    }

    /**
     * Reconstructs a sequential scan from a document.
     *
     * @param doc the document
     * @return the node
     * @throws PlanDeserializationException if the document is tagged with another
     *         node type or a required field is missing or invalid
     */
    public static SeqScanPlanNode fromJson(JsonNode doc) {
        String nodeType = PlanNodeType.SEQSCAN.name();
        JsonDocuments.requireType(doc, PLAN_NODE_TYPE, nodeType);
        Builder builder = builder();
        readScanFields(doc, builder, nodeType);
        builder.setColumnOids(readColumnOids(doc, nodeType));
        builder.setTableOid(TableOid.of(JsonDocuments.requireInt(doc, TABLE_OID, nodeType)));
        return builder.build();
    }

    static void writeColumnOids(ObjectNode doc, List<ColumnOid> columnOids) {
        ArrayNode array = doc.putArray(COLUMN_OIDS);
        for (ColumnOid oid : columnOids) {
            array.add(oid.value());
        }
    }

    static List<ColumnOid> readColumnOids(JsonNode doc, String nodeType) {
        ArrayNode array = JsonDocuments.requireArray(doc, COLUMN_OIDS, nodeType);
        List<ColumnOid> oids = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                throw PlanDeserializationException.invalidField(nodeType, COLUMN_OIDS, "an array of 32-bit integers");
            }
            oids.add(ColumnOid.of(element.intValue()));
        }
        return oids;
    }

    @Override
    public String toString() {
        return String.format("SeqScan(%s, columns=%s, predicate=%s%s)",
            tableOid, columnOids,
            getScanPredicate().map(Object::toString).orElse("none"),
            isForUpdate() ? ", for update" : "");
    }

    /**
     * Builder for {@link SeqScanPlanNode}.
     */
    public static final class Builder extends AbstractScanPlanNode.Builder<Builder, SeqScanPlanNode> {

        private final List<ColumnOid> columnOids = new ArrayList<>();
        private TableOid tableOid;

        private Builder() {}

        /**
         * Sets the columns to materialize. Order and duplicates are kept.
         *
         * @param columnOids the column OIDs
         * @return this builder
         */
        public Builder setColumnOids(List<ColumnOid> columnOids) {
            checkNotBuilt();
            this.columnOids.clear();
            for (ColumnOid oid : columnOids) {
                this.columnOids.add(Objects.requireNonNull(oid, "column OID must not be null"));
            }
            return this;
        }

        public Builder setTableOid(TableOid tableOid) {
            checkNotBuilt();
            this.tableOid = tableOid;
            return this;
        }

        @Override
        protected SeqScanPlanNode newNode() {
            return new SeqScanPlanNode(this);
        }
    }
}
