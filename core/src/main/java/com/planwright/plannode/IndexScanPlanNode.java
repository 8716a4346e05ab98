package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.IndexOid;
import com.planwright.catalog.TableOid;
import com.planwright.json.JsonDocuments;
import com.planwright.util.HashUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plan node that reads a table through one of its indexes.
 *
 * <p>Carries the same scan state as {@link SeqScanPlanNode} plus the index used to
 * locate tuples. The scan predicate is still evaluated against every tuple the
 * index returns.
 */
public final class IndexScanPlanNode extends AbstractScanPlanNode {

    static final String INDEX_OID = "index_oid";

    private final IndexOid indexOid;
    private final TableOid tableOid;
    private final List<ColumnOid> columnOids;

    private IndexScanPlanNode(Builder builder) {
        super(builder.children, builder.outputSchema, builder.scanPredicate, builder.isForUpdate,
            builder.databaseOid, builder.namespaceOid);
        this.indexOid = Objects.requireNonNull(builder.indexOid, "indexOid must not be null");
        this.tableOid = Objects.requireNonNull(builder.tableOid, "tableOid must not be null");
        this.columnOids = Collections.unmodifiableList(new ArrayList<>(builder.columnOids));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PlanNodeType getPlanNodeType() {
        return PlanNodeType.INDEXSCAN;
    }

    public IndexOid getIndexOid() {
        return indexOid;
    }

    public TableOid getTableOid() {
        return tableOid;
    }

    /**
     * Returns the columns this scan materializes, in declared order.
     *
     * @return an unmodifiable list of column OIDs
     */
    public List<ColumnOid> getColumnOids() {
        return columnOids;
    }

    @Override
    public long hash() {
        long h = super.hash();
        h = HashUtil.combine(h, indexOid.value());
        h = HashUtil.combine(h, tableOid.value());
        return HashUtil.combineAll(h, columnOids, oid -> oid.value());
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        if (!(obj instanceof IndexScanPlanNode)) return false;
        IndexScanPlanNode that = (IndexScanPlanNode) obj;
        return indexOid.equals(that.indexOid) &&
               tableOid.equals(that.tableOid) &&
               columnOids.equals(that.columnOids);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        super.writeFields(doc);
        doc.put(INDEX_OID, indexOid.value());
        doc.put(SeqScanPlanNode.TABLE_OID, tableOid.value());
        SeqScanPlanNode.writeColumnOids(doc, columnOids);
    }

    /**
     * Reconstructs an index scan from a document.
     *
     * @param doc the document
     * @return the node
     */
    public static IndexScanPlanNode fromJson(JsonNode doc) {
        String nodeType = PlanNodeType.INDEXSCAN.name();
        JsonDocuments.requireType(doc, PLAN_NODE_TYPE, nodeType);
        Builder builder = builder();
        readScanFields(doc, builder, nodeType);
        builder.setIndexOid(IndexOid.of(JsonDocuments.requireInt(doc, INDEX_OID, nodeType)));
        builder.setTableOid(TableOid.of(JsonDocuments.requireInt(doc, SeqScanPlanNode.TABLE_OID, nodeType)));
        builder.setColumnOids(SeqScanPlanNode.readColumnOids(doc, nodeType));
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("IndexScan(%s, %s, columns=%s, predicate=%s%s)",
            indexOid, tableOid, columnOids,
            getScanPredicate().map(Object::toString).orElse("none"),
            isForUpdate() ? ", for update" : "");
    }

    public static final class Builder extends AbstractScanPlanNode.Builder<Builder, IndexScanPlanNode> {

        private final List<ColumnOid> columnOids = new ArrayList<>();
        private IndexOid indexOid;
        private TableOid tableOid;

        private Builder() {}

        public Builder setIndexOid(IndexOid indexOid) {
            checkNotBuilt();
            this.indexOid = indexOid;
            return this;
        }

        public Builder setTableOid(TableOid tableOid) {
            checkNotBuilt();
            this.tableOid = tableOid;
            return this;
        }

        public Builder setColumnOids(List<ColumnOid> columnOids) {
            checkNotBuilt();
            this.columnOids.clear();
            for (ColumnOid oid : columnOids) {
                this.columnOids.add(Objects.requireNonNull(oid, "column OID must not be null"));
            }
            return this;
        }

        @Override
        protected IndexScanPlanNode newNode() {
            return new IndexScanPlanNode(this);
        }
    }
}
