package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.DatabaseOid;
import com.planwright.catalog.NamespaceOid;
import com.planwright.expression.AbstractExpression;
import com.planwright.expression.ExpressionUtils;
import com.planwright.json.JsonDocuments;
import com.planwright.schema.OutputSchema;
import com.planwright.util.HashUtil;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for plan nodes that read a base relation.
 *
 * <p>Adds the state every scan shares:
 * <ul>
 *   <li>an optional filter predicate. Absence means every tuple passes; it is not
 *       the same thing as a predicate that happens to be always true, and the two
 *       are never equal</li>
 *   <li>the update-intent flag, which downstream locking honors</li>
 *   <li>the database and namespace the scanned relation lives in</li>
 * </ul>
 *
 * <p>The predicate is held by shared reference; the same expression tree may also
 * be referenced by the statement it was bound from.
 */
public abstract sealed class AbstractScanPlanNode extends AbstractPlanNode
    permits SeqScanPlanNode, IndexScanPlanNode {

    static final String SCAN_PREDICATE = "scan_predicate";
    static final String IS_FOR_UPDATE = "is_for_update";
    static final String DATABASE_OID = "database_oid";
    static final String NAMESPACE_OID = "namespace_oid";

    private final AbstractExpression scanPredicate; // null when there is no filter
    private final boolean isForUpdate;
    private final DatabaseOid databaseOid;
    private final NamespaceOid namespaceOid;

    /**
     * Creates a scan node.
     *
     * @param children child plan nodes
     * @param outputSchema schema of the scan's output
     * @param scanPredicate filter predicate (may be null for no filter)
     * @param isForUpdate whether the scan is part of an update
     * @param databaseOid database of the scanned relation
     * @param namespaceOid namespace of the scanned relation
     */
    protected AbstractScanPlanNode(List<AbstractPlanNode> children, OutputSchema outputSchema,
                                   AbstractExpression scanPredicate, boolean isForUpdate,
                                   DatabaseOid databaseOid, NamespaceOid namespaceOid) {
        super(children, outputSchema);
        this.scanPredicate = scanPredicate;
        this.isForUpdate = isForUpdate;
        this.databaseOid = Objects.requireNonNull(databaseOid, "databaseOid must not be null");
        this.namespaceOid = Objects.requireNonNull(namespaceOid, "namespaceOid must not be null");
    }

    /**
     * Returns the filter predicate.
     *
     * @return the predicate, or empty if the scan does not filter
     */
    public Optional<AbstractExpression> getScanPredicate() {
        return Optional.ofNullable(scanPredicate);
    }

    public boolean isForUpdate() {
        return isForUpdate;
    }

    public DatabaseOid getDatabaseOid() {
        return databaseOid;
    }

    public NamespaceOid getNamespaceOid() {
        return namespaceOid;
    }

    /**
     * Computes the set of column OIDs that the predicate and the output-schema
     * expressions actually dereference.
     *
     * <p>This is the referenced set, not the declared projection list: a column may
     * be scanned without being referenced, and the result carries no order.
     *
     * @return an unmodifiable, unordered set of column OIDs
     */
    public Set<ColumnOid> collectInputOids() {
        Set<ColumnOid> result = new HashSet<>();
        if (scanPredicate != null) {
            ExpressionUtils.collectColumnOids(scanPredicate, result);
        }
        for (OutputSchema.Column column : getOutputSchema().getColumns()) {
            ExpressionUtils.collectColumnOids(column.expr(), result);
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public long hash() {
        long h = super.hash();
        h = HashUtil.combineOptional(h, getScanPredicate(), AbstractExpression::hash);
        h = HashUtil.combine(h, HashUtil.hash(isForUpdate));
        h = HashUtil.combine(h, databaseOid.value());
        return HashUtil.combine(h, namespaceOid.value());
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        if (!(obj instanceof AbstractScanPlanNode)) return false;
        AbstractScanPlanNode that = (AbstractScanPlanNode) obj;
        return isForUpdate == that.isForUpdate &&
               Objects.equals(scanPredicate, that.scanPredicate) &&
               databaseOid.equals(that.databaseOid) &&
               namespaceOid.equals(that.namespaceOid);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        if (scanPredicate != null) {
            doc.set(SCAN_PREDICATE, scanPredicate.toJson());
        } else {
            doc.putNull(SCAN_PREDICATE);
        }
        doc.put(IS_FOR_UPDATE, isForUpdate);
        doc.put(DATABASE_OID, databaseOid.value());
        doc.put(NAMESPACE_OID, namespaceOid.value());
    }

    /**
     * Reads the common and scan fields of a document into a builder.
     *
     * @param doc the document
     * @param builder the builder to populate
     * @param nodeType the node type being reconstructed
     */
    static void readScanFields(JsonNode doc, Builder<?, ?> builder, String nodeType) {
        readCommonFields(doc, builder, nodeType);
        builder.setScanPredicate(JsonDocuments.optionalObject(doc, SCAN_PREDICATE, nodeType)
            .map(AbstractExpression::fromJson)
            .orElse(null));
        builder.setIsForUpdate(JsonDocuments.requireBoolean(doc, IS_FOR_UPDATE, nodeType));
        builder.setDatabaseOid(DatabaseOid.of(JsonDocuments.requireInt(doc, DATABASE_OID, nodeType)));
        builder.setNamespaceOid(NamespaceOid.of(JsonDocuments.requireInt(doc, NAMESPACE_OID, nodeType)));
    }

    /**
     * Builder stage adding the scan fields.
     *
     * @param <B> the concrete builder type
     * @param <N> the node type produced
     */
    public abstract static class Builder<B extends Builder<B, N>, N extends AbstractScanPlanNode>
        extends AbstractPlanNode.Builder<B, N> {

        protected AbstractExpression scanPredicate;
        protected boolean isForUpdate;
        protected DatabaseOid databaseOid;
        protected NamespaceOid namespaceOid;

        /**
         * @param predicate the filter predicate, or null for no filter
         * @return this builder
         */
        public B setScanPredicate(AbstractExpression predicate) {
            checkNotBuilt();
            this.scanPredicate = predicate;
            return self();
        }

        public B setIsForUpdate(boolean isForUpdate) {
            checkNotBuilt();
            this.isForUpdate = isForUpdate;
            return self();
        }

        public B setDatabaseOid(DatabaseOid databaseOid) {
            checkNotBuilt();
            this.databaseOid = databaseOid;
            return self();
        }

        public B setNamespaceOid(NamespaceOid namespaceOid) {
            checkNotBuilt();
            this.namespaceOid = namespaceOid;
            return self();
        }
    }
}
