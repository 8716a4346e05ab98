package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.json.JsonDocuments;
import com.planwright.util.HashUtil;

/**
 * Plan node that skips the first {@code offset} tuples of its child and then
 * passes through at most {@code limit} tuples.
 */
public final class LimitPlanNode extends AbstractPlanNode {

    static final String LIMIT = "limit";
    static final String OFFSET = "offset";

    private final long limit;
    private final long offset;

    private LimitPlanNode(Builder builder) {
        super(builder.children, builder.outputSchema);
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PlanNodeType getPlanNodeType() {
        return PlanNodeType.LIMIT;
    }

    /**
     * Returns the maximum number of tuples produced.
     *
     * @return the limit, never negative
     */
    public long getLimit() {
        return limit;
    }

    /**
     * Returns the number of leading tuples skipped.
     *
     * @return the offset, never negative
     */
    public long getOffset() {
        return offset;
    }

    @Override
    public long hash() {
        long h = super.hash();
        h = HashUtil.combine(h, limit);
        return HashUtil.combine(h, offset);
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        if (!(obj instanceof LimitPlanNode)) return false;
        LimitPlanNode that = (LimitPlanNode) obj;
        return limit == that.limit && offset == that.offset;
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        doc.put(LIMIT, limit);
        doc.put(OFFSET, offset);
    }

    /**
     * Reconstructs a limit node from a document.
     * Children are decoded without a depth check; untrusted documents go through
     * {@link AbstractPlanNode#fromJson(JsonNode)}.
     *
     * @param doc the document
     * @return the node
     * @throws PlanDeserializationException if a count is missing or negative
     */
    public static LimitPlanNode fromJson(JsonNode doc) {
        String nodeType = PlanNodeType.LIMIT.name();
        JsonDocuments.requireType(doc, PLAN_NODE_TYPE, nodeType);
        Builder builder = builder();
        readCommonFields(doc, builder, nodeType);
        long limit = JsonDocuments.requireLong(doc, LIMIT, nodeType);
        if (limit < 0) {
            throw PlanDeserializationException.invalidField(nodeType, LIMIT, "non-negative");
        }
        long offset = JsonDocuments.requireLong(doc, OFFSET, nodeType);
        if (offset < 0) {
            throw PlanDeserializationException.invalidField(nodeType, OFFSET, "non-negative");
        }
        return builder.setLimit(limit).setOffset(offset).build();
    }

    @Override
    public String toString() {
        return offset == 0
            ? String.format("Limit(%d)", limit)
            : String.format("Limit(%d, offset=%d)", limit, offset);
    }

    public static final class Builder extends AbstractPlanNode.Builder<Builder, LimitPlanNode> {

        private long limit;
        private long offset;

        private Builder() {}

        /**
         * @param limit the maximum number of tuples, must be non-negative
         * @return this builder
         * @throws IllegalArgumentException if limit is negative
         */
        public Builder setLimit(long limit) {
            checkNotBuilt();
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be non-negative, got: " + limit);
            }
            this.limit = limit;
            return this;
        }

        /**
         * @param offset the number of tuples to skip, must be non-negative
         * @return this builder
         * @throws IllegalArgumentException if offset is negative
         */
        public Builder setOffset(long offset) {
            checkNotBuilt();
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
            }
            this.offset = offset;
            return this;
        }

        @Override
        protected LimitPlanNode newNode() {
            return new LimitPlanNode(this);
        }
    }
}
