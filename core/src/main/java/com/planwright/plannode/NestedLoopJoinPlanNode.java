package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.expression.AbstractExpression;
import com.planwright.json.JsonDocuments;
import com.planwright.util.HashUtil;
import java.util.Objects;
import java.util.Optional;

/**
 * Plan node that joins two children by evaluating the join predicate for every
 * pair of outer and inner tuples.
 *
 * <p>Child 0 is the outer relation, child 1 the inner one. A join without a
 * predicate pairs every outer tuple with every inner tuple.
 */
public final class NestedLoopJoinPlanNode extends AbstractPlanNode {

    static final String JOIN_TYPE = "join_type";
    static final String JOIN_PREDICATE = "join_predicate";

    private final LogicalJoinType joinType;
    private final AbstractExpression joinPredicate; // null when absent

    private NestedLoopJoinPlanNode(Builder builder) {
        super(builder.children, builder.outputSchema);
        this.joinType = Objects.requireNonNull(builder.joinType, "joinType must not be null");
        this.joinPredicate = builder.joinPredicate;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PlanNodeType getPlanNodeType() {
        return PlanNodeType.NESTLOOP;
    }

    public LogicalJoinType getLogicalJoinType() {
        return joinType;
    }

    /**
     * Returns the join predicate.
     *
     * @return the predicate, or empty for a cross product
     */
    public Optional<AbstractExpression> getJoinPredicate() {
        return Optional.ofNullable(joinPredicate);
    }

    @Override
    public long hash() {
        long h = super.hash();
        h = HashUtil.combine(h, HashUtil.hash(joinType));
        return HashUtil.combineOptional(h, getJoinPredicate(), AbstractExpression::hash);
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        if (!(obj instanceof NestedLoopJoinPlanNode)) return false;
        NestedLoopJoinPlanNode that = (NestedLoopJoinPlanNode) obj;
        return joinType == that.joinType &&
               Objects.equals(joinPredicate, that.joinPredicate);
    }

    @Override
    protected void writeFields(ObjectNode doc) {
        doc.put(JOIN_TYPE, joinType.name());
        if (joinPredicate != null) {
            doc.set(JOIN_PREDICATE, joinPredicate.toJson());
        } else {
            doc.putNull(JOIN_PREDICATE);
        }
    }

    /**
     * Reconstructs a nested loop join from a document.
     * Children are decoded without a depth check; untrusted documents go through
     * {@link AbstractPlanNode#fromJson(JsonNode)}.
     *
     * @param doc the document
     * @return the node
     */
    public static NestedLoopJoinPlanNode fromJson(JsonNode doc) {
        String nodeType = PlanNodeType.NESTLOOP.name();
        JsonDocuments.requireType(doc, PLAN_NODE_TYPE, nodeType);
        Builder builder = builder();
        readCommonFields(doc, builder, nodeType);
        String joinTypeName = JsonDocuments.requireText(doc, JOIN_TYPE, nodeType);
        try {
            builder.setJoinType(LogicalJoinType.valueOf(joinTypeName));
        } catch (IllegalArgumentException e) {
            throw new PlanDeserializationException(PlanDeserializationException.Reason.INVALID_FIELD,
                nodeType, JOIN_TYPE, "unsupported join type '" + joinTypeName + "'", e);
        }
        builder.setJoinPredicate(JsonDocuments.optionalObject(doc, JOIN_PREDICATE, nodeType)
            .map(AbstractExpression::fromJson)
            .orElse(null));
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("NestedLoopJoin(%s, %s)", joinType,
            getJoinPredicate().map(Object::toString).orElse("no predicate"));
    }

    public static final class Builder extends AbstractPlanNode.Builder<Builder, NestedLoopJoinPlanNode> {

        private LogicalJoinType joinType;
        private AbstractExpression joinPredicate;

        private Builder() {}

        public Builder setJoinType(LogicalJoinType joinType) {
            checkNotBuilt();
            this.joinType = joinType;
            return this;
        }

        /**
         * @param predicate the join predicate, or null for a cross product
         * @return this builder
         */
        public Builder setJoinPredicate(AbstractExpression predicate) {
            checkNotBuilt();
            this.joinPredicate = predicate;
            return this;
        }

        @Override
        protected NestedLoopJoinPlanNode newNode() {
            return new NestedLoopJoinPlanNode(this);
        }
    }
}
