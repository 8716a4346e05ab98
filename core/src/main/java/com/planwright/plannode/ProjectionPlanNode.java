package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.json.JsonDocuments;

/**
 * Plan node that computes its output schema's expressions over each tuple of its
 * single child.
 *
 * <p>A projection has no fields of its own; everything it does is described by its
 * {@link #getOutputSchema() output schema}.
 */
public final class ProjectionPlanNode extends AbstractPlanNode {

    private ProjectionPlanNode(Builder builder) {
        super(builder.children, builder.outputSchema);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PlanNodeType getPlanNodeType() {
        return PlanNodeType.PROJECTION;
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && obj instanceof ProjectionPlanNode;
    }

    /**
     * Reconstructs a projection from a document.
     * Children are decoded without a depth check; untrusted documents go through
     * {@link AbstractPlanNode#fromJson(JsonNode)}.
     *
     * @param doc the document
     * @return the node
     */
    public static ProjectionPlanNode fromJson(JsonNode doc) {
        String nodeType = PlanNodeType.PROJECTION.name();
        JsonDocuments.requireType(doc, PLAN_NODE_TYPE, nodeType);
        Builder builder = builder();
        readCommonFields(doc, builder, nodeType);
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("Projection(%s)", getOutputSchema().getColumns());
    }

    public static final class Builder extends AbstractPlanNode.Builder<Builder, ProjectionPlanNode> {

        private Builder() {}

        @Override
        protected ProjectionPlanNode newNode() {
            return new ProjectionPlanNode(this);
        }
    }
}
