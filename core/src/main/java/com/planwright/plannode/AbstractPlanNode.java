package com.planwright.plannode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.json.CodecConfig;
import com.planwright.json.JsonDocuments;
import com.planwright.schema.OutputSchema;
import com.planwright.util.HashUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all physical plan nodes.
 *
 * <p>A plan node describes one physical operator. It owns its children and its
 * {@link OutputSchema}; both are assigned once at construction and never replaced.
 * Plan transformations build new trees, sharing unchanged subtrees, which is safe
 * because nodes never change after {@link Builder#build()}.
 *
 * <p>Every node supports three identity operations consumers use without knowing
 * the concrete kind:
 * <ul>
 *   <li>{@link #hash()} - deterministic structural hash (plan cache key)</li>
 *   <li>{@link #equals(Object)} - structural equality; nodes of different kinds
 *       are simply unequal</li>
 *   <li>{@link #toJson()} / {@link #fromJson(JsonNode)} - self-describing document
 *       form for persistence and transport</li>
 * </ul>
 * Equal nodes always hash equal. A built tree may be hashed, compared and
 * serialized from many threads at once.
 *
 * <p>Concrete kinds are listed in {@link PlanNodeType}; consumers downcast after
 * checking {@link #getPlanNodeType()}.
 */
public abstract sealed class AbstractPlanNode
    permits AbstractScanPlanNode, ProjectionPlanNode, LimitPlanNode, NestedLoopJoinPlanNode {

    private static final Logger logger = LoggerFactory.getLogger(AbstractPlanNode.class);

    /** Reserved discriminant field of a plan node document. */
    public static final String PLAN_NODE_TYPE = "plan_node_type";
    static final String CHILDREN = "children";
    static final String OUTPUT_SCHEMA = "output_schema";

    /** Child nodes in the plan tree */
    private final List<AbstractPlanNode> children;

    /** Output schema of this node */
    private final OutputSchema outputSchema;

    /**
     * Creates a plan node.
     *
     * @param children the child nodes (copied)
     * @param outputSchema the schema of this node's output
     */
    protected AbstractPlanNode(List<AbstractPlanNode> children, OutputSchema outputSchema) {
        Objects.requireNonNull(children, "children must not be null");
        for (AbstractPlanNode child : children) {
            Objects.requireNonNull(child, "child plan node must not be null");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema must not be null");
    }

    /**
     * Returns the kind of this node.
     *
     * @return the plan node type
     */
    public abstract PlanNodeType getPlanNodeType();

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<AbstractPlanNode> getChildren() {
        return children;
    }

    /**
     * Returns the child at the given index.
     *
     * @param index the child index
     * @return the child
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public AbstractPlanNode getChild(int index) {
        return children.get(index);
    }

    public int getChildrenSize() {
        return children.size();
    }

    public OutputSchema getOutputSchema() {
        return outputSchema;
    }

    // ==================== Identity ====================

    /**
     * Computes the deterministic structural hash of this subtree. Covers the node
     * type, every child in order and the output schema; subclasses fold in their own
     * fields on top of this value.
     *
     * @return the hash
     */
    public long hash() {
        long h = HashUtil.hash(getPlanNodeType());
        h = HashUtil.combineAll(h, children, AbstractPlanNode::hash);
        return HashUtil.combine(h, outputSchema.hash());
    }

    /**
     * Compares the fields common to every node: the node type, the children
     * (element-wise, in order) and the output schema. Subclasses call this first
     * and then compare their own fields.
     *
     * @param obj the other object
     * @return true if the common fields are equal
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AbstractPlanNode)) return false;
        AbstractPlanNode that = (AbstractPlanNode) obj;
        return getPlanNodeType() == that.getPlanNodeType() &&
               children.equals(that.children) &&
               outputSchema.equals(that.outputSchema);
    }

    @Override
    public final int hashCode() {
        return Long.hashCode(hash());
    }

    // ==================== Serialization ====================

    /**
     * Serializes this subtree. The document carries {@value #PLAN_NODE_TYPE}, the
     * children, the output schema and every operator-specific field.
     *
     * @return the document
     */
    public ObjectNode toJson() {
        ObjectNode doc = JsonDocuments.newDocument();
        doc.put(PLAN_NODE_TYPE, getPlanNodeType().name());
        ArrayNode childDocs = doc.putArray(CHILDREN);
        for (AbstractPlanNode child : children) {
            childDocs.add(child.toJson());
        }
        doc.set(OUTPUT_SCHEMA, outputSchema.toJson());
        writeFields(doc);
        return doc;
    }

    /**
     * Writes operator-specific fields after the common ones.
     *
     * @param doc the document being built
     */
    protected void writeFields(ObjectNode doc) {
    }

    /**
     * Reconstructs a plan subtree of any kind from a document. The document is
     * rejected before decoding if it nests deeper than
     * {@link CodecConfig#maxDocumentDepth()}.
     *
     * @param doc the document
     * @return the reconstructed node
     * @throws PlanDeserializationException if the document is too deep or is not a
     *         valid plan
     */
    public static AbstractPlanNode fromJson(JsonNode doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        int maxDepth = CodecConfig.maxDocumentDepth();
        int depth = JsonDocuments.depth(doc);
        if (depth > maxDepth) {
            logger.warn("Rejecting plan document of depth {} (limit {})", depth, maxDepth);
            throw new PlanDeserializationException(PlanDeserializationException.Reason.DEPTH_EXCEEDED,
                null, null, "document depth " + depth + " exceeds the limit of " + maxDepth);
        }
        return decode(doc);
    }

    private static AbstractPlanNode decode(JsonNode doc) {
        String typeName = JsonDocuments.requireText(doc, PLAN_NODE_TYPE, "plan node");
        PlanNodeType type = PlanNodeType.fromName(typeName);
        if (type == null) {
            throw PlanDeserializationException.unknownType(typeName, PLAN_NODE_TYPE);
        }
        return switch (type) {
            case SEQSCAN -> SeqScanPlanNode.fromJson(doc);
            case INDEXSCAN -> IndexScanPlanNode.fromJson(doc);
            case PROJECTION -> ProjectionPlanNode.fromJson(doc);
            case LIMIT -> LimitPlanNode.fromJson(doc);
            case NESTLOOP -> NestedLoopJoinPlanNode.fromJson(doc);
        };
    }

    /**
     * Reads the children and output schema of a document into a builder.
     *
     * @param doc the document
     * @param builder the builder to populate
     * @param nodeType the node type being reconstructed
     */
    static void readCommonFields(JsonNode doc, Builder<?, ?> builder, String nodeType) {
        ArrayNode childDocs = JsonDocuments.requireArray(doc, CHILDREN, nodeType);
        List<AbstractPlanNode> children = new ArrayList<>(childDocs.size());
        for (JsonNode childDoc : childDocs) {
            children.add(decode(childDoc));
        }
        builder.setChildren(children);
        builder.setOutputSchema(OutputSchema.fromJson(JsonDocuments.requireObject(doc, OUTPUT_SCHEMA, nodeType)));
    }

    // ==================== Builder ====================

    /**
     * Base for the staged builders of every plan node.
     *
     * <p>Setters chain; {@link #build()} hands the collected fields to a new
     * immutable node. A builder produces exactly one node: after {@code build()}
     * returns, every further call throws {@link IllegalStateException}. No
     * cross-field validation happens here, that is the optimizer's job.
     *
     * @param <B> the concrete builder type
     * @param <N> the node type produced
     */
    public abstract static class Builder<B extends Builder<B, N>, N extends AbstractPlanNode> {

        protected final List<AbstractPlanNode> children = new ArrayList<>();
        protected OutputSchema outputSchema;
        private boolean built;

        protected Builder() {}

        /**
         * Appends a child node.
         *
         * @param child the child
         * @return this builder
         */
        public B addChild(AbstractPlanNode child) {
            checkNotBuilt();
            children.add(Objects.requireNonNull(child, "child must not be null"));
            return self();
        }

        /**
         * Replaces the children collected so far.
         *
         * @param children the children, in order
         * @return this builder
         */
        public B setChildren(List<AbstractPlanNode> children) {
            checkNotBuilt();
            List<AbstractPlanNode> replacement = new ArrayList<>(children);
            this.children.clear();
            for (AbstractPlanNode child : replacement) {
                addChild(child);
            }
            return self();
        }

        public B setOutputSchema(OutputSchema outputSchema) {
            checkNotBuilt();
            this.outputSchema = outputSchema;
            return self();
        }

        /**
         * Builds the node and retires this builder.
         *
         * @return the new node
         * @throws IllegalStateException if this builder has already built a node
         * @throws NullPointerException if a required field was never set
         */
        public final N build() {
            checkNotBuilt();
            N node = newNode();
            built = true;
            return node;
        }

        /**
         * Creates the node from the collected fields.
         *
         * @return the node
         */
        protected abstract N newNode();

        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }

        protected final void checkNotBuilt() {
            if (built) {
                Class<?> owner = getClass().getEnclosingClass();
                String name = owner != null ? owner.getSimpleName() : getClass().getSimpleName();
                throw new IllegalStateException(name + " builder has already built its node");
            }
        }
    }
}
