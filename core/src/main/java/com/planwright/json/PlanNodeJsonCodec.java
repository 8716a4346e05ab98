package com.planwright.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.plannode.AbstractPlanNode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for persisting and transmitting plan trees.
 *
 * <p>Plans travel as JSON documents. Each node is an object carrying the reserved
 * {@value AbstractPlanNode#PLAN_NODE_TYPE} discriminant, its children and output
 * schema, and its operator fields; expressions nest the same way under
 * {@code expression_type}. Serializing, deserializing and serializing again yields
 * the identical string.
 *
 * <p>Example:
 * <pre>
 *   String stored = PlanNodeJsonCodec.serialize(plan);
 *   AbstractPlanNode restored = PlanNodeJsonCodec.deserialize(stored);
 *   assert restored.equals(plan);
 * </pre>
 */
public final class PlanNodeJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(PlanNodeJsonCodec.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PlanNodeJsonCodec() {} // Utility class

    /**
     * Converts a plan tree into a document.
     *
     * @param node the root of the plan
     * @return the document
     */
    public static ObjectNode toJson(AbstractPlanNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return node.toJson();
    }

    /**
     * Reconstructs a plan tree of any kind from a document.
     *
     * @param doc the document
     * @return the root of the reconstructed plan
     * @throws PlanDeserializationException if the document nests deeper than
     *         {@link CodecConfig#maxDocumentDepth()} or is not a valid plan
     */
    public static AbstractPlanNode fromJson(JsonNode doc) {
        return AbstractPlanNode.fromJson(doc);
    }

    /**
     * Serializes a plan tree to text. Output is compact unless
     * {@value CodecConfig#PROP_PRETTY_PRINT} is set.
     *
     * @param node the root of the plan
     * @return the JSON text
     */
    public static String serialize(AbstractPlanNode node) {
        ObjectNode doc = toJson(node);
        try {
            if (CodecConfig.prettyPrint()) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
            }
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            // Tree nodes built by the plan model always serialize
            throw new IllegalStateException("Failed to serialize plan " + node.getPlanNodeType(), e);
        }
    }

    /**
     * Parses JSON text and reconstructs the plan it describes.
     *
     * @param json the JSON text
     * @return the root of the reconstructed plan
     * @throws PlanDeserializationException if the text is not well-formed JSON or
     *         does not describe a valid plan
     */
    public static AbstractPlanNode deserialize(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Rejecting unparseable plan document: {}", e.getOriginalMessage());
            throw new PlanDeserializationException(PlanDeserializationException.Reason.MALFORMED_DOCUMENT,
                null, null, "not a well-formed JSON document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            logger.debug("Rejecting plan document that is not a JSON object");
            throw new PlanDeserializationException(PlanDeserializationException.Reason.MALFORMED_DOCUMENT,
                null, null, "expected a JSON object");
        }
        return fromJson(root);
    }
}
