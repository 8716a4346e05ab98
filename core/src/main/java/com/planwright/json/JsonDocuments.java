package com.planwright.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Field accessors for reading plan and expression documents.
 *
 * <p>Every accessor takes the name of the node type being reconstructed so that a
 * failure can report both the node type and the field. Required fields are never
 * defaulted: an absent or JSON-null required field raises
 * {@link PlanDeserializationException.Reason#MISSING_FIELD}, a present field of the
 * wrong shape raises {@link PlanDeserializationException.Reason#INVALID_FIELD}.
 */
public final class JsonDocuments {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonDocuments() {}

    /**
     * Creates an empty document.
     *
     * @return a new object node
     */
    public static ObjectNode newDocument() {
        return NODES.objectNode();
    }

    /**
     * Checks that the document is an object carrying the expected discriminant.
     *
     * @param doc the document
     * @param discriminantField the reserved type field
     * @param expectedType the type the caller is reconstructing
     * @throws PlanDeserializationException if the document is not an object, lacks the
     *         discriminant, or carries a different one
     */
    public static void requireType(JsonNode doc, String discriminantField, String expectedType) {
        String actual = requireText(doc, discriminantField, expectedType);
        if (!expectedType.equals(actual)) {
            throw PlanDeserializationException.typeMismatch(expectedType, actual, discriminantField);
        }
    }

    public static JsonNode requireField(JsonNode doc, String field, String nodeType) {
        if (doc == null || !doc.isObject()) {
            throw new PlanDeserializationException(PlanDeserializationException.Reason.MALFORMED_DOCUMENT,
                nodeType, null, "expected a JSON object");
        }
        JsonNode value = doc.get(field);
        if (value == null || value.isNull()) {
            throw PlanDeserializationException.missingField(nodeType, field);
        }
        return value;
    }

    public static String requireText(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isTextual()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "a string");
        }
        return value.asText();
    }

    public static boolean requireBoolean(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isBoolean()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "a boolean");
        }
        return value.booleanValue();
    }

    /**
     * Reads a required integral field that must fit in 32 bits.
     *
     * @param doc the document
     * @param field the field name
     * @param nodeType the node type being reconstructed
     * @return the value
     */
    public static int requireInt(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "a 32-bit integer");
        }
        return value.intValue();
    }

    public static long requireLong(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "a 64-bit integer");
        }
        return value.longValue();
    }

    public static ArrayNode requireArray(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isArray()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "an array");
        }
        return (ArrayNode) value;
    }

    public static JsonNode requireObject(JsonNode doc, String field, String nodeType) {
        JsonNode value = requireField(doc, field, nodeType);
        if (!value.isObject()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "an object");
        }
        return value;
    }

    /**
     * Reads an optional object field. An absent field and an explicit JSON null both
     * mean "not present".
     *
     * @param doc the document
     * @param field the field name
     * @param nodeType the node type being reconstructed
     * @return the object, or empty
     */
    public static Optional<JsonNode> optionalObject(JsonNode doc, String field, String nodeType) {
        if (doc == null || !doc.isObject()) {
            throw new PlanDeserializationException(PlanDeserializationException.Reason.MALFORMED_DOCUMENT,
                nodeType, null, "expected a JSON object");
        }
        JsonNode value = doc.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isObject()) {
            throw PlanDeserializationException.invalidField(nodeType, field, "an object or null");
        }
        return Optional.of(value);
    }

    /**
     * Returns the nesting depth of a document. Scalars have depth 0, an empty object or
     * array has depth 1.
     *
     * @param root the document
     * @return the maximum container nesting depth
     */
    public static int depth(JsonNode root) {
        if (root == null || !root.isContainerNode()) {
            return 0;
        }
        int max = 0;
        Deque<Map.Entry<JsonNode, Integer>> pending = new ArrayDeque<>();
        pending.push(Map.entry(root, 1));
        while (!pending.isEmpty()) {
            Map.Entry<JsonNode, Integer> entry = pending.pop();
            int level = entry.getValue();
            max = Math.max(max, level);
            Iterator<JsonNode> elements = entry.getKey().elements();
            while (elements.hasNext()) {
                JsonNode child = elements.next();
                if (child.isContainerNode()) {
                    pending.push(Map.entry(child, level + 1));
                }
            }
        }
        return max;
    }
}
