package com.planwright.exception;

/**
 * Exception thrown when a serialized plan or expression document cannot be
 * turned back into a node.
 *
 * <p>Failures here are deterministic data errors: retrying the same document will
 * fail the same way. The exception carries enough context for the caller to
 * decide whether to abort the plan load or fall back to re-planning.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       AbstractPlanNode plan = PlanNodeJsonCodec.deserialize(stored);
 *   } catch (PlanDeserializationException e) {
 *       logger.warn("Discarding cached plan: {}", e.getMessage());
 *       replan();
 *   }
 * </pre>
 */
public class PlanDeserializationException extends RuntimeException {

    /**
     * Why a document was rejected.
     */
    public enum Reason {
        /** The document's discriminant names a different node type than the one requested. */
        TYPE_MISMATCH,
        /** The document's discriminant is not a known node type. */
        UNKNOWN_TYPE,
        /** A required field is absent or null. */
        MISSING_FIELD,
        /** A field is present but holds a value of the wrong shape. */
        INVALID_FIELD,
        /** The input is not a parseable document at all. */
        MALFORMED_DOCUMENT,
        /** The document nests deeper than the configured limit. */
        DEPTH_EXCEEDED
    }

    private final Reason reason;
    private final String nodeType;
    private final String field;

    /**
     * Creates a deserialization exception.
     *
     * @param reason why the document was rejected
     * @param nodeType the node type being reconstructed (may be null if unknown)
     * @param field the offending field (may be null)
     * @param message the error message
     */
    public PlanDeserializationException(Reason reason, String nodeType, String field, String message) {
        super(buildMessage(reason, nodeType, field, message));
        this.reason = reason;
        this.nodeType = nodeType;
        this.field = field;
    }

    /**
     * Creates a deserialization exception with a cause.
     *
     * @param reason why the document was rejected
     * @param nodeType the node type being reconstructed (may be null if unknown)
     * @param field the offending field (may be null)
     * @param message the error message
     * @param cause the underlying cause
     */
    public PlanDeserializationException(Reason reason, String nodeType, String field, String message,
                                        Throwable cause) {
        super(buildMessage(reason, nodeType, field, message), cause);
        this.reason = reason;
        this.nodeType = nodeType;
        this.field = field;
    }

    // ==================== Factory Methods ====================

    public static PlanDeserializationException missingField(String nodeType, String field) {
        return new PlanDeserializationException(Reason.MISSING_FIELD, nodeType, field,
            "required field '" + field + "' is missing");
    }

    public static PlanDeserializationException invalidField(String nodeType, String field, String expected) {
        return new PlanDeserializationException(Reason.INVALID_FIELD, nodeType, field,
            "field '" + field + "' must be " + expected);
    }

    public static PlanDeserializationException typeMismatch(String expectedType, String actualType,
                                                            String discriminantField) {
        return new PlanDeserializationException(Reason.TYPE_MISMATCH, expectedType, discriminantField,
            "document is tagged as " + actualType + ", expected " + expectedType);
    }

    public static PlanDeserializationException unknownType(String actualType, String discriminantField) {
        return new PlanDeserializationException(Reason.UNKNOWN_TYPE, null, discriminantField,
            "unknown node type '" + actualType + "'");
    }

    /**
     * Returns why the document was rejected.
     *
     * @return the reason
     */
    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the node type that was being reconstructed.
     *
     * @return the node type name, or null if it could not be determined
     */
    public String getNodeType() {
        return nodeType;
    }

    /**
     * Returns the field that caused the failure.
     *
     * @return the field name, or null if the failure is not tied to a field
     */
    public String getField() {
        return field;
    }

    private static String buildMessage(Reason reason, String nodeType, String field, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("Cannot deserialize ");
        sb.append(nodeType != null ? nodeType : "node");
        sb.append(" [").append(reason).append("]: ").append(message);
        if (field != null && !message.contains("'" + field + "'")) {
            sb.append(" (field: ").append(field).append(")");
        }
        return sb.toString();
    }
}
