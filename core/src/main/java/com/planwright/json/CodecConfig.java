package com.planwright.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the plan document codec.
 *
 * <p>Values are read from system properties each time they are requested, so tests
 * and embedding applications can change them without restarting:
 * <ul>
 *   <li>{@value #PROP_MAX_DEPTH} - maximum nesting depth of an accepted document
 *       (default {@value #DEFAULT_MAX_DEPTH})</li>
 *   <li>{@value #PROP_PRETTY_PRINT} - indent serialized documents
 *       (default {@code false})</li>
 * </ul>
 */
public final class CodecConfig {

    private static final Logger logger = LoggerFactory.getLogger(CodecConfig.class);

    public static final String PROP_MAX_DEPTH = "planwright.codec.maxDepth";
    public static final String PROP_PRETTY_PRINT = "planwright.codec.prettyPrint";

    /** Default maximum document depth. A plan level costs a handful of nesting levels. */
    public static final int DEFAULT_MAX_DEPTH = 256;

    private CodecConfig() {} // Utility class

    /**
     * Returns the maximum nesting depth of a document the codec will decode.
     *
     * @return the configured depth, or {@link #DEFAULT_MAX_DEPTH} if unset or invalid
     */
    public static int maxDocumentDepth() {
        String value = System.getProperty(PROP_MAX_DEPTH);
        if (value != null) {
            try {
                int depth = Integer.parseInt(value.trim());
                if (depth > 0) {
                    return depth;
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {}='{}'", PROP_MAX_DEPTH, value);
                return DEFAULT_MAX_DEPTH;
            }
            logger.warn("Ignoring non-positive {}={}", PROP_MAX_DEPTH, value);
        }
        return DEFAULT_MAX_DEPTH;
    }

    /**
     * Returns whether serialized documents are indented.
     *
     * @return true if pretty printing is enabled
     */
    public static boolean prettyPrint() {
        return Boolean.parseBoolean(System.getProperty(PROP_PRETTY_PRINT, "false"));
    }
}
