package com.planwright.types;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * SQL value types that can appear in output schemas and expression return types.
 *
 * <p>Each type has a stable {@link #typeName() type name} that is written into
 * serialized plan documents, so the names must never change once plans have been
 * persisted.
 *
 * <p>Types map to Java value classes as follows:
 * <ul>
 *   <li>BOOLEAN - {@link Boolean}</li>
 *   <li>INTEGER - {@link Integer}</li>
 *   <li>BIGINT - {@link Long}</li>
 *   <li>DOUBLE - {@link Double}</li>
 *   <li>VARCHAR - {@link String}</li>
 *   <li>DATE - {@link LocalDate}</li>
 *   <li>TIMESTAMP - {@link Instant}</li>
 * </ul>
 * {@code INVALID} is the type of expressions whose type has not been derived.
 */
public enum DataType {

    BOOLEAN("boolean", 1, Boolean.class),
    INTEGER("integer", 4, Integer.class),
    BIGINT("bigint", 8, Long.class),
    DOUBLE("double", 8, Double.class),
    VARCHAR("varchar", -1, String.class),
    DATE("date", 4, LocalDate.class),
    TIMESTAMP("timestamp", 8, Instant.class),
    INVALID("invalid", -1, Void.class);

    private final String typeName;
    private final int defaultSize;
    private final Class<?> javaClass;

    DataType(String typeName, int defaultSize, Class<?> javaClass) {
        this.typeName = typeName;
        this.defaultSize = defaultSize;
        this.javaClass = javaClass;
    }

    /**
     * Returns the serialized name of this type.
     *
     * @return the type name
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Returns the default size in bytes for values of this type.
     *
     * @return the size in bytes, or -1 for variable-length types
     */
    public int defaultSize() {
        return defaultSize;
    }

    /**
     * Returns the Java class used to hold non-null values of this type.
     *
     * @return the value class
     */
    public Class<?> javaClass() {
        return javaClass;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == BIGINT || this == DOUBLE;
    }

    /**
     * Returns whether the given value may be held by a constant of this type.
     * Null is accepted by every type.
     *
     * @param value the candidate value
     * @return true if the value's class matches this type
     */
    public boolean accepts(Object value) {
        return value == null || javaClass.isInstance(value);
    }

    /**
     * Resolves a type from its serialized name (case-insensitive).
     *
     * @param name the type name
     * @return the data type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DataType fromTypeName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Type name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.typeName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported data type: " + name);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
