package com.planwright.catalog;

/**
 * Catalog identifier of a index.
 *
 * @param value the raw OID
 */
public record IndexOid(int value) implements Oid {

    /** The reserved invalid index OID. */
    public static final IndexOid INVALID = new IndexOid(INVALID_VALUE);

    public static IndexOid of(int value) {
        return value == INVALID_VALUE ? INVALID : new IndexOid(value);
    }

    @Override
    public String toString() {
        return "index_oid(" + Integer.toUnsignedString(value) + ")";
    }
}
