package com.planwright.catalog;

/**
 * Catalog identifier of a column.
 *
 * @param value the raw OID
 */
public record ColumnOid(int value) implements Oid {

    /** The reserved invalid column OID. */
    public static final ColumnOid INVALID = new ColumnOid(INVALID_VALUE);

    public static ColumnOid of(int value) {
        return value == INVALID_VALUE ? INVALID : new ColumnOid(value);
    }

    @Override
    public String toString() {
        return "column_oid(" + Integer.toUnsignedString(value) + ")";
    }
}
