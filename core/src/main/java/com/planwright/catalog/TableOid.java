package com.planwright.catalog;

/**
 * Catalog identifier of a table.
 *
 * @param value the raw OID
 */
public record TableOid(int value) implements Oid {

    /** The reserved invalid table OID. */
    public static final TableOid INVALID = new TableOid(INVALID_VALUE);

    public static TableOid of(int value) {
        return value == INVALID_VALUE ? INVALID : new TableOid(value);
    }

    @Override
    public String toString() {
        return "table_oid(" + Integer.toUnsignedString(value) + ")";
    }
}
