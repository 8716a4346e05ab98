package com.planwright.catalog;

/**
 * Catalog identifier of a database.
 *
 * @param value the raw OID
 */
public record DatabaseOid(int value) implements Oid {

    /** The reserved invalid database OID. */
    public static final DatabaseOid INVALID = new DatabaseOid(INVALID_VALUE);

    public static DatabaseOid of(int value) {
        return value == INVALID_VALUE ? INVALID : new DatabaseOid(value);
    }

    @Override
    public String toString() {
        return "database_oid(" + Integer.toUnsignedString(value) + ")";
    }
}
