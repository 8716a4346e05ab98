package com.planwright.catalog;

/**
 * Common view over the strongly-typed catalog identifiers.
 *
 * <p>OIDs are opaque unsigned 32-bit identifiers handed out by the catalog. Each
 * identifier kind is its own type so that a table OID can never be passed where a
 * column OID is expected; two OIDs of different kinds are never equal even when
 * they carry the same number.
 *
 * <p>The value {@code 0} is reserved as the invalid OID for every kind.
 */
public sealed interface Oid permits DatabaseOid, NamespaceOid, TableOid, ColumnOid, IndexOid {

    /** Raw value of the invalid OID. */
    int INVALID_VALUE = 0;

    /**
     * Returns the raw identifier.
     *
     * @return the raw value
     */
    int value();

    /**
     * Returns whether this OID refers to a catalog object.
     *
     * @return false for the reserved invalid OID
     */
    default boolean isValid() {
        return value() != INVALID_VALUE;
    }
}
