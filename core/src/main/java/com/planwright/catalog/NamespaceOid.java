package com.planwright.catalog;

/**
 * Catalog identifier of a namespace.
 *
 * @param value the raw OID
 */
public record NamespaceOid(int value) implements Oid {

    /** The reserved invalid namespace OID. */
    public static final NamespaceOid INVALID = new NamespaceOid(INVALID_VALUE);

    public static NamespaceOid of(int value) {
        return value == INVALID_VALUE ? INVALID : new NamespaceOid(value);
    }

    @Override
    public String toString() {
        return "namespace_oid(" + Integer.toUnsignedString(value) + ")";
    }
}
