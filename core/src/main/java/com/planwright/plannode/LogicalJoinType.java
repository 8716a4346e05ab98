package com.planwright.plannode;

/**
 * Join semantics of a join plan node.
 */
public enum LogicalJoinType {
    INNER,
    LEFT,
    RIGHT,
    OUTER,
    /** Outer rows that have at least one match. */
    SEMI,
    /** Outer rows that have no match. */
    ANTI
}
