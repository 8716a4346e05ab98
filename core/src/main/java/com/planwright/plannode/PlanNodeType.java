package com.planwright.plannode;

/**
 * Discriminant of the concrete plan node kinds.
 *
 * <p>The constant names are the values of the {@code plan_node_type} field in
 * serialized plans. Adding a kind means adding a constant here, a concrete
 * {@link AbstractPlanNode} subclass, and a case in
 * {@link AbstractPlanNode#fromJson}; the compiler rejects the last step if it is
 * forgotten.
 */
public enum PlanNodeType {

    /** Sequential table scan. */
    SEQSCAN,

    /** Index scan. */
    INDEXSCAN,

    /** Projection over a single child. */
    PROJECTION,

    /** Row count restriction with offset. */
    LIMIT,

    /** Nested loop join. */
    NESTLOOP;

    /**
     * Resolves a serialized plan node type.
     *
     * @param name the constant name
     * @return the plan node type, or null if the name is unknown
     */
    public static PlanNodeType fromName(String name) {
        for (PlanNodeType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return null;
    }
}
