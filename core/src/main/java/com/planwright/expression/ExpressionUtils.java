package com.planwright.expression;

import com.planwright.catalog.ColumnOid;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Utility methods for inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Adds the OID of every column the expression dereferences to {@code result}.
     *
     * <p>A {@link ExpressionType#COLUMN_VALUE} node contributes its column OID;
     * any other node contributes whatever its children contribute. Pure and
     * allocation-free apart from the set insertions.
     *
     * @param expr the expression to walk
     * @param result the set to add to
     */
    public static void collectColumnOids(AbstractExpression expr, Set<ColumnOid> result) {
        if (expr.getExpressionType() == ExpressionType.COLUMN_VALUE) {
            result.add(((ColumnValueExpression) expr).getColumnOid());
            return;
        }
        for (AbstractExpression child : expr.getChildren()) {
            collectColumnOids(child, result);
        }
    }

    /**
     * Returns the set of column OIDs dereferenced by any of the given expressions.
     *
     * @param exprs the expressions
     * @return a new mutable set (unordered)
     */
    public static Set<ColumnOid> collectColumnOids(Collection<? extends AbstractExpression> exprs) {
        Set<ColumnOid> result = new HashSet<>();
        for (AbstractExpression expr : exprs) {
            collectColumnOids(expr, result);
        }
        return result;
    }
}
