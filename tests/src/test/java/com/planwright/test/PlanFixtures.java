package com.planwright.test;

import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.DatabaseOid;
import com.planwright.catalog.IndexOid;
import com.planwright.catalog.NamespaceOid;
import com.planwright.catalog.TableOid;
import com.planwright.expression.AbstractExpression;
import com.planwright.expression.ColumnValueExpression;
import com.planwright.expression.ComparisonExpression;
import com.planwright.expression.ConstantValueExpression;
import com.planwright.plannode.AbstractPlanNode;
import com.planwright.plannode.IndexScanPlanNode;
import com.planwright.plannode.LimitPlanNode;
import com.planwright.plannode.LogicalJoinType;
import com.planwright.plannode.NestedLoopJoinPlanNode;
import com.planwright.plannode.ProjectionPlanNode;
import com.planwright.plannode.SeqScanPlanNode;
import com.planwright.schema.OutputSchema;
import com.planwright.types.DataType;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for plans and expressions used across test classes.
 *
 * <p>Every fixture reads from table {@link #TABLE} in database {@link #DATABASE}
 * and namespace {@link #NAMESPACE}; column {@code n} is named {@code cn} and is an
 * INTEGER.
 */
public final class PlanFixtures {

    public static final DatabaseOid DATABASE = DatabaseOid.of(1);
    public static final NamespaceOid NAMESPACE = NamespaceOid.of(2);
    public static final TableOid TABLE = TableOid.of(10);
    public static final TableOid OTHER_TABLE = TableOid.of(20);
    public static final IndexOid INDEX = IndexOid.of(30);

    private PlanFixtures() {}

    public static ColumnValueExpression col(int columnOid) {
        return ColumnValueExpression.named(TABLE, ColumnOid.of(columnOid), "c" + columnOid, DataType.INTEGER);
    }

    public static List<ColumnOid> oids(int... values) {
        List<ColumnOid> result = new ArrayList<>();
        for (int value : values) {
            result.add(ColumnOid.of(value));
        }
        return result;
    }

    /**
     * Output schema with one pass-through column per given column OID.
     */
    public static OutputSchema schemaOf(int... columnOids) {
        List<OutputSchema.Column> columns = new ArrayList<>();
        for (int oid : columnOids) {
            columns.add(new OutputSchema.Column("c" + oid, col(oid)));
        }
        return new OutputSchema(columns);
    }

    /** {@code c<column> > value} */
    public static ComparisonExpression greaterThan(int columnOid, int value) {
        return ComparisonExpression.greaterThan(col(columnOid), ConstantValueExpression.of(value));
    }

    public static SeqScanPlanNode.Builder seqScanBuilder(List<ColumnOid> columnOids, OutputSchema schema) {
        return SeqScanPlanNode.builder()
            .setDatabaseOid(DATABASE)
            .setNamespaceOid(NAMESPACE)
            .setTableOid(TABLE)
            .setColumnOids(columnOids)
            .setOutputSchema(schema);
    }

    public static SeqScanPlanNode seqScan(List<ColumnOid> columnOids, AbstractExpression predicate,
                                          OutputSchema schema) {
        return seqScanBuilder(columnOids, schema).setScanPredicate(predicate).build();
    }

    public static IndexScanPlanNode indexScan(AbstractExpression predicate) {
        return IndexScanPlanNode.builder()
            .setDatabaseOid(DATABASE)
            .setNamespaceOid(NAMESPACE)
            .setTableOid(TABLE)
            .setIndexOid(INDEX)
            .setColumnOids(oids(1, 2))
            .setScanPredicate(predicate)
            .setOutputSchema(schemaOf(1, 2))
            .build();
    }

    public static ProjectionPlanNode projection(AbstractPlanNode child) {
        return ProjectionPlanNode.builder()
            .addChild(child)
            .setOutputSchema(schemaOf(1))
            .build();
    }

    public static LimitPlanNode limit(AbstractPlanNode child, long limit, long offset) {
        return LimitPlanNode.builder()
            .addChild(child)
            .setOutputSchema(child.getOutputSchema())
            .setLimit(limit)
            .setOffset(offset)
            .build();
    }

    public static NestedLoopJoinPlanNode join(LogicalJoinType joinType, AbstractExpression predicate) {
        SeqScanPlanNode outer = seqScan(oids(1, 2), null, schemaOf(1, 2));
        SeqScanPlanNode inner = SeqScanPlanNode.builder()
            .setDatabaseOid(DATABASE)
            .setNamespaceOid(NAMESPACE)
            .setTableOid(OTHER_TABLE)
            .setColumnOids(oids(7))
            .setOutputSchema(new OutputSchema(new OutputSchema.Column("k",
                ColumnValueExpression.of(OTHER_TABLE, ColumnOid.of(7), DataType.INTEGER))))
            .build();
        return NestedLoopJoinPlanNode.builder()
            .addChild(outer)
            .addChild(inner)
            .setJoinType(joinType)
            .setJoinPredicate(predicate)
            .setOutputSchema(schemaOf(1, 2))
            .build();
    }

    /**
     * One node of every kind, including a multi-level tree.
     */
    public static List<AbstractPlanNode> oneOfEachKind() {
        SeqScanPlanNode scan = seqScan(oids(1, 2, 3), greaterThan(3, 100), schemaOf(2));
        return List.of(
            scan,
            seqScan(oids(1, 1, 2), null, schemaOf(1, 2)),
            indexScan(greaterThan(1, 5)),
            projection(scan),
            limit(scan, 10, 5),
            join(LogicalJoinType.INNER,
                ComparisonExpression.equal(col(1),
                    ColumnValueExpression.of(OTHER_TABLE, ColumnOid.of(7), DataType.INTEGER))),
            join(LogicalJoinType.SEMI, null),
            limit(projection(join(LogicalJoinType.LEFT, greaterThan(2, 0))), 1, 0));
    }
}
