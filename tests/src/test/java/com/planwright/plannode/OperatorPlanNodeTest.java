package com.planwright.plannode;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.catalog.ColumnOid;
import com.planwright.catalog.IndexOid;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.expression.ConstantValueExpression;
import com.planwright.test.TestBase;
import com.planwright.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.planwright.test.PlanFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the non-sequential operator nodes: index scan, projection, limit
 * and nested loop join.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Plan
@DisplayName("Operator Plan Node Tests")
public class OperatorPlanNodeTest extends TestBase {

    @Nested
    @DisplayName("IndexScanPlanNode")
    class IndexScanTests {

        @Test
        @DisplayName("Builder sets index, table and columns")
        void testFields() {
            IndexScanPlanNode scan = indexScan(greaterThan(1, 5));

            assertThat(scan.getPlanNodeType()).isEqualTo(PlanNodeType.INDEXSCAN);
            assertThat(scan.getIndexOid()).isEqualTo(INDEX);
            assertThat(scan.getTableOid()).isEqualTo(TABLE);
            assertThat(scan.getColumnOids()).containsExactlyElementsOf(oids(1, 2));
            assertThat(scan.getScanPredicate()).isPresent();
        }

        @Test
        @DisplayName("Referenced columns cover predicate and schema")
        void testCollectInputOids() {
            IndexScanPlanNode scan = indexScan(greaterThan(3, 5));

            assertThat(scan.collectInputOids())
                .containsExactlyInAnyOrder(ColumnOid.of(1), ColumnOid.of(2), ColumnOid.of(3));
        }

        @Test
        @DisplayName("Index OID takes part in equality")
        void testIndexOidCompared() {
            IndexScanPlanNode a = indexScan(null);
            IndexScanPlanNode b = IndexScanPlanNode.builder()
                .setDatabaseOid(DATABASE)
                .setNamespaceOid(NAMESPACE)
                .setTableOid(TABLE)
                .setIndexOid(IndexOid.of(31))
                .setColumnOids(oids(1, 2))
                .setOutputSchema(schemaOf(1, 2))
                .build();

            assertThat(a).isNotEqualTo(b);
            assertThat(a.hash()).isNotEqualTo(b.hash());
        }

        @Test
        @DisplayName("Missing index OID fails at build time")
        void testMissingIndexOid() {
            assertThatThrownBy(() -> IndexScanPlanNode.builder()
                    .setDatabaseOid(DATABASE)
                    .setNamespaceOid(NAMESPACE)
                    .setTableOid(TABLE)
                    .setOutputSchema(schemaOf(1))
                    .build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("indexOid");
        }

        @Test
        @DisplayName("Sequential scan document is rejected")
        void testTypeMismatch() {
            ObjectNode doc = seqScan(oids(1), null, schemaOf(1)).toJson();

            assertThatThrownBy(() -> IndexScanPlanNode.fromJson(doc))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(PlanDeserializationException.Reason.TYPE_MISMATCH));
        }
    }

    @Nested
    @DisplayName("ProjectionPlanNode")
    class ProjectionTests {

        @Test
        @DisplayName("Projection wraps its child")
        void testChild() {
            SeqScanPlanNode scan = seqScan(oids(1, 2), null, schemaOf(1, 2));
            ProjectionPlanNode projection = projection(scan);

            assertThat(projection.getPlanNodeType()).isEqualTo(PlanNodeType.PROJECTION);
            assertThat(projection.getChildrenSize()).isEqualTo(1);
            assertThat(projection.getChild(0)).isSameAs(scan);
            assertThat(projection.getOutputSchema().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Projections over different children differ")
        void testChildCompared() {
            ProjectionPlanNode a = projection(seqScan(oids(1), null, schemaOf(1)));
            ProjectionPlanNode b = projection(seqScan(oids(2), null, schemaOf(1)));

            assertThat(a).isNotEqualTo(b);
            assertThat(a.hash()).isNotEqualTo(b.hash());
        }

        @Test
        @DisplayName("Replacing children with the builder's own list keeps them")
        void testSetChildrenFromOwnList() {
            SeqScanPlanNode scan = seqScan(oids(1), null, schemaOf(1));
            ProjectionPlanNode.Builder builder = ProjectionPlanNode.builder()
                .addChild(scan)
                .setOutputSchema(schemaOf(1));

            ProjectionPlanNode projection = builder.setChildren(builder.children).build();

            assertThat(projection.getChildren()).containsExactly(scan);
        }

        @Test
        @DisplayName("Replacing children discards earlier ones")
        void testSetChildrenReplaces() {
            SeqScanPlanNode first = seqScan(oids(1), null, schemaOf(1));
            SeqScanPlanNode second = seqScan(oids(2), null, schemaOf(1));

            ProjectionPlanNode projection = ProjectionPlanNode.builder()
                .addChild(first)
                .setChildren(List.of(second))
                .setOutputSchema(schemaOf(1))
                .build();

            assertThat(projection.getChildren()).containsExactly(second);
        }

        @Test
        @DisplayName("Child index out of range throws")
        void testChildOutOfRange() {
            ProjectionPlanNode projection = projection(seqScan(oids(1), null, schemaOf(1)));

            assertThatThrownBy(() -> projection.getChild(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    @DisplayName("LimitPlanNode")
    class LimitTests {

        @Test
        @DisplayName("Limit and offset are kept")
        void testFields() {
            LimitPlanNode node = limit(seqScan(oids(1), null, schemaOf(1)), 10, 5);

            assertThat(node.getPlanNodeType()).isEqualTo(PlanNodeType.LIMIT);
            assertThat(node.getLimit()).isEqualTo(10);
            assertThat(node.getOffset()).isEqualTo(5);
            assertThat(node.toString()).isEqualTo("Limit(10, offset=5)");
        }

        @Test
        @DisplayName("Negative counts are rejected")
        void testNegativeRejected() {
            assertThatThrownBy(() -> LimitPlanNode.builder().setLimit(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit must be non-negative");
            assertThatThrownBy(() -> LimitPlanNode.builder().setOffset(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset must be non-negative");
        }

        @Test
        @DisplayName("Zero limit is allowed")
        void testZeroLimit() {
            LimitPlanNode node = limit(seqScan(oids(1), null, schemaOf(1)), 0, 0);

            assertThat(node.getLimit()).isZero();
            assertThat(node.toString()).isEqualTo("Limit(0)");
        }

        @Test
        @DisplayName("Limit and offset are not interchangeable")
        void testLimitOffsetDistinct() {
            SeqScanPlanNode scan = seqScan(oids(1), null, schemaOf(1));

            assertThat(limit(scan, 10, 5)).isNotEqualTo(limit(scan, 5, 10));
            assertThat(limit(scan, 10, 5).hash()).isNotEqualTo(limit(scan, 5, 10).hash());
        }

        @Test
        @DisplayName("Negative count in a document is rejected")
        void testNegativeInDocument() {
            ObjectNode doc = limit(seqScan(oids(1), null, schemaOf(1)), 10, 0).toJson();
            doc.put("offset", -3);

            assertThatThrownBy(() -> LimitPlanNode.fromJson(doc))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(PlanDeserializationException.Reason.INVALID_FIELD);
                    assertThat(e.getField()).isEqualTo("offset");
                });
        }

        @Test
        @DisplayName("Counts beyond 32 bits survive a round trip")
        void testLargeCounts() {
            LimitPlanNode node = limit(seqScan(oids(1), null, schemaOf(1)), 5_000_000_000L, 3_000_000_000L);

            assertThat(LimitPlanNode.fromJson(node.toJson())).isEqualTo(node);
        }
    }

    @Nested
    @DisplayName("NestedLoopJoinPlanNode")
    class NestedLoopJoinTests {

        @Test
        @DisplayName("Join carries type, predicate and two children")
        void testFields() {
            NestedLoopJoinPlanNode node = join(LogicalJoinType.LEFT, greaterThan(1, 0));

            assertThat(node.getPlanNodeType()).isEqualTo(PlanNodeType.NESTLOOP);
            assertThat(node.getLogicalJoinType()).isEqualTo(LogicalJoinType.LEFT);
            assertThat(node.getJoinPredicate()).contains(greaterThan(1, 0));
            assertThat(node.getChildrenSize()).isEqualTo(2);
        }

        @ParameterizedTest
        @EnumSource(LogicalJoinType.class)
        @DisplayName("Every join type survives a round trip")
        void testJoinTypes(LogicalJoinType joinType) {
            NestedLoopJoinPlanNode node = join(joinType, greaterThan(2, 1));

            assertThat(NestedLoopJoinPlanNode.fromJson(node.toJson())).isEqualTo(node);
        }

        @Test
        @DisplayName("Absent predicate differs from an always-true predicate")
        void testAbsentPredicate() {
            NestedLoopJoinPlanNode cross = join(LogicalJoinType.INNER, null);
            NestedLoopJoinPlanNode alwaysTrue = join(LogicalJoinType.INNER, ConstantValueExpression.of(true));

            assertThat(cross.getJoinPredicate()).isEmpty();
            assertThat(cross).isNotEqualTo(alwaysTrue);
            assertThat(cross.hash()).isNotEqualTo(alwaysTrue.hash());
        }

        @Test
        @DisplayName("Join type takes part in equality")
        void testJoinTypeCompared() {
            assertThat(join(LogicalJoinType.SEMI, null)).isNotEqualTo(join(LogicalJoinType.ANTI, null));
        }

        @Test
        @DisplayName("Unknown join type in a document is rejected")
        void testUnknownJoinType() {
            ObjectNode doc = join(LogicalJoinType.INNER, null).toJson();
            doc.put("join_type", "CROSS");

            assertThatThrownBy(() -> NestedLoopJoinPlanNode.fromJson(doc))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(PlanDeserializationException.Reason.INVALID_FIELD);
                    assertThat(e.getField()).isEqualTo("join_type");
                });
        }

        @Test
        @DisplayName("Missing join type fails at build time")
        void testMissingJoinType() {
            assertThatThrownBy(() -> NestedLoopJoinPlanNode.builder()
                    .setOutputSchema(schemaOf(1))
                    .build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("joinType");
        }
    }
}
