package com.planwright.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.exception.PlanDeserializationException.Reason;
import com.planwright.expression.ConstantValueExpression;
import com.planwright.expression.OperatorExpression;
import com.planwright.test.TestBase;
import com.planwright.test.TestCategories;
import com.planwright.types.DataType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.planwright.test.PlanFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for OutputSchema.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("OutputSchema Tests")
public class OutputSchemaTest extends TestBase {

    @Test
    @DisplayName("Columns keep order and types")
    void testColumns() {
        OutputSchema schema = new OutputSchema(
            new OutputSchema.Column("id", col(1)),
            new OutputSchema.Column("total", OperatorExpression.plus(col(2), ConstantValueExpression.of(1.5))));

        assertThat(schema.size()).isEqualTo(2);
        assertThat(schema.getColumn(0).name()).isEqualTo("id");
        assertThat(schema.getColumn(0).type()).isEqualTo(DataType.INTEGER);
        assertThat(schema.getColumn(1).type()).isEqualTo(DataType.DOUBLE);
        assertThat(schema.columnIndex("total")).isEqualTo(1);
        assertThat(schema.columnIndex("missing")).isEqualTo(-1);
        assertThat(schema.getExpressions()).containsExactly(col(1),
            OperatorExpression.plus(col(2), ConstantValueExpression.of(1.5)));
    }

    @Test
    @DisplayName("Column rejects null parts")
    void testColumnNulls() {
        assertThatThrownBy(() -> new OutputSchema.Column(null, col(1)))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new OutputSchema.Column("x", DataType.INTEGER, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Equality is structural and order-sensitive")
    void testEquality() {
        assertThat(schemaOf(1, 2)).isEqualTo(schemaOf(1, 2));
        assertThat(schemaOf(1, 2).hash()).isEqualTo(schemaOf(1, 2).hash());
        assertThat(schemaOf(1, 2)).isNotEqualTo(schemaOf(2, 1));
        assertThat(schemaOf(1, 2).hash()).isNotEqualTo(schemaOf(2, 1).hash());
        assertThat(new OutputSchema()).isNotEqualTo(schemaOf(1));
    }

    @Test
    @DisplayName("Declared type takes part in equality")
    void testDeclaredType() {
        OutputSchema asInteger = new OutputSchema(new OutputSchema.Column("c1", DataType.INTEGER, col(1)));
        OutputSchema asBigint = new OutputSchema(new OutputSchema.Column("c1", DataType.BIGINT, col(1)));

        assertThat(asInteger).isNotEqualTo(asBigint);
    }

    @Test
    @DisplayName("Document round trip reproduces the schema")
    void testRoundTrip() {
        OutputSchema schema = schemaOf(1, 2, 3);
        ObjectNode doc = schema.toJson();

        assertThat(doc.get("columns").size()).isEqualTo(3);
        assertThat(doc.get("columns").get(0).get("type").asText()).isEqualTo("integer");
        assertThat(OutputSchema.fromJson(doc)).isEqualTo(schema);
    }

    @Test
    @DisplayName("Unknown column type is rejected")
    void testUnknownType() {
        ObjectNode doc = schemaOf(1).toJson();
        ((ObjectNode) doc.get("columns").get(0)).put("type", "money");

        assertThatThrownBy(() -> OutputSchema.fromJson(doc))
            .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD);
                assertThat(e.getNodeType()).isEqualTo("output_schema");
                assertThat(e.getField()).isEqualTo("type");
            });
    }

    @Test
    @DisplayName("Column without expression is rejected")
    void testMissingExpression() {
        ObjectNode doc = schemaOf(1).toJson();
        ((ObjectNode) doc.get("columns").get(0)).remove("expr");

        assertThatThrownBy(() -> OutputSchema.fromJson(doc))
            .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                assertThat(e.getReason()).isEqualTo(Reason.MISSING_FIELD);
                assertThat(e.getField()).isEqualTo("expr");
            });
    }
}
