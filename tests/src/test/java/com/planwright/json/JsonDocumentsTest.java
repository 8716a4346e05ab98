package com.planwright.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.exception.PlanDeserializationException;
import com.planwright.exception.PlanDeserializationException.Reason;
import com.planwright.test.TestBase;
import com.planwright.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the document field accessors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Serialization
@DisplayName("JsonDocuments Tests")
public class JsonDocumentsTest extends TestBase {

    private ObjectNode doc;

    @Override
    protected void doSetUp() {
        doc = JsonDocuments.newDocument();
        doc.put("name", "scan");
        doc.put("flag", true);
        doc.put("small", 7);
        doc.put("big", 5_000_000_000L);
        doc.put("ratio", 1.5);
        doc.putNull("nothing");
        doc.putArray("list").add(1);
        doc.putObject("nested").put("x", 1);
    }

    @Nested
    @DisplayName("Required Fields")
    class RequiredFieldTests {

        @Test
        @DisplayName("Present fields of the right shape are returned")
        void testPresentFields() {
            assertThat(JsonDocuments.requireText(doc, "name", "T")).isEqualTo("scan");
            assertThat(JsonDocuments.requireBoolean(doc, "flag", "T")).isTrue();
            assertThat(JsonDocuments.requireInt(doc, "small", "T")).isEqualTo(7);
            assertThat(JsonDocuments.requireLong(doc, "big", "T")).isEqualTo(5_000_000_000L);
            assertThat(JsonDocuments.requireArray(doc, "list", "T").size()).isEqualTo(1);
            assertThat(JsonDocuments.requireObject(doc, "nested", "T").get("x").intValue()).isEqualTo(1);
        }

        @Test
        @DisplayName("Absent and null fields are MISSING_FIELD")
        void testMissing() {
            assertThatThrownBy(() -> JsonDocuments.requireText(doc, "absent", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(Reason.MISSING_FIELD);
                    assertThat(e.getNodeType()).isEqualTo("T");
                    assertThat(e.getField()).isEqualTo("absent");
                });
            assertThatThrownBy(() -> JsonDocuments.requireText(doc, "nothing", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.MISSING_FIELD));
        }

        @Test
        @DisplayName("Wrong shapes are INVALID_FIELD")
        void testWrongShape() {
            assertThatThrownBy(() -> JsonDocuments.requireInt(doc, "big", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD));
            assertThatThrownBy(() -> JsonDocuments.requireInt(doc, "ratio", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD));
            assertThatThrownBy(() -> JsonDocuments.requireBoolean(doc, "name", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD));
            assertThatThrownBy(() -> JsonDocuments.requireArray(doc, "nested", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD));
        }

        @Test
        @DisplayName("Discriminant mismatch is TYPE_MISMATCH")
        void testRequireType() {
            JsonDocuments.requireType(doc, "name", "scan");

            assertThatThrownBy(() -> JsonDocuments.requireType(doc, "name", "join"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(Reason.TYPE_MISMATCH);
                    assertThat(e.getNodeType()).isEqualTo("join");
                })
                .hasMessageContaining("tagged as scan");
        }
    }

    @Nested
    @DisplayName("Optional Fields")
    class OptionalFieldTests {

        @Test
        @DisplayName("Absent and null are empty")
        void testEmpty() {
            assertThat(JsonDocuments.optionalObject(doc, "absent", "T")).isEmpty();
            assertThat(JsonDocuments.optionalObject(doc, "nothing", "T")).isEmpty();
        }

        @Test
        @DisplayName("Object is returned, other shapes are rejected")
        void testPresent() {
            assertThat(JsonDocuments.optionalObject(doc, "nested", "T")).isPresent();
            assertThatThrownBy(() -> JsonDocuments.optionalObject(doc, "list", "T"))
                .isInstanceOfSatisfying(PlanDeserializationException.class, e ->
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_FIELD));
        }
    }

    @Test
    @DisplayName("Depth counts container nesting")
    void testDepth() {
        assertThat(JsonDocuments.depth(JsonDocuments.newDocument())).isEqualTo(1);
        assertThat(JsonDocuments.depth(doc)).isEqualTo(2);

        ObjectNode deep = JsonDocuments.newDocument();
        deep.putArray("a").addObject().putArray("b");
        assertThat(JsonDocuments.depth(deep)).isEqualTo(4);
        assertThat(JsonDocuments.depth(null)).isZero();
    }
}
