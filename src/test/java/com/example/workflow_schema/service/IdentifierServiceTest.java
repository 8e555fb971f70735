package com.example.workflow_schema.service;

import static org.assertj.core.api.Assertions.*;

import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.IdentifierRegistry;
import com.example.workflow_schema.graph.NodeKind;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IdentifierServiceTest {

    private final IdentifierService service = new IdentifierService();

    @Nested
    @DisplayName("Slug rule")
    class SlugTests {

        @Test
        @DisplayName("should lower-case and join words with underscores")
        void testSimpleSlug() {
            assertThat(service.slugOf("Order Drink")).isEqualTo("order_drink");
        }

        @Test
        @DisplayName("should trim and drop apostrophes")
        void testTrimAndApostrophe() {
            assertThat(service.slugOf("  Customer's Order  ")).isEqualTo("customers_order");
        }

        @Test
        @DisplayName("should drop punctuation after replacing spaces")
        void testPunctuation() {
            assertThat(service.slugOf("Step 1: Check-in")).isEqualTo("step_1_checkin");
        }

        @Test
        @DisplayName("should turn each space of a run into its own underscore")
        void testConsecutiveSpaces() {
            assertThat(service.slugOf("a  b")).isEqualTo("a__b");
        }

        @Test
        @DisplayName("should drop tabs instead of replacing them")
        void testTab() {
            assertThat(service.slugOf("Tab\tSeparated")).isEqualTo("tabseparated");
        }

        @Test
        @DisplayName("should keep superscripts, fractions and numeral letters")
        void testOtherNumbers() {
            assertThat(service.slugOf("Area m²")).isEqualTo("area_m²");
            assertThat(service.slugOf("½ cup")).isEqualTo("½_cup");
            assertThat(service.slugOf("Chapter Ⅻ")).isEqualTo("chapter_ⅻ");
        }

        @Test
        @DisplayName("should fall back to unnamed_action when nothing survives")
        void testEmptySlug() {
            assertThat(service.slugOf("!!!")).isEqualTo(IdentifierService.UNNAMED_ACTION);
            assertThat(service.slugOf(null)).isEqualTo(IdentifierService.UNNAMED_ACTION);
        }
    }

    @Nested
    @DisplayName("Reference mapping")
    class MappingTests {

        @Test
        @DisplayName("should suffix a second node with the same text")
        void testDuplicateText() {
            // Given
            FlowGraph g = FlowGraph.builder()
                    .node("n1", NodeKind.ACTIVITY, "Order Drink")
                    .node("n2", NodeKind.ACTIVITY, "Order Drink")
                    .build();

            // When
            ReferenceMapping refs = service.buildReferenceMapping(g);

            // Then
            assertThat(refs.getActionIds()).containsEntry("n1", "order_drink").containsEntry("n2", "order_drink_2");
        }

        @Test
        @DisplayName("should name gateways by wire kind and input position")
        void testGatewayIds() {
            // Given
            FlowGraph g = FlowGraph.builder()
                    .node("s", NodeKind.START, "")
                    .node("fork", NodeKind.PARALLEL_GATEWAY, "")
                    .node("a", NodeKind.ACTIVITY, "Work")
                    .node("choice", NodeKind.EXCLUSIVE_GATEWAY, "")
                    .node("opt", NodeKind.INCLUSIVE_GATEWAY, "")
                    .build();

            // When
            ReferenceMapping refs = service.buildReferenceMapping(g);

            // Then
            assertThat(refs.getGatewayIds()).containsExactly(
                    entry("fork", "gateway_and_1"),
                    entry("choice", "gateway_xor_3"),
                    entry("opt", "gateway_or_4"));
        }

        @Test
        @DisplayName("should leave unlabeled Start and End nodes out of the action ids")
        void testUnlabeledStructuralNodes() {
            // Given
            FlowGraph g = FlowGraph.builder()
                    .node("s", NodeKind.START, "")
                    .node("a", NodeKind.ACTIVITY, "Work")
                    .node("e", NodeKind.END, " ")
                    .build();

            // When
            ReferenceMapping refs = service.buildReferenceMapping(g);

            // Then
            assertThat(refs.getActionIds()).containsOnlyKeys("a");
            assertThat(refs.schemaIdOf("s")).isEqualTo(ReferenceMapping.START_SENTINEL);
            assertThat(refs.schemaIdOf("e")).isNull();
        }

        @Test
        @DisplayName("should rebuild the same mapping on every call")
        void testFreshRegistryPerCall() {
            // Given
            FlowGraph g = FlowGraph.builder()
                    .node("n1", NodeKind.ACTIVITY, "Order Drink")
                    .node("n2", NodeKind.ACTIVITY, "Order Drink")
                    .build();

            // When
            ReferenceMapping first = service.buildReferenceMapping(g);
            ReferenceMapping second = service.buildReferenceMapping(g);

            // Then
            assertThat(second.getActionIds()).isEqualTo(first.getActionIds());
        }

        @Test
        @DisplayName("should claim ids through the given registry")
        void testActionIdWithRegistry() {
            // Given
            IdentifierRegistry registry = new IdentifierRegistry();

            // When
            String first = service.actionId("Check stock", registry);
            String second = service.actionId("check  stock", registry);
            String third = service.actionId("Check stock!", registry);

            // Then
            assertThat(first).isEqualTo("check_stock");
            assertThat(second).isEqualTo("check__stock");
            assertThat(third).isEqualTo("check_stock_2");
        }
    }
}
