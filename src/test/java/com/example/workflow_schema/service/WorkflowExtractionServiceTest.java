package com.example.workflow_schema.service;

import static com.example.workflow_schema.TestRecords.*;
import static org.assertj.core.api.Assertions.*;

import com.example.workflow_schema.config.ExtractionOptions;
import com.example.workflow_schema.dto.ActionItem;
import com.example.workflow_schema.dto.BatchExtractionResult;
import com.example.workflow_schema.dto.BranchItem;
import com.example.workflow_schema.dto.ExecutionStateItem;
import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.GatewayItem;
import com.example.workflow_schema.dto.IdentifierMapping;
import com.example.workflow_schema.dto.SequenceFlowItem;
import com.example.workflow_schema.dto.StepNodeItem;
import com.example.workflow_schema.dto.WorkflowDocument;
import com.example.workflow_schema.dto.WorkflowSchema;
import com.example.workflow_schema.exception.MalformedRecordException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowExtractionServiceTest {

    private final WorkflowExtractionService service = extractionService(new ExtractionOptions());
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("Single record")
    class SingleRecordTests {

        @Test
        @DisplayName("should extract the payment choice into actions, one gateway and sorted states")
        void testPaymentExample() {
            // When
            WorkflowDocument doc = service.extract(payment());

            // Then
            WorkflowSchema w = doc.getWorkflow();
            assertThat(doc.getFileIndex().asInt()).isEqualTo(1);
            assertThat(doc.getProcedureText()).isEqualTo("procedure 1");
            assertThat(w.getActors()).containsExactly("Cashier", "Customer");
            assertThat(w.getActions()).extracting(ActionItem::getId).containsExactly("pay_cash", "pay_card");
            assertThat(w.getGateways()).hasSize(1);
            assertThat(w.getGateways().get(0).getBranches()).hasSize(2);

            ExecutionStateItem initial = w.getExecutionStates().get(0);
            assertThat(initial.getCompletedActions()).isEmpty();
            assertThat(initial.getAvailableNext()).containsExactly("pay_card", "pay_cash");
            assertThat(w.getExecutionStates()).hasSize(3);
            assertThat(w.getExecutionStates().subList(1, 3)).allMatch(ExecutionStateItem::canTerminate);
        }

        @Test
        @DisplayName("should only reference known ids, the start sentinel or null branches")
        void testReferentialClosure() throws Exception {
            // Given
            FlowRecord record = fixture("records/coffee_order.json");

            // When
            WorkflowSchema w = service.extract(record).getWorkflow();

            // Then
            Set<String> known = new HashSet<>();
            w.getActions().forEach(a -> known.add(a.getId()));
            w.getGateways().forEach(g -> known.add(g.getId()));
            Set<String> allowed = new HashSet<>(known);
            allowed.add("start");

            for (ActionItem a : w.getActions()) {
                assertThat(allowed).containsAll(a.getPredecessors());
                assertThat(known).containsAll(a.getSuccessors());
            }
            for (GatewayItem g : w.getGateways()) {
                assertThat(known).containsAll(g.getIncomingFrom());
                for (BranchItem b : g.getBranches()) {
                    if (b.getNext() != null) assertThat(known).contains(b.getNext());
                }
            }
            for (ExecutionStateItem s : w.getExecutionStates()) {
                assertThat(known).containsAll(s.getCompletedActions());
                assertThat(known).containsAll(s.getAvailableNext());
            }
        }

        @Test
        @DisplayName("should produce identical output for the same record")
        void testDeterministicOutput() throws Exception {
            // Given
            FlowRecord record = fixture("records/coffee_order.json");

            // When
            String first = objectMapper.writeValueAsString(service.extract(record));
            String second = objectMapper.writeValueAsString(service.extract(record));

            // Then
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should suffix repeated action names within one record only")
        void testDuplicateNamesPerRecord() throws Exception {
            // Given
            FlowRecord record = fixture("records/coffee_order.json");

            // When
            IdentifierMapping first = service.identifiers(record);
            IdentifierMapping second = service.identifiers(payment());

            // Then
            assertThat(first.getActions()).containsValues("order_drink", "order_drink_2");
            assertThat(second.getActions()).containsOnly(entry("cash", "pay_cash"), entry("card", "pay_card"));
            assertThat(second.getGateways()).containsOnly(entry("x", "gateway_xor_1"));
        }

        @Test
        @DisplayName("should fail a malformed record as a whole")
        void testMalformed() {
            // Given
            FlowRecord record = payment();
            record.setSequenceFlows(null);

            // When / Then
            assertThatThrownBy(() -> service.extract(record)).isInstanceOf(MalformedRecordException.class);
        }

        @Test
        @DisplayName("should expose the enumerated paths before they are folded into states")
        void testEnumeratePaths() {
            // When
            List<List<String>> paths = service.enumeratePaths(breakfast("AND"));

            // Then
            assertThat(paths).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Batches")
    class BatchTests {

        @Test
        @DisplayName("should report malformed records as failures and keep the rest")
        void testBatchWithFailure() {
            // Given
            FlowRecord broken = record(99, List.of(node("a", "Activity", "A")), List.of());
            broken.setStepNodes(null);

            // When
            BatchExtractionResult result = service.extractAll(Arrays.asList(payment(), broken, breakfast("OR")));

            // Then
            assertThat(result.getDocuments()).hasSize(2);
            assertThat(result.getFailures()).hasSize(1);
            assertThat(result.getFailures().get(0).getFileIndex().asInt()).isEqualTo(99);
            assertThat(result.getFailures().get(0).getMessage()).contains("step_nodes");
        }

        @Test
        @DisplayName("should extract a very long record next to a short one without failing the batch")
        void testLongRecordInBatch() {
            // Given
            List<StepNodeItem> nodes = new ArrayList<>();
            List<SequenceFlowItem> flows = new ArrayList<>();
            nodes.add(node("s", "StartNode", "Begin"));
            String prev = "s";
            for (int i = 0; i < 20_000; i++) {
                nodes.add(node("a" + i, "Activity", "Step " + i));
                flows.add(flow(prev, "a" + i));
                prev = "a" + i;
            }
            FlowRecord chain = record(7, nodes, flows);

            // When
            BatchExtractionResult result = service.extractAll(Arrays.asList(chain, payment()));

            // Then
            assertThat(result.getFailures()).isEmpty();
            assertThat(result.getDocuments()).hasSize(2);
            WorkflowSchema schema = result.getDocuments().get(0).getWorkflow();
            assertThat(schema.getActions()).hasSize(20_001);
            assertThat(schema.getExecutionStates()).hasSize(ExtractionOptions.DEFAULT_MAX_DEPTH + 1);
        }
    }

    private FlowRecord fixture(String path) throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            JsonNode node = objectMapper.readTree(in);
            return objectMapper.treeToValue(node, FlowRecord.class);
        }
    }
}
