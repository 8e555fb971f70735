package com.example.workflow_schema.controller;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.example.workflow_schema.TestRecords;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.InputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private byte[] resource(String path) throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            return in.readAllBytes();
        }
    }

    @Nested
    @DisplayName("POST /api/workflow/extract")
    class ExtractTests {

        @Test
        @DisplayName("should return the workflow document with snake_case fields")
        void testExtract() throws Exception {
            mockMvc.perform(post("/api/workflow/extract")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(TestRecords.payment())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.file_index").value(1))
                    .andExpect(jsonPath("$.procedure_text").value("procedure 1"))
                    .andExpect(jsonPath("$.workflow.actors", contains("Cashier", "Customer")))
                    .andExpect(jsonPath("$.workflow.actions[*].id", contains("pay_cash", "pay_card")))
                    .andExpect(jsonPath("$.workflow.actions[0].postconditions", contains("pay_cash_done")))
                    .andExpect(jsonPath("$.workflow.gateways[0].incoming_from", empty()))
                    .andExpect(jsonPath("$.workflow.gateways[0].branches[0].condition").value("cash"))
                    .andExpect(jsonPath("$.workflow.execution_states[0].completed_actions", empty()))
                    .andExpect(jsonPath("$.workflow.execution_states[0].available_next", contains("pay_card", "pay_cash")))
                    .andExpect(jsonPath("$.workflow.execution_states[0].can_terminate").doesNotExist())
                    .andExpect(jsonPath("$.workflow.execution_states[1].can_terminate").value(true));
        }

        @Test
        @DisplayName("should answer 400 for a record without step_nodes")
        void testMalformedRecord() throws Exception {
            mockMvc.perform(post("/api/workflow/extract")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"file_index\": 5, \"SequenceFlow\": []}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("error"))
                    .andExpect(jsonPath("$.message", containsString("step_nodes")));
        }

        @Test
        @DisplayName("should answer 400 for an unreadable body")
        void testUnreadableBody() throws Exception {
            mockMvc.perform(post("/api/workflow/extract")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"step_nodes\": ["))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value("error"));
        }
    }

    @Nested
    @DisplayName("Batches and uploads")
    class BatchTests {

        @Test
        @DisplayName("should extract a batch and list the malformed record as a failure")
        void testExtractBatch() throws Exception {
            mockMvc.perform(post("/api/workflow/extract/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(resource("records/batch.json")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.documents", hasSize(1)))
                    .andExpect(jsonPath("$.documents[0].procedure_text").value("Pay by cash or by card."))
                    .andExpect(jsonPath("$.failures", hasSize(1)))
                    .andExpect(jsonPath("$.failures[0].file_index").value("batch-2"));
        }

        @Test
        @DisplayName("should extract an uploaded BPMN file")
        void testUploadBpmn() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "ticket_triage.bpmn",
                    MediaType.APPLICATION_XML_VALUE, resource("records/ticket_triage.bpmn"));

            mockMvc.perform(multipart("/api/workflow/upload").file(file))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.documents", hasSize(1)))
                    .andExpect(jsonPath("$.documents[0].file_index").value("ticket_triage.bpmn"))
                    .andExpect(jsonPath("$.documents[0].workflow.actors", contains("Agent", "Team lead", "Billing")))
                    .andExpect(jsonPath("$.documents[0].workflow.actions[*].id",
                            contains("ticket_received", "answer_customer", "escalate_ticket", "send_invoice")));
        }

        @Test
        @DisplayName("should answer 400 for an upload that is not valid JSON")
        void testUploadInvalidJson() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "records.json",
                    MediaType.APPLICATION_JSON_VALUE, "[{".getBytes());

            mockMvc.perform(multipart("/api/workflow/upload").file(file))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message", containsString("records.json")));
        }

        @Test
        @DisplayName("should answer 400 when the file part is missing")
        void testUploadWithoutFile() throws Exception {
            mockMvc.perform(multipart("/api/workflow/upload"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Identifiers and validation")
    class ValidationTests {

        @Test
        @DisplayName("should expose the identifier mapping of a record")
        void testIdentifiers() throws Exception {
            mockMvc.perform(post("/api/workflow/identifiers")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(resource("records/coffee_order.json")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.actions.n1").value("order_drink"))
                    .andExpect(jsonPath("$.actions.n4").value("order_drink_2"))
                    .andExpect(jsonPath("$.gateways.n2").value("gateway_xor_2"))
                    .andExpect(jsonPath("$.gateways.n5").value("gateway_and_5"));
        }

        @Test
        @DisplayName("should validate an extraction round trip with perfect scores")
        void testValidate() throws Exception {
            // Given
            byte[] record = resource("records/coffee_order.json");
            String extracted = mockMvc.perform(post("/api/workflow/extract")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(record))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();

            ObjectNode body = objectMapper.createObjectNode();
            body.set("record", objectMapper.readTree(record));
            body.set("document", objectMapper.readTree(extracted));

            // When / Then
            mockMvc.perform(post("/api/workflow/validate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(body)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.file_index").value(42))
                    .andExpect(jsonPath("$.actions.f1").value(1.0))
                    .andExpect(jsonPath("$.gateways.count_match").value(true))
                    .andExpect(jsonPath("$.action_successors.f1").value(1.0))
                    .andExpect(jsonPath("$.branch_tuples.f1").value(1.0))
                    .andExpect(jsonPath("$.branch_counts.accuracy").value(1.0));
        }

        @Test
        @DisplayName("should summarize a batch of validations")
        void testValidateBatch() throws Exception {
            // Given
            JsonNode record = objectMapper.valueToTree(TestRecords.payment());
            String extracted = mockMvc.perform(post("/api/workflow/extract")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(record)))
                    .andReturn().getResponse().getContentAsString();
            ObjectNode pair = objectMapper.createObjectNode();
            pair.set("record", record);
            pair.set("document", objectMapper.readTree(extracted));

            // When / Then
            mockMvc.perform(post("/api/workflow/validate/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(objectMapper.createArrayNode().add(pair))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.records").value(1))
                    .andExpect(jsonPath("$.averages.action_f1").value(1.0))
                    .andExpect(jsonPath("$.reports", hasSize(1)));
        }
    }
}
