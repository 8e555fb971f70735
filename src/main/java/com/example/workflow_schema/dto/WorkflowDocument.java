package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/** Extraction output for one record. */
@JsonPropertyOrder({"file_index", "procedure_text", "workflow"})
public class WorkflowDocument {

    @JsonProperty("file_index")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private JsonNode fileIndex;

    @JsonProperty("procedure_text")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String procedureText;

    private WorkflowSchema workflow;

    public WorkflowDocument() {}

    public WorkflowDocument(JsonNode fileIndex, String procedureText, WorkflowSchema workflow) {
        this.fileIndex = fileIndex;
        this.procedureText = procedureText;
        this.workflow = workflow;
    }

    public JsonNode getFileIndex() { return fileIndex; }
    public void setFileIndex(JsonNode fileIndex) { this.fileIndex = fileIndex; }

    public String getProcedureText() { return procedureText; }
    public void setProcedureText(String procedureText) { this.procedureText = procedureText; }

    public WorkflowSchema getWorkflow() { return workflow; }
    public void setWorkflow(WorkflowSchema workflow) { this.workflow = workflow; }
}
