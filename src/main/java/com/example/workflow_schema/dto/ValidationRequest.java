package com.example.workflow_schema.dto;

/** A raw record paired with the document extracted from it. */
public class ValidationRequest {

    private FlowRecord record;
    private WorkflowDocument document;

    public ValidationRequest() {}

    public ValidationRequest(FlowRecord record, WorkflowDocument document) {
        this.record = record;
        this.document = document;
    }

    public FlowRecord getRecord() { return record; }
    public void setRecord(FlowRecord record) { this.record = record; }

    public WorkflowDocument getDocument() { return document; }
    public void setDocument(WorkflowDocument document) { this.document = document; }
}
