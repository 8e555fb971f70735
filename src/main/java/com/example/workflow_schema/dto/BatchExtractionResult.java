package com.example.workflow_schema.dto;

import java.util.ArrayList;
import java.util.List;

public class BatchExtractionResult {

    private List<WorkflowDocument> documents = new ArrayList<>();
    private List<RecordFailure> failures = new ArrayList<>();

    public BatchExtractionResult() {}

    public BatchExtractionResult(List<WorkflowDocument> documents, List<RecordFailure> failures) {
        this.documents = documents;
        this.failures = failures;
    }

    public List<WorkflowDocument> getDocuments() { return documents; }
    public void setDocuments(List<WorkflowDocument> documents) { this.documents = documents; }

    public List<RecordFailure> getFailures() { return failures; }
    public void setFailures(List<RecordFailure> failures) { this.failures = failures; }
}
