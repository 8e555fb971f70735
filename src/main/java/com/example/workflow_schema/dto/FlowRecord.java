package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One raw flow-graph record: the procedure text plus its nodes and sequence flows.
 * {@code file_index} is passed through to the output verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowRecord {

    @JsonProperty("file_index")
    private JsonNode fileIndex;

    @JsonProperty("paragraph")
    @JsonAlias("procedure_text")
    private String paragraph;

    @JsonProperty("step_nodes")
    private List<StepNodeItem> stepNodes;

    @JsonProperty("SequenceFlow")
    private List<SequenceFlowItem> sequenceFlows;

    public FlowRecord() {}

    public FlowRecord(JsonNode fileIndex, String paragraph,
                      List<StepNodeItem> stepNodes, List<SequenceFlowItem> sequenceFlows) {
        this.fileIndex = fileIndex;
        this.paragraph = paragraph;
        this.stepNodes = stepNodes;
        this.sequenceFlows = sequenceFlows;
    }

    public JsonNode getFileIndex() {
        return fileIndex;
    }

    public void setFileIndex(JsonNode fileIndex) {
        this.fileIndex = fileIndex;
    }

    public String getParagraph() {
        return paragraph;
    }

    public void setParagraph(String paragraph) {
        this.paragraph = paragraph;
    }

    public List<StepNodeItem> getStepNodes() {
        return stepNodes;
    }

    public void setStepNodes(List<StepNodeItem> stepNodes) {
        this.stepNodes = stepNodes;
    }

    public List<SequenceFlowItem> getSequenceFlows() {
        return sequenceFlows;
    }

    public void setSequenceFlows(List<SequenceFlowItem> sequenceFlows) {
        this.sequenceFlows = sequenceFlows;
    }

    /** Short label for log lines and error messages. */
    public String describe() {
        return fileIndex == null || fileIndex.isNull() ? "<no file_index>" : fileIndex.asText();
    }
}
