package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SequenceFlowItem {

    @JsonProperty("src")
    private String src;

    @JsonProperty("tgt")
    private String tgt;

    @JsonProperty("condition")
    private String condition;

    public SequenceFlowItem() {}

    public SequenceFlowItem(String src, String tgt, String condition) {
        this.src = src;
        this.tgt = tgt;
        this.condition = condition;
    }

    public String getSrc() { return src; }
    public void setSrc(String src) { this.src = src; }

    public String getTgt() { return tgt; }
    public void setTgt(String tgt) { this.tgt = tgt; }

    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = condition; }
}
