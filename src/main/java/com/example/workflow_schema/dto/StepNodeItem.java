package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StepNodeItem {

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("type")
    private String type;

    @JsonProperty("NodeText")
    private String nodeText;

    @JsonProperty("agent")
    private String agent;

    public StepNodeItem() {}

    public StepNodeItem(String resourceId, String type, String nodeText, String agent) {
        this.resourceId = resourceId;
        this.type = type;
        this.nodeText = nodeText;
        this.agent = agent;
    }

    public String getResourceId() { return resourceId; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getNodeText() { return nodeText; }
    public void setNodeText(String nodeText) { this.nodeText = nodeText; }

    public String getAgent() { return agent; }
    public void setAgent(String agent) { this.agent = agent; }
}
