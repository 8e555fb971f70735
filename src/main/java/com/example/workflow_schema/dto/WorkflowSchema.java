package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"actors", "actions", "gateways", "execution_states"})
public class WorkflowSchema {

    private List<String> actors = new ArrayList<>();
    private List<ActionItem> actions = new ArrayList<>();
    private List<GatewayItem> gateways = new ArrayList<>();

    @JsonProperty("execution_states")
    private List<ExecutionStateItem> executionStates = new ArrayList<>();

    public WorkflowSchema() {}

    public WorkflowSchema(List<String> actors, List<ActionItem> actions,
                          List<GatewayItem> gateways, List<ExecutionStateItem> executionStates) {
        this.actors = actors;
        this.actions = actions;
        this.gateways = gateways;
        this.executionStates = executionStates;
    }

    public List<String> getActors() { return actors; }
    public void setActors(List<String> actors) { this.actors = actors; }

    public List<ActionItem> getActions() { return actions; }
    public void setActions(List<ActionItem> actions) { this.actions = actions; }

    public List<GatewayItem> getGateways() { return gateways; }
    public void setGateways(List<GatewayItem> gateways) { this.gateways = gateways; }

    public List<ExecutionStateItem> getExecutionStates() { return executionStates; }
    public void setExecutionStates(List<ExecutionStateItem> executionStates) { this.executionStates = executionStates; }
}
