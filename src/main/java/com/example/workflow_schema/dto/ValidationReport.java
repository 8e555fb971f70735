package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/** Scores of one extracted document against the ground truth rebuilt from its raw record. */
@JsonPropertyOrder({"file_index", "actions", "gateways", "action_successors", "action_predecessors",
        "gateway_branches_next", "gateway_incoming", "branch_tuples", "branch_counts"})
public class ValidationReport {

    @JsonProperty("file_index")
    private JsonNode fileIndex;

    private SetMetric actions;
    private GatewayMetric gateways;

    @JsonProperty("action_successors")
    private SetMetric actionSuccessors;

    @JsonProperty("action_predecessors")
    private SetMetric actionPredecessors;

    @JsonProperty("gateway_branches_next")
    private SetMetric gatewayBranchesNext;

    @JsonProperty("gateway_incoming")
    private SetMetric gatewayIncoming;

    @JsonProperty("branch_tuples")
    private SetMetric branchTuples;

    @JsonProperty("branch_counts")
    private BranchCountMetric branchCounts;

    public ValidationReport() {}

    public JsonNode getFileIndex() { return fileIndex; }
    public void setFileIndex(JsonNode fileIndex) { this.fileIndex = fileIndex; }

    public SetMetric getActions() { return actions; }
    public void setActions(SetMetric actions) { this.actions = actions; }

    public GatewayMetric getGateways() { return gateways; }
    public void setGateways(GatewayMetric gateways) { this.gateways = gateways; }

    public SetMetric getActionSuccessors() { return actionSuccessors; }
    public void setActionSuccessors(SetMetric actionSuccessors) { this.actionSuccessors = actionSuccessors; }

    public SetMetric getActionPredecessors() { return actionPredecessors; }
    public void setActionPredecessors(SetMetric actionPredecessors) { this.actionPredecessors = actionPredecessors; }

    public SetMetric getGatewayBranchesNext() { return gatewayBranchesNext; }
    public void setGatewayBranchesNext(SetMetric gatewayBranchesNext) { this.gatewayBranchesNext = gatewayBranchesNext; }

    public SetMetric getGatewayIncoming() { return gatewayIncoming; }
    public void setGatewayIncoming(SetMetric gatewayIncoming) { this.gatewayIncoming = gatewayIncoming; }

    public SetMetric getBranchTuples() { return branchTuples; }
    public void setBranchTuples(SetMetric branchTuples) { this.branchTuples = branchTuples; }

    public BranchCountMetric getBranchCounts() { return branchCounts; }
    public void setBranchCounts(BranchCountMetric branchCounts) { this.branchCounts = branchCounts; }
}
