package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * A distinct prefix of completed actions and the actions that may follow it.
 * {@code can_terminate} is only written when some path ends at this prefix.
 */
@JsonPropertyOrder({"completed_actions", "available_next", "can_terminate"})
public class ExecutionStateItem {

    @JsonProperty("completed_actions")
    private List<String> completedActions = new ArrayList<>();

    @JsonProperty("available_next")
    private List<String> availableNext = new ArrayList<>();

    @JsonProperty("can_terminate")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean canTerminate;

    public ExecutionStateItem() {}

    public ExecutionStateItem(List<String> completedActions, List<String> availableNext, boolean canTerminate) {
        this.completedActions = completedActions;
        this.availableNext = availableNext;
        this.canTerminate = canTerminate ? Boolean.TRUE : null;
    }

    public List<String> getCompletedActions() { return completedActions; }
    public void setCompletedActions(List<String> completedActions) { this.completedActions = completedActions; }

    public List<String> getAvailableNext() { return availableNext; }
    public void setAvailableNext(List<String> availableNext) { this.availableNext = availableNext; }

    public Boolean getCanTerminate() { return canTerminate; }
    public void setCanTerminate(Boolean canTerminate) { this.canTerminate = canTerminate; }

    public boolean canTerminate() {
        return Boolean.TRUE.equals(canTerminate);
    }
}
