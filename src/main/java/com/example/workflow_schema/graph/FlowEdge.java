package com.example.workflow_schema.graph;

/** Directed edge with an optional branch-guard label (empty when absent). */
public final class FlowEdge {

    private final String sourceId;
    private final String targetId;
    private final String condition;

    public FlowEdge(String sourceId, String targetId, String condition) {
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.condition = condition != null ? condition : "";
    }

    public String getSourceId() { return sourceId; }
    public String getTargetId() { return targetId; }
    public String getCondition() { return condition; }

    @Override
    public String toString() {
        return sourceId + " -> " + targetId + (condition.isBlank() ? "" : " [" + condition + "]");
    }
}
