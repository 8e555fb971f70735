package com.example.workflow_schema.graph;

import java.util.Objects;

/** One vertex of a flow graph. Immutable once loaded. */
public final class FlowNode {

    private final String resourceId;
    private final NodeKind kind;
    private final String text;
    private final String agent;

    public FlowNode(String resourceId, NodeKind kind, String text, String agent) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text != null ? text : "";
        this.agent = agent != null ? agent : "";
    }

    public String getResourceId() { return resourceId; }
    public NodeKind getKind() { return kind; }
    public String getText() { return text; }
    public String getAgent() { return agent; }

    public boolean hasLabel() {
        return !text.isBlank();
    }

    /** Labeled Start, End or Activity node. */
    public boolean isActionable() {
        return kind.isActionable() && hasLabel();
    }

    public boolean isGateway() {
        return kind.isGateway();
    }

    @Override
    public String toString() {
        return "FlowNode{" + resourceId + ", " + kind + ", '" + text + "'}";
    }
}
