package com.example.workflow_schema.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resource id to schema reference for one record: ActionIds for actionable nodes,
 * GatewayIds for gateways, and the {@code "start"} sentinel for unlabeled Start nodes.
 */
public final class ReferenceMapping {

    public static final String START_SENTINEL = "start";

    private final FlowGraph graph;
    private final Map<String, String> actionIds;
    private final Map<String, String> gatewayIds;

    public ReferenceMapping(FlowGraph graph, LinkedHashMap<String, String> actionIds,
                            LinkedHashMap<String, String> gatewayIds) {
        this.graph = graph;
        this.actionIds = Collections.unmodifiableMap(actionIds);
        this.gatewayIds = Collections.unmodifiableMap(gatewayIds);
    }

    public FlowGraph getGraph() {
        return graph;
    }

    /** Insertion-ordered, in node order. */
    public Map<String, String> getActionIds() {
        return actionIds;
    }

    /** Insertion-ordered, in node order. */
    public Map<String, String> getGatewayIds() {
        return gatewayIds;
    }

    public String actionIdOf(String resourceId) {
        return actionIds.get(resourceId);
    }

    public String gatewayIdOf(String resourceId) {
        return gatewayIds.get(resourceId);
    }

    /**
     * Schema reference for a node: its ActionId, its GatewayId, {@code "start"} for an
     * unlabeled Start node, or {@code null} for anything else (unlabeled End and Activity
     * nodes, unknown ids).
     */
    public String schemaIdOf(String resourceId) {
        String id = actionIds.get(resourceId);
        if (id != null) return id;
        id = gatewayIds.get(resourceId);
        if (id != null) return id;
        FlowNode node = graph.node(resourceId);
        if (node != null && node.getKind() == NodeKind.START && !node.hasLabel()) return START_SENTINEL;
        return null;
    }
}
