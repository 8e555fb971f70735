package com.example.workflow_schema.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexed view of one record: nodes in input order plus outgoing/incoming adjacency.
 * Edges that name an unknown node stay in the adjacency lists (they still count toward
 * degrees) and are also listed in {@link #getDanglingEdges()}; lookups for the missing
 * node return {@code null} and callers skip them.
 */
public final class FlowGraph {

    private final Map<String, FlowNode> nodeById;
    private final Map<String, Integer> positionById;
    private final Map<String, List<FlowEdge>> outgoing;
    private final Map<String, List<FlowEdge>> incoming;
    private final List<FlowEdge> danglingEdges;

    FlowGraph(LinkedHashMap<String, FlowNode> nodeById,
              Map<String, List<FlowEdge>> outgoing,
              Map<String, List<FlowEdge>> incoming,
              List<FlowEdge> danglingEdges) {
        this.nodeById = Collections.unmodifiableMap(nodeById);
        Map<String, Integer> positions = new HashMap<>(nodeById.size() * 2);
        int i = 0;
        for (String id : nodeById.keySet()) positions.put(id, i++);
        this.positionById = positions;
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.danglingEdges = Collections.unmodifiableList(danglingEdges);
    }

    public static Builder builder() {
        return new Builder();
    }

    public FlowNode node(String id) {
        return nodeById.get(id);
    }

    public Collection<FlowNode> nodes() {
        return nodeById.values();
    }

    public int size() {
        return nodeById.size();
    }

    /** Position of the node in input order, or -1 when unknown. */
    public int positionOf(String id) {
        Integer p = positionById.get(id);
        return p != null ? p : -1;
    }

    public List<FlowEdge> outgoing(String id) {
        return outgoing.getOrDefault(id, Collections.emptyList());
    }

    public List<FlowEdge> incoming(String id) {
        return incoming.getOrDefault(id, Collections.emptyList());
    }

    public int outDegree(String id) {
        return outgoing(id).size();
    }

    public int inDegree(String id) {
        return incoming(id).size();
    }

    public boolean isSplit(String id) {
        return outDegree(id) > 1;
    }

    public boolean isJoin(String id) {
        return inDegree(id) > 1;
    }

    public List<String> startNodeIds() {
        List<String> starts = new ArrayList<>();
        for (FlowNode n : nodeById.values()) {
            if (n.getKind() == NodeKind.START) starts.add(n.getResourceId());
        }
        return starts;
    }

    public List<FlowEdge> getDanglingEdges() {
        return danglingEdges;
    }

    public int edgeCount() {
        int count = 0;
        for (List<FlowEdge> edges : outgoing.values()) count += edges.size();
        return count;
    }

    /** Collects nodes then edges; a repeated resource id replaces the node but keeps its first position. */
    public static final class Builder {
        private final LinkedHashMap<String, FlowNode> nodeById = new LinkedHashMap<>();
        private final List<FlowEdge> edges = new ArrayList<>();

        private Builder() {}

        public Builder node(FlowNode node) {
            nodeById.put(node.getResourceId(), node);
            return this;
        }

        public Builder node(String id, NodeKind kind, String text) {
            return node(new FlowNode(id, kind, text, ""));
        }

        public Builder edge(String src, String tgt) {
            return edge(src, tgt, "");
        }

        public Builder edge(String src, String tgt, String condition) {
            edges.add(new FlowEdge(src, tgt, condition));
            return this;
        }

        public FlowGraph build() {
            Map<String, List<FlowEdge>> out = new HashMap<>();
            Map<String, List<FlowEdge>> in = new HashMap<>();
            List<FlowEdge> dangling = new ArrayList<>();
            for (FlowEdge e : edges) {
                out.computeIfAbsent(e.getSourceId(), k -> new ArrayList<>()).add(e);
                in.computeIfAbsent(e.getTargetId(), k -> new ArrayList<>()).add(e);
                if (!nodeById.containsKey(e.getSourceId()) || !nodeById.containsKey(e.getTargetId())) {
                    dangling.add(e);
                }
            }
            return new FlowGraph(new LinkedHashMap<>(nodeById), out, in, dangling);
        }
    }
}
