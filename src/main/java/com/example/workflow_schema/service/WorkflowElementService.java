package com.example.workflow_schema.service;

import com.example.workflow_schema.dto.ActionItem;
import com.example.workflow_schema.dto.BranchItem;
import com.example.workflow_schema.dto.GatewayItem;
import com.example.workflow_schema.dto.StepNodeItem;
import com.example.workflow_schema.graph.FlowEdge;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import com.example.workflow_schema.graph.GatewayRole;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the Action and Gateway entities of a workflow schema from an indexed graph.
 */
@Service
public class WorkflowElementService {

    public List<ActionItem> extractActions(ReferenceMapping refs) {
        FlowGraph g = refs.getGraph();
        List<ActionItem> actions = new ArrayList<>();

        for (FlowNode node : g.nodes()) {
            if (!node.isActionable()) continue;
            String rid = node.getResourceId();

            Set<String> predecessors = new LinkedHashSet<>();
            for (FlowEdge e : g.incoming(rid)) {
                String ref = predecessorRef(refs, e.getSourceId());
                if (ref != null) predecessors.add(ref);
            }

            // unlabeled End targets are implicit termination and leave no trace here
            Set<String> successors = new LinkedHashSet<>();
            for (FlowEdge e : g.outgoing(rid)) {
                String ref = successorRef(refs, e.getTargetId());
                if (ref != null) successors.add(ref);
            }

            actions.add(new ActionItem(
                    refs.actionIdOf(rid),
                    node.getText().strip(),
                    blankToNull(node.getAgent()),
                    new ArrayList<>(predecessors),
                    new ArrayList<>(successors)));
        }
        return actions;
    }

    public List<GatewayItem> extractGateways(ReferenceMapping refs) {
        FlowGraph g = refs.getGraph();
        List<GatewayItem> gateways = new ArrayList<>();

        for (FlowNode node : g.nodes()) {
            if (!node.isGateway()) continue;
            String rid = node.getResourceId();

            List<BranchItem> branches = new ArrayList<>();
            for (FlowEdge e : g.outgoing(rid)) {
                FlowNode target = g.node(e.getTargetId());
                if (target == null) continue;

                String next;
                switch (target.getKind()) {
                    case END -> next = target.hasLabel() ? refs.actionIdOf(target.getResourceId()) : null;
                    case START, ACTIVITY, EXCLUSIVE_GATEWAY, PARALLEL_GATEWAY, INCLUSIVE_GATEWAY -> {
                        next = successorRef(refs, target.getResourceId());
                        // an unlabeled Start or Activity has no schema reference to point at
                        if (next == null) continue;
                    }
                    default -> {
                        continue;
                    }
                }
                branches.add(new BranchItem(next, blankToNull(e.getCondition())));
            }

            Set<String> incomingFrom = new LinkedHashSet<>();
            for (FlowEdge e : g.incoming(rid)) {
                String ref = successorRef(refs, e.getSourceId());
                if (ref != null) incomingFrom.add(ref);
            }

            GatewayRole role = GatewayRole.of(g.inDegree(rid), g.outDegree(rid));
            gateways.add(new GatewayItem(
                    refs.gatewayIdOf(rid),
                    node.getKind().getGatewayType(),
                    role.getValue(),
                    new ArrayList<>(incomingFrom),
                    branches,
                    blankToNull(node.getAgent())));
        }
        return gateways;
    }

    /** Distinct non-blank agent names across all step nodes, first-seen order. */
    public List<String> collectActors(List<StepNodeItem> stepNodes) {
        Set<String> actors = new LinkedHashSet<>();
        if (stepNodes == null) return new ArrayList<>();
        for (StepNodeItem n : stepNodes) {
            if (n == null || n.getAgent() == null || n.getAgent().isBlank()) continue;
            actors.add(n.getAgent().strip());
        }
        return new ArrayList<>(actors);
    }

    /** ActionId or GatewayId of a neighbour, or null when it has neither. */
    private String successorRef(ReferenceMapping refs, String rid) {
        String id = refs.actionIdOf(rid);
        return id != null ? id : refs.gatewayIdOf(rid);
    }

    /** As {@link #successorRef} but an unlabeled Start yields the {@code "start"} sentinel. */
    private String predecessorRef(ReferenceMapping refs, String rid) {
        return refs.schemaIdOf(rid);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
