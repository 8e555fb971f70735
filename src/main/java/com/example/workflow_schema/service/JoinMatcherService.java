package com.example.workflow_schema.service;

import com.example.workflow_schema.graph.FlowEdge;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds where the branches of a split gateway converge again.
 */
@Service
public class JoinMatcherService {

    private static final Logger log = LoggerFactory.getLogger(JoinMatcherService.class);

    /**
     * Nearest gateway with in-degree &gt; 1 that every outgoing branch of {@code splitId} can reach.
     * The first BFS pass collects, per branch, all nodes reachable without passing through the
     * split itself; the second pass walks from the branches in BFS order and returns the first
     * common node that qualifies as a join. Any gateway kind is accepted as the join.
     *
     * @return the join's resource id, or {@code null} when the branches never reconverge
     */
    public String findMatchingJoin(FlowGraph g, String splitId) {
        List<FlowEdge> branches = g.outgoing(splitId);
        if (branches.size() <= 1) return null;

        Set<String> common = null;
        for (FlowEdge branch : branches) {
            Set<String> reachable = reachableFrom(g, branch.getTargetId(), splitId);
            if (common == null) common = reachable;
            else common.retainAll(reachable);
            if (common.isEmpty()) {
                log.debug("Split {}: branches never reconverge", splitId);
                return null;
            }
        }

        ArrayDeque<String> queue = new ArrayDeque<>();
        for (FlowEdge branch : branches) queue.add(branch.getTargetId());
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            String nid = queue.poll();
            if (!visited.add(nid)) continue;
            if (common.contains(nid) && g.isJoin(nid)) {
                FlowNode node = g.node(nid);
                if (node != null && node.isGateway()) {
                    log.debug("Split {}: matching join {}", splitId, nid);
                    return nid;
                }
            }
            for (FlowEdge e : g.outgoing(nid)) queue.add(e.getTargetId());
        }
        log.debug("Split {}: no join among {} common node(s)", splitId, common.size());
        return null;
    }

    private Set<String> reachableFrom(FlowGraph g, String startId, String excludedId) {
        Set<String> reachable = new HashSet<>();
        ArrayDeque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String nid = queue.poll();
            if (nid.equals(excludedId) || !reachable.add(nid)) continue;
            for (FlowEdge e : g.outgoing(nid)) queue.add(e.getTargetId());
        }
        return reachable;
    }
}
