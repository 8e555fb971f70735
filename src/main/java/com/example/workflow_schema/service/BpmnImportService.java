package com.example.workflow_schema.service;

import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.SequenceFlowItem;
import com.example.workflow_schema.dto.StepNodeItem;
import com.example.workflow_schema.exception.RecordImportException;
import com.example.workflow_schema.graph.NodeKind;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.*;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.xml.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a BPMN 2.0 model into a flow-graph record so it can go through the same extraction.
 */
@Service
public class BpmnImportService {

    private static final Logger log = LoggerFactory.getLogger(BpmnImportService.class);

    public FlowRecord read(InputStream in, String fileName) {
        BpmnModelInstance model;
        try {
            model = Bpmn.readModelFromStream(in);
        } catch (ModelException e) {
            throw new RecordImportException("Cannot read BPMN file " + fileName + ": " + e.getMessage(), e);
        }
        return toRecord(model, fileName);
    }

    /**
     * Nodes and flows of every process, each process in document order. Sub-processes are
     * imported as single activities; their inner elements are not walked.
     */
    public FlowRecord toRecord(BpmnModelInstance model, String fileIndex) {
        Map<String, String> nodeToLane = mapNodeToLane(model);

        List<StepNodeItem> nodes = new ArrayList<>();
        List<SequenceFlowItem> flows = new ArrayList<>();
        for (Process proc : model.getModelElementsByType(Process.class)) {
            for (FlowElement e : proc.getFlowElements()) {
                if (e instanceof FlowNode) {
                    FlowNode n = (FlowNode) e;
                    NodeKind kind = kindOf(n);
                    if (kind == NodeKind.UNKNOWN) {
                        log.debug("BPMN {}: skipping {} ({})", fileIndex, n.getId(), n.getElementType().getTypeName());
                        continue;
                    }
                    nodes.add(new StepNodeItem(n.getId(), kind.getWireName(),
                            safe(n.getName()), safe(nodeToLane.get(n.getId()))));
                } else if (e instanceof SequenceFlow) {
                    SequenceFlow sf = (SequenceFlow) e;
                    if (sf.getSource() == null || sf.getTarget() == null) continue;
                    flows.add(new SequenceFlowItem(sf.getSource().getId(), sf.getTarget().getId(), conditionOf(sf)));
                }
            }
        }

        if (nodes.isEmpty()) {
            throw new RecordImportException("BPMN file " + fileIndex + " holds no flow nodes");
        }
        log.info("BPMN {}: imported {} node(s) and {} sequence flow(s)", fileIndex, nodes.size(), flows.size());
        return new FlowRecord(JsonNodeFactory.instance.textNode(fileIndex), documentationOf(model), nodes, flows);
    }

    /* ===================== Node kinds ===================== */

    private NodeKind kindOf(FlowNode n) {
        if (n instanceof StartEvent) return NodeKind.START;
        if (n instanceof EndEvent) return NodeKind.END;
        if (n instanceof ExclusiveGateway || n instanceof EventBasedGateway) return NodeKind.EXCLUSIVE_GATEWAY;
        if (n instanceof ParallelGateway) return NodeKind.PARALLEL_GATEWAY;
        if (n instanceof InclusiveGateway || n instanceof ComplexGateway) return NodeKind.INCLUSIVE_GATEWAY;
        if (n instanceof Activity) return NodeKind.ACTIVITY;
        if (n instanceof IntermediateCatchEvent || n instanceof IntermediateThrowEvent
                || n instanceof BoundaryEvent) return NodeKind.ACTIVITY;
        return NodeKind.UNKNOWN;
    }

    private String conditionOf(SequenceFlow sf) {
        if (!isBlank(sf.getName())) return sf.getName().trim();
        ConditionExpression expr = sf.getConditionExpression();
        if (expr != null && !isBlank(expr.getTextContent())) return expr.getTextContent().trim();
        return "";
    }

    private String documentationOf(BpmnModelInstance model) {
        List<String> parts = new ArrayList<>();
        for (Process proc : model.getModelElementsByType(Process.class)) {
            for (Documentation d : proc.getDocumentations()) {
                if (!isBlank(d.getTextContent())) parts.add(d.getTextContent().trim());
            }
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    /* ===================== Lane / Actor ===================== */

    /** Lane name per node; a process without lanes falls back to its pool (participant) name. */
    private Map<String, String> mapNodeToLane(BpmnModelInstance model) {
        Map<String, String> nodeToLane = new HashMap<>();
        Map<String, String> processToPool = new HashMap<>();

        for (Participant p : model.getModelElementsByType(Participant.class)) {
            Process proc = p.getProcess();
            String pool = safeTrim(p.getName());
            if (proc != null && pool != null) processToPool.put(proc.getId(), pool);
        }

        for (Lane lane : model.getModelElementsByType(Lane.class)) {
            String ln = safeTrim(lane.getName());
            if (ln == null) continue;
            for (FlowNode n : lane.getFlowNodeRefs()) nodeToLane.put(n.getId(), ln);
        }

        for (Process proc : model.getModelElementsByType(Process.class)) {
            String pool = processToPool.get(proc.getId());
            if (pool == null) continue;
            boolean hasAnyLane = false;
            for (FlowElement e : proc.getFlowElements()) {
                if (e instanceof FlowNode && nodeToLane.containsKey(e.getId())) { hasAnyLane = true; break; }
            }
            if (hasAnyLane) continue;
            for (FlowElement e : proc.getFlowElements()) {
                if (e instanceof FlowNode) nodeToLane.put(e.getId(), pool);
            }
        }
        return nodeToLane;
    }

    private static boolean isBlank(String s) { return s == null || s.trim().isEmpty(); }
    private static String safeTrim(String s) { return isBlank(s) ? null : s.trim(); }
    private static String safe(String s) { return s == null ? "" : s.trim(); }
}
