package com.example.workflow_schema.service;

import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.SequenceFlowItem;
import com.example.workflow_schema.dto.StepNodeItem;
import com.example.workflow_schema.exception.MalformedRecordException;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import com.example.workflow_schema.graph.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads a record's nodes and sequence flows into a {@link FlowGraph}.
 */
@Service
public class GraphIndexService {

    private static final Logger log = LoggerFactory.getLogger(GraphIndexService.class);

    public FlowGraph buildGraph(FlowRecord record) {
        if (record == null) throw new MalformedRecordException("<null>", "record is missing");
        String label = record.describe();

        List<StepNodeItem> stepNodes = record.getStepNodes();
        if (stepNodes == null) throw new MalformedRecordException(label, "missing 'step_nodes'");
        List<SequenceFlowItem> flows = record.getSequenceFlows();
        if (flows == null) throw new MalformedRecordException(label, "missing 'SequenceFlow'");

        FlowGraph.Builder builder = FlowGraph.builder();

        for (int i = 0; i < stepNodes.size(); i++) {
            StepNodeItem n = stepNodes.get(i);
            if (n == null) throw new MalformedRecordException(label, "step_nodes[" + i + "] is null");
            if (n.getResourceId() == null) {
                throw new MalformedRecordException(label, "step_nodes[" + i + "] has no 'resourceId'");
            }
            if (n.getType() == null) {
                throw new MalformedRecordException(label, "step_nodes[" + i + "] has no 'type'");
            }
            NodeKind kind = NodeKind.fromWire(n.getType());
            if (kind == NodeKind.UNKNOWN) {
                log.debug("Record {}: node {} has unrecognised type '{}'", label, n.getResourceId(), n.getType());
            }
            builder.node(new FlowNode(n.getResourceId(), kind, n.getNodeText(), n.getAgent()));
        }

        for (int i = 0; i < flows.size(); i++) {
            SequenceFlowItem f = flows.get(i);
            if (f == null) throw new MalformedRecordException(label, "SequenceFlow[" + i + "] is null");
            if (f.getSrc() == null) throw new MalformedRecordException(label, "SequenceFlow[" + i + "] has no 'src'");
            if (f.getTgt() == null) throw new MalformedRecordException(label, "SequenceFlow[" + i + "] has no 'tgt'");
            builder.edge(f.getSrc(), f.getTgt(), f.getCondition());
        }

        FlowGraph graph = builder.build();
        if (!graph.getDanglingEdges().isEmpty()) {
            log.warn("Record {}: {} sequence flow(s) reference unknown nodes and will be ignored: {}",
                    label, graph.getDanglingEdges().size(), graph.getDanglingEdges());
        }
        log.debug("Record {}: indexed {} nodes, {} edges", label, graph.size(), graph.edgeCount());
        return graph;
    }
}
