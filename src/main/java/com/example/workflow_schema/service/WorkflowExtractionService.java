package com.example.workflow_schema.service;

import com.example.workflow_schema.config.ExtractionOptions;
import com.example.workflow_schema.dto.ActionItem;
import com.example.workflow_schema.dto.BatchExtractionResult;
import com.example.workflow_schema.dto.ExecutionStateItem;
import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.GatewayItem;
import com.example.workflow_schema.dto.IdentifierMapping;
import com.example.workflow_schema.dto.RecordFailure;
import com.example.workflow_schema.dto.WorkflowDocument;
import com.example.workflow_schema.dto.WorkflowSchema;
import com.example.workflow_schema.exception.MalformedRecordException;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Turns one flow-graph record into a workflow document: graph index, identifiers,
 * actions and gateways, paths, execution states.
 */
@Service
public class WorkflowExtractionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExtractionService.class);

    private final GraphIndexService graphIndexService;
    private final IdentifierService identifierService;
    private final WorkflowElementService elementService;
    private final PathEnumerationService pathEnumerationService;
    private final ExecutionStateService executionStateService;
    private final ExtractionOptions options;

    public WorkflowExtractionService(GraphIndexService graphIndexService,
                                     IdentifierService identifierService,
                                     WorkflowElementService elementService,
                                     PathEnumerationService pathEnumerationService,
                                     ExecutionStateService executionStateService,
                                     ExtractionOptions options) {
        this.graphIndexService = graphIndexService;
        this.identifierService = identifierService;
        this.elementService = elementService;
        this.pathEnumerationService = pathEnumerationService;
        this.executionStateService = executionStateService;
        this.options = options;
    }

    /**
     * @throws MalformedRecordException when a required field is missing; nothing partial is returned
     */
    public WorkflowDocument extract(FlowRecord record) {
        FlowGraph graph = graphIndexService.buildGraph(record);
        ReferenceMapping refs = identifierService.buildReferenceMapping(graph);

        List<String> actors = elementService.collectActors(record.getStepNodes());
        List<ActionItem> actions = elementService.extractActions(refs);
        List<GatewayItem> gateways = elementService.extractGateways(refs);

        List<List<String>> paths = pathEnumerationService.findAllPaths(refs, options);
        List<ExecutionStateItem> states = executionStateService.buildExecutionStates(paths, options);

        log.debug("Record {}: {} actions, {} gateways, {} paths, {} states, actors {}",
                record.describe(), actions.size(), gateways.size(), paths.size(), states.size(), actors);

        return new WorkflowDocument(record.getFileIndex(), record.getParagraph(),
                new WorkflowSchema(actors, actions, gateways, states));
    }

    /** Enumerated paths only, for callers that want the per-path view before merging. */
    public List<List<String>> enumeratePaths(FlowRecord record) {
        FlowGraph graph = graphIndexService.buildGraph(record);
        return pathEnumerationService.findAllPaths(identifierService.buildReferenceMapping(graph), options);
    }

    /** Extracts every record; malformed ones are reported as failures instead of aborting the batch. */
    public BatchExtractionResult extractAll(List<FlowRecord> records) {
        List<WorkflowDocument> documents = new ArrayList<>(records.size());
        List<RecordFailure> failures = new ArrayList<>();

        for (FlowRecord record : records) {
            try {
                documents.add(extract(record));
            } catch (MalformedRecordException e) {
                log.warn("Skipping record: {}", e.getMessage());
                failures.add(new RecordFailure(record != null ? record.getFileIndex() : null, e.getMessage()));
            }
        }

        log.info("Extracted {} of {} record(s), {} failure(s)", documents.size(), records.size(), failures.size());
        return new BatchExtractionResult(documents, failures);
    }

    public IdentifierMapping identifiers(FlowRecord record) {
        ReferenceMapping refs = identifierService.buildReferenceMapping(graphIndexService.buildGraph(record));
        return new IdentifierMapping(new LinkedHashMap<>(refs.getActionIds()), new LinkedHashMap<>(refs.getGatewayIds()));
    }
}
