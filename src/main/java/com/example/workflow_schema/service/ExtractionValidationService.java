package com.example.workflow_schema.service;

import com.example.workflow_schema.dto.ActionItem;
import com.example.workflow_schema.dto.BranchCountMetric;
import com.example.workflow_schema.dto.BranchItem;
import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.GatewayItem;
import com.example.workflow_schema.dto.GatewayMetric;
import com.example.workflow_schema.dto.SetMetric;
import com.example.workflow_schema.dto.ValidationReport;
import com.example.workflow_schema.dto.ValidationRequest;
import com.example.workflow_schema.dto.ValidationSummary;
import com.example.workflow_schema.dto.WorkflowDocument;
import com.example.workflow_schema.dto.WorkflowSchema;
import com.example.workflow_schema.exception.MalformedRecordException;
import com.example.workflow_schema.graph.FlowEdge;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import com.example.workflow_schema.graph.GatewayRole;
import com.example.workflow_schema.graph.NodeKind;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scores an extracted workflow document against ground truth rebuilt from the raw record
 * with the same identifier rules the extractor uses.
 */
@Service
public class ExtractionValidationService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionValidationService.class);

    /** Relation diffs are trimmed to this many entries. */
    static final int DIFF_SAMPLE = 5;

    private final GraphIndexService graphIndexService;
    private final IdentifierService identifierService;

    public ExtractionValidationService(GraphIndexService graphIndexService, IdentifierService identifierService) {
        this.graphIndexService = graphIndexService;
        this.identifierService = identifierService;
    }

    public ValidationReport validate(FlowRecord record, WorkflowDocument document) {
        if (document == null || document.getWorkflow() == null) {
            throw new MalformedRecordException(record != null ? record.describe() : "<null>",
                    "extracted document has no 'workflow'");
        }
        FlowGraph g = graphIndexService.buildGraph(record);
        ReferenceMapping refs = identifierService.buildReferenceMapping(g);
        WorkflowSchema w = document.getWorkflow();

        ValidationReport report = new ValidationReport();
        report.setFileIndex(record.getFileIndex());
        report.setActions(scoreActions(refs, w));
        report.setGateways(scoreGateways(refs, w));

        Set<List<String>> gtSucc = new HashSet<>();
        Set<List<String>> gtPred = new HashSet<>();
        for (String rid : refs.getActionIds().keySet()) {
            String aid = refs.actionIdOf(rid);
            for (FlowEdge e : g.outgoing(rid)) {
                String sid = neighbourRef(refs, e.getTargetId());
                if (sid != null) gtSucc.add(pair(aid, sid));
            }
            for (FlowEdge e : g.incoming(rid)) {
                String sid = refs.schemaIdOf(e.getSourceId());
                if (sid != null) gtPred.add(pair(sid, aid));
            }
        }
        Set<List<String>> extSucc = new HashSet<>();
        Set<List<String>> extPred = new HashSet<>();
        for (ActionItem a : nullSafe(w.getActions())) {
            for (String s : nullSafe(a.getSuccessors())) extSucc.add(pair(a.getId(), s));
            for (String p : nullSafe(a.getPredecessors())) extPred.add(pair(p, a.getId()));
        }
        report.setActionSuccessors(setMetric(gtSucc, extSucc, DIFF_SAMPLE));
        report.setActionPredecessors(setMetric(gtPred, extPred, DIFF_SAMPLE));

        Set<List<String>> gtNext = new HashSet<>();
        Set<List<String>> gtIncoming = new HashSet<>();
        Set<List<String>> gtBranches = new HashSet<>();
        for (Map.Entry<String, String> gw : refs.getGatewayIds().entrySet()) {
            String gid = gw.getValue();
            for (FlowEdge e : g.outgoing(gw.getKey())) {
                FlowNode target = g.node(e.getTargetId());
                if (target == null) continue;
                String sid = neighbourRef(refs, e.getTargetId());
                // an unlabeled End is an explicit null branch, other unresolvable targets are no branch
                if (sid == null && target.getKind() != NodeKind.END) continue;
                String cond = e.getCondition().isBlank() ? null : e.getCondition().strip();
                gtNext.add(pair(gid, sid));
                gtBranches.add(Arrays.asList(gid, sid, cond));
            }
            for (FlowEdge e : g.incoming(gw.getKey())) {
                String sid = neighbourRef(refs, e.getSourceId());
                if (sid != null) gtIncoming.add(pair(sid, gid));
            }
        }
        Set<List<String>> extNext = new HashSet<>();
        Set<List<String>> extIncoming = new HashSet<>();
        Set<List<String>> extBranches = new HashSet<>();
        for (GatewayItem gw : nullSafe(w.getGateways())) {
            for (BranchItem b : nullSafe(gw.getBranches())) {
                extNext.add(pair(gw.getId(), b.getNext()));
                extBranches.add(Arrays.asList(gw.getId(), b.getNext(), b.getCondition()));
            }
            for (String inc : nullSafe(gw.getIncomingFrom())) extIncoming.add(pair(inc, gw.getId()));
        }
        report.setGatewayBranchesNext(setMetric(gtNext, extNext, DIFF_SAMPLE));
        report.setGatewayIncoming(setMetric(gtIncoming, extIncoming, DIFF_SAMPLE));
        report.setBranchTuples(setMetric(gtBranches, extBranches, DIFF_SAMPLE));
        report.setBranchCounts(scoreBranchCounts(refs, w));

        log.debug("Validated record {}: action F1 {}, successor F1 {}",
                record.describe(), report.getActions().getF1(), report.getActionSuccessors().getF1());
        return report;
    }

    /** Validates each pair and averages every score across them. */
    public ValidationSummary summarize(List<ValidationRequest> requests) {
        List<ValidationReport> reports = new ArrayList<>(requests.size());
        for (ValidationRequest r : requests) {
            reports.add(validate(r.getRecord(), r.getDocument()));
        }

        Map<String, Double> averages = new LinkedHashMap<>();
        averages.put("action_f1", average(reports, r -> r.getActions().getF1()));
        averages.put("gateway_type_accuracy", average(reports, r -> r.getGateways().getTypeAccuracy()));
        averages.put("gateway_role_accuracy", average(reports, r -> r.getGateways().getRoleAccuracy()));
        averages.put("action_successor_f1", average(reports, r -> r.getActionSuccessors().getF1()));
        averages.put("action_predecessor_f1", average(reports, r -> r.getActionPredecessors().getF1()));
        averages.put("gateway_next_f1", average(reports, r -> r.getGatewayBranchesNext().getF1()));
        averages.put("gateway_incoming_f1", average(reports, r -> r.getGatewayIncoming().getF1()));
        averages.put("branch_tuple_f1", average(reports, r -> r.getBranchTuples().getF1()));
        averages.put("branch_count_accuracy", average(reports, r -> r.getBranchCounts().getAccuracy()));

        log.info("Validation over {} record(s): {}", reports.size(), averages);
        return new ValidationSummary(averages, reports);
    }

    /* ===================== Scores ===================== */

    private SetMetric scoreActions(ReferenceMapping refs, WorkflowSchema w) {
        Set<String> gt = new HashSet<>();
        for (String rid : refs.getActionIds().keySet()) {
            gt.add(normalize(refs.getGraph().node(rid).getText()));
        }
        Set<String> ext = new HashSet<>();
        for (ActionItem a : nullSafe(w.getActions())) {
            if (a.getName() != null) ext.add(normalize(a.getName()));
        }
        return setMetric(gt, ext, Integer.MAX_VALUE);
    }

    private GatewayMetric scoreGateways(ReferenceMapping refs, WorkflowSchema w) {
        FlowGraph g = refs.getGraph();
        List<GatewayItem> extracted = nullSafe(w.getGateways());

        Map<String, Integer> gtTypes = new TreeMap<>();
        List<String> gtRoles = new ArrayList<>();
        for (String rid : refs.getGatewayIds().keySet()) {
            gtTypes.merge(g.node(rid).getKind().getGatewayType(), 1, Integer::sum);
            gtRoles.add(GatewayRole.of(g.inDegree(rid), g.outDegree(rid)).getValue());
        }
        Map<String, Integer> extTypes = new TreeMap<>();
        for (GatewayItem gw : extracted) {
            if (gw.getType() != null) extTypes.merge(gw.getType(), 1, Integer::sum);
        }

        int gtCount = gtRoles.size();
        int extCount = extracted.size();

        Set<String> allTypes = new LinkedHashSet<>(gtTypes.keySet());
        allTypes.addAll(extTypes.keySet());
        int typeMatches = 0;
        for (String type : allTypes) {
            typeMatches += Math.min(gtTypes.getOrDefault(type, 0), extTypes.getOrDefault(type, 0));
        }
        int typeTotal = Math.max(gtCount, extCount);
        double typeAccuracy = typeTotal > 0 ? (double) typeMatches / typeTotal : 1.0;

        int roleTotal = Math.min(gtCount, extCount);
        int roleMatches = 0;
        for (int i = 0; i < roleTotal; i++) {
            if (gtRoles.get(i).equals(extracted.get(i).getRole())) roleMatches++;
        }
        double roleAccuracy = roleTotal > 0 ? (double) roleMatches / roleTotal : 1.0;

        return new GatewayMetric(gtCount, extCount, typeAccuracy, roleAccuracy, gtTypes, extTypes);
    }

    private BranchCountMetric scoreBranchCounts(ReferenceMapping refs, WorkflowSchema w) {
        List<String> gtOrder = new ArrayList<>(refs.getGatewayIds().keySet());
        List<GatewayItem> extracted = nullSafe(w.getGateways());
        int total = Math.min(gtOrder.size(), extracted.size());
        int matches = 0;
        for (int i = 0; i < total; i++) {
            if (refs.getGraph().outDegree(gtOrder.get(i)) == nullSafe(extracted.get(i).getBranches()).size()) {
                matches++;
            }
        }
        return new BranchCountMetric(total > 0 ? (double) matches / total : 1.0, total);
    }

    /* ===================== Helpers ===================== */

    /** Trimmed, lower-cased, inner whitespace collapsed, trailing semicolons dropped. */
    static String normalize(String text) {
        String collapsed = String.join(" ", text.strip().toLowerCase(Locale.ROOT).split("\\s+"));
        int end = collapsed.length();
        while (end > 0 && collapsed.charAt(end - 1) == ';') end--;
        return collapsed.substring(0, end);
    }

    static double f1(double precision, double recall) {
        if (precision + recall == 0) return 0.0;
        return 2 * precision * recall / (precision + recall);
    }

    static <T> SetMetric setMetric(Set<T> groundTruth, Set<T> extracted, int sample) {
        List<String> missing = diff(groundTruth, extracted, sample);
        List<String> extra = diff(extracted, groundTruth, sample);
        if (groundTruth.isEmpty() && extracted.isEmpty()) {
            return new SetMetric(1.0, 1.0, 1.0, 0, 0, missing, extra);
        }
        long matched = groundTruth.stream().filter(extracted::contains).count();
        double precision = extracted.isEmpty() ? 0.0 : (double) matched / extracted.size();
        double recall = groundTruth.isEmpty() ? 0.0 : (double) matched / groundTruth.size();
        return new SetMetric(precision, recall, f1(precision, recall),
                groundTruth.size(), extracted.size(), missing, extra);
    }

    private static <T> List<String> diff(Set<T> a, Set<T> b, int sample) {
        return a.stream()
                .filter(x -> !b.contains(x))
                .map(ExtractionValidationService::render)
                .sorted()
                .limit(sample)
                .collect(Collectors.toList());
    }

    private static String render(Object o) {
        if (o instanceof List) {
            return ((List<?>) o).stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
        }
        return String.valueOf(o);
    }

    /** ActionId or GatewayId; the {@code "start"} sentinel only ever appears as a predecessor. */
    private static String neighbourRef(ReferenceMapping refs, String rid) {
        String id = refs.actionIdOf(rid);
        return id != null ? id : refs.gatewayIdOf(rid);
    }

    private static List<String> pair(String a, String b) {
        return Arrays.asList(a, b);
    }

    private static double average(List<ValidationReport> reports, Function<ValidationReport, Double> score) {
        if (reports.isEmpty()) return 0.0;
        double sum = 0;
        for (ValidationReport r : reports) sum += score.apply(r);
        return sum / reports.size();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
