package com.example.workflow_schema.service;

import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import com.example.workflow_schema.graph.IdentifierRegistry;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Synthesises ActionIds and GatewayIds. Every method is a pure function of its inputs, so the
 * validator can rebuild exactly the mapping the extractor used.
 */
@Service
public class IdentifierService {

    public static final String UNNAMED_ACTION = "unnamed_action";

    /**
     * Slug of a node label: trimmed, lower-cased, each single space replaced by {@code _},
     * apostrophes dropped, then every character that is not a letter, number or {@code _}
     * dropped. Numbers include superscripts and numeral letters ({@code "m²"}, {@code "Ⅻ"}). Consecutive spaces therefore give consecutive underscores
     * ({@code "a  b"} becomes {@code "a__b"}); tabs and newlines are dropped outright.
     * An empty result falls back to {@value #UNNAMED_ACTION}.
     */
    public String slugOf(String text) {
        if (text == null) return UNNAMED_ACTION;
        String s = text.strip().toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace("'", "");
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints()
                .filter(c -> isWordChar(c) || c == '_')
                .forEach(sb::appendCodePoint);
        return sb.length() == 0 ? UNNAMED_ACTION : sb.toString();
    }

    private static boolean isWordChar(int c) {
        if (Character.isLetterOrDigit(c)) return true;
        int type = Character.getType(c);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

    /** Slug of {@code text}, made unique within {@code registry}. */
    public String actionId(String text, IdentifierRegistry registry) {
        return registry.claim(slugOf(text));
    }

    /**
     * {@code gateway_<wire kind>_<position>}, position being the node's index in input order.
     * Ids follow input ordering, not content: the same graph re-ordered yields other ids.
     */
    public String gatewayId(FlowGraph graph, FlowNode node) {
        return "gateway_" + node.getKind().idToken() + "_" + graph.positionOf(node.getResourceId());
    }

    /** Builds the per-record reference mapping with a fresh identifier registry. */
    public ReferenceMapping buildReferenceMapping(FlowGraph graph) {
        IdentifierRegistry registry = new IdentifierRegistry();
        LinkedHashMap<String, String> actionIds = new LinkedHashMap<>();
        LinkedHashMap<String, String> gatewayIds = new LinkedHashMap<>();

        for (FlowNode n : graph.nodes()) {
            if (n.isActionable()) {
                actionIds.put(n.getResourceId(), actionId(n.getText(), registry));
            } else if (n.isGateway()) {
                gatewayIds.put(n.getResourceId(), gatewayId(graph, n));
            }
        }
        return new ReferenceMapping(graph, actionIds, gatewayIds);
    }
}
