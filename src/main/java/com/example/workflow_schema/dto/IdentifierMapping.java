package com.example.workflow_schema.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/** Resource id to ActionId / GatewayId for one record, as the extractor assigns them. */
public class IdentifierMapping {

    private Map<String, String> actions = new LinkedHashMap<>();
    private Map<String, String> gateways = new LinkedHashMap<>();

    public IdentifierMapping() {}

    public IdentifierMapping(Map<String, String> actions, Map<String, String> gateways) {
        this.actions = actions;
        this.gateways = gateways;
    }

    public Map<String, String> getActions() { return actions; }
    public void setActions(Map<String, String> actions) { this.actions = actions; }

    public Map<String, String> getGateways() { return gateways; }
    public void setGateways(Map<String, String> gateways) { this.gateways = gateways; }
}
