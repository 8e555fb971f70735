package com.example.workflow_schema.graph;

/** Structural role of a gateway, derived from its in- and out-degree only. */
public enum GatewayRole {
    SPLIT("split"),
    MERGE("merge"),
    JOIN_SPLIT("join_split"),
    PASS_THROUGH("pass_through");

    private final String value;

    GatewayRole(String value) {
        this.value = value;
    }

    public static GatewayRole of(int inDegree, int outDegree) {
        if (inDegree <= 1 && outDegree > 1) return SPLIT;
        if (inDegree > 1 && outDegree <= 1) return MERGE;
        if (inDegree > 1 && outDegree > 1) return JOIN_SPLIT;
        return PASS_THROUGH;
    }

    public String getValue() {
        return value;
    }
}
