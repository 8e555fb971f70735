package com.example.workflow_schema.graph;

import java.util.Locale;

/**
 * Closed set of node kinds a flow-graph record may carry. The wire name is the
 * {@code type} string used in {@code step_nodes}.
 */
public enum NodeKind {
    START("StartNode", null),
    END("EndNode", null),
    ACTIVITY("Activity", null),
    EXCLUSIVE_GATEWAY("XOR", "exclusive"),
    PARALLEL_GATEWAY("AND", "parallel"),
    INCLUSIVE_GATEWAY("OR", "inclusive"),
    /** Any type string outside the known set; carried through but never acted on. */
    UNKNOWN(null, null);

    private final String wireName;
    private final String gatewayType;

    NodeKind(String wireName, String gatewayType) {
        this.wireName = wireName;
        this.gatewayType = gatewayType;
    }

    public static NodeKind fromWire(String type) {
        if (type == null) return UNKNOWN;
        for (NodeKind kind : values()) {
            if (type.equals(kind.wireName)) return kind;
        }
        return UNKNOWN;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isGateway() {
        return gatewayType != null;
    }

    /** Start, End and Activity nodes become actions when they carry text. */
    public boolean isActionable() {
        return this == START || this == END || this == ACTIVITY;
    }

    /** Schema-level gateway type: exclusive, parallel or inclusive. */
    public String getGatewayType() {
        if (gatewayType == null) throw new IllegalStateException(this + " is not a gateway kind");
        return gatewayType;
    }

    /** Lower-cased wire name, the kind part of a gateway identifier. */
    public String idToken() {
        if (wireName == null) throw new IllegalStateException(this + " has no wire name");
        return wireName.toLowerCase(Locale.ROOT);
    }
}
