package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"count_match", "gt_count", "ext_count", "type_accuracy", "role_accuracy", "gt_types", "ext_types"})
public class GatewayMetric {

    @JsonProperty("count_match")
    private boolean countMatch;

    @JsonProperty("gt_count")
    private int gtCount;

    @JsonProperty("ext_count")
    private int extCount;

    @JsonProperty("type_accuracy")
    private double typeAccuracy;

    @JsonProperty("role_accuracy")
    private double roleAccuracy;

    @JsonProperty("gt_types")
    private Map<String, Integer> gtTypes = new LinkedHashMap<>();

    @JsonProperty("ext_types")
    private Map<String, Integer> extTypes = new LinkedHashMap<>();

    public GatewayMetric() {}

    public GatewayMetric(int gtCount, int extCount, double typeAccuracy, double roleAccuracy,
                         Map<String, Integer> gtTypes, Map<String, Integer> extTypes) {
        this.countMatch = gtCount == extCount;
        this.gtCount = gtCount;
        this.extCount = extCount;
        this.typeAccuracy = typeAccuracy;
        this.roleAccuracy = roleAccuracy;
        this.gtTypes = gtTypes;
        this.extTypes = extTypes;
    }

    public boolean isCountMatch() { return countMatch; }
    public void setCountMatch(boolean countMatch) { this.countMatch = countMatch; }

    public int getGtCount() { return gtCount; }
    public void setGtCount(int gtCount) { this.gtCount = gtCount; }

    public int getExtCount() { return extCount; }
    public void setExtCount(int extCount) { this.extCount = extCount; }

    public double getTypeAccuracy() { return typeAccuracy; }
    public void setTypeAccuracy(double typeAccuracy) { this.typeAccuracy = typeAccuracy; }

    public double getRoleAccuracy() { return roleAccuracy; }
    public void setRoleAccuracy(double roleAccuracy) { this.roleAccuracy = roleAccuracy; }

    public Map<String, Integer> getGtTypes() { return gtTypes; }
    public void setGtTypes(Map<String, Integer> gtTypes) { this.gtTypes = gtTypes; }

    public Map<String, Integer> getExtTypes() { return extTypes; }
    public void setExtTypes(Map<String, Integer> extTypes) { this.extTypes = extTypes; }
}
