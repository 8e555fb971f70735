package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class BranchCountMetric {

    private double accuracy;

    @JsonProperty("total_compared")
    private int totalCompared;

    public BranchCountMetric() {}

    public BranchCountMetric(double accuracy, int totalCompared) {
        this.accuracy = accuracy;
        this.totalCompared = totalCompared;
    }

    public double getAccuracy() { return accuracy; }
    public void setAccuracy(double accuracy) { this.accuracy = accuracy; }

    public int getTotalCompared() { return totalCompared; }
    public void setTotalCompared(int totalCompared) { this.totalCompared = totalCompared; }
}
