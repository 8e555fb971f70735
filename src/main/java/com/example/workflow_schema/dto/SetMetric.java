package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** Precision, recall and F1 of an extracted set against its ground truth. */
@JsonPropertyOrder({"precision", "recall", "f1", "gt_count", "ext_count", "missing", "extra"})
public class SetMetric {

    private double precision;
    private double recall;
    private double f1;

    @JsonProperty("gt_count")
    private int gtCount;

    @JsonProperty("ext_count")
    private int extCount;

    private List<String> missing = new ArrayList<>();
    private List<String> extra = new ArrayList<>();

    public SetMetric() {}

    public SetMetric(double precision, double recall, double f1, int gtCount, int extCount,
                     List<String> missing, List<String> extra) {
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
        this.gtCount = gtCount;
        this.extCount = extCount;
        this.missing = missing;
        this.extra = extra;
    }

    public double getPrecision() { return precision; }
    public void setPrecision(double precision) { this.precision = precision; }

    public double getRecall() { return recall; }
    public void setRecall(double recall) { this.recall = recall; }

    public double getF1() { return f1; }
    public void setF1(double f1) { this.f1 = f1; }

    public int getGtCount() { return gtCount; }
    public void setGtCount(int gtCount) { this.gtCount = gtCount; }

    public int getExtCount() { return extCount; }
    public void setExtCount(int extCount) { this.extCount = extCount; }

    public List<String> getMissing() { return missing; }
    public void setMissing(List<String> missing) { this.missing = missing; }

    public List<String> getExtra() { return extra; }
    public void setExtra(List<String> extra) { this.extra = extra; }
}
