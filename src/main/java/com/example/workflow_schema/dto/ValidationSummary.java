package com.example.workflow_schema.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per-record reports plus each score averaged over the records. */
public class ValidationSummary {

    private int records;
    private Map<String, Double> averages = new LinkedHashMap<>();
    private List<ValidationReport> reports = new ArrayList<>();

    public ValidationSummary() {}

    public ValidationSummary(Map<String, Double> averages, List<ValidationReport> reports) {
        this.records = reports.size();
        this.averages = averages;
        this.reports = reports;
    }

    public int getRecords() { return records; }
    public void setRecords(int records) { this.records = records; }

    public Map<String, Double> getAverages() { return averages; }
    public void setAverages(Map<String, Double> averages) { this.averages = averages; }

    public List<ValidationReport> getReports() { return reports; }
    public void setReports(List<ValidationReport> reports) { this.reports = reports; }
}
