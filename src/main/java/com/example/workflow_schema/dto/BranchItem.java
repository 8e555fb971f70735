package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One outgoing edge of a gateway. {@code next} is null when the edge ends the process
 * at an unlabeled End node.
 */
@JsonPropertyOrder({"next", "condition"})
public class BranchItem {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String next;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String condition;

    public BranchItem() {}

    public BranchItem(String next, String condition) {
        this.next = next;
        this.condition = condition;
    }

    public String getNext() { return next; }
    public void setNext(String next) { this.next = next; }

    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = condition; }
}
