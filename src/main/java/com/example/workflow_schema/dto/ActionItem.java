package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** A named action with its neighbours in the schema. {@code actor} is always written, null when absent. */
@JsonPropertyOrder({"id", "name", "actor", "predecessors", "successors", "postconditions"})
public class ActionItem {

    private String id;
    private String name;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String actor;

    private List<String> predecessors = new ArrayList<>();
    private List<String> successors = new ArrayList<>();
    private List<String> postconditions = new ArrayList<>();

    public ActionItem() {}

    public ActionItem(String id, String name, String actor,
                      List<String> predecessors, List<String> successors) {
        this.id = id;
        this.name = name;
        this.actor = actor;
        this.predecessors = predecessors;
        this.successors = successors;
        this.postconditions = List.of(id + "_done");
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }

    public List<String> getPredecessors() { return predecessors; }
    public void setPredecessors(List<String> predecessors) { this.predecessors = predecessors; }

    public List<String> getSuccessors() { return successors; }
    public void setSuccessors(List<String> successors) { this.successors = successors; }

    public List<String> getPostconditions() { return postconditions; }
    public void setPostconditions(List<String> postconditions) { this.postconditions = postconditions; }
}
