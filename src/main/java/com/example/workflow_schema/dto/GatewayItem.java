package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"id", "type", "role", "incoming_from", "branches", "actor"})
public class GatewayItem {

    private String id;
    private String type;
    private String role;

    @JsonProperty("incoming_from")
    private List<String> incomingFrom = new ArrayList<>();

    private List<BranchItem> branches = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String actor;

    public GatewayItem() {}

    public GatewayItem(String id, String type, String role,
                       List<String> incomingFrom, List<BranchItem> branches, String actor) {
        this.id = id;
        this.type = type;
        this.role = role;
        this.incomingFrom = incomingFrom;
        this.branches = branches;
        this.actor = actor;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public List<String> getIncomingFrom() { return incomingFrom; }
    public void setIncomingFrom(List<String> incomingFrom) { this.incomingFrom = incomingFrom; }

    public List<BranchItem> getBranches() { return branches; }
    public void setBranches(List<BranchItem> branches) { this.branches = branches; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }
}
