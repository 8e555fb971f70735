package com.example.workflow_schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/** A record rejected during batch extraction, with the reason. */
public class RecordFailure {

    @JsonProperty("file_index")
    private JsonNode fileIndex;

    private String message;

    public RecordFailure() {}

    public RecordFailure(JsonNode fileIndex, String message) {
        this.fileIndex = fileIndex;
        this.message = message;
    }

    public JsonNode getFileIndex() { return fileIndex; }
    public void setFileIndex(JsonNode fileIndex) { this.fileIndex = fileIndex; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
