package com.example.workflow_schema.exception;

/** A record lacks a field the extraction cannot do without. The whole record is rejected. */
public class MalformedRecordException extends RuntimeException {

    private final String recordLabel;

    public MalformedRecordException(String recordLabel, String message) {
        super("Malformed record " + recordLabel + ": " + message);
        this.recordLabel = recordLabel;
    }

    public String getRecordLabel() {
        return recordLabel;
    }
}
