package com.example.workflow_schema.exception;

/** An uploaded file could not be read as BPMN 2.0 XML or as flow-graph records. */
public class RecordImportException extends RuntimeException {

    public RecordImportException(String message) {
        super(message);
    }

    public RecordImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
