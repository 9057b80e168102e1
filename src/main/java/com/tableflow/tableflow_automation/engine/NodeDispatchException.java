package com.tableflow.tableflow_automation.engine;

/** Transient dispatch failure; the runner retries it with backoff. */
public class NodeDispatchException extends RuntimeException {

    public NodeDispatchException(String message) {
        super(message);
    }

    public NodeDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
