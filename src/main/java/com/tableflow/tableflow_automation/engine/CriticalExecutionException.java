package com.tableflow.tableflow_automation.engine;

/**
 * Aborts the whole run. Never retried and never swallowed by the per-node error handling.
 */
public abstract class CriticalExecutionException extends RuntimeException {

    protected CriticalExecutionException(String message) {
        super(message);
    }

    protected CriticalExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
