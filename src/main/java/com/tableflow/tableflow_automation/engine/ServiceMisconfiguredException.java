package com.tableflow.tableflow_automation.engine;

/**
 * Thrown by an executor when the service it talks to is misconfigured
 * (missing URL, unknown target table, ...). Retrying cannot help.
 */
public class ServiceMisconfiguredException extends RuntimeException {

    public ServiceMisconfiguredException(String message) {
        super(message);
    }

    public ServiceMisconfiguredException(String message, Throwable cause) {
        super(message, cause);
    }
}
