package com.tableflow.tableflow_automation.engine;

/**
 * Malformed trigger, branch or template configuration. Surfaced to the caller, never retried.
 */
public class AutomationConfigurationException extends RuntimeException {

    public AutomationConfigurationException(String message) {
        super(message);
    }

    public AutomationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
