package com.tableflow.tableflow_automation.model.domain;

public enum ExecutionLogStatus {
    // Workflow-level entries
    COMPLETED,
    // Node-level entries
    SUCCESS,
    RETRYING,
    // Both
    FAILED
}
