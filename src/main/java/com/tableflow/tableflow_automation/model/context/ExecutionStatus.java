package com.tableflow.tableflow_automation.model.context;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
