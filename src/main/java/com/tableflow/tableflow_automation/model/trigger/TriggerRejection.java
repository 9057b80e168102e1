package com.tableflow.tableflow_automation.model.trigger;

public enum TriggerRejection {
    METHOD_NOT_ALLOWED,
    UNAUTHORIZED,
    INVALID_PAYLOAD
}
