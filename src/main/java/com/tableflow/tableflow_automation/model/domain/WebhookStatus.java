package com.tableflow.tableflow_automation.model.domain;

public enum WebhookStatus {
    ACTIVE,
    PAUSED,
    DISABLED
}
