package com.tableflow.tableflow_automation.model.domain;

public enum DeliveryStatus {
    PENDING,
    SUCCESS,
    FAILED,     // waiting for next_retry_at
    ABANDONED;

    public boolean isTerminal() {
        return this == SUCCESS || this == ABANDONED;
    }
}
