package com.tableflow.tableflow_automation.model.domain;

public enum ActivityKind {
    DELIVERY_SUCCESS,
    DELIVERY_FAILED,
    DELIVERY_ABANDONED
}
