package com.tableflow.tableflow_automation.model.domain;

public enum NodeCategory {
    TRIGGER,
    ACTION,
    BRANCH,
    DELAY
}
