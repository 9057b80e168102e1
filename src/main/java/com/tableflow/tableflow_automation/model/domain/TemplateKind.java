package com.tableflow.tableflow_automation.model.domain;

public enum TemplateKind {
    TRIGGER,    // trigger + action skeleton
    ACTION      // action skeleton appended to an existing workflow
}
