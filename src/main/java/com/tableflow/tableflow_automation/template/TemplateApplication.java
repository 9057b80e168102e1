package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.model.domain.WorkflowNode;

import java.util.List;

/** Nodes created by one template application; triggerNode is null for action templates. */
public record TemplateApplication(String templateName, WorkflowNode triggerNode, List<WorkflowNode> actionNodes) {
}
