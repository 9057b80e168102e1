package com.tableflow.tableflow_automation.support;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public final class TestNodes {

    private TestNodes() {}

    public static Workflow workflow() {
        Workflow workflow = new Workflow();
        workflow.setId(UUID.randomUUID());
        workflow.setWorkspaceId(UUID.randomUUID());
        workflow.setName("Test workflow");
        workflow.setPublished(true);
        return workflow;
    }

    public static WorkflowNode node(Workflow workflow, NodeType type, Map<String, Object> config) {
        WorkflowNode node = new WorkflowNode();
        node.setId(UUID.randomUUID());
        node.setWorkflowId(workflow != null ? workflow.getId() : UUID.randomUUID());
        node.setNodeType(type);
        node.setLabel(type.getConfigKey());
        node.setConfig(new LinkedHashMap<>(config));
        return node;
    }

    public static WorkflowNode node(NodeType type, Map<String, Object> config) {
        return node(null, type, config);
    }

    /** Appends next after previous on the given output tag. */
    public static WorkflowNode after(WorkflowNode previous, String output, WorkflowNode next) {
        next.setPreviousNodeId(previous.getId());
        next.setPreviousNodeOutput(output);
        next.setWorkflowId(previous.getWorkflowId());
        return next;
    }
}
