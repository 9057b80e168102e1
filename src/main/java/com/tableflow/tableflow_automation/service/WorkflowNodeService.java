package com.tableflow.tableflow_automation.service;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.executor.NodeExecutorRegistry;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.repository.WorkflowNodeRepository;
import com.tableflow.tableflow_automation.trigger.TriggerConfigBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Node creation contract: configs are checked before a node is stored, and new nodes
 * are appended after the workflow's existing ones.
 */
@Service
@RequiredArgsConstructor
public class WorkflowNodeService {

    private final WorkflowNodeRepository nodeRepository;
    private final TriggerConfigBinder binder;
    private final NodeExecutorRegistry executorRegistry;

    /** Checks a node config without storing anything; throws {@link AutomationConfigurationException}. */
    public void validate(NodeType type, Map<String, Object> config) {
        if (type.isTrigger()) {
            binder.validate(type, config);
        } else if (!executorRegistry.isSupported(type)) {
            throw new AutomationConfigurationException("No executor available for node type " + type.getConfigKey()
                    + ", executable types are " + executorRegistry.registeredTypes());
        }
    }

    @Transactional
    public WorkflowNode createNode(Workflow workflow, NodeType type, String label, Map<String, Object> config,
                                   UUID previousNodeId, String outputTag) {
        validate(type, config);

        WorkflowNode node = new WorkflowNode();
        node.setWorkflowId(workflow.getId());
        node.setNodeType(type);
        node.setLabel(label);
        node.setConfig(config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>());
        node.setPreviousNodeId(previousNodeId);
        node.setPreviousNodeOutput(outputTag != null ? outputTag : WorkflowNode.DEFAULT_OUTPUT);
        node.setNodeOrder((int) nodeRepository.countByWorkflowId(workflow.getId()));
        return nodeRepository.save(node);
    }
}
