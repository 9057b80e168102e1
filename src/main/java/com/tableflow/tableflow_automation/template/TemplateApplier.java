package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.engine.WorkflowGraph;
import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.TemplateKind;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.repository.AutomationTemplateRepository;
import com.tableflow.tableflow_automation.repository.WorkflowNodeRepository;
import com.tableflow.tableflow_automation.repository.WorkflowRepository;
import com.tableflow.tableflow_automation.service.RowDataGateway;
import com.tableflow.tableflow_automation.service.WorkflowNodeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Materializes a template into workflow nodes.
 *
 * <p>Every problem (inactive template, missing or mistyped field mappings, invalid node
 * configs) is collected before anything is written; any problem aborts the whole
 * application with a {@link TemplateApplicationException} and creates no node.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateApplier {

    private final AutomationTemplateRepository templateRepository;
    private final WorkflowRepository workflowRepository;
    private final WorkflowNodeRepository nodeRepository;
    private final WorkflowNodeService nodeService;
    private final RowDataGateway rowDataGateway;

    @Transactional
    public TemplateApplication apply(UUID templateId, UUID workflowId, Map<String, String> fieldMappings) {
        AutomationTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
        return apply(template, workflow, fieldMappings);
    }

    @Transactional
    public TemplateApplication apply(AutomationTemplate template, Workflow workflow, Map<String, String> fieldMappings) {
        Map<String, String> mappings = fieldMappings != null ? fieldMappings : Map.of();
        List<String> problems = new ArrayList<>();
        if (!template.isActive()) {
            problems.add("template is inactive");
        }

        boolean withTrigger = template.getKind() == TemplateKind.TRIGGER;
        List<Map<String, Object>> actionConfigs = template.getActionConfigs() != null ? template.getActionConfigs() : List.of();

        checkMappings(template, actionConfigs, mappings, problems);

        WorkflowGraph graph = WorkflowGraph.of(nodeRepository.findByWorkflowIdOrderByNodeOrderAsc(workflow.getId()));
        PlannedNode trigger = null;
        if (withTrigger) {
            if (template.getTriggerConfig() == null) {
                problems.add("trigger template has no trigger config");
            } else {
                trigger = plan("trigger", template.getTriggerConfig(), mappings, true, problems);
            }
            if (graph.trigger().isPresent()) {
                problems.add("workflow already has a trigger node");
            }
        } else if (graph.lastOnDefaultPath().isEmpty()) {
            problems.add("workflow has no trigger node to append actions to");
        }

        List<PlannedNode> actions = new ArrayList<>();
        for (int i = 0; i < actionConfigs.size(); i++) {
            PlannedNode action = plan("action " + (i + 1), actionConfigs.get(i), mappings, false, problems);
            if (action != null) actions.add(action);
        }

        if (!problems.isEmpty()) {
            throw new TemplateApplicationException(template.getName(), problems);
        }

        WorkflowNode triggerNode = null;
        UUID previous;
        if (withTrigger) {
            triggerNode = nodeService.createNode(workflow, trigger.type(), label(trigger, template.getName()),
                    trigger.config(), null, WorkflowNode.DEFAULT_OUTPUT);
            previous = triggerNode.getId();
        } else {
            previous = graph.lastOnDefaultPath().map(WorkflowNode::getId).orElseThrow();
        }

        List<WorkflowNode> actionNodes = new ArrayList<>();
        for (PlannedNode action : actions) {
            WorkflowNode node = nodeService.createNode(workflow, action.type(), label(action, action.type().getConfigKey()),
                    action.config(), previous, WorkflowNode.DEFAULT_OUTPUT);
            actionNodes.add(node);
            previous = node.getId();
        }

        templateRepository.incrementUsage(template.getId());
        log.info("Applied template '{}' to workflow {}: {} node(s) created",
                template.getName(), workflow.getId(), actionNodes.size() + (triggerNode != null ? 1 : 0));
        return new TemplateApplication(template.getName(), triggerNode, actionNodes);
    }

    private void checkMappings(AutomationTemplate template, List<Map<String, Object>> actionConfigs,
                               Map<String, String> mappings, List<String> problems) {
        Map<String, String> placeholders = new LinkedHashMap<>();
        if (template.getTriggerConfig() != null) {
            placeholders.putAll(FieldPlaceholders.collect(template.getTriggerConfig()));
        }
        actionConfigs.forEach(config -> FieldPlaceholders.collect(config).forEach(placeholders::putIfAbsent));

        List<String> missing = placeholders.keySet().stream()
                .filter(name -> !mappings.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            problems.add("missing field mappings: " + String.join(", ", missing));
        }

        placeholders.forEach((name, key) -> {
            String fieldId = mappings.get(name);
            if (fieldId == null) return;
            FieldPlaceholders.expectedFieldType(key).ifPresent(expected -> {
                Optional<String> actual = rowDataGateway.findFieldType(fieldId);
                if (actual.isEmpty()) {
                    problems.add("field '" + name + "' is mapped to '" + fieldId + "', which does not exist");
                } else if (!expected.equals(actual.get())) {
                    problems.add("field '" + name + "' must be of type '" + expected + "', got '" + actual.get() + "'");
                }
            });
        });
    }

    @SuppressWarnings("unchecked")
    private PlannedNode plan(String what, Map<String, Object> raw, Map<String, String> mappings,
                             boolean trigger, List<String> problems) {
        Object typeKey = raw.get("type");
        Optional<NodeType> type = NodeType.fromConfigKey(typeKey != null ? typeKey.toString() : null);
        if (type.isEmpty()) {
            problems.add(what + ": unknown node type '" + typeKey + "'");
            return null;
        }
        if (type.get().isTrigger() != trigger) {
            problems.add(what + ": '" + typeKey + "' cannot be used as " + (trigger ? "a trigger" : "an action"));
            return null;
        }

        Map<String, Object> config = (Map<String, Object>) FieldPlaceholders.substitute(raw, mappings);
        config.remove("type");
        Object label = config.remove("label");
        try {
            nodeService.validate(type.get(), config);
        } catch (AutomationConfigurationException ex) {
            problems.add(what + ": " + ex.getMessage());
        }
        return new PlannedNode(type.get(), label != null ? label.toString() : null, config);
    }

    private static String label(PlannedNode node, String fallback) {
        return node.label() != null ? node.label() : fallback;
    }

    private record PlannedNode(NodeType type, String label, Map<String, Object> config) {
    }
}
