package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.trigger.condition.ConditionOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes CONDITIONAL_BRANCH nodes.
 *
 * Config: { "condition_template": "{{ amount }}", "condition_type": "greater_than",
 *           "comparison_value_template": "500" }
 *
 * Result: successors tagged "true" run when the condition holds, "false" otherwise.
 */
@Component
@RequiredArgsConstructor
public class ConditionalBranchExecutor implements NodeExecutor {

    public static final String TRUE_OUTPUT = "true";
    public static final String FALSE_OUTPUT = "false";

    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITIONAL_BRANCH;
    }

    @Override
    public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
        Map<String, Object> config = node.getConfig() != null ? node.getConfig() : Map.of();

        ConditionOperator operator;
        try {
            operator = ConditionOperator.fromKey(String.valueOf(config.getOrDefault("condition_type", "equals")));
        } catch (AutomationConfigurationException ex) {
            throw new ServiceMisconfiguredException("Branch node " + node.getId() + ": " + ex.getMessage(), ex);
        }

        String left = renderer.renderConfig(node, "condition_template", context.getPayload());
        String right = renderer.renderConfig(node, "comparison_value_template", context.getPayload());
        boolean result = operator.test(left, right);
        String branch = result ? TRUE_OUTPUT : FALSE_OUTPUT;

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("condition_result", result);
        output.put("output_branch", branch);
        return DispatchResult.tagged(output, branch);
    }
}
