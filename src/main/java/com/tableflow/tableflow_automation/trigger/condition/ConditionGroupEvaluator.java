package com.tableflow.tableflow_automation.trigger.condition;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig.Condition;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig.ConditionGroup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Evaluates the condition groups of a conditional trigger and combines them by evaluation mode.
 */
@Component
@RequiredArgsConstructor
public class ConditionGroupEvaluator {

    public static final String ALL_MUST_MATCH = "all_must_match";
    public static final String ANY_CAN_MATCH = "any_can_match";
    public static final String CUSTOM_LOGIC = "custom_logic";

    private final CustomLogicParser parser;

    public boolean evaluate(ConditionalTriggerConfig config, Function<String, Object> valueLookup) {
        List<ConditionGroup> groups = config.getConditionGroups();
        if (groups == null || groups.isEmpty()) {
            return true;
        }

        List<Boolean> results = new ArrayList<>(groups.size());
        for (ConditionGroup group : groups) {
            results.add(evaluateGroup(group, valueLookup));
        }

        String mode = config.getEvaluationMode() == null ? ALL_MUST_MATCH : config.getEvaluationMode();
        return switch (mode) {
            case ALL_MUST_MATCH -> results.stream().allMatch(Boolean::booleanValue);
            case ANY_CAN_MATCH -> results.stream().anyMatch(Boolean::booleanValue);
            case CUSTOM_LOGIC -> parser.parse(config.getCustomLogic(), groupIds(groups)).evaluate(results);
            default -> throw new AutomationConfigurationException("Unknown evaluation mode: " + mode);
        };
    }

    /** Checks operators, group logic and custom logic without evaluating any values. */
    public void validate(ConditionalTriggerConfig config) {
        List<ConditionGroup> groups = config.getConditionGroups() == null ? List.of() : config.getConditionGroups();
        for (ConditionGroup group : groups) {
            logicOf(group);
            if (group.getConditions() == null) continue;
            for (Condition c : group.getConditions()) {
                ConditionOperator.forTrigger(c.getOperator());
            }
        }
        String mode = config.getEvaluationMode() == null ? ALL_MUST_MATCH : config.getEvaluationMode();
        if (CUSTOM_LOGIC.equals(mode)) {
            parser.parse(config.getCustomLogic(), groupIds(groups));
        } else if (!ALL_MUST_MATCH.equals(mode) && !ANY_CAN_MATCH.equals(mode)) {
            throw new AutomationConfigurationException("Unknown evaluation mode: " + mode);
        }
    }

    /** Group ids in order; a group without id is addressed as group_{index}. */
    public static List<String> groupIds(List<ConditionGroup> groups) {
        List<String> ids = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            String id = groups.get(i).getId();
            ids.add(id == null || id.isBlank() ? "group_" + i : id);
        }
        return ids;
    }

    private boolean evaluateGroup(ConditionGroup group, Function<String, Object> valueLookup) {
        boolean and = logicOf(group);
        List<Condition> conditions = group.getConditions() == null ? List.of() : group.getConditions();
        for (Condition condition : conditions) {
            ConditionOperator op = ConditionOperator.forTrigger(condition.getOperator());
            boolean matched = op.test(valueLookup.apply(condition.getField()), condition.getValue());
            if (and && !matched) return false;
            if (!and && matched) return true;
        }
        // Empty "and" group holds, empty "or" group does not
        return and;
    }

    private static boolean logicOf(ConditionGroup group) {
        String logic = group.getLogic() == null ? "and" : group.getLogic().toLowerCase();
        return switch (logic) {
            case "and" -> true;
            case "or" -> false;
            default -> throw new AutomationConfigurationException("Unknown group logic: " + group.getLogic());
        };
    }
}
