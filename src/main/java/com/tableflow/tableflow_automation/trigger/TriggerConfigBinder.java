package com.tableflow.tableflow_automation.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.DateTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.FieldCondition;
import com.tableflow.tableflow_automation.model.trigger.LinkedRecordTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.RowChangeKind;
import com.tableflow.tableflow_automation.model.trigger.WebhookTriggerConfig;
import com.tableflow.tableflow_automation.trigger.condition.ConditionGroupEvaluator;
import com.tableflow.tableflow_automation.trigger.condition.ConditionOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds trigger node configs to their typed form and checks them before a node is created.
 */
@Component
@RequiredArgsConstructor
public class TriggerConfigBinder {

    private static final Set<String> AUTH_TYPES = Set.of("none", "api_key", "bearer_token", "signature");

    private static final Set<String> CHANGE_TYPES = Arrays.stream(RowChangeKind.values())
            .map(RowChangeKind::getChangeType)
            .collect(Collectors.toSet());

    private final ObjectMapper objectMapper;
    private final ConditionGroupEvaluator groupEvaluator;

    public <T> T bind(WorkflowNode node, Class<T> type) {
        return bind(node.getConfig(), type);
    }

    public <T> T bind(Map<String, Object> config, Class<T> type) {
        try {
            return objectMapper.convertValue(config != null ? config : Map.of(), type);
        } catch (IllegalArgumentException ex) {
            throw new AutomationConfigurationException("Invalid " + type.getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    public void validate(NodeType type, Map<String, Object> config) {
        switch (type) {
            case DATE_TRIGGER -> validateDate(bind(config, DateTriggerConfig.class));
            case LINKED_RECORD_TRIGGER -> validateLinkedRecord(bind(config, LinkedRecordTriggerConfig.class));
            case WEBHOOK_TRIGGER -> validateWebhook(bind(config, WebhookTriggerConfig.class));
            case CONDITIONAL_TRIGGER -> validateConditional(bind(config, ConditionalTriggerConfig.class));
            default -> { }
        }
    }

    public static LocalTime parseTime(String value, String fieldName) {
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new AutomationConfigurationException(fieldName + " must be HH:mm, got '" + value + "'", ex);
        }
    }

    private void validateDate(DateTriggerConfig config) {
        DateCondition condition = DateCondition.fromKey(config.getConditionType());
        require(config.getTableId(), "table_id");
        if (condition.requiresDateField()) {
            require(config.getDateFieldId(), "date_field_id");
        }
        if (condition == DateCondition.RECURRING && config.getRecurringPattern() == null) {
            throw new AutomationConfigurationException("recurring condition needs a recurring_pattern");
        }
        if (config.getRecurringPattern() != null) {
            config.getRecurringPattern().validate();
        }
        if (config.getCheckTime() != null && !config.getCheckTime().isBlank()) {
            parseTime(config.getCheckTime(), "check_time");
        }
        validateFieldConditions(config.getAdditionalConditions());
    }

    private void validateLinkedRecord(LinkedRecordTriggerConfig config) {
        require(config.getLinkedTableId(), "linked_table_id");
        String changeType = config.getChangeType();
        if (!LinkedRecordTriggerConfig.ANY_CHANGE.equals(changeType) && !CHANGE_TYPES.contains(changeType)) {
            throw new AutomationConfigurationException("Unknown change_type: " + changeType);
        }
        validateFieldConditions(config.getLinkedRecordConditions());
    }

    private void validateWebhook(WebhookTriggerConfig config) {
        require(config.getUrlPath(), "url_path");
        String authType = config.getAuthType() == null ? "none" : config.getAuthType();
        if (!AUTH_TYPES.contains(authType)) {
            throw new AutomationConfigurationException("Unknown auth_type: " + authType);
        }
        if (authType.equals("api_key") || authType.equals("bearer_token")) {
            require(config.getAuthToken(), "auth_token");
        }
        if (authType.equals("signature")) {
            require(config.getSignatureSecret(), "signature_secret");
        }
    }

    private void validateConditional(ConditionalTriggerConfig config) {
        if (config.getBaseTriggerId() == null) {
            throw new AutomationConfigurationException("base_trigger_id is required");
        }
        groupEvaluator.validate(config);
        ConditionalTriggerConfig.TimeConditions time = config.getTimeConditions();
        if (time != null) {
            if (time.getStartTime() != null) parseTime(time.getStartTime(), "start_time");
            if (time.getEndTime() != null) parseTime(time.getEndTime(), "end_time");
        }
    }

    private static void validateFieldConditions(Map<String, FieldCondition> conditions) {
        if (conditions == null) return;
        conditions.values().forEach(c -> ConditionOperator.forTrigger(c.getOperator()));
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new AutomationConfigurationException(name + " is required");
        }
    }
}
