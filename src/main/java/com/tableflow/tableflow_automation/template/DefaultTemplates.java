package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import com.tableflow.tableflow_automation.model.domain.TemplateKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Built-in catalog seeded into an empty template table. */
public final class DefaultTemplates {

    private DefaultTemplates() {}

    public static List<AutomationTemplate> all() {
        return List.of(
                dueDateReminder(),
                overdueTaskAlert(),
                weeklyStatusReport(),
                linkedRecordSync(),
                inboundOrderWebhook(),
                notifyOnCompletion());
    }

    static AutomationTemplate dueDateReminder() {
        return trigger("Due Date Reminder",
                "Notify webhooks the day before a task is due",
                "project_management",
                map("type", "date_based_trigger",
                        "table_id", "tasks_table",
                        "date_field_id", "due_date",
                        "condition_type", "days_before",
                        "days_offset", 1,
                        "check_time", "09:00",
                        "additional_conditions", map("status", map("operator", "not_equals", "value", "completed"))),
                List.of(map("type", "notify_webhooks", "event_kind", "task_due_soon")),
                List.of("date", "single_select"));
    }

    static AutomationTemplate overdueTaskAlert() {
        return trigger("Overdue Task Alert",
                "Daily alert for overdue tasks",
                "project_management",
                map("type", "date_based_trigger",
                        "table_id", "tasks_table",
                        "date_field_id", "due_date",
                        "condition_type", "overdue",
                        "recurring_pattern", map("frequency", "daily"),
                        "check_time", "09:00",
                        "additional_conditions", map("status", map("operator", "not_equals", "value", "completed"))),
                List.of(map("type", "notify_webhooks", "event_kind", "task_overdue")),
                List.of("date", "single_select"));
    }

    static AutomationTemplate weeklyStatusReport() {
        return trigger("Weekly Status Report",
                "Post the task list to a reporting endpoint every Friday",
                "reporting",
                map("type", "date_based_trigger",
                        "table_id", "tasks_table",
                        "condition_type", "recurring",
                        "recurring_pattern", map("frequency", "weekly", "weekday", 4),
                        "check_time", "17:00"),
                List.of(map("type", "webhook",
                        "url", "https://example.com/reports/weekly",
                        "method", "POST",
                        "payload_template", "{\"rows\": {{ rows }}, \"generated_at\": \"{{ trigger_time }}\"}")),
                List.of("date"));
    }

    static AutomationTemplate linkedRecordSync() {
        return trigger("Linked Record Status Sync",
                "Mark the parent row as updated when a linked record changes status",
                "data_sync",
                map("type", "linked_record_change_trigger",
                        "linked_table_id", "subtasks_table",
                        "parent_table_id", "tasks_table",
                        "link_field_id", "parent_link",
                        "change_type", "linked_record_updated",
                        "monitored_fields", List.of("status")),
                List.of(map("type", "update_row",
                        "table_id", "tasks_table",
                        "row_id", "{{ parent_rows.0.id }}",
                        "values", map("last_subtask_change", "{{ linked_records.0.id }}"))),
                List.of("link_row"));
    }

    static AutomationTemplate inboundOrderWebhook() {
        return trigger("Inbound Order Webhook",
                "Receive orders from an external shop and branch on the order total",
                "integrations",
                map("type", "webhook_trigger",
                        "url_path", "orders",
                        "auth_type", "none",
                        "allowed_methods", List.of("POST"),
                        "validation_rules", map("required_fields", List.of("order_id", "total"))),
                List.of(map("type", "conditional_branch",
                        "condition_template", "{{ total }}",
                        "condition_type", "greater_than",
                        "comparison_value_template", "500")),
                List.of());
    }

    static AutomationTemplate notifyOnCompletion() {
        AutomationTemplate template = new AutomationTemplate();
        template.setKind(TemplateKind.ACTION);
        template.setName("Notify On Completion");
        template.setDescription("Append a webhook notification to an existing workflow");
        template.setCategory("notifications");
        template.setTriggerConfig(null);
        template.setActionConfigs(List.of(map("type", "notify_webhooks", "event_kind", "workflow_completed")));
        template.setRequiredFieldTypes(List.of());
        return template;
    }

    private static AutomationTemplate trigger(String name, String description, String category,
                                              Map<String, Object> triggerConfig,
                                              List<Map<String, Object>> actions,
                                              List<String> requiredFieldTypes) {
        AutomationTemplate template = new AutomationTemplate();
        template.setKind(TemplateKind.TRIGGER);
        template.setName(name);
        template.setDescription(description);
        template.setCategory(category);
        template.setTriggerConfig(triggerConfig);
        template.setActionConfigs(actions);
        template.setRequiredFieldTypes(requiredFieldTypes);
        return template;
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
