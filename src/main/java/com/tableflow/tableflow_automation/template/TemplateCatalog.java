package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import com.tableflow.tableflow_automation.repository.AutomationTemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Read side of the template catalog: listing, compatibility filtering and previews. */
@Service
@RequiredArgsConstructor
public class TemplateCatalog {

    private final AutomationTemplateRepository templateRepository;

    /** Active templates, most used first. */
    public List<AutomationTemplate> list(String category) {
        if (category == null || category.isBlank()) {
            return templateRepository.findByActiveTrueOrderByUsageCountDescNameAsc();
        }
        return templateRepository.findByActiveTrueAndCategoryOrderByUsageCountDescNameAsc(category);
    }

    /** Active templates whose required field types are all among the available ones. */
    public List<AutomationTemplate> compatibleWith(Collection<String> availableFieldTypes) {
        return templateRepository.findByActiveTrueOrderByUsageCountDescNameAsc().stream()
                .filter(t -> isCompatible(t, availableFieldTypes))
                .toList();
    }

    public TemplatePreview preview(UUID templateId) {
        AutomationTemplate template = templateRepository.findById(templateId)
                .filter(AutomationTemplate::isActive)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));
        return preview(template);
    }

    public TemplatePreview preview(AutomationTemplate template) {
        Map<String, Object> trigger = template.getTriggerConfig();
        List<Map<String, Object>> actions = template.getActionConfigs() != null ? template.getActionConfigs() : List.of();
        String triggerType = trigger != null && trigger.get("type") != null ? trigger.get("type").toString() : null;

        return new TemplatePreview(
                triggerType,
                trigger != null ? describeTrigger(trigger) : null,
                actions.size(),
                actions.stream().map(TemplateCatalog::describeAction).toList(),
                complexity(triggerType, trigger, actions.size()));
    }

    static boolean isCompatible(AutomationTemplate template, Collection<String> availableFieldTypes) {
        List<String> required = template.getRequiredFieldTypes();
        return required == null || availableFieldTypes.containsAll(required);
    }

    static String describeTrigger(Map<String, Object> config) {
        String type = String.valueOf(config.get("type"));
        return switch (type) {
            case "date_based_trigger" -> "Triggers when " + humanize(config.getOrDefault("condition_type", "date_reached"));
            case "linked_record_change_trigger" -> "Triggers on " + humanize(config.getOrDefault("change_type", "any_change")) + " in linked records";
            case "webhook_trigger" -> "Triggers when external webhook is received";
            case "conditional_trigger" -> "Triggers when complex conditions are met";
            default -> "Triggers on " + humanize(type);
        };
    }

    static String describeAction(Map<String, Object> config) {
        String type = String.valueOf(config.get("type"));
        return switch (type) {
            case "webhook" -> "Makes HTTP request to external service";
            case "notify_webhooks" -> "Notifies the workspace's webhooks";
            case "update_row" -> "Updates existing row";
            case "conditional_branch" -> "Branches on a condition";
            case "delay" -> "Waits before continuing";
            default -> "Performs " + humanize(type);
        };
    }

    static String complexity(String triggerType, Map<String, Object> trigger, int actionCount) {
        int score = "conditional_trigger".equals(triggerType) || "linked_record_change_trigger".equals(triggerType) ? 2 : 1;
        score += actionCount;
        if (trigger != null && trigger.get("additional_conditions") instanceof Map<?, ?> conditions) {
            score += conditions.size();
        }
        if (score <= 2) return "Simple";
        if (score <= 5) return "Medium";
        return "Complex";
    }

    private static String humanize(Object value) {
        return String.valueOf(value).replace('_', ' ');
    }
}
