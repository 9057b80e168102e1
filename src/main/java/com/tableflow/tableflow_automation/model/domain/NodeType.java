package com.tableflow.tableflow_automation.model.domain;

import java.util.Arrays;
import java.util.Optional;

public enum NodeType {
    // Triggers
    DATE_TRIGGER("date_based_trigger", NodeCategory.TRIGGER),
    LINKED_RECORD_TRIGGER("linked_record_change_trigger", NodeCategory.TRIGGER),
    WEBHOOK_TRIGGER("webhook_trigger", NodeCategory.TRIGGER),
    CONDITIONAL_TRIGGER("conditional_trigger", NodeCategory.TRIGGER),

    // Actions
    WEBHOOK_ACTION("webhook", NodeCategory.ACTION),       // outbound HTTP call, response visible to later nodes
    NOTIFY_WEBHOOKS("notify_webhooks", NodeCategory.ACTION), // durable fan-out to the workspace's webhooks
    UPDATE_ROW("update_row", NodeCategory.ACTION),

    // Flow control
    CONDITIONAL_BRANCH("conditional_branch", NodeCategory.BRANCH),
    DELAY("delay", NodeCategory.DELAY);

    private final String configKey;
    private final NodeCategory category;

    NodeType(String configKey, NodeCategory category) {
        this.configKey = configKey;
        this.category = category;
    }

    /** Name used in template configs, e.g. {@code "date_based_trigger"}. */
    public String getConfigKey() {
        return configKey;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public boolean isTrigger() {
        return category == NodeCategory.TRIGGER;
    }

    public static Optional<NodeType> fromConfigKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.configKey.equals(key) || t.name().equalsIgnoreCase(key))
                .findFirst();
    }
}
