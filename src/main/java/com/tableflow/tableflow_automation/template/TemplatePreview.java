package com.tableflow.tableflow_automation.template;

import java.util.List;

public record TemplatePreview(String triggerType,
                              String triggerDescription,
                              int actionCount,
                              List<String> actionDescriptions,
                              String complexity) {
}
