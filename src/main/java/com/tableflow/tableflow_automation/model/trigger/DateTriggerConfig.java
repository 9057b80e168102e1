package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <pre>
 * {
 *   "table_id": "tasks",
 *   "date_field_id": "due_date",
 *   "condition_type": "days_before",
 *   "days_offset": 1,
 *   "recurring_pattern": { "frequency": "weekly", "weekday": 0 },
 *   "check_time": "09:00",
 *   "additional_conditions": { "status": { "operator": "not_equals", "value": "Done" } }
 * }
 * </pre>
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DateTriggerConfig {
    private String tableId;
    private String dateFieldId;
    private String conditionType = "date_reached";
    private int daysOffset;
    private RecurringPattern recurringPattern;
    private String checkTime;
    private Map<String, FieldCondition> additionalConditions = new LinkedHashMap<>();
}
