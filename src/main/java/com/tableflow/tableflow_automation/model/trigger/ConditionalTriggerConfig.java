package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * <pre>
 * {
 *   "base_trigger_id": "6f1c...",
 *   "condition_groups": [
 *     { "id": "group_0", "logic": "and", "conditions": [ { "field": "status", "operator": "equals", "value": "Open" } ] }
 *   ],
 *   "evaluation_mode": "custom_logic",
 *   "custom_logic": "group_0 & !group_1",
 *   "time_conditions": { "weekdays": [0, 1, 2, 3, 4], "start_time": "08:00", "end_time": "18:00" }
 * }
 * </pre>
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionalTriggerConfig {

    private UUID baseTriggerId;
    private List<ConditionGroup> conditionGroups = new ArrayList<>();
    // all_must_match | any_can_match | custom_logic
    private String evaluationMode = "all_must_match";
    private String customLogic;
    private TimeConditions timeConditions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConditionGroup {
        private String id;
        private String logic = "and";
        private List<Condition> conditions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Condition {
        private String field;
        private String operator;
        private Object value;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeConditions {
        // Monday = 0
        private List<Integer> weekdays = new ArrayList<>();
        private String startTime;
        private String endTime;
    }
}
