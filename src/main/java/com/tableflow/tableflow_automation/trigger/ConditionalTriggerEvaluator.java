package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.ConditionalTriggerConfig.TimeConditions;
import com.tableflow.tableflow_automation.model.trigger.ReevaluationRequest;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.trigger.condition.ConditionGroupEvaluator;
import com.tableflow.tableflow_automation.trigger.condition.PayloadPaths;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * Wraps a base trigger: when the base fires, its payload is checked against the condition groups
 * and, on success, handed on unchanged.
 */
@Component
@RequiredArgsConstructor
public class ConditionalTriggerEvaluator implements TriggerEvaluator {

    private final TriggerConfigBinder binder;
    private final ConditionGroupEvaluator groupEvaluator;
    private final Clock clock;

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITIONAL_TRIGGER;
    }

    @Override
    public TriggerDecision evaluate(WorkflowNode trigger, TriggerEvent event) {
        if (!(event instanceof ReevaluationRequest request)) {
            return TriggerDecision.notFired();
        }
        ConditionalTriggerConfig config = binder.bind(trigger, ConditionalTriggerConfig.class);
        if (config.getBaseTriggerId() == null || !config.getBaseTriggerId().equals(request.baseTriggerNodeId())) {
            return TriggerDecision.notFired();
        }
        if (!withinTimeConditions(config.getTimeConditions(), LocalDateTime.now(clock))) {
            return TriggerDecision.notFired();
        }

        Map<String, Object> payload = request.payload() != null ? request.payload() : Map.of();
        boolean matched = groupEvaluator.evaluate(config, field -> lookup(payload, field));
        return matched ? TriggerDecision.fire(payload) : TriggerDecision.notFired();
    }

    // Payload first, then the first row the base trigger reported
    private Object lookup(Map<String, Object> payload, String field) {
        Object direct = PayloadPaths.get(payload, field);
        if (direct != null) return direct;
        for (String rowsKey : List.of("rows", "linked_records")) {
            if (payload.get(rowsKey) instanceof List<?> rows && !rows.isEmpty()) {
                Object value = PayloadPaths.get(rows.get(0), field);
                if (value != null) return value;
            }
        }
        return null;
    }

    private boolean withinTimeConditions(TimeConditions time, LocalDateTime now) {
        if (time == null) return true;
        if (time.getWeekdays() != null && !time.getWeekdays().isEmpty()
                && !time.getWeekdays().contains(now.getDayOfWeek().getValue() - 1)) {
            return false;
        }
        if (time.getStartTime() == null || time.getEndTime() == null) return true;

        LocalTime start = TriggerConfigBinder.parseTime(time.getStartTime(), "start_time");
        LocalTime end = TriggerConfigBinder.parseTime(time.getEndTime(), "end_time");
        LocalTime t = now.toLocalTime();
        if (!start.isAfter(end)) {
            return !t.isBefore(start) && !t.isAfter(end);
        }
        // Window spans midnight, e.g. 22:00-06:00
        return !t.isBefore(start) || !t.isAfter(end);
    }
}
