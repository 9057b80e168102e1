package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.ClockTick;
import com.tableflow.tableflow_automation.model.trigger.DateTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.FieldCondition;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.service.RowDataGateway;
import com.tableflow.tableflow_automation.trigger.condition.ConditionOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fires on clock ticks for rows whose date field satisfies the configured condition.
 *
 * <p>With {@code check_time} set only the tick in that minute is evaluated. A recurring
 * pattern, when present, must match the tick. Additional field conditions are ANDed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DateTriggerEvaluator implements TriggerEvaluator {

    // Rows handed to the workflow per firing
    static final int MATCH_LIMIT = 100;
    static final int SCAN_LIMIT = 10_000;

    private final RowDataGateway rowDataGateway;
    private final TriggerConfigBinder binder;
    private final Clock clock;

    @Override
    public NodeType supportedType() {
        return NodeType.DATE_TRIGGER;
    }

    @Override
    public TriggerDecision evaluate(WorkflowNode trigger, TriggerEvent event) {
        if (!(event instanceof ClockTick tick)) {
            return TriggerDecision.notFired();
        }
        DateTriggerConfig config = binder.bind(trigger, DateTriggerConfig.class);
        ZoneId zone = clock.getZone();
        LocalDateTime now = LocalDateTime.ofInstant(tick.now(), zone);

        if (!passesTimeGate(config, now)) {
            return TriggerDecision.notFired();
        }
        DateCondition condition = DateCondition.fromKey(config.getConditionType());
        // The pattern only gates recurring triggers; other kinds ignore it
        if (condition == DateCondition.RECURRING
                && config.getRecurringPattern() != null && !config.getRecurringPattern().matches(now)) {
            return TriggerDecision.notFired();
        }

        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> row : rowDataGateway.findRows(config.getTableId(), SCAN_LIMIT)) {
            if (matching.size() >= MATCH_LIMIT) break;
            if (condition.requiresDateField()) {
                Temporal fieldValue = toTemporal(row.get(config.getDateFieldId()), zone);
                if (!condition.matches(fieldValue, now, config.getDaysOffset())) continue;
            }
            if (matchesAdditional(row, config.getAdditionalConditions())) {
                matching.add(row);
            }
        }

        if (matching.isEmpty()) {
            return TriggerDecision.notFired();
        }
        log.debug("Date trigger {} matched {} row(s) at {}", trigger.getId(), matching.size(), now);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rows", matching);
        payload.put("trigger_time", tick.now().toString());
        payload.put("condition_type", condition.getKey());
        return TriggerDecision.fire(payload);
    }

    private boolean passesTimeGate(DateTriggerConfig config, LocalDateTime now) {
        String checkTime = config.getCheckTime();
        if (checkTime == null || checkTime.isBlank()) return true;
        LocalTime gate = TriggerConfigBinder.parseTime(checkTime, "check_time");
        return now.getHour() == gate.getHour() && now.getMinute() == gate.getMinute();
    }

    private boolean matchesAdditional(Map<String, Object> row, Map<String, FieldCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) return true;
        for (Map.Entry<String, FieldCondition> entry : conditions.entrySet()) {
            FieldCondition condition = entry.getValue();
            ConditionOperator op = ConditionOperator.forTrigger(condition.getOperator());
            if (!op.test(row.get(entry.getKey()), condition.getValue())) return false;
        }
        return true;
    }

    /** Date-only values stay {@link LocalDate}; instants are shifted into the clock's zone. */
    public static Temporal toTemporal(Object value, ZoneId zone) {
        if (value == null) return null;
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt;
        if (value instanceof Instant i) return LocalDateTime.ofInstant(i, zone);
        if (value instanceof OffsetDateTime o) return LocalDateTime.ofInstant(o.toInstant(), zone);
        if (value instanceof ZonedDateTime z) return LocalDateTime.ofInstant(z.toInstant(), zone);
        if (value instanceof Date d) return LocalDateTime.ofInstant(d.toInstant(), zone);

        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        try {
            if (text.length() == 10) return LocalDate.parse(text);
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return LocalDateTime.ofInstant(OffsetDateTime.parse(text).toInstant(), zone);
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring unparseable date value '{}'", text);
            return null;
        }
    }
}
