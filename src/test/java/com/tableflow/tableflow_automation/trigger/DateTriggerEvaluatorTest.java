package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.ClockTick;
import com.tableflow.tableflow_automation.model.trigger.RowChangeEvent;
import com.tableflow.tableflow_automation.model.trigger.RowChangeKind;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.service.InMemoryRowDataGateway;
import com.tableflow.tableflow_automation.support.MutableClock;
import com.tableflow.tableflow_automation.support.TestNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateTriggerEvaluatorTest {

    // Tuesday 2024-03-12 09:00 UTC
    private static final Instant NOW = Instant.parse("2024-03-12T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 12);

    private InMemoryRowDataGateway rows;
    private MutableClock clock;
    private DateTriggerEvaluator evaluator;

    @BeforeEach
    void setUp() {
        rows = new InMemoryRowDataGateway();
        clock = new MutableClock(NOW);
        evaluator = new DateTriggerEvaluator(rows, TriggerTestSupport.binder(), clock);
    }

    @Test
    void daysBeforeFiresForTomorrowOnly() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.plusDays(1).toString()));
        WorkflowNode trigger = trigger(Map.of("condition_type", "days_before", "days_offset", 1));

        TriggerDecision decision = evaluator.evaluate(trigger, ClockTick.at(NOW));

        assertThat(decision.fired()).isTrue();
        assertThat(decision.payload()).containsEntry("condition_type", "days_before");
        assertThat((List<?>) decision.payload().get("rows")).hasSize(1);
    }

    @Test
    void daysBeforeDoesNotFireForDayAfterTomorrow() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.plusDays(2).toString()));
        WorkflowNode trigger = trigger(Map.of("condition_type", "days_before", "days_offset", 1));

        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW)).fired()).isFalse();
    }

    @Test
    void checkTimeGatesTheMinute() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.toString()));
        WorkflowNode trigger = trigger(Map.of("condition_type", "date_reached", "check_time", "09:00"));

        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW)).fired()).isTrue();
        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW.plusSeconds(60))).fired()).isFalse();
    }

    @Test
    void recurringPatternMustMatchTheTick() {
        rows.putRow("reports", Map.of("id", 1));
        Map<String, Object> config = new HashMap<>();
        config.put("table_id", "reports");
        config.put("condition_type", "recurring");
        config.put("recurring_pattern", Map.of("frequency", "weekly", "weekday", 1));
        WorkflowNode trigger = TestNodes.node(NodeType.DATE_TRIGGER, config);

        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW)).fired()).isTrue();
        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW.plusSeconds(86_400))).fired()).isFalse();
    }

    @Test
    void recurringPatternIsIgnoredForOtherConditionTypes() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.toString()));
        Map<String, Object> config = new HashMap<>(Map.of("condition_type", "date_reached"));
        // Tuesday tick, pattern asks for Friday
        config.put("recurring_pattern", Map.of("frequency", "weekly", "weekday", 4));

        assertThat(evaluator.evaluate(trigger(config), ClockTick.at(NOW)).fired()).isTrue();
    }

    @Test
    void additionalConditionsAreAnded() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.minusDays(2).toString(), "status", "Done"));
        rows.putRow("tasks", Map.of("id", 2, "due_date", TODAY.minusDays(2).toString(), "status", "Open"));
        Map<String, Object> config = new HashMap<>(Map.of("condition_type", "overdue"));
        config.put("additional_conditions", Map.of("status", Map.of("operator", "not_equals", "value", "Done")));

        TriggerDecision decision = evaluator.evaluate(trigger(config), ClockTick.at(NOW));

        assertThat(decision.fired()).isTrue();
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> matched = (List<Map<String, Object>>) decision.payload().get("rows");
        assertThat(matched).extracting(r -> r.get("id")).containsExactly(2);
    }

    @Test
    void unsupportedAdditionalOperatorIsAConfigurationError() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", TODAY.toString()));
        Map<String, Object> config = new HashMap<>(Map.of("condition_type", "date_reached"));
        config.put("additional_conditions", Map.of("status", Map.of("operator", "starts_with", "value", "O")));

        assertThatThrownBy(() -> evaluator.evaluate(trigger(config), ClockTick.at(NOW)))
                .isInstanceOf(AutomationConfigurationException.class);
    }

    @Test
    void otherEventsNeverFire() {
        WorkflowNode trigger = trigger(Map.of("condition_type", "date_reached"));
        RowChangeEvent change = new RowChangeEvent("e1", "tasks", RowChangeKind.UPDATED, Set.of(), List.of());

        assertThat(evaluator.evaluate(trigger, change).fired()).isFalse();
    }

    @Test
    void dateTimeValuesAreReadInTheClockZone() {
        rows.putRow("tasks", Map.of("id", 1, "due_date", "2024-03-12T23:30:00-05:00"));
        WorkflowNode trigger = trigger(Map.of("condition_type", "days_before", "days_offset", 1));

        // 23:30 at -05:00 is 04:30 UTC on the 13th
        assertThat(evaluator.evaluate(trigger, ClockTick.at(NOW)).fired()).isTrue();
    }

    private WorkflowNode trigger(Map<String, Object> extra) {
        Map<String, Object> config = new HashMap<>();
        config.put("table_id", "tasks");
        config.put("date_field_id", "due_date");
        config.putAll(extra);
        return TestNodes.node(NodeType.DATE_TRIGGER, config);
    }
}
