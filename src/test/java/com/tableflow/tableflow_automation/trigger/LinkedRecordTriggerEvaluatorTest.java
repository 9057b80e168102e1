package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.RowChangeEvent;
import com.tableflow.tableflow_automation.model.trigger.RowChangeKind;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.service.InMemoryRowDataGateway;
import com.tableflow.tableflow_automation.support.TestNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LinkedRecordTriggerEvaluatorTest {

    private InMemoryRowDataGateway rows;
    private LinkedRecordTriggerEvaluator evaluator;

    @BeforeEach
    void setUp() {
        rows = new InMemoryRowDataGateway();
        rows.putRow("projects", Map.of("id", "p1", "tasks_link", List.of("t1", "t2")));
        rows.putRow("projects", Map.of("id", "p2", "tasks_link", List.of("t9")));
        evaluator = new LinkedRecordTriggerEvaluator(rows, TriggerTestSupport.binder());
    }

    @Test
    void updateOfMonitoredFieldFiresWithParentRows() {
        WorkflowNode trigger = trigger(Map.of("change_type", "linked_record_updated", "monitored_fields", List.of("status")));

        TriggerDecision decision = evaluator.evaluate(trigger,
                change(RowChangeKind.UPDATED, Set.of("status", "title"), Map.of("id", "t1", "status", "Done")));

        assertThat(decision.fired()).isTrue();
        assertThat(decision.payload())
                .containsEntry("change_type", "linked_record_updated")
                .containsEntry("changed_fields", List.of("status", "title"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> parents = (List<Map<String, Object>>) decision.payload().get("parent_rows");
        assertThat(parents).extracting(r -> r.get("id")).containsExactly("p1");
    }

    @Test
    void unmonitoredFieldChangeDoesNotFire() {
        WorkflowNode trigger = trigger(Map.of("monitored_fields", List.of("status")));

        assertThat(evaluator.evaluate(trigger, change(RowChangeKind.UPDATED, Set.of("title"), Map.of("id", "t1"))).fired())
                .isFalse();
    }

    @Test
    void changeKindMustMatchUnlessAnyChange() {
        WorkflowNode created = trigger(Map.of("change_type", "linked_record_created"));
        WorkflowNode any = trigger(Map.of());
        RowChangeEvent deleted = change(RowChangeKind.DELETED, Set.of(), Map.of("id", "t1"));

        assertThat(evaluator.evaluate(created, deleted).fired()).isFalse();
        assertThat(evaluator.evaluate(any, deleted).fired()).isTrue();
    }

    @Test
    void recordConditionsFilterTheLinkedRecords() {
        WorkflowNode trigger = trigger(Map.of("linked_record_conditions",
                Map.of("status", Map.of("operator", "equals", "value", "Done"))));

        TriggerDecision decision = evaluator.evaluate(trigger, change(RowChangeKind.UPDATED, Set.of("status"),
                Map.of("id", "t1", "status", "Open"), Map.of("id", "t2", "status", "Done")));

        assertThat(decision.fired()).isTrue();
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> linked = (List<Map<String, Object>>) decision.payload().get("linked_records");
        assertThat(linked).extracting(r -> r.get("id")).containsExactly("t2");
    }

    @Test
    void otherTablesAreIgnored() {
        RowChangeEvent elsewhere = new RowChangeEvent("e", "contacts", RowChangeKind.UPDATED, Set.of(), List.of(Map.of("id", "c1")));

        assertThat(evaluator.evaluate(trigger(Map.of()), elsewhere).fired()).isFalse();
    }

    private static WorkflowNode trigger(Map<String, Object> extra) {
        Map<String, Object> config = new HashMap<>();
        config.put("linked_table_id", "tasks");
        config.put("parent_table_id", "projects");
        config.put("link_field_id", "tasks_link");
        config.putAll(extra);
        return TestNodes.node(NodeType.LINKED_RECORD_TRIGGER, config);
    }

    @SafeVarargs
    private static RowChangeEvent change(RowChangeKind kind, Set<String> fields, Map<String, Object>... records) {
        return new RowChangeEvent("evt", "tasks", kind, fields, List.of(records));
    }
}
