package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.FieldCondition;
import com.tableflow.tableflow_automation.model.trigger.LinkedRecordTriggerConfig;
import com.tableflow.tableflow_automation.model.trigger.RowChangeEvent;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.service.RowDataGateway;
import com.tableflow.tableflow_automation.trigger.condition.ConditionOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Fires when records of a linked table change in a way the trigger monitors.
 * Parent rows (rows of the table holding the link field) are attached to the payload.
 */
@Component
@RequiredArgsConstructor
public class LinkedRecordTriggerEvaluator implements TriggerEvaluator {

    static final int PARENT_ROW_LIMIT = 100;

    private final RowDataGateway rowDataGateway;
    private final TriggerConfigBinder binder;

    @Override
    public NodeType supportedType() {
        return NodeType.LINKED_RECORD_TRIGGER;
    }

    @Override
    public TriggerDecision evaluate(WorkflowNode trigger, TriggerEvent event) {
        if (!(event instanceof RowChangeEvent change)) {
            return TriggerDecision.notFired();
        }
        LinkedRecordTriggerConfig config = binder.bind(trigger, LinkedRecordTriggerConfig.class);

        if (!Objects.equals(change.tableId(), config.getLinkedTableId())) {
            return TriggerDecision.notFired();
        }
        if (!changeKindMatches(config.getChangeType(), change)) {
            return TriggerDecision.notFired();
        }
        List<String> monitored = config.getMonitoredFields();
        if (monitored != null && !monitored.isEmpty()
                && Collections.disjoint(monitored, change.changedFields())) {
            return TriggerDecision.notFired();
        }

        List<Map<String, Object>> matching = change.records().stream()
                .filter(record -> satisfies(record, config.getLinkedRecordConditions()))
                .toList();
        if (matching.isEmpty()) {
            return TriggerDecision.notFired();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("change_type", change.changeKind().getChangeType());
        payload.put("changed_fields", new ArrayList<>(new TreeSet<>(change.changedFields())));
        payload.put("linked_records", matching);
        payload.put("parent_rows", parentRows(config, matching));
        return TriggerDecision.fire(payload);
    }

    private boolean changeKindMatches(String changeType, RowChangeEvent change) {
        if (changeType == null || LinkedRecordTriggerConfig.ANY_CHANGE.equals(changeType)) return true;
        return change.changeKind().getChangeType().equals(changeType);
    }

    private boolean satisfies(Map<String, Object> record, Map<String, FieldCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) return true;
        for (Map.Entry<String, FieldCondition> entry : conditions.entrySet()) {
            ConditionOperator op = ConditionOperator.forTrigger(entry.getValue().getOperator());
            if (!op.test(record.get(entry.getKey()), entry.getValue().getValue())) return false;
        }
        return true;
    }

    private List<Map<String, Object>> parentRows(LinkedRecordTriggerConfig config, List<Map<String, Object>> linked) {
        if (config.getParentTableId() == null || config.getLinkFieldId() == null) {
            return List.of();
        }
        List<Object> ids = linked.stream()
                .map(r -> r.get("id"))
                .filter(Objects::nonNull)
                .toList();
        if (ids.isEmpty()) return List.of();
        return rowDataGateway.findRowsLinkingTo(config.getParentTableId(), config.getLinkFieldId(), ids, PARENT_ROW_LIMIT);
    }
}
