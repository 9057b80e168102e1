package com.tableflow.tableflow_automation.model.trigger;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Row mutation notification from the table layer. Each record carries at least an "id" entry.
 */
public record RowChangeEvent(String eventId,
                             String tableId,
                             RowChangeKind changeKind,
                             Set<String> changedFields,
                             List<Map<String, Object>> records) implements TriggerEvent {

    public RowChangeEvent {
        changedFields = changedFields != null ? Set.copyOf(changedFields) : Set.of();
        records = records != null ? List.copyOf(records) : List.of();
    }
}
