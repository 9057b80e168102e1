package com.tableflow.tableflow_automation.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local table store, used when no gateway to the table layer is registered.
 */
public class InMemoryRowDataGateway implements RowDataGateway {

    private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();
    private final Map<String, String> fieldTypes = new ConcurrentHashMap<>();

    public void putRow(String tableId, Map<String, Object> row) {
        Object id = row.get("id");
        if (id == null) throw new IllegalArgumentException("Row needs an id");
        tables.computeIfAbsent(tableId, t -> new ConcurrentHashMap<>())
                .put(String.valueOf(id), new LinkedHashMap<>(row));
    }

    public void defineField(String fieldId, String type) {
        fieldTypes.put(fieldId, type);
    }

    @Override
    public List<Map<String, Object>> findRows(String tableId, int limit) {
        return rowsOf(tableId).stream()
                .limit(limit)
                .map(LinkedHashMap::new)
                .collect(Collectors.toList());
    }

    @Override
    public List<Map<String, Object>> findRowsLinkingTo(String tableId, String linkFieldId,
                                                       Collection<?> linkedRowIds, int limit) {
        Set<String> wanted = linkedRowIds.stream().map(String::valueOf).collect(Collectors.toSet());
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rowsOf(tableId)) {
            if (result.size() >= limit) break;
            if (references(row.get(linkFieldId), wanted)) {
                result.add(new LinkedHashMap<>(row));
            }
        }
        return result;
    }

    @Override
    public Optional<String> findFieldType(String fieldId) {
        return Optional.ofNullable(fieldTypes.get(fieldId));
    }

    @Override
    public Optional<Map<String, Object>> updateRow(String tableId, Object rowId, Map<String, Object> values) {
        Map<String, Map<String, Object>> rows = tables.get(tableId);
        if (rows == null) return Optional.empty();
        Map<String, Object> updated = rows.computeIfPresent(String.valueOf(rowId), (id, row) -> {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.putAll(values);
            copy.put("id", row.get("id"));
            return copy;
        });
        return Optional.ofNullable(updated).map(LinkedHashMap::new);
    }

    private Collection<Map<String, Object>> rowsOf(String tableId) {
        Map<String, Map<String, Object>> rows = tables.get(tableId);
        return rows != null ? rows.values() : List.of();
    }

    // Link values are either a single id or a list of ids / {id: ...} maps
    private boolean references(Object linkValue, Set<String> wanted) {
        if (linkValue == null) return false;
        if (linkValue instanceof Collection<?> values) {
            return values.stream().anyMatch(v -> references(v, wanted));
        }
        if (linkValue instanceof Map<?, ?> ref) {
            return ref.get("id") != null && wanted.contains(String.valueOf(ref.get("id")));
        }
        return wanted.contains(String.valueOf(linkValue));
    }
}
