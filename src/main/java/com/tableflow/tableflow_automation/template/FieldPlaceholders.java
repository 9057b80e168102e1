package com.tableflow.tableflow_automation.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds and replaces field/table placeholders in template configs.
 *
 * <p>A placeholder is a string value under a key named {@code field} or {@code table_id}, or
 * ending in {@code _field}, {@code _field_id}, {@code _table} or {@code _table_id}. The keys of
 * field-keyed maps ({@code additional_conditions}, {@code linked_record_conditions}, {@code values})
 * and the items of {@code monitored_fields} lists are placeholders too.
 * Nested maps and lists are searched recursively.
 */
public final class FieldPlaceholders {

    private static final Set<String> FIELD_KEYED_MAPS = Set.of("additional_conditions", "linked_record_conditions", "values");
    private static final Set<String> FIELD_LISTS = Set.of("monitored_fields");
    private static final List<String> SUFFIXES = List.of("_field", "_field_id", "_table", "_table_id");

    private FieldPlaceholders() {}

    public static boolean isPlaceholderKey(String key) {
        if (key.equals("field") || key.equals("table_id")) return true;
        return SUFFIXES.stream().anyMatch(key::endsWith);
    }

    /** Placeholder name to the config key it was first found under, in discovery order. */
    public static Map<String, String> collect(Object config) {
        Map<String, String> found = new LinkedHashMap<>();
        collect(config, found);
        return found;
    }

    /** Deep copy of the config with every mapped placeholder replaced; unmapped ones are left as is. */
    public static Object substitute(Object config, Map<String, String> mappings) {
        if (config instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                if (FIELD_KEYED_MAPS.contains(key) && v instanceof Map<?, ?> conditions) {
                    Map<String, Object> renamed = new LinkedHashMap<>();
                    conditions.forEach((name, condition) ->
                            renamed.put(mappings.getOrDefault(String.valueOf(name), String.valueOf(name)),
                                    substitute(condition, mappings)));
                    copy.put(key, renamed);
                } else if (isPlaceholderKey(key) && v instanceof String s) {
                    copy.put(key, mappings.getOrDefault(s, s));
                } else if (FIELD_LISTS.contains(key) && v instanceof List<?> names) {
                    List<Object> mapped = new ArrayList<>(names.size());
                    names.forEach(n -> mapped.add(n instanceof String name ? mappings.getOrDefault(name, name) : n));
                    copy.put(key, mapped);
                } else {
                    copy.put(key, substitute(v, mappings));
                }
            });
            return copy;
        }
        if (config instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(substitute(item, mappings)));
            return copy;
        }
        return config;
    }

    /** Field type a placeholder under this key must have, when the key implies one. */
    public static Optional<String> expectedFieldType(String key) {
        if (key.startsWith("date_field")) return Optional.of("date");
        if (key.startsWith("link_field")) return Optional.of("link_row");
        return Optional.empty();
    }

    private static void collect(Object config, Map<String, String> found) {
        if (config instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                if (FIELD_KEYED_MAPS.contains(key) && v instanceof Map<?, ?> conditions) {
                    conditions.keySet().forEach(name -> found.putIfAbsent(String.valueOf(name), key));
                    conditions.values().forEach(condition -> collect(condition, found));
                } else if (isPlaceholderKey(key) && v instanceof String s && !s.isBlank()) {
                    found.putIfAbsent(s, key);
                } else if (FIELD_LISTS.contains(key) && v instanceof List<?> names) {
                    names.forEach(n -> {
                        if (n instanceof String name && !name.isBlank()) found.putIfAbsent(name, key);
                    });
                } else {
                    collect(v, found);
                }
            });
        } else if (config instanceof List<?> list) {
            list.forEach(item -> collect(item, found));
        }
    }
}
