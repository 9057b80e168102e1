package com.tableflow.tableflow_automation.trigger.condition;

import java.util.List;
import java.util.Map;

/**
 * Dotted path lookup over nested maps and lists, e.g. "data.user.name" or "rows.0.status".
 */
public final class PayloadPaths {

    private PayloadPaths() {}

    public static Object get(Object root, String path) {
        if (root == null || path == null || path.isBlank()) return null;
        Object current = root;
        for (String segment : path.trim().split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                current = elementAt(list, segment);
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }

    public static boolean has(Object root, String path) {
        return get(root, path) != null;
    }

    private static Object elementAt(List<?> list, String segment) {
        try {
            int index = Integer.parseInt(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
