package com.tableflow.tableflow_automation.trigger.condition;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Comparison operators shared by trigger conditions and branch nodes.
 * Ordering comparisons are numeric when both sides parse as numbers, lexical otherwise.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    CUSTOM("custom");

    // Operators accepted in trigger condition sets; branch nodes accept all
    private static final Set<ConditionOperator> TRIGGER_OPERATORS =
            EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, LESS_THAN, CONTAINS, IS_EMPTY, IS_NOT_EMPTY);

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String key;

    ConditionOperator(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ConditionOperator fromKey(String key) {
        return Arrays.stream(values())
                .filter(op -> op.key.equalsIgnoreCase(key == null ? "" : key.trim()))
                .findFirst()
                .orElseThrow(() -> new AutomationConfigurationException("Unknown operator: " + key));
    }

    /** Resolves an operator for a trigger condition set, rejecting branch-only operators. */
    public static ConditionOperator forTrigger(String key) {
        ConditionOperator op = fromKey(key);
        if (!TRIGGER_OPERATORS.contains(op)) {
            throw new AutomationConfigurationException("Operator not supported in trigger conditions: " + key);
        }
        return op;
    }

    public boolean test(Object actual, Object expected) {
        return switch (this) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case GREATER_THAN -> actual != null && expected != null && compare(actual, expected) > 0;
            case LESS_THAN -> actual != null && expected != null && compare(actual, expected) < 0;
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> actual != null && expected != null && actual.toString().startsWith(expected.toString());
            case ENDS_WITH -> actual != null && expected != null && actual.toString().endsWith(expected.toString());
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case CUSTOM -> actual != null && TRUTHY.contains(actual.toString().trim().toLowerCase());
        };
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) return actual == expected;
        Double l = toNumber(actual);
        Double r = toNumber(expected);
        if (l != null && r != null) return l.doubleValue() == r.doubleValue();
        return actual.toString().equals(expected.toString());
    }

    private static int compare(Object actual, Object expected) {
        Double l = toNumber(actual);
        Double r = toNumber(expected);
        if (l != null && r != null) return Double.compare(l, r);
        return actual.toString().compareTo(expected.toString());
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) return false;
        if (actual instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> valuesEqual(item, expected));
        }
        return actual.toString().contains(expected.toString());
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.toString().isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        if (value instanceof Boolean b) return !b;
        return false;
    }

    /** Plain decimal text only; NaN, infinities and type suffixes such as "1f" compare as text. */
    private static Double toNumber(Object value) {
        if (value instanceof Boolean) return null;
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else {
            String s = value.toString().trim();
            if (!DECIMAL.matcher(s).matches()) return null;
            d = Double.parseDouble(s);
        }
        return Double.isFinite(d) ? d : null;
    }
}
