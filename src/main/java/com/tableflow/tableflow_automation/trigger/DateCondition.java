package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.Arrays;

/**
 * Date condition of a date trigger. Field values are either {@link LocalDate} or {@link LocalDateTime}.
 */
public enum DateCondition {
    DATE_REACHED("date_reached"),
    DAYS_BEFORE("days_before"),
    DAYS_AFTER("days_after"),
    RECURRING("recurring"),
    OVERDUE("overdue");

    private final String key;

    DateCondition(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static DateCondition fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new AutomationConfigurationException("Unknown date condition type: " + key));
    }

    public boolean requiresDateField() {
        return this != RECURRING;
    }

    /**
     * @param fieldValue the row's date value
     * @param now        current time in the clock's zone
     * @param daysOffset offset for days_before / days_after
     */
    public boolean matches(Temporal fieldValue, LocalDateTime now, int daysOffset) {
        if (this == RECURRING) return true;
        if (fieldValue == null) return false;

        LocalDate today = now.toLocalDate();
        LocalDate fieldDate = fieldValue instanceof LocalDateTime dt ? dt.toLocalDate() : (LocalDate) fieldValue;
        return switch (this) {
            case DATE_REACHED -> fieldDate.equals(today);
            case DAYS_BEFORE -> fieldDate.equals(today.plusDays(daysOffset));
            case DAYS_AFTER -> fieldDate.equals(today.minusDays(daysOffset));
            case OVERDUE -> fieldValue instanceof LocalDateTime dt ? dt.isBefore(now) : fieldDate.isBefore(today);
            case RECURRING -> true;
        };
    }
}
