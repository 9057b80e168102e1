package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Recurrence of a date trigger. Weekday follows the Monday = 0 convention.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecurringPattern {

    private static final Set<String> FREQUENCIES = Set.of("daily", "weekly", "monthly", "yearly");

    private String frequency = "daily";
    private Integer weekday;
    private Integer dayOfMonth;
    private Integer month;

    public static RecurringPattern daily() {
        return new RecurringPattern("daily", null, null, null);
    }

    public static RecurringPattern weekly(int weekday) {
        return new RecurringPattern("weekly", weekday, null, null);
    }

    public static RecurringPattern monthly(int dayOfMonth) {
        return new RecurringPattern("monthly", null, dayOfMonth, null);
    }

    public boolean matches(LocalDateTime now) {
        String f = frequency == null ? "daily" : frequency.toLowerCase();
        return switch (f) {
            case "daily" -> true;
            case "weekly" -> now.getDayOfWeek().getValue() - 1 == valueOr(weekday, 0);
            case "monthly" -> now.getDayOfMonth() == valueOr(dayOfMonth, 1);
            case "yearly" -> now.getMonthValue() == valueOr(month, 1)
                    && now.getDayOfMonth() == valueOr(dayOfMonth, 1);
            default -> throw new AutomationConfigurationException("Unknown recurring frequency: " + frequency);
        };
    }

    public void validate() {
        String f = frequency == null ? "daily" : frequency.toLowerCase();
        if (!FREQUENCIES.contains(f)) {
            throw new AutomationConfigurationException("Unknown recurring frequency: " + frequency);
        }
        if (weekday != null && (weekday < 0 || weekday > 6)) {
            throw new AutomationConfigurationException("weekday must be between 0 (Monday) and 6 (Sunday): " + weekday);
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new AutomationConfigurationException("day_of_month must be between 1 and 31: " + dayOfMonth);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new AutomationConfigurationException("month must be between 1 and 12: " + month);
        }
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
