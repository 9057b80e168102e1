package com.tableflow.tableflow_automation.model.trigger;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurringPatternTest {

    // Tuesday
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 12, 9, 0);

    @Test
    void dailyAlwaysMatches() {
        assertThat(RecurringPattern.daily().matches(NOW)).isTrue();
    }

    @Test
    void weeklyUsesMondayAsZero() {
        assertThat(RecurringPattern.weekly(1).matches(NOW)).isTrue();
        assertThat(RecurringPattern.weekly(0).matches(NOW)).isFalse();
        assertThat(RecurringPattern.weekly(6).matches(NOW.plusDays(5))).isTrue();
    }

    @Test
    void monthlyMatchesDayOfMonth() {
        assertThat(RecurringPattern.monthly(12).matches(NOW)).isTrue();
        assertThat(RecurringPattern.monthly(13).matches(NOW)).isFalse();
    }

    @Test
    void yearlyNeedsMonthAndDay() {
        assertThat(new RecurringPattern("yearly", null, 12, 3).matches(NOW)).isTrue();
        assertThat(new RecurringPattern("yearly", null, 12, 4).matches(NOW)).isFalse();
    }

    @Test
    void unknownFrequencyIsAConfigurationError() {
        RecurringPattern pattern = new RecurringPattern("hourly", null, null, null);

        assertThatThrownBy(pattern::validate).isInstanceOf(AutomationConfigurationException.class);
        assertThatThrownBy(() -> pattern.matches(NOW)).isInstanceOf(AutomationConfigurationException.class);
    }

    @Test
    void validateRejectsOutOfRangeWeekday() {
        assertThatThrownBy(() -> RecurringPattern.weekly(7).validate())
                .isInstanceOf(AutomationConfigurationException.class)
                .hasMessageContaining("weekday");
    }
}
