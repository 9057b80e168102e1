package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateConditionTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 12, 9, 0);
    private static final LocalDate TODAY = NOW.toLocalDate();

    @Test
    void daysBeforeMatchesExactlyTodayPlusOffset() {
        assertThat(DateCondition.DAYS_BEFORE.matches(TODAY.plusDays(1), NOW, 1)).isTrue();
        assertThat(DateCondition.DAYS_BEFORE.matches(TODAY.plusDays(2), NOW, 1)).isFalse();
        assertThat(DateCondition.DAYS_BEFORE.matches(TODAY, NOW, 1)).isFalse();
    }

    @Test
    void daysAfterLooksBackwards() {
        assertThat(DateCondition.DAYS_AFTER.matches(TODAY.minusDays(3), NOW, 3)).isTrue();
        assertThat(DateCondition.DAYS_AFTER.matches(TODAY.plusDays(3), NOW, 3)).isFalse();
    }

    @Test
    void dateReachedIgnoresTimeOfDay() {
        assertThat(DateCondition.DATE_REACHED.matches(TODAY.atTime(23, 59), NOW, 0)).isTrue();
        assertThat(DateCondition.DATE_REACHED.matches(TODAY.minusDays(1), NOW, 0)).isFalse();
    }

    @Test
    void overdueIsStrictlyBeforeNow() {
        assertThat(DateCondition.OVERDUE.matches(TODAY.minusDays(1), NOW, 0)).isTrue();
        assertThat(DateCondition.OVERDUE.matches(TODAY, NOW, 0)).isFalse();
        assertThat(DateCondition.OVERDUE.matches(NOW.minusMinutes(1), NOW, 0)).isTrue();
        assertThat(DateCondition.OVERDUE.matches(NOW, NOW, 0)).isFalse();
    }

    @Test
    void missingDateNeverMatchesExceptRecurring() {
        assertThat(DateCondition.DATE_REACHED.matches(null, NOW, 0)).isFalse();
        assertThat(DateCondition.RECURRING.matches(null, NOW, 0)).isTrue();
    }

    @Test
    void unknownConditionKeyIsRejected() {
        assertThat(DateCondition.fromKey("days_before")).isEqualTo(DateCondition.DAYS_BEFORE);
        assertThatThrownBy(() -> DateCondition.fromKey("someday"))
                .isInstanceOf(AutomationConfigurationException.class);
    }
}
