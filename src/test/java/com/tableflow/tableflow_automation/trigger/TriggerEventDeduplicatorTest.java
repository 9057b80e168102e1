package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TriggerEventDeduplicatorTest {

    private final UUID trigger = UUID.randomUUID();
    private AutomationProperties properties;
    private MutableClock clock;
    private ObjectProvider<StringRedisTemplate> redisProvider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new AutomationProperties();
        properties.getDedup().setWindow(Duration.ofMinutes(10));
        clock = new MutableClock(Instant.parse("2024-03-12T09:00:00Z"));
        redisProvider = mock(ObjectProvider.class);
    }

    @Test
    void duplicateInsideWindowIsSuppressed() {
        TriggerEventDeduplicator dedup = new TriggerEventDeduplicator(properties, redisProvider, clock);

        assertThat(dedup.firstOccurrence(trigger, "row-7")).isTrue();
        assertThat(dedup.firstOccurrence(trigger, "row-7")).isFalse();
        assertThat(dedup.firstOccurrence(UUID.randomUUID(), "row-7")).isTrue();
    }

    @Test
    void eventIsAcceptedAgainAfterTheWindow() {
        TriggerEventDeduplicator dedup = new TriggerEventDeduplicator(properties, redisProvider, clock);
        dedup.firstOccurrence(trigger, "row-7");

        clock.advance(Duration.ofMinutes(10));

        assertThat(dedup.firstOccurrence(trigger, "row-7")).isTrue();
    }

    @Test
    void eventsWithoutIdAreNeverDeduplicated() {
        TriggerEventDeduplicator dedup = new TriggerEventDeduplicator(properties, redisProvider, clock);

        assertThat(dedup.firstOccurrence(trigger, null)).isTrue();
        assertThat(dedup.firstOccurrence(trigger, null)).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void usesRedisSetIfAbsentWhenEnabled() {
        properties.getDedup().setRedisEnabled(true);
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(redisProvider.getIfAvailable()).thenReturn(redis);
        when(ops.setIfAbsent(anyString(), eq("1"), eq(Duration.ofMinutes(10)))).thenReturn(true, false);
        TriggerEventDeduplicator dedup = new TriggerEventDeduplicator(properties, redisProvider, clock);

        assertThat(dedup.firstOccurrence(trigger, "e1")).isTrue();
        assertThat(dedup.firstOccurrence(trigger, "e1")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fallsBackToMemoryWhenRedisFails() {
        properties.getDedup().setRedisEnabled(true);
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(redisProvider.getIfAvailable()).thenReturn(redis);
        when(ops.setIfAbsent(anyString(), anyString(), eq(Duration.ofMinutes(10))))
                .thenThrow(new RedisConnectionFailureException("down"));
        TriggerEventDeduplicator dedup = new TriggerEventDeduplicator(properties, redisProvider, clock);

        assertThat(dedup.firstOccurrence(trigger, "e1")).isTrue();
        assertThat(dedup.firstOccurrence(trigger, "e1")).isFalse();
    }
}
