package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At-most-once firing per (trigger node, event id) within the dedup window.
 * Uses Redis SET NX with a TTL when enabled so the guarantee holds across instances,
 * otherwise an in-process map.
 */
@Slf4j
@Component
public class TriggerEventDeduplicator {

    private static final String KEY_PREFIX = "tableflow:automation:trigger-dedup:";

    private final AutomationProperties properties;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final Clock clock;

    // key -> expiry
    private final Map<String, Instant> seen = new ConcurrentHashMap<>();

    public TriggerEventDeduplicator(AutomationProperties properties,
                                    ObjectProvider<StringRedisTemplate> redisTemplate,
                                    Clock clock) {
        this.properties = properties;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    /** True the first time the pair is seen inside the window. Events without an id always pass. */
    public boolean firstOccurrence(UUID triggerNodeId, String eventId) {
        if (eventId == null) return true;
        String key = KEY_PREFIX + triggerNodeId + ":" + eventId;
        Duration window = properties.getDedup().getWindow();

        StringRedisTemplate redis = properties.getDedup().isRedisEnabled() ? redisTemplate.getIfAvailable() : null;
        if (redis != null) {
            try {
                return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, "1", window));
            } catch (DataAccessException ex) {
                log.warn("Redis dedup unavailable ({}), falling back to in-memory for {}", ex.getMessage(), key);
            }
        }

        Instant now = clock.instant();
        boolean[] first = {false};
        seen.compute(key, (k, expiry) -> {
            if (expiry == null || !expiry.isAfter(now)) {
                first[0] = true;
                return now.plus(window);
            }
            return expiry;
        });
        return first[0];
    }

    @Scheduled(fixedDelay = 60_000)
    public void evictExpired() {
        Instant now = clock.instant();
        seen.values().removeIf(expiry -> !expiry.isAfter(now));
    }
}
