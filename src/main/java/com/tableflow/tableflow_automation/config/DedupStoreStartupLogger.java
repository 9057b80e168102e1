package com.tableflow.tableflow_automation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Logs at startup which store backs trigger event deduplication.
 * With redis-enabled but no Redis connection, deduplication falls back to this instance only.
 */
@Slf4j
@Component
public class DedupStoreStartupLogger implements ApplicationRunner {

    private final AutomationProperties properties;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;

    public DedupStoreStartupLogger(AutomationProperties properties,
                                   ObjectProvider<StringRedisTemplate> redisTemplate) {
        this.properties = properties;
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean wanted = properties.getDedup().isRedisEnabled();
        boolean available = redisTemplate.getIfAvailable() != null;
        if (wanted && available) {
            log.info("Trigger dedup: Redis (window {})", properties.getDedup().getWindow());
        } else if (wanted) {
            log.warn("Trigger dedup: Redis requested but no StringRedisTemplate bean, using in-memory store (single instance only)");
        } else {
            log.info("Trigger dedup: in-memory (window {})", properties.getDedup().getWindow());
        }
    }
}
