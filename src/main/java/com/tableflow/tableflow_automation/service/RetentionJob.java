package com.tableflow.tableflow_automation.service;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.repository.ExecutionLogRepository;
import com.tableflow.tableflow_automation.repository.WebhookActivityLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes execution logs and webhook activity older than the configured windows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionJob {

    private final ExecutionLogRepository executionLogRepository;
    private final WebhookActivityLogRepository activityLogRepository;
    private final AutomationProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${tableflow.automation.scheduler.retention-cron:0 30 3 * * *}")
    public void purge() {
        Instant now = clock.instant();
        AutomationProperties.Retention retention = properties.getRetention();
        try {
            int logs = executionLogRepository.deleteOlderThan(now.minus(retention.getExecutionLogs()));
            int activity = activityLogRepository.deleteOlderThan(now.minus(retention.getWebhookActivity()));
            log.info("Retention sweep removed {} execution log entries and {} webhook activity entries", logs, activity);
        } catch (DataAccessException ex) {
            log.error("Retention sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
