package com.tableflow.tableflow_automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "tableflow.automation")
public class AutomationProperties {

    private Runner runner = new Runner();
    private Workers workers = new Workers();
    private Scheduler scheduler = new Scheduler();
    private Webhooks webhooks = new Webhooks();
    private Dedup dedup = new Dedup();
    private Retention retention = new Retention();
    private Templates templates = new Templates();

    @Data
    public static class Runner {
        private Duration maxExecutionTime = Duration.ofSeconds(300);
        private int maxAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private double retryMultiplier = 2.0d;
    }

    @Data
    public static class Workers {
        private int triggerThreads = 4;
        private int triggerQueueCapacity = 1000;
        private int runThreads = 8;
        private int runQueueCapacity = 1000;
        private int deliveryThreads = 4;
        private int deliveryQueueCapacity = 1000;
    }

    @Data
    public static class Scheduler {
        private String dateTickCron = "0 * * * * *";
        private Duration deliverySweepInterval = Duration.ofSeconds(60);
        private String retentionCron = "0 30 3 * * *";
    }

    @Data
    public static class Webhooks {
        // Used in the User-Agent and X-<Product>-* headers
        private String productName = "Tableflow";
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int responseBodyLimit = 10_000;
    }

    @Data
    public static class Dedup {
        private Duration window = Duration.ofMinutes(10);
        private boolean redisEnabled = false;
    }

    @Data
    public static class Retention {
        private Duration executionLogs = Duration.ofDays(30);
        private Duration webhookActivity = Duration.ofDays(30);
    }

    @Data
    public static class Templates {
        private boolean seedDefaults = true;
    }
}
