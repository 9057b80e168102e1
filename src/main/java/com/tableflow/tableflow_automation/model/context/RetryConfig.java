package com.tableflow.tableflow_automation.model.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry policy of a node. Defaults come from {@code tableflow.automation.runner.*};
 * a node may override them in its config under the "retry" key:
 *
 * <pre>
 * { "retry": { "max_attempts": 5, "backoff_ms": 500, "backoff_multiplier": 3.0 } }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryConfig {

    public static final int MAX_ATTEMPTS_CAP = 10;

    /** Total attempts including the first one. Clamped to [1, 10]. */
    private int maxAttempts = 3;

    /** Delay before the second attempt. */
    private long backoffMs = 1000L;

    private double backoffMultiplier = 2.0d;

    /** Delay after the given failed attempt (1-based): base * multiplier^(attempt-1). */
    public Duration delayForAttempt(int attempt) {
        double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis((long) Math.max(0d, backoffMs * factor));
    }

    public RetryConfig normalized() {
        int attempts = Math.max(1, Math.min(MAX_ATTEMPTS_CAP, maxAttempts));
        long backoff = backoffMs < 0 ? 0 : backoffMs;
        double multiplier = backoffMultiplier > 0 ? backoffMultiplier : 1.0d;
        return new RetryConfig(attempts, backoff, multiplier);
    }
}
