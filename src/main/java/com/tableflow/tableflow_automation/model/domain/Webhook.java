package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outbound webhook channel. Configuration is owned by the surrounding CRUD layer;
 * the delivery service only touches the statistics columns, through atomic updates.
 */
@Entity
@Table(name = "automation_webhooks")
@Data
public class Webhook {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    private String name;

    @Column(nullable = false, length = 2000)
    private String url;

    // Event kinds this webhook accepts, e.g. row_created
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> triggers = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> headers = new HashMap<>();

    private String secret;

    @Enumerated(EnumType.STRING)
    private WebhookStatus status = WebhookStatus.ACTIVE;

    @Column(name = "max_attempts")
    private int maxAttempts = 3;

    @Column(name = "retry_delay_seconds")
    private int retryDelaySeconds = 60;

    @Column(name = "timeout_seconds")
    private int timeoutSeconds = 30;

    @Column(name = "total_deliveries")
    private long totalDeliveries;

    @Column(name = "successful_deliveries")
    private long successfulDeliveries;

    @Column(name = "failed_deliveries")
    private long failedDeliveries;

    @Column(name = "last_delivery_at")
    private Instant lastDeliveryAt;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Column(name = "last_failure_at")
    private Instant lastFailureAt;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public boolean isActive() {
        return status == WebhookStatus.ACTIVE;
    }

    public boolean accepts(String eventKind) {
        return triggers != null && triggers.contains(eventKind);
    }
}
