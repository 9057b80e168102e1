package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "automation_webhook_deliveries", indexes = {
        @Index(name = "idx_deliveries_webhook_status", columnList = "webhook_id, status"),
        @Index(name = "idx_deliveries_next_retry", columnList = "next_retry_at")
})
@Data
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "webhook_id", nullable = false)
    private UUID webhookId;

    @Column(name = "event_kind", nullable = false)
    private String eventKind;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    private DeliveryStatus status = DeliveryStatus.PENDING;

    private int attempts;

    @Column(name = "max_attempts")
    private int maxAttempts;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "response_status_code")
    private Integer responseStatusCode;

    @Column(name = "response_body", length = 10000)
    private String responseBody;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
