package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "automation_webhook_activity", indexes = {
        @Index(name = "idx_webhook_activity_webhook", columnList = "webhook_id, created_at")
})
@Data
public class WebhookActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "webhook_id", nullable = false)
    private UUID webhookId;

    @Column(name = "delivery_id")
    private UUID deliveryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActivityKind kind;

    @Column(length = 1000)
    private String message;

    @Column(name = "error_text", length = 4000)
    private String errorText;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
