package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.Webhook;
import com.tableflow.tableflow_automation.model.domain.WebhookStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Delivery statistics are only ever moved with the increments below, never by saving a loaded entity.
 */
public interface WebhookRepository extends JpaRepository<Webhook, UUID> {

    List<Webhook> findByWorkspaceIdAndStatus(UUID workspaceId, WebhookStatus status);

    @Transactional
    @Modifying
    @Query("update Webhook w set w.totalDeliveries = w.totalDeliveries + 1, w.lastDeliveryAt = :at where w.id = :id")
    int recordAttempt(@Param("id") UUID id, @Param("at") Instant at);

    @Transactional
    @Modifying
    @Query("update Webhook w set w.successfulDeliveries = w.successfulDeliveries + 1, w.lastSuccessAt = :at where w.id = :id")
    int recordSuccess(@Param("id") UUID id, @Param("at") Instant at);

    @Transactional
    @Modifying
    @Query("update Webhook w set w.failedDeliveries = w.failedDeliveries + 1, w.lastFailureAt = :at where w.id = :id")
    int recordFailure(@Param("id") UUID id, @Param("at") Instant at);
}
