package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.WebhookActivityLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WebhookActivityLogRepository extends JpaRepository<WebhookActivityLog, UUID> {

    List<WebhookActivityLog> findByWebhookIdOrderByCreatedAtDesc(UUID webhookId);

    List<WebhookActivityLog> findByDeliveryIdOrderByCreatedAtAsc(UUID deliveryId);

    @Transactional
    @Modifying
    @Query("delete from WebhookActivityLog a where a.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
