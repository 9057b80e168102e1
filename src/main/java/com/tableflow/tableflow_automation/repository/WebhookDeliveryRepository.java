package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.DeliveryStatus;
import com.tableflow.tableflow_automation.model.domain.WebhookDelivery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, UUID> {

    List<WebhookDelivery> findByWebhookIdOrderByCreatedAtDesc(UUID webhookId);

    @Query("""
            select d from WebhookDelivery d
            where d.status in :statuses and d.nextRetryAt <= :now and d.attempts < d.maxAttempts
            order by d.nextRetryAt asc
            """)
    List<WebhookDelivery> findDueForRetry(@Param("statuses") Collection<DeliveryStatus> statuses, @Param("now") Instant now);
}
