package com.tableflow.tableflow_automation.webhook;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.engine.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery worker pool, separate from trigger evaluation and workflow runs.
 * A delivery id is held from enqueue until its attempt finishes, so it is never queued twice.
 */
@Slf4j
@Component
public class DeliveryQueue {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final ObjectProvider<WebhookDeliveryService> deliveryService;
    private final AutomationProperties properties;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private volatile WorkerPool pool;

    public DeliveryQueue(ObjectProvider<WebhookDeliveryService> deliveryService, AutomationProperties properties) {
        this.deliveryService = deliveryService;
        this.properties = properties;
    }

    public synchronized void start() {
        if (pool != null) {
            return;
        }
        AutomationProperties.Workers workers = properties.getWorkers();
        pool = new WorkerPool("webhook-delivery", workers.getDeliveryThreads(), workers.getDeliveryQueueCapacity());
    }

    public synchronized void stop() {
        if (pool == null) {
            return;
        }
        pool.shutdown(SHUTDOWN_GRACE);
        pool = null;
        inFlight.clear();
    }

    public boolean enqueue(UUID deliveryId) {
        return enqueueAfter(deliveryId, Duration.ZERO);
    }

    /** False when the queue is stopped or full, or the delivery is already queued. */
    public boolean enqueueAfter(UUID deliveryId, Duration delay) {
        WorkerPool current = pool;
        if (current == null) {
            log.warn("Delivery queue not started, refusing delivery {}", deliveryId);
            return false;
        }
        if (!inFlight.add(deliveryId)) {
            log.debug("Delivery {} is already queued", deliveryId);
            return false;
        }
        boolean accepted = current.submitAfter(delay, () -> attempt(deliveryId), () -> inFlight.remove(deliveryId));
        if (!accepted) {
            inFlight.remove(deliveryId);
        }
        return accepted;
    }

    boolean isQueued(UUID deliveryId) {
        return inFlight.contains(deliveryId);
    }

    private void attempt(UUID deliveryId) {
        Optional<Duration> retryIn = Optional.empty();
        try {
            retryIn = deliveryService.getObject().deliver(deliveryId);
        } catch (RuntimeException ex) {
            log.error("Delivery {} attempt failed unexpectedly: {}", deliveryId, ex.getMessage(), ex);
        } finally {
            inFlight.remove(deliveryId);
        }
        retryIn.ifPresent(delay -> enqueueAfter(deliveryId, delay));
    }
}
