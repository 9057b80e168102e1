package com.tableflow.tableflow_automation.webhook;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.model.domain.ActivityKind;
import com.tableflow.tableflow_automation.model.domain.DeliveryStatus;
import com.tableflow.tableflow_automation.model.domain.Webhook;
import com.tableflow.tableflow_automation.model.domain.WebhookActivityLog;
import com.tableflow.tableflow_automation.model.domain.WebhookDelivery;
import com.tableflow.tableflow_automation.model.domain.WebhookStatus;
import com.tableflow.tableflow_automation.repository.WebhookActivityLogRepository;
import com.tableflow.tableflow_automation.repository.WebhookDeliveryRepository;
import com.tableflow.tableflow_automation.repository.WebhookRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates and attempts outbound webhook deliveries.
 *
 * <p>Each attempt posts the canonical JSON body, signed when the webhook has a secret.
 * A failed attempt is retried after {@code retryDelaySeconds * 2^(attempts-1)} until
 * {@code maxAttempts} is reached, then the delivery is abandoned. Webhook statistics only
 * move through the repository's atomic increments.
 */
@Slf4j
@Service
public class WebhookDeliveryService {

    static final List<DeliveryStatus> SWEPT_STATUSES = List.of(DeliveryStatus.PENDING, DeliveryStatus.FAILED);

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookActivityLogRepository activityRepository;
    private final WebhookHttpClient httpClient;
    private final WebhookSigner signer;
    private final DeliveryQueue deliveryQueue;
    private final AutomationProperties properties;
    private final Clock clock;

    public WebhookDeliveryService(WebhookRepository webhookRepository,
                                  WebhookDeliveryRepository deliveryRepository,
                                  WebhookActivityLogRepository activityRepository,
                                  WebhookHttpClient httpClient,
                                  WebhookSigner signer,
                                  DeliveryQueue deliveryQueue,
                                  AutomationProperties properties,
                                  Clock clock) {
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.activityRepository = activityRepository;
        this.httpClient = httpClient;
        this.signer = signer;
        this.deliveryQueue = deliveryQueue;
        this.properties = properties;
        this.clock = clock;
    }

    /** Empty when the webhook is not active or does not subscribe to the event kind. */
    public Optional<WebhookDelivery> trigger(Webhook webhook, String eventKind, Map<String, Object> payload) {
        if (!webhook.isActive() || !webhook.accepts(eventKind)) {
            log.debug("Webhook {} skipped for event {}", webhook.getId(), eventKind);
            return Optional.empty();
        }

        WebhookDelivery delivery = new WebhookDelivery();
        delivery.setWebhookId(webhook.getId());
        delivery.setEventKind(eventKind);
        delivery.setPayload(payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>());
        delivery.setStatus(DeliveryStatus.PENDING);
        delivery.setAttempts(0);
        delivery.setMaxAttempts(Math.max(1, webhook.getMaxAttempts()));
        delivery.setCreatedAt(clock.instant());
        // Due at once, so the sweep picks it up if the queue refuses it
        delivery.setNextRetryAt(delivery.getCreatedAt());
        delivery = deliveryRepository.save(delivery);

        if (!deliveryQueue.enqueue(delivery.getId())) {
            log.warn("Delivery {} not queued, waiting for the retry sweep", delivery.getId());
        }
        return Optional.of(delivery);
    }

    public int triggerForWorkspace(UUID workspaceId, String eventKind, Map<String, Object> payload) {
        int created = 0;
        for (Webhook webhook : webhookRepository.findByWorkspaceIdAndStatus(workspaceId, WebhookStatus.ACTIVE)) {
            if (trigger(webhook, eventKind, payload).isPresent()) {
                created++;
            }
        }
        return created;
    }

    /**
     * Performs one attempt. Returns the delay before the next attempt when one is due.
     */
    public Optional<Duration> deliver(UUID deliveryId) {
        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElse(null);
        if (delivery == null) {
            log.warn("Delivery {} not found, nothing to send", deliveryId);
            return Optional.empty();
        }
        if (delivery.getStatus().isTerminal() || !delivery.hasAttemptsLeft()) {
            log.debug("Delivery {} is {} after {} attempt(s), not sending", deliveryId, delivery.getStatus(), delivery.getAttempts());
            return Optional.empty();
        }

        Webhook webhook = webhookRepository.findById(delivery.getWebhookId()).orElse(null);
        if (webhook == null) {
            delivery.setStatus(DeliveryStatus.ABANDONED);
            delivery.setErrorMessage("Webhook no longer exists");
            deliveryRepository.save(delivery);
            log.error("Delivery {} abandoned: webhook {} no longer exists", deliveryId, delivery.getWebhookId());
            return Optional.empty();
        }

        delivery.setAttempts(delivery.getAttempts() + 1);
        Instant attemptAt = clock.instant();
        webhookRepository.recordAttempt(webhook.getId(), attemptAt);

        long started = clock.millis();
        WebhookHttpClient.WebhookResponse response;
        try {
            byte[] body = signer.canonicalJson(delivery.getPayload());
            Map<String, String> headers = buildHeaders(webhook, delivery, body);
            response = httpClient.post(webhook.getUrl(), headers, body, Duration.ofSeconds(webhook.getTimeoutSeconds()));
        } catch (WebhookTransportException ex) {
            return fail(webhook, delivery, ex.getMessage(), clock.millis() - started);
        } catch (RuntimeException ex) {
            log.error("Delivery {} to webhook {} could not be sent", deliveryId, webhook.getId(), ex);
            return fail(webhook, delivery, ex.getClass().getSimpleName() + ": " + ex.getMessage(), clock.millis() - started);
        }

        long latency = clock.millis() - started;
        delivery.setResponseStatusCode(response.statusCode());
        delivery.setResponseBody(truncate(response.body()));
        delivery.setDeliveredAt(clock.instant());
        if (response.isSuccessful()) {
            succeed(webhook, delivery, response.statusCode(), latency);
            return Optional.empty();
        }
        String error = "HTTP " + response.statusCode() + ": " + truncate(response.body());
        return fail(webhook, delivery, error, latency);
    }

    /** Requeues pending and failed deliveries whose attempt time has passed. */
    @Scheduled(fixedDelayString = "${tableflow.automation.scheduler.delivery-sweep-interval:PT60S}")
    public int retryDueDeliveries() {
        List<WebhookDelivery> due = deliveryRepository.findDueForRetry(SWEPT_STATUSES, clock.instant());
        int queued = 0;
        for (WebhookDelivery delivery : due) {
            if (deliveryQueue.enqueue(delivery.getId())) {
                queued++;
            }
        }
        if (queued > 0) {
            log.info("Requeued {} webhook deliveries due for retry", queued);
        }
        return queued;
    }

    Map<String, String> buildHeaders(Webhook webhook, WebhookDelivery delivery, byte[] body) {
        String product = properties.getWebhooks().getProductName();
        Map<String, String> reserved = new LinkedHashMap<>();
        reserved.put("Content-Type", "application/json");
        reserved.put("User-Agent", product + "-Webhooks/1.0");
        reserved.put("X-" + product + "-Event", delivery.getEventKind());
        reserved.put("X-" + product + "-Delivery", delivery.getId().toString());
        reserved.put("X-" + product + "-Webhook", webhook.getId().toString());
        if (webhook.getSecret() != null && !webhook.getSecret().isEmpty()) {
            reserved.put("X-" + product + "-Signature", signer.sign(body, webhook.getSecret()));
        }

        // Custom headers never replace the ones above, whatever their case
        Map<String, String> headers = new LinkedHashMap<>();
        if (webhook.getHeaders() != null) {
            webhook.getHeaders().forEach((name, value) -> {
                if (reserved.keySet().stream().noneMatch(name::equalsIgnoreCase)) {
                    headers.put(name, value);
                }
            });
        }
        headers.putAll(reserved);
        return headers;
    }

    static Duration backoff(Webhook webhook, int attempts) {
        long factor = 1L << Math.min(Math.max(attempts - 1, 0), 20);
        return Duration.ofSeconds(webhook.getRetryDelaySeconds() * factor);
    }

    private void succeed(Webhook webhook, WebhookDelivery delivery, int statusCode, long latency) {
        delivery.setStatus(DeliveryStatus.SUCCESS);
        delivery.setNextRetryAt(null);
        delivery.setErrorMessage(null);
        deliveryRepository.save(delivery);
        webhookRepository.recordSuccess(webhook.getId(), clock.instant());
        activity(webhook, delivery, ActivityKind.DELIVERY_SUCCESS,
                "Webhook delivered successfully (HTTP " + statusCode + ")", null, latency);
        log.info("Delivery {} to webhook {} succeeded on attempt {}", delivery.getId(), webhook.getId(), delivery.getAttempts());
    }

    private Optional<Duration> fail(Webhook webhook, WebhookDelivery delivery, String error, long latency) {
        delivery.setErrorMessage(error);

        if (!delivery.hasAttemptsLeft()) {
            delivery.setStatus(DeliveryStatus.ABANDONED);
            delivery.setNextRetryAt(null);
            deliveryRepository.save(delivery);
            webhookRepository.recordFailure(webhook.getId(), clock.instant());
            activity(webhook, delivery, ActivityKind.DELIVERY_ABANDONED,
                    "Webhook delivery abandoned after " + delivery.getAttempts() + " attempts", error, latency);
            log.error("Delivery {} to webhook {} abandoned after {} attempts: {}",
                    delivery.getId(), webhook.getId(), delivery.getAttempts(), error);
            return Optional.empty();
        }

        Duration delay = backoff(webhook, delivery.getAttempts());
        delivery.setStatus(DeliveryStatus.FAILED);
        delivery.setNextRetryAt(clock.instant().plus(delay));
        deliveryRepository.save(delivery);
        activity(webhook, delivery, ActivityKind.DELIVERY_FAILED,
                "Webhook delivery failed (attempt " + delivery.getAttempts() + "), retrying in " + delay.toSeconds() + "s",
                error, latency);
        log.warn("Delivery {} to webhook {} failed on attempt {}/{}: {}",
                delivery.getId(), webhook.getId(), delivery.getAttempts(), delivery.getMaxAttempts(), error);
        return Optional.of(delay);
    }

    private void activity(Webhook webhook, WebhookDelivery delivery, ActivityKind kind,
                          String message, String error, long latency) {
        WebhookActivityLog entry = new WebhookActivityLog();
        entry.setWebhookId(webhook.getId());
        entry.setDeliveryId(delivery.getId());
        entry.setKind(kind);
        entry.setMessage(message);
        entry.setErrorText(error);
        entry.setLatencyMs(latency);
        entry.setCreatedAt(clock.instant());
        activityRepository.save(entry);
    }

    private String truncate(String body) {
        if (body == null) return null;
        int limit = properties.getWebhooks().getResponseBodyLimit();
        return body.length() > limit ? body.substring(0, limit) : body;
    }
}
