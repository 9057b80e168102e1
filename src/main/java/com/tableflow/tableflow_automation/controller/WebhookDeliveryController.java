package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.model.domain.WebhookActivityLog;
import com.tableflow.tableflow_automation.model.domain.WebhookDelivery;
import com.tableflow.tableflow_automation.repository.WebhookActivityLogRepository;
import com.tableflow.tableflow_automation.repository.WebhookDeliveryRepository;
import com.tableflow.tableflow_automation.repository.WebhookRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/automation/webhooks/{webhookId}")
@RequiredArgsConstructor
public class WebhookDeliveryController {

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookActivityLogRepository activityRepository;

    @GetMapping("/deliveries")
    public List<WebhookDelivery> deliveries(@PathVariable UUID webhookId) {
        requireWebhook(webhookId);
        return deliveryRepository.findByWebhookIdOrderByCreatedAtDesc(webhookId);
    }

    @GetMapping("/activity")
    public List<WebhookActivityLog> activity(@PathVariable UUID webhookId) {
        requireWebhook(webhookId);
        return activityRepository.findByWebhookIdOrderByCreatedAtDesc(webhookId);
    }

    private void requireWebhook(UUID webhookId) {
        if (!webhookRepository.existsById(webhookId)) {
            throw new IllegalArgumentException("Webhook not found: " + webhookId);
        }
    }
}
