package com.tableflow.tableflow_automation.webhook;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RestTemplateWebhookHttpClient implements WebhookHttpClient {

    private final RestTemplateBuilder builder;
    private final Duration defaultTimeout;

    // Webhooks configure their own timeout; one template per distinct value
    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    public RestTemplateWebhookHttpClient(RestTemplateBuilder builder, AutomationProperties properties) {
        this.builder = builder;
        this.defaultTimeout = properties.getWebhooks().getDefaultTimeout();
        templateFor(defaultTimeout);
    }

    @Override
    public WebhookResponse post(String url, Map<String, String> headers, byte[] body, Duration timeout) {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::set);
        try {
            ResponseEntity<String> response = templateFor(timeout)
                    .exchange(url, HttpMethod.POST, new HttpEntity<>(body, httpHeaders), String.class);
            return new WebhookResponse(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException ex) {
            return new WebhookResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (ResourceAccessException ex) {
            throw new WebhookTransportException("POST " + url + " failed: " + ex.getMessage(), ex);
        }
    }

    RestTemplate templateFor(Duration timeout) {
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative() ? defaultTimeout : timeout;
        return templates.computeIfAbsent(effective, t -> builder
                .setConnectTimeout(t)
                .setReadTimeout(t)
                .build());
    }
}
