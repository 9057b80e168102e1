package com.tableflow.tableflow_automation.webhook;

import java.time.Duration;
import java.util.Map;

/**
 * Outbound transport for webhook deliveries. Any HTTP status comes back as a response;
 * only transport failures (connect, read timeout, DNS) throw.
 */
public interface WebhookHttpClient {

    WebhookResponse post(String url, Map<String, String> headers, byte[] body, Duration timeout);

    record WebhookResponse(int statusCode, String body) {

        public boolean isSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
