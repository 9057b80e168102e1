package com.tableflow.tableflow_automation.model.trigger;

import java.util.Map;

public record InboundWebhookRequest(String eventId,
                                    String path,
                                    String method,
                                    Map<String, String> headers,
                                    byte[] rawBody) implements TriggerEvent {

    /** The body is kept as received; signatures are checked over these exact bytes. */
    public InboundWebhookRequest {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        rawBody = rawBody != null ? rawBody : new byte[0];
    }

    /** Case-insensitive header lookup. */
    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }
}
