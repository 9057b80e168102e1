package com.tableflow.tableflow_automation.webhook;

public class WebhookTransportException extends RuntimeException {

    public WebhookTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
