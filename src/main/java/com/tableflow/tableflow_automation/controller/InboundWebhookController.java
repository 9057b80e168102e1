package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.model.trigger.InboundWebhookRequest;
import com.tableflow.tableflow_automation.service.InboundWebhookService;
import com.tableflow.tableflow_automation.service.InboundWebhookService.InboundWebhookResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/automation/hooks")
@RequiredArgsConstructor
public class InboundWebhookController {

    static final String PATH_PREFIX = "/api/automation/hooks/";
    static final String EVENT_ID_HEADER = "X-Event-Id";

    private final InboundWebhookService inboundWebhookService;

    // ANY /api/automation/hooks/{path}: the trigger is resolved by its url_path
    @RequestMapping("/**")
    public ResponseEntity<Map<String, Object>> receive(HttpServletRequest request,
                                                       @RequestHeader HttpHeaders headers,
                                                       @RequestBody(required = false) byte[] body) {
        String uri = request.getRequestURI().substring(request.getContextPath().length());
        String path = uri.startsWith(PATH_PREFIX) ? uri.substring(PATH_PREFIX.length()) : "";

        Map<String, String> flatHeaders = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) flatHeaders.put(name, values.get(0));
        });

        InboundWebhookResult result = inboundWebhookService.receive(new InboundWebhookRequest(
                headers.getFirst(EVENT_ID_HEADER), path, request.getMethod(), flatHeaders, body));

        return switch (result.outcome().status()) {
            case ACCEPTED -> ResponseEntity.ok(Map.of("status", "accepted", "runs_queued", result.runsQueued()));
            case NOT_FOUND -> error(HttpStatus.NOT_FOUND, "No webhook trigger registered for path '" + path + "'");
            case ERROR -> error(HttpStatus.INTERNAL_SERVER_ERROR, "Webhook trigger evaluation failed");
            case REJECTED -> switch (result.outcome().rejection()) {
                case METHOD_NOT_ALLOWED -> error(HttpStatus.METHOD_NOT_ALLOWED, "Method " + request.getMethod() + " not allowed");
                case UNAUTHORIZED -> error(HttpStatus.UNAUTHORIZED, "Authentication failed");
                case INVALID_PAYLOAD -> error(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid payload");
            };
        };
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("status", "rejected", "error", message));
    }
}
