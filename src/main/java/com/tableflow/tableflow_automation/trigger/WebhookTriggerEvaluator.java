package com.tableflow.tableflow_automation.trigger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.InboundWebhookRequest;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.model.trigger.TriggerRejection;
import com.tableflow.tableflow_automation.model.trigger.WebhookTriggerConfig;
import com.tableflow.tableflow_automation.trigger.condition.PayloadPaths;
import com.tableflow.tableflow_automation.webhook.WebhookSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates inbound webhook requests (method, auth, required fields) and maps their body into the run payload.
 * A rejected request has no side effect.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookTriggerEvaluator implements TriggerEvaluator {

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final TriggerConfigBinder binder;
    private final WebhookSigner signer;
    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.WEBHOOK_TRIGGER;
    }

    @Override
    public TriggerDecision evaluate(WorkflowNode trigger, TriggerEvent event) {
        if (!(event instanceof InboundWebhookRequest request)) {
            return TriggerDecision.notFired();
        }
        WebhookTriggerConfig config = binder.bind(trigger, WebhookTriggerConfig.class);
        if (!normalizePath(config.getUrlPath()).equals(normalizePath(request.path()))) {
            return TriggerDecision.notFired();
        }

        if (!methodAllowed(config.getAllowedMethods(), request.method())) {
            return TriggerDecision.reject(TriggerRejection.METHOD_NOT_ALLOWED);
        }
        if (!authenticated(config, request)) {
            log.warn("Webhook trigger {} rejected request on /{}: authentication failed", trigger.getId(), normalizePath(request.path()));
            return TriggerDecision.reject(TriggerRejection.UNAUTHORIZED);
        }

        Map<String, Object> body;
        try {
            body = parseBody(request.rawBody());
        } catch (IOException ex) {
            return TriggerDecision.reject(TriggerRejection.INVALID_PAYLOAD);
        }
        if (!hasRequiredFields(config, body)) {
            return TriggerDecision.reject(TriggerRejection.INVALID_PAYLOAD);
        }
        return TriggerDecision.fire(mapPayload(config.getPayloadMapping(), body));
    }

    public static String normalizePath(String path) {
        if (path == null) return "";
        String p = path.trim();
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    private boolean methodAllowed(List<String> allowed, String method) {
        if (allowed == null || allowed.isEmpty()) return true;
        return method != null && allowed.stream().anyMatch(m -> m.equalsIgnoreCase(method));
    }

    private boolean authenticated(WebhookTriggerConfig config, InboundWebhookRequest request) {
        String authType = config.getAuthType() == null ? "none" : config.getAuthType();
        return switch (authType) {
            case "none" -> true;
            case "api_key" -> constantTimeEquals(config.getAuthToken(), request.header(config.getApiKeyHeader()));
            case "bearer_token" -> constantTimeEquals("Bearer " + config.getAuthToken(), request.header("Authorization"));
            case "signature" -> signer.verify(request.rawBody(), config.getSignatureSecret(),
                    request.header(config.getSignatureHeader()));
            default -> throw new AutomationConfigurationException("Unknown auth_type: " + authType);
        };
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> parseBody(byte[] rawBody) throws IOException {
        if (isBlank(rawBody)) return new LinkedHashMap<>();
        Map<String, Object> body = objectMapper.readValue(rawBody, BODY_TYPE);
        return body != null ? body : new LinkedHashMap<>();
    }

    private static boolean isBlank(byte[] raw) {
        for (byte b : raw) {
            if (!Character.isWhitespace(b)) return false;
        }
        return true;
    }

    private boolean hasRequiredFields(WebhookTriggerConfig config, Map<String, Object> body) {
        WebhookTriggerConfig.ValidationRules rules = config.getValidationRules();
        if (rules == null || rules.getRequiredFields() == null) return true;
        return rules.getRequiredFields().stream().allMatch(field -> PayloadPaths.has(body, field));
    }

    private Map<String, Object> mapPayload(Map<String, String> mapping, Map<String, Object> body) {
        if (mapping == null || mapping.isEmpty()) return body;
        Map<String, Object> mapped = new LinkedHashMap<>();
        mapping.forEach((target, sourcePath) -> mapped.put(target, PayloadPaths.get(body, sourcePath)));
        return mapped;
    }
}
