package com.tableflow.tableflow_automation.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.engine.NodeDispatchException;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.webhook.WebhookSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes WEBHOOK_ACTION nodes: one HTTP call to an external endpoint.
 *
 * Config: { "url": "https://...", "method": "POST", "headers": {...},
 *           "payload_template": "{\"id\": {{ row_id }}}",
 *           "authentication": { "type": "bearer", "token": "..." }, "secret": "..." }
 *
 * Non-2xx responses and transport errors raise {@link NodeDispatchException}; the runner retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookActionExecutor implements NodeExecutor {

    private static final int RESPONSE_BODY_LIMIT = 1000;

    private final TemplateRenderer renderer;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WebhookSigner signer;
    private final AutomationProperties properties;

    @Override
    public NodeType supportedType() {
        return NodeType.WEBHOOK_ACTION;
    }

    @Override
    @SuppressWarnings("unchecked")
    public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
        Map<String, Object> config = node.getConfig() != null ? node.getConfig() : Map.of();
        Map<String, Object> payload = context.getPayload();

        String url = renderer.renderConfig(node, "url", payload);
        if (url.isBlank()) {
            throw new ServiceMisconfiguredException("Webhook action " + node.getId() + " has no url configured");
        }
        HttpMethod method = parseMethod(String.valueOf(config.getOrDefault("method", "POST")), node);

        Map<String, Object> headerValues = new LinkedHashMap<>(
                renderer.renderMap((Map<String, Object>) config.getOrDefault("headers", Map.of()), payload));
        applyAuth((Map<String, Object>) config.get("authentication"), headerValues);

        Map<String, Object> body = parseBody(renderer.renderConfig(node, "payload_template", payload), node);
        byte[] bodyBytes = signer.canonicalJson(body);

        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        headerValues.forEach((k, v) -> httpHeaders.set(k, String.valueOf(v)));
        Object secret = config.get("secret");
        if (secret instanceof String s && !s.isBlank()) {
            httpHeaders.set("X-" + properties.getWebhooks().getProductName() + "-Signature", signer.sign(bodyBytes, s));
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, method, new HttpEntity<>(bodyBytes, httpHeaders), String.class);

            Map<String, Object> output = new LinkedHashMap<>();
            output.put("status", "success");
            output.put("status_code", response.getStatusCode().value());
            output.put("response_body", truncate(response.getBody()));
            return DispatchResult.of(output);

        } catch (HttpStatusCodeException ex) {
            throw new NodeDispatchException("Webhook " + method + " " + url + " returned "
                    + ex.getStatusCode().value() + ": " + truncate(ex.getResponseBodyAsString()), ex);
        } catch (ResourceAccessException ex) {
            throw new NodeDispatchException("Webhook " + method + " " + url + " failed: " + ex.getMessage(), ex);
        }
    }

    private void applyAuth(Map<String, Object> auth, Map<String, Object> headers) {
        if (auth == null || auth.get("type") == null) return;

        switch (String.valueOf(auth.get("type")).toLowerCase()) {
            case "bearer" -> headers.put("Authorization", "Bearer " + auth.getOrDefault("token", ""));
            case "api_key" -> {
                String keyName = String.valueOf(auth.getOrDefault("key_name", "Authorization"));
                headers.put(keyName, String.valueOf(auth.getOrDefault("key_value", "")));
            }
            case "basic" -> {
                String username = String.valueOf(auth.getOrDefault("username", ""));
                String password = String.valueOf(auth.getOrDefault("password", ""));
                String encoded = Base64.getEncoder()
                        .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
                headers.put("Authorization", "Basic " + encoded);
            }
            case "none" -> { }
            default -> throw new ServiceMisconfiguredException("Unsupported authentication type: " + auth.get("type"));
        }
    }

    private Map<String, Object> parseBody(String rendered, WorkflowNode node) {
        if (rendered == null || rendered.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(rendered, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException ex) {
            throw new ServiceMisconfiguredException("Webhook action " + node.getId()
                    + " payload template did not render to a JSON object: " + ex.getOriginalMessage(), ex);
        }
    }

    private static HttpMethod parseMethod(String method, WorkflowNode node) {
        return switch (method.trim().toUpperCase()) {
            case "GET" -> HttpMethod.GET;
            case "POST" -> HttpMethod.POST;
            case "PUT" -> HttpMethod.PUT;
            case "PATCH" -> HttpMethod.PATCH;
            case "DELETE" -> HttpMethod.DELETE;
            default -> throw new ServiceMisconfiguredException("Webhook action " + node.getId() + " has unsupported method " + method);
        };
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() > RESPONSE_BODY_LIMIT ? body.substring(0, RESPONSE_BODY_LIMIT) : body;
    }
}
