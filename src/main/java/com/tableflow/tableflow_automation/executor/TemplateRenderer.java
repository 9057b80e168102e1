package com.tableflow.tableflow_automation.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.trigger.condition.PayloadPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{ path }}} references against the run payload.
 * Missing paths render as the empty string; maps and lists render as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateRenderer {

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");

    private final ObjectMapper objectMapper;

    public String render(String template, Map<String, Object> payload) {
        if (template == null || !template.contains("{{")) return template == null ? "" : template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            Object value = PayloadPaths.get(payload, path);
            if (value == null) {
                log.debug("Reference {{{}}} resolved to nothing", path);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(stringify(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Renders the template stored under {@code key} in the node config. Numbers and booleans are
     * used as their text; a map or list there is a misconfigured node.
     */
    public String renderConfig(WorkflowNode node, String key, Map<String, Object> payload) {
        Object raw = node.getConfig() != null ? node.getConfig().get(key) : null;
        if (raw == null || raw instanceof String) {
            return render((String) raw, payload);
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return render(String.valueOf(raw), payload);
        }
        throw new ServiceMisconfiguredException("Node " + node.getId() + ": " + key + " must be a text template, got "
                + raw.getClass().getSimpleName());
    }

    /** Renders every string value of the map; other values pass through. */
    public Map<String, Object> renderMap(Map<String, ?> values, Map<String, Object> payload) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        if (values == null) return rendered;
        values.forEach((key, value) -> rendered.put(key, value instanceof String s ? render(s, payload) : value));
        return rendered;
    }

    private String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
