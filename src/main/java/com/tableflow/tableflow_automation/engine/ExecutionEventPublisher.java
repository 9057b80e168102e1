package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.model.context.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class ExecutionEventPublisher {

    // Clients subscribe to /topic/automation/executions/{executionId}
    static final String TOPIC = "/topic/automation/executions/";

    private final SimpMessagingTemplate messagingTemplate;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void nodeStarted(String executionId, UUID nodeId) {
        publish(executionId, event("NODE_STARTED", nodeId, null));
    }

    public void nodeRetrying(String executionId, UUID nodeId, int attempt, String error) {
        Map<String, Object> payload = event("NODE_RETRYING", nodeId, error);
        payload.put("attempt", attempt);
        publish(executionId, payload);
    }

    public void nodeCompleted(String executionId, UUID nodeId) {
        publish(executionId, event("NODE_COMPLETED", nodeId, null));
    }

    public void nodeFailed(String executionId, UUID nodeId, String error) {
        publish(executionId, event("NODE_FAILED", nodeId, error));
    }

    public void executionFinished(String executionId, ExecutionStatus status) {
        Map<String, Object> payload = event("EXECUTION_FINISHED", null, null);
        payload.put("status", status.name());
        publish(executionId, payload);
    }

    private Map<String, Object> event(String type, UUID nodeId, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("nodeId", nodeId != null ? nodeId.toString() : "");
        payload.put("error", error != null ? error : "");
        return payload;
    }

    // Live events are best effort; the execution log is the record
    private void publish(String executionId, Map<String, Object> payload) {
        try {
            messagingTemplate.convertAndSend(TOPIC + executionId, payload);
        } catch (MessagingException ex) {
            log.warn("Could not publish {} for execution {}: {}", payload.get("type"), executionId, ex.getMessage());
        }
    }
}
