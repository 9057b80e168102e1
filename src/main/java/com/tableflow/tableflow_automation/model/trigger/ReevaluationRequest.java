package com.tableflow.tableflow_automation.model.trigger;

import java.util.Map;
import java.util.UUID;

/**
 * Raised when a trigger fires, so conditional triggers wrapping it can evaluate against its payload.
 */
public record ReevaluationRequest(String eventId, UUID baseTriggerNodeId, Map<String, Object> payload)
        implements TriggerEvent {}
