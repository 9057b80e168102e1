package com.tableflow.tableflow_automation.model.trigger;

import java.util.Map;
import java.util.UUID;

/** A trigger that fired and the payload its workflow run starts with. */
public record TriggerFiring(UUID workflowId, UUID triggerNodeId, Map<String, Object> payload) {}
