package com.tableflow.tableflow_automation.model.trigger;

import java.util.Map;

public record TriggerDecision(boolean fired, Map<String, Object> payload, TriggerRejection rejection) {

    private static final TriggerDecision NOT_FIRED = new TriggerDecision(false, Map.of(), null);

    public static TriggerDecision fire(Map<String, Object> payload) {
        return new TriggerDecision(true, payload, null);
    }

    public static TriggerDecision notFired() {
        return NOT_FIRED;
    }

    public static TriggerDecision reject(TriggerRejection rejection) {
        return new TriggerDecision(false, Map.of(), rejection);
    }

    public boolean rejected() {
        return rejection != null;
    }
}
