package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.trigger.TriggerFiring;
import com.tableflow.tableflow_automation.model.trigger.TriggerRejection;

import java.util.List;

public record WebhookDispatchOutcome(Status status, TriggerRejection rejection, List<TriggerFiring> firings) {

    public enum Status {
        NOT_FOUND,
        REJECTED,
        ACCEPTED,
        ERROR
    }

    public static WebhookDispatchOutcome notFound() {
        return new WebhookDispatchOutcome(Status.NOT_FOUND, null, List.of());
    }

    public static WebhookDispatchOutcome rejected(TriggerRejection rejection) {
        return new WebhookDispatchOutcome(Status.REJECTED, rejection, List.of());
    }

    public static WebhookDispatchOutcome accepted(List<TriggerFiring> firings) {
        return new WebhookDispatchOutcome(Status.ACCEPTED, null, List.copyOf(firings));
    }

    public static WebhookDispatchOutcome error() {
        return new WebhookDispatchOutcome(Status.ERROR, null, List.of());
    }
}
