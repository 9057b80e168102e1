package com.tableflow.tableflow_automation.service;

import com.tableflow.tableflow_automation.engine.AutomationEngine;
import com.tableflow.tableflow_automation.model.trigger.InboundWebhookRequest;
import com.tableflow.tableflow_automation.trigger.TriggerDispatcher;
import com.tableflow.tableflow_automation.trigger.WebhookDispatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Evaluates an inbound webhook request synchronously, so the caller gets the trigger's
 * verdict, and hands the resulting runs to the engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundWebhookService {

    private final TriggerDispatcher dispatcher;
    private final AutomationEngine engine;

    public InboundWebhookResult receive(InboundWebhookRequest request) {
        WebhookDispatchOutcome outcome = dispatcher.dispatchWebhook(request);
        if (outcome.status() != WebhookDispatchOutcome.Status.ACCEPTED) {
            log.info("Inbound webhook {} {} not accepted: {} {}", request.method(), request.path(),
                    outcome.status(), outcome.rejection() != null ? outcome.rejection() : "");
            return new InboundWebhookResult(outcome, 0);
        }
        int queued = engine.startRuns(outcome.firings());
        if (queued < outcome.firings().size()) {
            log.warn("Inbound webhook {} fired {} trigger(s) but only {} run(s) were queued",
                    request.path(), outcome.firings().size(), queued);
        }
        return new InboundWebhookResult(outcome, queued);
    }

    public record InboundWebhookResult(WebhookDispatchOutcome outcome, int runsQueued) {
    }
}
