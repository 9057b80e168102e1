package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.ClockTick;
import com.tableflow.tableflow_automation.model.trigger.InboundWebhookRequest;
import com.tableflow.tableflow_automation.model.trigger.ReevaluationRequest;
import com.tableflow.tableflow_automation.model.trigger.RowChangeEvent;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.model.trigger.TriggerFiring;
import com.tableflow.tableflow_automation.model.trigger.TriggerRejection;
import com.tableflow.tableflow_automation.model.trigger.WebhookTriggerConfig;
import com.tableflow.tableflow_automation.repository.WorkflowNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Routes an event to every active trigger of the matching kind and collects the firings.
 *
 * <p>Each trigger is evaluated in isolation: an evaluator error is logged and counts as
 * "did not fire". A firing cascades to the conditional triggers wrapping the fired node.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerDispatcher {

    // Conditional triggers wrapping conditional triggers; deeper chains are construction errors
    static final int MAX_CASCADE_DEPTH = 8;

    private final WorkflowNodeRepository nodeRepository;
    private final TriggerEvaluatorRegistry evaluators;
    private final TriggerEventDeduplicator deduplicator;
    private final TriggerConfigBinder binder;
    private final Clock clock;

    public List<TriggerFiring> dispatch(TriggerEvent event) {
        List<TriggerFiring> firings = new ArrayList<>();
        dispatch(event, firings, 0);
        return firings;
    }

    /** Resolves the trigger registered under the request path and evaluates it synchronously. */
    public WebhookDispatchOutcome dispatchWebhook(InboundWebhookRequest request) {
        String path = WebhookTriggerEvaluator.normalizePath(request.path());
        List<WorkflowNode> candidates = nodeRepository.findActiveTriggers(NodeType.WEBHOOK_TRIGGER, clock.instant())
                .stream()
                .filter(node -> registeredUnder(node, path))
                .toList();
        if (candidates.isEmpty()) {
            return WebhookDispatchOutcome.notFound();
        }

        List<TriggerFiring> firings = new ArrayList<>();
        TriggerRejection rejection = null;
        boolean failed = false;
        for (WorkflowNode node : candidates) {
            TriggerDecision decision;
            try {
                decision = evaluators.get(NodeType.WEBHOOK_TRIGGER).evaluate(node, request);
            } catch (Exception ex) {
                log.error("Webhook trigger {} failed to evaluate: {}", node.getId(), ex.getMessage(), ex);
                failed = true;
                continue;
            }
            if (decision.fired()) {
                recordFiring(node, request, decision.payload(), firings, 0);
            } else if (decision.rejected() && rejection == null) {
                rejection = decision.rejection();
            }
        }

        if (!firings.isEmpty()) return WebhookDispatchOutcome.accepted(firings);
        if (rejection != null) return WebhookDispatchOutcome.rejected(rejection);
        if (failed) return WebhookDispatchOutcome.error();
        // Every candidate saw the event as a duplicate
        return WebhookDispatchOutcome.accepted(List.of());
    }

    private void dispatch(TriggerEvent event, List<TriggerFiring> firings, int depth) {
        NodeType type = triggerTypeFor(event);
        for (WorkflowNode node : nodeRepository.findActiveTriggers(type, clock.instant())) {
            TriggerDecision decision = evaluateSafely(node, event);
            if (decision.fired()) {
                recordFiring(node, event, decision.payload(), firings, depth);
            }
        }
    }

    private TriggerDecision evaluateSafely(WorkflowNode node, TriggerEvent event) {
        try {
            return evaluators.get(node.getNodeType()).evaluate(node, event);
        } catch (Exception ex) {
            log.error("Trigger {} ({}) failed to evaluate event {}: {}",
                    node.getId(), node.getNodeType(), event.eventId(), ex.getMessage(), ex);
            return TriggerDecision.notFired();
        }
    }

    private void recordFiring(WorkflowNode node, TriggerEvent event, Map<String, Object> payload,
                              List<TriggerFiring> firings, int depth) {
        if (!deduplicator.firstOccurrence(node.getId(), event.eventId())) {
            log.info("Trigger {} already fired for event {}, skipping duplicate", node.getId(), event.eventId());
            return;
        }
        firings.add(new TriggerFiring(node.getWorkflowId(), node.getId(), payload));

        if (depth >= MAX_CASCADE_DEPTH) {
            log.warn("Conditional trigger cascade from {} stopped at depth {}", node.getId(), depth);
            return;
        }
        String cascadeId = event.eventId() == null ? null : event.eventId() + "/" + node.getId();
        dispatch(new ReevaluationRequest(cascadeId, node.getId(), payload), firings, depth + 1);
    }

    private boolean registeredUnder(WorkflowNode node, String path) {
        try {
            WebhookTriggerConfig config = binder.bind(node, WebhookTriggerConfig.class);
            return WebhookTriggerEvaluator.normalizePath(config.getUrlPath()).equals(path);
        } catch (RuntimeException ex) {
            log.error("Webhook trigger {} has an unreadable config: {}", node.getId(), ex.getMessage());
            return false;
        }
    }

    private static NodeType triggerTypeFor(TriggerEvent event) {
        if (event instanceof ClockTick) return NodeType.DATE_TRIGGER;
        if (event instanceof RowChangeEvent) return NodeType.LINKED_RECORD_TRIGGER;
        if (event instanceof InboundWebhookRequest) return NodeType.WEBHOOK_TRIGGER;
        if (event instanceof ReevaluationRequest) return NodeType.CONDITIONAL_TRIGGER;
        throw new IllegalArgumentException("Unsupported trigger event: " + event.getClass().getSimpleName());
    }
}
