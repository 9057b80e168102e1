package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.engine.AutomationEngine;
import com.tableflow.tableflow_automation.engine.NodeDispatchException;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.trigger.DateTriggerEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes DELAY nodes.
 *
 * Config: { "delay_type": "fixed", "delay_seconds": 3600 }
 *     or  { "delay_type": "until_date", "delay_until_template": "{{ due_date }}" }
 *
 * A positive delay schedules the node's successors as a continuation run and ends this
 * branch of the current run. "until_condition" is accepted but does not wait.
 */
@Slf4j
@Component
public class DelayExecutor implements NodeExecutor {

    private final TemplateRenderer renderer;
    private final ObjectProvider<AutomationEngine> engine;
    private final Clock clock;

    public DelayExecutor(TemplateRenderer renderer, ObjectProvider<AutomationEngine> engine, Clock clock) {
        this.renderer = renderer;
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.DELAY;
    }

    @Override
    public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
        Map<String, Object> config = node.getConfig() != null ? node.getConfig() : Map.of();
        Duration delay = calculateDelay(node, config, context.getPayload());

        Map<String, Object> output = new LinkedHashMap<>();
        if (delay.isZero()) {
            output.put("status", "immediate");
            output.put("delay_seconds", 0L);
            return DispatchResult.of(output);
        }

        boolean scheduled = engine.getObject().scheduleContinuation(
                context.getWorkflowId(), node.getId(), new LinkedHashMap<>(context.getPayload()), delay);
        if (!scheduled) {
            throw new NodeDispatchException("Continuation after delay node " + node.getId() + " could not be scheduled");
        }
        output.put("status", "scheduled");
        output.put("delay_seconds", delay.toSeconds());
        output.put("scheduled_at", clock.instant().plus(delay).toString());
        return DispatchResult.deferred(output);
    }

    Duration calculateDelay(WorkflowNode node, Map<String, Object> config, Map<String, Object> payload) {
        String type = String.valueOf(config.getOrDefault("delay_type", "fixed"));
        switch (type) {
            case "fixed" -> {
                Object seconds = config.get("delay_seconds");
                if (seconds == null) return Duration.ZERO;
                try {
                    long value = seconds instanceof Number n ? n.longValue() : Long.parseLong(seconds.toString().trim());
                    return value > 0 ? Duration.ofSeconds(value) : Duration.ZERO;
                } catch (NumberFormatException ex) {
                    throw new ServiceMisconfiguredException("Delay node " + node.getId() + " has a non-numeric delay_seconds: " + seconds);
                }
            }
            case "until_date" -> {
                String rendered = renderer.renderConfig(node, "delay_until_template", payload);
                Instant target = toInstant(DateTriggerEvaluator.toTemporal(rendered, clock.getZone()));
                if (target == null) {
                    log.warn("Delay node {} has an invalid target date '{}', continuing immediately", node.getId(), rendered);
                    return Duration.ZERO;
                }
                Duration remaining = Duration.between(clock.instant(), target);
                return remaining.isNegative() ? Duration.ZERO : Duration.ofSeconds(remaining.toSeconds());
            }
            case "until_condition" -> {
                return Duration.ZERO;
            }
            default -> throw new ServiceMisconfiguredException("Delay node " + node.getId() + " has unknown delay_type " + type);
        }
    }

    private Instant toInstant(Temporal value) {
        if (value instanceof LocalDate date) return date.atStartOfDay(clock.getZone()).toInstant();
        if (value instanceof LocalDateTime dateTime) return dateTime.atZone(clock.getZone()).toInstant();
        return null;
    }
}
