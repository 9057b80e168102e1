package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.webhook.WebhookDeliveryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Fans the run payload out to every active webhook of the workspace subscribed to event_kind. */
@Component
@RequiredArgsConstructor
public class NotifyWebhooksExecutor implements NodeExecutor {

    private final WebhookDeliveryService deliveryService;

    @Override
    public NodeType supportedType() {
        return NodeType.NOTIFY_WEBHOOKS;
    }

    @Override
    public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
        Object eventKind = node.getConfig() != null ? node.getConfig().get("event_kind") : null;
        if (eventKind == null || eventKind.toString().isBlank()) {
            throw new ServiceMisconfiguredException("Notify node " + node.getId() + " has no event_kind configured");
        }

        int queued = deliveryService.triggerForWorkspace(
                context.getWorkspaceId(), eventKind.toString(), new LinkedHashMap<>(context.getPayload()));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("event_kind", eventKind.toString());
        output.put("deliveries_queued", queued);
        return DispatchResult.of(output);
    }
}
