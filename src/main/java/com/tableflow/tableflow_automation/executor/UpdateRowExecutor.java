package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.service.RowDataGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes UPDATE_ROW nodes.
 *
 * Config: { "table_id": "orders", "row_id": "{{ rows.0.id }}", "values": { "status": "Done" } }
 */
@Component
@RequiredArgsConstructor
public class UpdateRowExecutor implements NodeExecutor {

    private final RowDataGateway rowDataGateway;
    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.UPDATE_ROW;
    }

    @Override
    @SuppressWarnings("unchecked")
    public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
        Map<String, Object> config = node.getConfig() != null ? node.getConfig() : Map.of();
        String tableId = renderer.renderConfig(node, "table_id", context.getPayload());
        String rowId = renderer.renderConfig(node, "row_id", context.getPayload());
        if (tableId.isBlank() || rowId.isBlank()) {
            throw new ServiceMisconfiguredException("Update row node " + node.getId() + " needs table_id and row_id");
        }

        Map<String, Object> values = renderer.renderMap(
                (Map<String, Object>) config.getOrDefault("values", Map.of()), context.getPayload());
        Map<String, Object> updated = rowDataGateway.updateRow(tableId, rowId, values)
                .orElseThrow(() -> new ServiceMisconfiguredException(
                        "Row " + rowId + " of table " + tableId + " does not exist"));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("updated_row", updated);
        return DispatchResult.of(output);
    }
}
