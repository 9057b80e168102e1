package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;

public interface NodeExecutor {

    NodeType supportedType();

    // Dispatches the node against the run's current payload; throws to signal failure
    DispatchResult execute(WorkflowNode node, ExecutionContext context);
}
