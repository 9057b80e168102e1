package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.model.trigger.TriggerDecision;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;

public interface TriggerEvaluator {

    NodeType supportedType();

    // Decides whether the trigger fires for the event; events of other kinds never fire it
    TriggerDecision evaluate(WorkflowNode trigger, TriggerEvent event);
}
