package com.tableflow.tableflow_automation.model.context;

import com.tableflow.tableflow_automation.model.domain.WorkflowNode;

import java.util.Map;

/**
 * What a node executor hands back to the runner.
 *
 * @param output    merged into the run payload and stored as the node's output
 * @param outputTag selects the successor set ("true"/"false" for branches)
 * @param deferred  successors run later in a continuation, not in this run
 */
public record DispatchResult(Map<String, Object> output, String outputTag, boolean deferred) {

    public static DispatchResult of(Map<String, Object> output) {
        return new DispatchResult(output, WorkflowNode.DEFAULT_OUTPUT, false);
    }

    public static DispatchResult tagged(Map<String, Object> output, String outputTag) {
        return new DispatchResult(output, outputTag, false);
    }

    public static DispatchResult deferred(Map<String, Object> output) {
        return new DispatchResult(output, WorkflowNode.DEFAULT_OUTPUT, true);
    }
}
