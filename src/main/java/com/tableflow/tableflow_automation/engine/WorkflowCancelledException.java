package com.tableflow.tableflow_automation.engine;

/** The worker running the execution was interrupted, e.g. during shutdown. */
public class WorkflowCancelledException extends CriticalExecutionException {

    public WorkflowCancelledException(String executionId, InterruptedException cause) {
        super("Execution " + executionId + " was cancelled", cause);
    }
}
