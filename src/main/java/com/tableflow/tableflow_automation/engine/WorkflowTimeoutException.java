package com.tableflow.tableflow_automation.engine;

import java.time.Duration;

public class WorkflowTimeoutException extends CriticalExecutionException {

    public WorkflowTimeoutException(String executionId, Duration limit) {
        super("Execution " + executionId + " exceeded maximum execution time of " + limit.toSeconds() + "s");
    }
}
