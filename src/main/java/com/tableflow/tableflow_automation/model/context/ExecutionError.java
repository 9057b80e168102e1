package com.tableflow.tableflow_automation.model.context;

import java.time.Instant;

/**
 * One error recorded during a run. nodeId is null for run-level errors (timeout, cancellation).
 */
public record ExecutionError(String nodeId, String errorType, String message, Instant occurredAt) {}
