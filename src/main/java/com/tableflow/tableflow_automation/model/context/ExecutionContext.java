package com.tableflow.tableflow_automation.model.context;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable state of one run. Owned by the worker thread executing the run, never shared.
 */
@Getter
public class ExecutionContext {

    private final String executionId;
    private final UUID workflowId;
    private final UUID workspaceId;
    private final Instant startedAt;

    private final Map<String, Object> payload = new LinkedHashMap<>();

    // Keyed by node UUID, in execution order
    private final Map<String, Map<String, Object>> nodeOutputs = new LinkedHashMap<>();

    private final List<String> executionPath = new ArrayList<>();

    private final List<ExecutionError> errors = new ArrayList<>();

    private ExecutionStatus status = ExecutionStatus.RUNNING;

    private Instant completedAt;

    private ExecutionContext(String executionId, UUID workflowId, UUID workspaceId, Instant startedAt) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.workspaceId = workspaceId;
        this.startedAt = startedAt;
    }

    public static ExecutionContext create(UUID workflowId, UUID workspaceId,
                                          Map<String, Object> initialPayload, Instant now) {
        ExecutionContext context = new ExecutionContext(UUID.randomUUID().toString(), workflowId, workspaceId, now);
        if (initialPayload != null) {
            context.payload.putAll(initialPayload);
        }
        return context;
    }

    public void recordNodeOutput(String nodeId, Map<String, Object> output) {
        Map<String, Object> safe = output != null ? output : Map.of();
        nodeOutputs.put(nodeId, safe);
        executionPath.add(nodeId);
        payload.putAll(safe);
    }

    public void addError(String nodeId, Throwable error, Instant now) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        errors.add(new ExecutionError(nodeId, error.getClass().getSimpleName(), message, now));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void complete(Instant now) {
        finish(ExecutionStatus.COMPLETED, now);
    }

    public void fail(Instant now) {
        finish(ExecutionStatus.FAILED, now);
    }

    public boolean isTerminal() {
        return status != ExecutionStatus.RUNNING;
    }

    private void finish(ExecutionStatus terminal, Instant now) {
        if (isTerminal()) return;
        this.status = terminal;
        this.completedAt = now;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    /** Snapshot stored on the workflow-level log entry. */
    public Map<String, Object> toLogSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("execution_path", new ArrayList<>(executionPath));
        snapshot.put("node_outputs", new LinkedHashMap<>(nodeOutputs));
        List<Map<String, Object>> errorList = new ArrayList<>();
        for (ExecutionError e : errors) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("node_id", e.nodeId());
            entry.put("error_type", e.errorType());
            entry.put("message", e.message());
            entry.put("occurred_at", e.occurredAt().toString());
            errorList.add(entry);
        }
        snapshot.put("errors", errorList);
        return snapshot;
    }
}
