package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.context.ExecutionStatus;
import com.tableflow.tableflow_automation.model.domain.ExecutionLogEntry;
import com.tableflow.tableflow_automation.model.domain.ExecutionLogStatus;
import com.tableflow.tableflow_automation.repository.ExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Appends execution log entries. Entries are never updated after they are written.
 */
@Component
@RequiredArgsConstructor
public class ExecutionLogWriter {

    private final ExecutionLogRepository repository;
    private final Clock clock;

    public ExecutionLogEntry nodeEntry(ExecutionContext context, UUID nodeId, ExecutionLogStatus status,
                                       Map<String, Object> input, Map<String, Object> output,
                                       long durationMs, String errorMessage, int retryCount) {
        ExecutionLogEntry entry = newEntry(context, status);
        entry.setNodeId(nodeId);
        entry.setInputSnapshot(copy(input));
        entry.setOutputSnapshot(copy(output));
        entry.setDurationMs(durationMs);
        entry.setErrorMessage(errorMessage);
        entry.setRetryCount(retryCount);
        return repository.save(entry);
    }

    public ExecutionLogEntry workflowEntry(ExecutionContext context) {
        ExecutionLogStatus status = context.getStatus() == ExecutionStatus.COMPLETED
                ? ExecutionLogStatus.COMPLETED
                : ExecutionLogStatus.FAILED;
        ExecutionLogEntry entry = newEntry(context, status);
        entry.setInputSnapshot(copy(context.getPayload()));
        entry.setOutputSnapshot(context.toLogSnapshot());
        entry.setDurationMs(Duration.between(context.getStartedAt(), clock.instant()).toMillis());
        if (context.getStatus() == ExecutionStatus.FAILED && context.hasErrors()) {
            entry.setErrorMessage(context.getErrors().get(context.getErrors().size() - 1).message());
        }
        return repository.save(entry);
    }

    private ExecutionLogEntry newEntry(ExecutionContext context, ExecutionLogStatus status) {
        ExecutionLogEntry entry = new ExecutionLogEntry();
        entry.setExecutionId(context.getExecutionId());
        entry.setWorkflowId(context.getWorkflowId());
        entry.setStatus(status);
        entry.setCreatedAt(clock.instant());
        return entry;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source != null ? new LinkedHashMap<>(source) : null;
    }
}
