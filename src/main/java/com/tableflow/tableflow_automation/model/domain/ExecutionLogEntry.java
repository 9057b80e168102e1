package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of one workflow run (nodeId == null) or one node attempt within it.
 */
@Entity
@Table(name = "automation_execution_logs", indexes = {
        @Index(name = "idx_execution_logs_execution", columnList = "execution_id"),
        @Index(name = "idx_execution_logs_workflow", columnList = "workflow_id, created_at")
})
@Data
public class ExecutionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private String executionId;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "node_id")
    private UUID nodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionLogStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_snapshot")
    private Map<String, Object> inputSnapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_snapshot")
    private Map<String, Object> outputSnapshot;

    @Column(name = "duration_ms")
    private long durationMs;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isWorkflowLevel() {
        return nodeId == null;
    }
}
