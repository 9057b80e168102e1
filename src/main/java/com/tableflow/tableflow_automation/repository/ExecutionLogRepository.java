package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.ExecutionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ExecutionLogRepository extends JpaRepository<ExecutionLogEntry, UUID> {

    List<ExecutionLogEntry> findByExecutionIdOrderByCreatedAtAsc(String executionId);

    // Workflow-level entries only, newest first
    List<ExecutionLogEntry> findByWorkflowIdAndNodeIdIsNullOrderByCreatedAtDesc(UUID workflowId);

    @Transactional
    @Modifying
    @Query("delete from ExecutionLogEntry e where e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
