package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.model.domain.ExecutionLogEntry;
import com.tableflow.tableflow_automation.repository.ExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/automation")
@RequiredArgsConstructor
public class ExecutionLogController {

    private final ExecutionLogRepository executionLogRepository;

    // GET /api/automation/executions/{executionId}: workflow entry and every node attempt, oldest first
    @GetMapping("/executions/{executionId}")
    public ResponseEntity<List<ExecutionLogEntry>> execution(@PathVariable String executionId) {
        List<ExecutionLogEntry> entries = executionLogRepository.findByExecutionIdOrderByCreatedAtAsc(executionId);
        if (entries.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(entries);
    }

    // GET /api/automation/workflows/{workflowId}/executions: one entry per run, newest first
    @GetMapping("/workflows/{workflowId}/executions")
    public List<ExecutionLogEntry> workflowExecutions(@PathVariable UUID workflowId) {
        return executionLogRepository.findByWorkflowIdAndNodeIdIsNullOrderByCreatedAtDesc(workflowId);
    }
}
