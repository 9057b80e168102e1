package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, UUID> {

    List<WorkflowNode> findByWorkflowIdOrderByNodeOrderAsc(UUID workflowId);

    /** Trigger nodes of the given type whose workflow may currently be triggered. */
    @Query("""
            select n from WorkflowNode n, Workflow w
            where n.workflowId = w.id
              and n.nodeType = :type
              and ((w.published = true and w.paused = false) or w.testRunUntil > :now)
            order by n.createdAt asc
            """)
    List<WorkflowNode> findActiveTriggers(@Param("type") NodeType type, @Param("now") Instant now);

    long countByWorkflowId(UUID workflowId);
}
