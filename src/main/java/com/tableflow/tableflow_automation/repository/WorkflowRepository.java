package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    // Test run window closes after the first successful run
    @Transactional
    @Modifying
    @Query("update Workflow w set w.testRunUntil = null where w.id = :id")
    int clearTestRun(@Param("id") UUID id);
}
