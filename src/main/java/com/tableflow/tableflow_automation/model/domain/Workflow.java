package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "automation_workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    @Column(nullable = false)
    private String name;

    private boolean published;

    private boolean paused;

    /** While in the future the workflow can be triggered even when unpublished. Cleared after the first successful run. */
    @Column(name = "test_run_until")
    private Instant testRunUntil;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isTriggerable(Instant now) {
        if (published && !paused) return true;
        return testRunUntil != null && testRunUntil.isAfter(now);
    }
}
