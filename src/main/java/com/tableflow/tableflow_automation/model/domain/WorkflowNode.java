package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "automation_workflow_nodes")
@Data
public class WorkflowNode {

    /** Output tag of the implicit successor set of linear nodes. */
    public static final String DEFAULT_OUTPUT = "";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false)
    private NodeType nodeType;

    private String label;

    // Kind-specific configuration, bound to typed config objects at evaluation/dispatch time
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> config;

    @Column(name = "previous_node_id")
    private UUID previousNodeId;

    // "true"/"false" under a branch node, DEFAULT_OUTPUT otherwise
    @Column(name = "previous_node_output", nullable = false)
    private String previousNodeOutput = DEFAULT_OUTPUT;

    @Column(name = "node_order", nullable = false)
    private int nodeOrder;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
