package com.tableflow.tableflow_automation.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Catalog entry. Applying a template never changes it; only usageCount moves, via an atomic update.
 */
@Entity
@Table(name = "automation_templates")
@Data
public class AutomationTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TemplateKind kind = TemplateKind.TRIGGER;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 1000)
    private String description;

    private String category;

    // { "type": "date_based_trigger", "date_field_id": "due_date", ... }; null for ACTION templates
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "trigger_config")
    private Map<String, Object> triggerConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "action_configs")
    private List<Map<String, Object>> actionConfigs = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "required_field_types")
    private List<String> requiredFieldTypes = new ArrayList<>();

    @Column(name = "usage_count")
    private long usageCount;

    private boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
