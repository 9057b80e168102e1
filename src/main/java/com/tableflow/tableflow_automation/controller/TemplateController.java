package com.tableflow.tableflow_automation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import com.tableflow.tableflow_automation.template.TemplateApplication;
import com.tableflow.tableflow_automation.template.TemplateApplier;
import com.tableflow.tableflow_automation.template.TemplateCatalog;
import com.tableflow.tableflow_automation.template.TemplatePreview;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/automation/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateCatalog catalog;
    private final TemplateApplier applier;

    @GetMapping
    public List<AutomationTemplate> list(@RequestParam(required = false) String category,
                                         @RequestParam(name = "field_types", required = false) List<String> fieldTypes) {
        if (fieldTypes != null && !fieldTypes.isEmpty()) {
            return catalog.compatibleWith(fieldTypes);
        }
        return catalog.list(category);
    }

    @GetMapping("/{templateId}/preview")
    public TemplatePreview preview(@PathVariable UUID templateId) {
        return catalog.preview(templateId);
    }

    // POST /api/automation/templates/{id}/apply, body: { "workflow_id": "...", "field_mappings": {...} }
    @PostMapping("/{templateId}/apply")
    public TemplateApplication apply(@PathVariable UUID templateId, @RequestBody ApplyTemplateRequest request) {
        if (request.workflowId() == null) {
            throw new AutomationConfigurationException("workflow_id is required");
        }
        return applier.apply(templateId, request.workflowId(), request.fieldMappings());
    }

    public record ApplyTemplateRequest(@JsonProperty("workflow_id") UUID workflowId,
                                       @JsonProperty("field_mappings") Map<String, String> fieldMappings) {
    }
}
