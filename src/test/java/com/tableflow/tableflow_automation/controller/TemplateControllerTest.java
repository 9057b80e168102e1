package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import com.tableflow.tableflow_automation.template.TemplateApplicationException;
import com.tableflow.tableflow_automation.template.TemplateApplier;
import com.tableflow.tableflow_automation.template.TemplateCatalog;
import com.tableflow.tableflow_automation.template.TemplateApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TemplateController.class)
class TemplateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TemplateCatalog catalog;

    @MockBean
    private TemplateApplier applier;

    @Test
    void fieldTypesSwitchToCompatibilityFiltering() throws Exception {
        AutomationTemplate template = new AutomationTemplate();
        template.setName("Due Date Reminder");
        when(catalog.compatibleWith(List.of("date", "text"))).thenReturn(List.of(template));

        mockMvc.perform(get("/api/automation/templates").param("field_types", "date", "text"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Due Date Reminder"));
    }

    @Test
    void applyPassesWorkflowAndMappings() throws Exception {
        UUID templateId = UUID.randomUUID();
        UUID workflowId = UUID.randomUUID();
        when(applier.apply(eq(templateId), eq(workflowId), any()))
                .thenReturn(new TemplateApplication("Due Date Reminder", null, List.of()));

        mockMvc.perform(post("/api/automation/templates/{id}/apply", templateId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_id\":\"" + workflowId + "\",\"field_mappings\":{\"due_date\":\"fld_1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.templateName").value("Due Date Reminder"));

        verify(applier).apply(templateId, workflowId, Map.of("due_date", "fld_1"));
    }

    @Test
    void applicationProblemsAreA400WithEveryProblem() throws Exception {
        UUID templateId = UUID.randomUUID();
        when(applier.apply(eq(templateId), any(), any())).thenThrow(new TemplateApplicationException(
                "Due Date Reminder", List.of("missing field mappings: due_date, status", "template is inactive")));

        mockMvc.perform(post("/api/automation/templates/{id}/apply", templateId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_id\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems.length()").value(2));
    }

    @Test
    void missingWorkflowIdIsRejectedBeforeApplying() throws Exception {
        mockMvc.perform(post("/api/automation/templates/{id}/apply", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("workflow_id is required"));

        verifyNoInteractions(applier);
    }

    @Test
    void unknownTemplatePreviewIsNotFound() throws Exception {
        UUID templateId = UUID.randomUUID();
        when(catalog.preview(templateId)).thenThrow(new IllegalArgumentException("Template not found: " + templateId));

        mockMvc.perform(get("/api/automation/templates/{id}/preview", templateId))
                .andExpect(status().isNotFound());
    }
}
