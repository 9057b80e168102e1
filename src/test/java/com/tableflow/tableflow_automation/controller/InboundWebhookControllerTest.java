package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.model.trigger.InboundWebhookRequest;
import com.tableflow.tableflow_automation.model.trigger.TriggerFiring;
import com.tableflow.tableflow_automation.model.trigger.TriggerRejection;
import com.tableflow.tableflow_automation.service.InboundWebhookService;
import com.tableflow.tableflow_automation.service.InboundWebhookService.InboundWebhookResult;
import com.tableflow.tableflow_automation.trigger.WebhookDispatchOutcome;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InboundWebhookController.class)
class InboundWebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InboundWebhookService inboundWebhookService;

    @Test
    void acceptedRequestReportsQueuedRuns() throws Exception {
        TriggerFiring firing = new TriggerFiring(UUID.randomUUID(), UUID.randomUUID(), Map.of("order_id", 1));
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.accepted(List.of(firing)), 1));

        mockMvc.perform(post("/api/automation/hooks/shop/orders")
                        .header("X-Event-Id", "evt-1")
                        .header("Authorization", "Bearer abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order_id\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.runs_queued").value(1));

        ArgumentCaptor<InboundWebhookRequest> request = ArgumentCaptor.forClass(InboundWebhookRequest.class);
        verify(inboundWebhookService).receive(request.capture());
        assertThat(request.getValue().path()).isEqualTo("shop/orders");
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().eventId()).isEqualTo("evt-1");
        assertThat(request.getValue().rawBody()).isEqualTo("{\"order_id\":1}".getBytes(StandardCharsets.UTF_8));
        assertThat(request.getValue().header("authorization")).isEqualTo("Bearer abc");
    }

    @Test
    void nonJsonBodyIsPassedOnAsTheExactBytesReceived() throws Exception {
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.accepted(List.of()), 0));
        byte[] body = "{\"name\":\"Zoë\"}".getBytes(StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/automation/hooks/orders")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<InboundWebhookRequest> request = ArgumentCaptor.forClass(InboundWebhookRequest.class);
        verify(inboundWebhookService).receive(request.capture());
        assertThat(request.getValue().rawBody()).isEqualTo(body);
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.notFound(), 0));

        mockMvc.perform(post("/api/automation/hooks/nothing-here").content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    void disallowedMethodIs405() throws Exception {
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.rejected(TriggerRejection.METHOD_NOT_ALLOWED), 0));

        mockMvc.perform(get("/api/automation/hooks/orders"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method GET not allowed"));
    }

    @Test
    void failedAuthenticationIs401() throws Exception {
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.rejected(TriggerRejection.UNAUTHORIZED), 0));

        mockMvc.perform(post("/api/automation/hooks/orders").content("{}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void invalidPayloadIs422() throws Exception {
        when(inboundWebhookService.receive(any()))
                .thenReturn(new InboundWebhookResult(WebhookDispatchOutcome.rejected(TriggerRejection.INVALID_PAYLOAD), 0));

        mockMvc.perform(post("/api/automation/hooks/orders").content("not json"))
                .andExpect(status().isUnprocessableEntity());
    }
}
