package com.tableflow.tableflow_automation.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.engine.AutomationEngine;
import com.tableflow.tableflow_automation.engine.NodeDispatchException;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.support.MutableClock;
import com.tableflow.tableflow_automation.support.TestNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DelayExecutorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private AutomationEngine engine;
    private DelayExecutor executor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        engine = mock(AutomationEngine.class);
        ObjectProvider<AutomationEngine> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(engine);
        executor = new DelayExecutor(new TemplateRenderer(new ObjectMapper()), provider, clock);
    }

    @Test
    void fixedDelaySchedulesContinuationAndDefers() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "fixed", "delay_seconds", 3600));
        ExecutionContext context = context(Map.of("id", 1));
        when(engine.scheduleContinuation(any(), any(), anyMap(), any())).thenReturn(true);

        DispatchResult result = executor.execute(node, context);

        assertThat(result.deferred()).isTrue();
        assertThat(result.output())
                .containsEntry("status", "scheduled")
                .containsEntry("delay_seconds", 3600L)
                .containsEntry("scheduled_at", "2024-05-01T11:00:00Z");
        verify(engine).scheduleContinuation(eq(context.getWorkflowId()), eq(node.getId()),
                eq(Map.of("id", 1)), eq(Duration.ofHours(1)));
    }

    @Test
    void zeroDelayContinuesImmediately() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "fixed", "delay_seconds", 0));

        DispatchResult result = executor.execute(node, context(Map.of()));

        assertThat(result.deferred()).isFalse();
        assertThat(result.output()).containsEntry("status", "immediate");
        verify(engine, never()).scheduleContinuation(any(), any(), anyMap(), any());
    }

    @Test
    void untilDateWaitsForTheRenderedDate() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY,
                Map.of("delay_type", "until_date", "delay_until_template", "{{ due }}"));

        Duration delay = executor.calculateDelay(node, node.getConfig(), Map.of("due", "2024-05-02T10:00:00"));

        assertThat(delay).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void pastOrInvalidTargetDateMeansNoDelay() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY,
                Map.of("delay_type", "until_date", "delay_until_template", "{{ due }}"));

        assertThat(executor.calculateDelay(node, node.getConfig(), Map.of("due", "2024-04-01"))).isZero();
        assertThat(executor.calculateDelay(node, node.getConfig(), Map.of("due", "someday"))).isZero();
    }

    @Test
    void untilConditionDoesNotWait() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "until_condition"));

        assertThat(executor.calculateDelay(node, node.getConfig(), Map.of())).isZero();
    }

    @Test
    void unknownTypeOrNonNumericSecondsIsAMisconfiguration() {
        WorkflowNode unknown = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "until_lunch"));
        WorkflowNode nonNumeric = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "fixed", "delay_seconds", "soon"));

        assertThatThrownBy(() -> executor.execute(unknown, context(Map.of())))
                .isInstanceOf(ServiceMisconfiguredException.class);
        assertThatThrownBy(() -> executor.execute(nonNumeric, context(Map.of())))
                .isInstanceOf(ServiceMisconfiguredException.class);
    }

    @Test
    void continuationThatCannotBeScheduledFailsTheNode() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY, Map.of("delay_type", "fixed", "delay_seconds", 60));
        when(engine.scheduleContinuation(any(), any(), anyMap(), any())).thenReturn(false);

        assertThatThrownBy(() -> executor.execute(node, context(Map.of())))
                .isInstanceOf(NodeDispatchException.class);
    }

    @Test
    void nonTextUntilTemplateIsAMisconfiguration() {
        WorkflowNode node = TestNodes.node(NodeType.DELAY,
                Map.of("delay_type", "until_date", "delay_until_template", List.of("2024-05-02")));

        assertThatThrownBy(() -> executor.execute(node, context(Map.of())))
                .isInstanceOf(ServiceMisconfiguredException.class)
                .hasMessageContaining("delay_until_template");
    }

    private ExecutionContext context(Map<String, Object> payload) {
        return ExecutionContext.create(UUID.randomUUID(), UUID.randomUUID(), payload, clock.instant());
    }
}
