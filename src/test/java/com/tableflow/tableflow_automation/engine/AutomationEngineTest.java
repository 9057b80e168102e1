package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.trigger.ClockTick;
import com.tableflow.tableflow_automation.model.trigger.TriggerFiring;
import com.tableflow.tableflow_automation.repository.WorkflowRepository;
import com.tableflow.tableflow_automation.support.TestNodes;
import com.tableflow.tableflow_automation.trigger.TriggerDispatcher;
import com.tableflow.tableflow_automation.webhook.DeliveryQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutomationEngineTest {

    private TriggerDispatcher dispatcher;
    private WorkflowRunner runner;
    private WorkflowRepository workflowRepository;
    private DeliveryQueue deliveryQueue;
    private AutomationEngine engine;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        dispatcher = mock(TriggerDispatcher.class);
        runner = mock(WorkflowRunner.class);
        workflowRepository = mock(WorkflowRepository.class);
        deliveryQueue = mock(DeliveryQueue.class);
        AutomationProperties properties = new AutomationProperties();
        properties.getWorkers().setTriggerThreads(1);
        properties.getWorkers().setRunThreads(2);
        engine = new AutomationEngine(dispatcher, runner, workflowRepository, deliveryQueue, properties);

        workflow = TestNodes.workflow();
        when(workflowRepository.findById(workflow.getId())).thenReturn(Optional.of(workflow));
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    void startAndStopDriveTheDeliveryQueue() {
        engine.start();
        engine.start();
        assertThat(engine.isRunning()).isTrue();

        engine.stop();

        assertThat(engine.isRunning()).isFalse();
        verify(deliveryQueue).start();
        verify(deliveryQueue).stop();
    }

    @Test
    void submittedEventIsDispatchedAndItsRunsExecuted() {
        engine.start();
        ClockTick tick = ClockTick.at(Instant.parse("2024-03-12T09:00:00Z"));
        Map<String, Object> payload = Map.of("rows", List.of());
        when(dispatcher.dispatch(tick)).thenReturn(List.of(new TriggerFiring(workflow.getId(), UUID.randomUUID(), payload)));

        assertThat(engine.submitEvent(tick)).isTrue();

        verify(runner, timeout(5000)).run(workflow, payload);
    }

    @Test
    void runFailureIsContainedInTheWorker() {
        engine.start();
        when(runner.run(any(), any())).thenThrow(new WorkflowTimeoutException("x", Duration.ofSeconds(1)));
        TriggerFiring firing = new TriggerFiring(workflow.getId(), UUID.randomUUID(), Map.of());

        assertThat(engine.startRuns(List.of(firing, firing))).isEqualTo(2);

        verify(runner, timeout(5000).times(2)).run(eq(workflow), any());
    }

    @Test
    void continuationRunsAfterTheDelay() {
        engine.start();
        UUID delayNode = UUID.randomUUID();

        assertThat(engine.scheduleContinuation(workflow.getId(), delayNode, Map.of("a", 1), Duration.ofMillis(20))).isTrue();

        verify(runner, timeout(5000)).runContinuation(workflow, delayNode, Map.of("a", 1));
    }

    @Test
    void stoppedEngineAcceptsNothing() {
        TriggerFiring firing = new TriggerFiring(workflow.getId(), UUID.randomUUID(), Map.of());

        assertThat(engine.submitEvent(ClockTick.at(Instant.now()))).isFalse();
        assertThat(engine.startRuns(List.of(firing))).isZero();
        verify(dispatcher, never()).dispatch(any());
    }
}
