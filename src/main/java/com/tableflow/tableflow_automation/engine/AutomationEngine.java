package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.trigger.TriggerEvent;
import com.tableflow.tableflow_automation.model.trigger.TriggerFiring;
import com.tableflow.tableflow_automation.repository.WorkflowRepository;
import com.tableflow.tableflow_automation.trigger.TriggerDispatcher;
import com.tableflow.tableflow_automation.webhook.DeliveryQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Owns the worker pools: trigger evaluation, workflow runs and (through {@link DeliveryQueue})
 * webhook deliveries. Nothing is accepted before {@link #start()} or after {@link #stop()}.
 */
@Slf4j
@Component
public class AutomationEngine implements SmartLifecycle {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final TriggerDispatcher dispatcher;
    private final WorkflowRunner runner;
    private final WorkflowRepository workflowRepository;
    private final DeliveryQueue deliveryQueue;
    private final AutomationProperties properties;

    private volatile WorkerPool triggerPool;
    private volatile WorkerPool runPool;
    private volatile boolean running;

    public AutomationEngine(TriggerDispatcher dispatcher,
                            WorkflowRunner runner,
                            WorkflowRepository workflowRepository,
                            DeliveryQueue deliveryQueue,
                            AutomationProperties properties) {
        this.dispatcher = dispatcher;
        this.runner = runner;
        this.workflowRepository = workflowRepository;
        this.deliveryQueue = deliveryQueue;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        AutomationProperties.Workers workers = properties.getWorkers();
        triggerPool = new WorkerPool("automation-trigger", workers.getTriggerThreads(), workers.getTriggerQueueCapacity());
        runPool = new WorkerPool("automation-run", workers.getRunThreads(), workers.getRunQueueCapacity());
        deliveryQueue.start();
        running = true;
        log.info("Automation engine started: {} trigger worker(s), {} run worker(s)",
                workers.getTriggerThreads(), workers.getRunThreads());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            triggerPool.shutdown(SHUTDOWN_GRACE);
            runPool.shutdown(SHUTDOWN_GRACE);
        } finally {
            deliveryQueue.stop();
            log.info("Automation engine stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Queues an event for trigger evaluation; false when the engine is stopped or the queue is full. */
    public boolean submitEvent(TriggerEvent event) {
        if (!running) {
            log.warn("Automation engine not running, dropping event {}", event.eventId());
            return false;
        }
        return triggerPool.submit(() -> evaluate(event));
    }

    /** Queues one run per firing and returns how many were accepted. */
    public int startRuns(List<TriggerFiring> firings) {
        int queued = 0;
        for (TriggerFiring firing : firings) {
            if (queueRun(firing.workflowId(), wf -> runner.run(wf, firing.payload()), Duration.ZERO)) {
                queued++;
            }
        }
        return queued;
    }

    /** Runs the successors of a delay node once the delay elapses. Not durable across restarts. */
    public boolean scheduleContinuation(UUID workflowId, UUID fromNodeId, Map<String, Object> payload, Duration delay) {
        log.info("Scheduling continuation of workflow {} after node {} in {} s", workflowId, fromNodeId, delay.toSeconds());
        return queueRun(workflowId, wf -> runner.runContinuation(wf, fromNodeId, payload), delay);
    }

    private void evaluate(TriggerEvent event) {
        try {
            List<TriggerFiring> firings = dispatcher.dispatch(event);
            if (!firings.isEmpty()) {
                int queued = startRuns(firings);
                log.info("Event {} fired {} trigger(s), {} run(s) queued", event.eventId(), firings.size(), queued);
            }
        } catch (RuntimeException ex) {
            log.error("Trigger evaluation of event {} failed: {}", event.eventId(), ex.getMessage(), ex);
        }
    }

    private boolean queueRun(UUID workflowId, Function<Workflow, ExecutionContext> body, Duration delay) {
        if (!running) {
            log.warn("Automation engine not running, dropping run of workflow {}", workflowId);
            return false;
        }
        Runnable task = () -> runWorkflow(workflowId, body);
        return delay.isZero() ? runPool.submit(task) : runPool.submitAfter(delay, task);
    }

    private void runWorkflow(UUID workflowId, Function<Workflow, ExecutionContext> body) {
        Optional<Workflow> workflow = workflowRepository.findById(workflowId);
        if (workflow.isEmpty()) {
            log.warn("Workflow {} no longer exists, run skipped", workflowId);
            return;
        }
        try {
            body.apply(workflow.get());
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Workflow {} execution failed: {}", workflowId, msg, ex);
        }
    }
}
