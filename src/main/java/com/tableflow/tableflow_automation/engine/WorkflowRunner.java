package com.tableflow.tableflow_automation.engine;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.executor.NodeExecutorRegistry;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.context.ExecutionStatus;
import com.tableflow.tableflow_automation.model.context.RetryConfig;
import com.tableflow.tableflow_automation.model.domain.ExecutionLogStatus;
import com.tableflow.tableflow_automation.model.domain.Workflow;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import com.tableflow.tableflow_automation.repository.WorkflowNodeRepository;
import com.tableflow.tableflow_automation.repository.WorkflowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Walks a workflow's node graph for one run.
 *
 * <p>Nodes run strictly sequentially on the calling thread. Each node is retried with
 * exponential backoff; a node that still fails is recorded and its siblings continue.
 * Critical errors (timeout, cancellation, VM errors) abort the run. Exactly one
 * workflow-level log entry is written per run, whatever the outcome.
 */
@Slf4j
@Service
public class WorkflowRunner {

    private final WorkflowNodeRepository nodeRepository;
    private final WorkflowRepository workflowRepository;
    private final NodeExecutorRegistry executorRegistry;
    private final ExecutionLogWriter logWriter;
    private final ExecutionEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final AutomationProperties properties;
    private final Clock clock;

    public WorkflowRunner(WorkflowNodeRepository nodeRepository,
                          WorkflowRepository workflowRepository,
                          NodeExecutorRegistry executorRegistry,
                          ExecutionLogWriter logWriter,
                          ExecutionEventPublisher eventPublisher,
                          ObjectMapper objectMapper,
                          AutomationProperties properties,
                          Clock clock) {
        this.nodeRepository = nodeRepository;
        this.workflowRepository = workflowRepository;
        this.executorRegistry = executorRegistry;
        this.logWriter = logWriter;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public ExecutionContext run(Workflow workflow, Map<String, Object> initialPayload) {
        WorkflowGraph graph = loadGraph(workflow);
        return execute(workflow, initialPayload, () -> {
            WorkflowNode trigger = graph.trigger()
                    .orElseThrow(() -> new AutomationConfigurationException("Workflow " + workflow.getId() + " has no trigger node"));
            return graph.successors(trigger.getId(), WorkflowNode.DEFAULT_OUTPUT);
        }, graph);
    }

    /** Runs the successors of a delay node as a new execution. */
    public ExecutionContext runContinuation(Workflow workflow, UUID fromNodeId, Map<String, Object> payload) {
        WorkflowGraph graph = loadGraph(workflow);
        return execute(workflow, payload, () -> {
            graph.node(fromNodeId)
                    .orElseThrow(() -> new AutomationConfigurationException("Node " + fromNodeId + " not found in workflow " + workflow.getId()));
            return graph.successors(fromNodeId, WorkflowNode.DEFAULT_OUTPUT);
        }, graph);
    }

    private WorkflowGraph loadGraph(Workflow workflow) {
        return WorkflowGraph.of(nodeRepository.findByWorkflowIdOrderByNodeOrderAsc(workflow.getId()));
    }

    /** Start nodes are resolved inside the run, so a broken graph still gets its log entry. */
    private ExecutionContext execute(Workflow workflow, Map<String, Object> payload,
                                     Supplier<List<WorkflowNode>> startNodes, WorkflowGraph graph) {
        ExecutionContext context = ExecutionContext.create(workflow.getId(), workflow.getWorkspaceId(), payload, clock.instant());
        log.info("Starting execution {} of workflow {}", context.getExecutionId(), workflow.getId());
        try {
            executeBranch(startNodes.get(), graph, context);
            context.complete(clock.instant());
            log.info("Completed execution {} in {} ms with {} node error(s)",
                    context.getExecutionId(), elapsed(context).toMillis(), context.getErrors().size());
        } catch (CriticalExecutionException ex) {
            context.addError(null, ex, clock.instant());
            context.fail(clock.instant());
            log.error("Execution {} of workflow {} aborted: {}", context.getExecutionId(), workflow.getId(), ex.getMessage());
            throw ex;
        } catch (AutomationConfigurationException ex) {
            context.addError(null, ex, clock.instant());
            context.fail(clock.instant());
            log.error("Execution {} of workflow {} cannot start: {}", context.getExecutionId(), workflow.getId(), ex.getMessage());
            throw ex;
        } catch (VirtualMachineError ex) {
            context.addError(null, ex, clock.instant());
            context.fail(clock.instant());
            log.error("Execution {} of workflow {} aborted by {}", context.getExecutionId(), workflow.getId(), ex.toString());
            throw ex;
        } finally {
            if (!context.isTerminal()) {
                context.fail(clock.instant());
            }
            finish(workflow, context);
        }
        return context;
    }

    private void executeBranch(List<WorkflowNode> nodes, WorkflowGraph graph, ExecutionContext context) {
        for (WorkflowNode node : nodes) {
            checkTimeout(context);

            DispatchResult result;
            try {
                result = executeNodeWithRetry(node, context);
            } catch (CriticalExecutionException ex) {
                throw ex;
            } catch (NodeMisconfiguredException ex) {
                context.addError(node.getId().toString(), ex, clock.instant());
                log.error("Execution {}: {}", context.getExecutionId(), ex.getMessage(), ex);
                continue;
            } catch (RuntimeException ex) {
                context.addError(node.getId().toString(), ex, clock.instant());
                log.warn("Execution {}: node {} failed but continuing execution: {}",
                        context.getExecutionId(), node.getId(), message(ex));
                continue;
            } catch (VirtualMachineError ex) {
                throw ex;
            } catch (Error ex) {
                context.addError(node.getId().toString(), ex, clock.instant());
                log.error("Execution {}: node {} raised {}, continuing execution",
                        context.getExecutionId(), node.getId(), ex.toString(), ex);
                continue;
            }

            if (!result.deferred()) {
                executeBranch(graph.successors(node.getId(), result.outputTag()), graph, context);
            }
        }
    }

    private DispatchResult executeNodeWithRetry(WorkflowNode node, ExecutionContext context) {
        RetryConfig retry = retryConfigFor(node);
        String executionId = context.getExecutionId();
        int attempt = 0;

        while (true) {
            attempt++;
            Map<String, Object> input = new LinkedHashMap<>(context.getPayload());
            long startedAt = clock.millis();
            eventPublisher.nodeStarted(executionId, node.getId());
            try {
                DispatchResult result = dispatch(node, context);
                Map<String, Object> output = result.output() != null ? result.output() : Map.of();
                context.recordNodeOutput(node.getId().toString(), output);
                logWriter.nodeEntry(context, node.getId(), ExecutionLogStatus.SUCCESS, input, output,
                        clock.millis() - startedAt, null, attempt - 1);
                eventPublisher.nodeCompleted(executionId, node.getId());
                return result;
            } catch (CriticalExecutionException ex) {
                throw ex;
            } catch (NodeMisconfiguredException ex) {
                // Retrying cannot fix a misconfigured service
                logWriter.nodeEntry(context, node.getId(), ExecutionLogStatus.FAILED, input, null,
                        clock.millis() - startedAt, ex.getMessage(), attempt - 1);
                eventPublisher.nodeFailed(executionId, node.getId(), ex.getMessage());
                throw ex;
            } catch (RuntimeException ex) {
                String msg = message(ex);
                if (attempt >= retry.getMaxAttempts()) {
                    logWriter.nodeEntry(context, node.getId(), ExecutionLogStatus.FAILED, input, null,
                            clock.millis() - startedAt, msg, attempt - 1);
                    eventPublisher.nodeFailed(executionId, node.getId(), msg);
                    throw ex;
                }

                Duration delay = retry.delayForAttempt(attempt);
                log.warn("Node {} ({}) failed on attempt {}/{}: {}. Retrying in {} ms",
                        node.getId(), node.getNodeType(), attempt, retry.getMaxAttempts(), msg, delay.toMillis());
                logWriter.nodeEntry(context, node.getId(), ExecutionLogStatus.RETRYING, input, null,
                        clock.millis() - startedAt, msg, attempt - 1);
                eventPublisher.nodeRetrying(executionId, node.getId(), attempt, msg);

                sleep(delay, context);
                checkTimeout(context);
            } catch (VirtualMachineError ex) {
                throw ex;
            } catch (Error ex) {
                // Not retried
                logWriter.nodeEntry(context, node.getId(), ExecutionLogStatus.FAILED, input, null,
                        clock.millis() - startedAt, message(ex), attempt - 1);
                eventPublisher.nodeFailed(executionId, node.getId(), message(ex));
                throw ex;
            }
        }
    }

    private DispatchResult dispatch(WorkflowNode node, ExecutionContext context) {
        try {
            return executorRegistry.get(node.getNodeType()).execute(node, context);
        } catch (ServiceMisconfiguredException | AutomationConfigurationException ex) {
            throw new NodeMisconfiguredException(node.getId(), ex);
        }
    }

    /** Run defaults, overridden field by field by the node's "retry" config. */
    RetryConfig retryConfigFor(WorkflowNode node) {
        AutomationProperties.Runner runner = properties.getRunner();
        RetryConfig defaults = new RetryConfig(runner.getMaxAttempts(),
                runner.getRetryBaseDelay().toMillis(), runner.getRetryMultiplier());

        Map<String, Object> config = node.getConfig();
        if (config == null || !(config.get("retry") instanceof Map<?, ?> raw)) {
            return defaults.normalized();
        }
        try {
            return objectMapper.updateValue(defaults, raw).normalized();
        } catch (JsonMappingException ex) {
            log.warn("Ignoring unreadable retry config on node {}: {}", node.getId(), ex.getOriginalMessage());
            return defaults.normalized();
        }
    }

    private void checkTimeout(ExecutionContext context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new WorkflowCancelledException(context.getExecutionId(),
                    new InterruptedException("worker interrupted"));
        }
        Duration limit = properties.getRunner().getMaxExecutionTime();
        if (elapsed(context).compareTo(limit) > 0) {
            throw new WorkflowTimeoutException(context.getExecutionId(), limit);
        }
    }

    protected void sleep(Duration delay, ExecutionContext context) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException(context.getExecutionId(), ex);
        }
    }

    private void finish(Workflow workflow, ExecutionContext context) {
        try {
            logWriter.workflowEntry(context);
        } catch (RuntimeException ex) {
            log.error("Failed to write execution log for execution {}: {}", context.getExecutionId(), ex.getMessage(), ex);
        }
        eventPublisher.executionFinished(context.getExecutionId(), context.getStatus());

        if (context.getStatus() == ExecutionStatus.COMPLETED && workflow.getTestRunUntil() != null) {
            workflowRepository.clearTestRun(workflow.getId());
            workflow.setTestRunUntil(null);
        }
    }

    private Duration elapsed(ExecutionContext context) {
        return Duration.between(context.getStartedAt(), clock.instant());
    }

    private static String message(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
