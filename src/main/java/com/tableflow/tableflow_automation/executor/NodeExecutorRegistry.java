package com.tableflow.tableflow_automation.executor;

import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each action, branch and delay node type to its executor.
 * Trigger nodes are evaluated by the trigger layer and never executed, so an executor
 * claiming a trigger type, or two executors claiming one type, fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<NodeType, NodeExecutor> byType = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        for (NodeExecutor executor : executors) {
            NodeType type = executor.supportedType();
            if (type.isTrigger()) {
                throw new IllegalStateException(executor.getClass().getSimpleName()
                        + " claims trigger node type " + type + "; triggers are not executed");
            }
            NodeExecutor existing = byType.putIfAbsent(type, executor);
            if (existing != null) {
                throw new IllegalStateException("Node type " + type + " is claimed by both "
                        + existing.getClass().getSimpleName() + " and " + executor.getClass().getSimpleName());
            }
        }
        log.info("Node executors registered for {}", byType.keySet());
    }

    public NodeExecutor get(NodeType type) {
        NodeExecutor executor = byType.get(type);
        if (executor == null) {
            throw new ServiceMisconfiguredException(type != null && type.isTrigger()
                    ? "Trigger node type " + type + " cannot be executed inside a run"
                    : "No executor registered for node type: " + type);
        }
        return executor;
    }

    public boolean isSupported(NodeType type) {
        return byType.containsKey(type);
    }

    public Set<NodeType> registeredTypes() {
        return Collections.unmodifiableSet(byType.keySet());
    }
}
