package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.model.domain.WorkflowNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of a workflow's nodes. Successors of N under tag T are the nodes whose
 * previous node is N and previous output is T, in node order.
 */
public final class WorkflowGraph {

    private final Map<UUID, WorkflowNode> nodesById = new LinkedHashMap<>();
    private final Map<UUID, Map<String, List<WorkflowNode>>> successors = new HashMap<>();

    private WorkflowGraph(List<WorkflowNode> nodes) {
        List<WorkflowNode> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparingInt(WorkflowNode::getNodeOrder));
        for (WorkflowNode node : ordered) {
            nodesById.put(node.getId(), node);
            if (node.getPreviousNodeId() != null) {
                String tag = node.getPreviousNodeOutput() != null ? node.getPreviousNodeOutput() : WorkflowNode.DEFAULT_OUTPUT;
                successors.computeIfAbsent(node.getPreviousNodeId(), k -> new HashMap<>())
                        .computeIfAbsent(tag, k -> new ArrayList<>())
                        .add(node);
            }
        }
    }

    public static WorkflowGraph of(List<WorkflowNode> nodes) {
        return new WorkflowGraph(nodes);
    }

    /** The root trigger: a trigger node without a previous node. */
    public Optional<WorkflowNode> trigger() {
        return nodesById.values().stream()
                .filter(n -> n.getNodeType() != null && n.getNodeType().isTrigger())
                .filter(n -> n.getPreviousNodeId() == null)
                .findFirst();
    }

    public Optional<WorkflowNode> node(UUID id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public List<WorkflowNode> successors(UUID nodeId, String outputTag) {
        Map<String, List<WorkflowNode>> byTag = successors.get(nodeId);
        if (byTag == null) return List.of();
        return List.copyOf(byTag.getOrDefault(Objects.requireNonNullElse(outputTag, WorkflowNode.DEFAULT_OUTPUT), List.of()));
    }

    /** Last node reached by following the first default successor from the trigger. */
    public Optional<WorkflowNode> lastOnDefaultPath() {
        Optional<WorkflowNode> current = trigger();
        if (current.isEmpty()) return Optional.empty();
        WorkflowNode node = current.get();
        int guard = nodesById.size();
        while (guard-- > 0) {
            List<WorkflowNode> next = successors(node.getId(), WorkflowNode.DEFAULT_OUTPUT);
            if (next.isEmpty()) break;
            node = next.get(0);
        }
        return Optional.of(node);
    }

    public int size() {
        return nodesById.size();
    }
}
