package com.tableflow.tableflow_automation.trigger;

import com.tableflow.tableflow_automation.model.domain.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class TriggerEvaluatorRegistry {

    private final List<TriggerEvaluator> evaluators;
    private final Map<NodeType, TriggerEvaluator> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        evaluators.forEach(evaluator -> registry.put(evaluator.supportedType(), evaluator));
    }

    public TriggerEvaluator get(NodeType type) {
        TriggerEvaluator evaluator = registry.get(type);
        if (evaluator == null) {
            throw new UnsupportedOperationException("No trigger evaluator registered for node type: " + type);
        }
        return evaluator;
    }
}
