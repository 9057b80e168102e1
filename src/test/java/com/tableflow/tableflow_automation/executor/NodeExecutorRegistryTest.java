package com.tableflow.tableflow_automation.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tableflow.tableflow_automation.engine.ServiceMisconfiguredException;
import com.tableflow.tableflow_automation.model.context.DispatchResult;
import com.tableflow.tableflow_automation.model.context.ExecutionContext;
import com.tableflow.tableflow_automation.model.domain.NodeType;
import com.tableflow.tableflow_automation.model.domain.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeExecutorRegistryTest {

    private final TemplateRenderer renderer = new TemplateRenderer(new ObjectMapper());

    @Test
    void executorIsFoundByItsNodeType() {
        ConditionalBranchExecutor branch = new ConditionalBranchExecutor(renderer);
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(branch));
        registry.init();

        assertThat(registry.get(NodeType.CONDITIONAL_BRANCH)).isSameAs(branch);
        assertThat(registry.isSupported(NodeType.CONDITIONAL_BRANCH)).isTrue();
        assertThat(registry.isSupported(NodeType.UPDATE_ROW)).isFalse();
        assertThat(registry.registeredTypes()).containsExactly(NodeType.CONDITIONAL_BRANCH);
    }

    @Test
    void missingExecutorIsAMisconfiguration() {
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of());
        registry.init();

        assertThatThrownBy(() -> registry.get(NodeType.UPDATE_ROW))
                .isInstanceOf(ServiceMisconfiguredException.class)
                .hasMessageContaining("UPDATE_ROW");
        assertThatThrownBy(() -> registry.get(NodeType.WEBHOOK_TRIGGER))
                .isInstanceOf(ServiceMisconfiguredException.class)
                .hasMessageContaining("cannot be executed");
    }

    @Test
    void twoExecutorsForOneTypeFailStartup() {
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(
                new ConditionalBranchExecutor(renderer), new ConditionalBranchExecutor(renderer)));

        assertThatThrownBy(registry::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CONDITIONAL_BRANCH");
    }

    @Test
    void executorClaimingATriggerTypeFailsStartup() {
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(new FixedTypeExecutor(NodeType.DATE_TRIGGER)));

        assertThatThrownBy(registry::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DATE_TRIGGER");
    }

    private record FixedTypeExecutor(NodeType supportedType) implements NodeExecutor {

        @Override
        public DispatchResult execute(WorkflowNode node, ExecutionContext context) {
            return DispatchResult.of(Map.of());
        }
    }
}
