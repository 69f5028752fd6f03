package com.pipeline.actions;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.InputSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRegistryTest {

    private final CompositeAction setupNode = new CompositeAction() {
        @Override
        public String name() {
            return "setup-node";
        }

        @Override
        public List<InputSpec> inputs() {
            return List.of(
                InputSpec.required("node-version", "Node.js version"),
                InputSpec.optional("registry", "https://registry.npmjs.org", "Package registry")
            );
        }

        @Override
        public ActionOutcome execute(ActionContext context) {
            return ActionOutcome.empty();
        }
    };

    @Test
    void resolveInputs_shouldApplyDefaults() {
        Map<String, String> resolved = ActionRegistry.resolveInputs(setupNode, Map.of("node-version", "20"), "jobs.build.steps.node");

        assertThat(resolved)
            .containsEntry("node-version", "20")
            .containsEntry("registry", "https://registry.npmjs.org");
    }

    @Test
    void resolveInputs_shouldRejectMissingRequiredInput() {
        assertThatThrownBy(() -> ActionRegistry.resolveInputs(setupNode, Map.of(), "jobs.build.steps.node"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("jobs.build.steps.node")
            .hasMessageContaining("node-version");
    }

    @Test
    void get_shouldRejectUnknownAction() {
        ActionRegistry registry = new ActionRegistry(List.of(setupNode));

        assertThat(registry.names()).containsExactly("setup-node");
        assertThatThrownBy(() -> registry.get("setup-python", "jobs.test.steps.0"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("setup-python");
    }

    @Test
    void checkDeclaredInputs_shouldAcceptExpressionsForRequiredInputs() {
        ActionRegistry.checkDeclaredInputs(setupNode, Map.of("node-version", "${{ env.NODE }}"), "jobs.build.steps.node");

        assertThatThrownBy(() -> ActionRegistry.checkDeclaredInputs(setupNode, Map.of(), "jobs.build.steps.node"))
            .isInstanceOf(ConfigurationException.class);
    }
}
