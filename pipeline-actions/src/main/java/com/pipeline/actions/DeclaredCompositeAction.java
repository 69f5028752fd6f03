package com.pipeline.actions;

import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.StepResult;

import java.util.List;
import java.util.Map;

/**
 * Composite action declared as data: an input schema, a nested step sequence
 * and output expressions. Nested steps run inline in the invoking job's environment
 * and see the resolved inputs as {@code inputs.*}.
 */
public class DeclaredCompositeAction implements CompositeAction {
    
    public static final String ERROR_NESTED_STEP_FAILED = "NESTED_STEP_FAILED";
    
    private final String name;
    private final String description;
    private final List<InputSpec> inputs;
    private final List<StepDefinition> steps;
    private final Map<String, String> outputs;
    
    public DeclaredCompositeAction(String name, String description, List<InputSpec> inputs,
                                   List<StepDefinition> steps, Map<String, String> outputs) {
        this.name = name;
        this.description = description;
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
    }
    
    @Override
    public String name() {
        return name;
    }
    
    @Override
    public List<InputSpec> inputs() {
        return inputs;
    }
    
    public String description() {
        return description;
    }
    
    public List<StepDefinition> steps() {
        return steps;
    }

    /** Output name to expression over the nested step results. */
    public Map<String, String> outputs() {
        return outputs;
    }
    
    @Override
    public ActionOutcome execute(ActionContext context) throws ActionException {
        ActionContext.NestedRun nested = context.runSteps(steps, context.getInputs(), outputs);
        
        StepResult failed = nested.firstFatalFailure();
        if (failed != null) {
            throw new ActionException(ERROR_NESTED_STEP_FAILED, String.format(
                "Step '%s' of action '%s' failed: %s", failed.stepId(), name, failed.errorMessage()));
        }
        return ActionOutcome.of(nested.outputs());
    }
}
