package com.pipeline.actions;

import com.pipeline.core.model.InputSpec;

import java.util.List;

/**
 * A reusable, named step with a declared input schema.
 * Built-in actions (cache, artifacts, deploy, quality gate) and actions declared
 * in YAML as a nested step sequence all implement this one capability.
 */
public interface CompositeAction {

    /**
     * Name a step references in its {@code uses} field.
     */
    String name();

    /**
     * Declared inputs. Required inputs must be supplied; optional ones fall back to their default.
     */
    List<InputSpec> inputs();

    /**
     * Execute the action.
     * 
     * @param context Execution context providing resolved inputs, the workspace and run services
     * @return Outputs and produced resources
     * @throws ActionException if the action fails
     */
    ActionOutcome execute(ActionContext context) throws ActionException;
}
