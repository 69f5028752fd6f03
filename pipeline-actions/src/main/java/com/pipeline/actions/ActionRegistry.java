package com.pipeline.actions;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.InputSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to action lookup for {@code uses} references, plus input schema resolution.
 */
public class ActionRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);
    
    private final Map<String, CompositeAction> actions = new ConcurrentHashMap<>();
    
    public ActionRegistry() {
    }
    
    public ActionRegistry(Collection<? extends CompositeAction> initial) {
        initial.forEach(this::register);
    }
    
    /**
     * Register an action, replacing any earlier action with the same name.
     */
    public void register(CompositeAction action) {
        CompositeAction previous = actions.put(action.name(), action);
        if (previous != null) {
            log.warn("Replaced composite action: {}", action.name());
        } else {
            log.info("Registered composite action: {} (inputs: {})", action.name(),
                action.inputs().stream().map(InputSpec::name).toList());
        }
    }
    
    public Optional<CompositeAction> find(String name) {
        return Optional.ofNullable(actions.get(name));
    }
    
    /**
     * Get an action by name.
     * 
     * @param name The {@code uses} reference
     * @param location Declaration path for the diagnostic
     * @throws ConfigurationException if no action has that name
     */
    public CompositeAction get(String name, String location) {
        CompositeAction action = actions.get(name);
        if (action == null) {
            throw new ConfigurationException(location, "unknown composite action '" + name + "'");
        }
        return action;
    }
    
    public boolean contains(String name) {
        return actions.containsKey(name);
    }
    
    /** Registered action names, sorted. */
    public List<String> names() {
        return actions.keySet().stream().sorted().toList();
    }
    
    /**
     * Apply an action's input schema to the supplied inputs: defaults fill absent
     * optional inputs, and every required input must be present and non-blank.
     * Undeclared inputs are passed through.
     * 
     * @throws ConfigurationException naming the first missing required input
     */
    public static Map<String, String> resolveInputs(CompositeAction action, Map<String, String> supplied,
                                                    String location) {
        Map<String, String> resolved = new LinkedHashMap<>(supplied);
        for (InputSpec spec : action.inputs()) {
            String value = resolved.get(spec.name());
            if (value == null || value.isEmpty()) {
                if (spec.hasDefault()) {
                    resolved.put(spec.name(), spec.defaultValue());
                } else if (spec.required()) {
                    throw new ConfigurationException(location, String.format(
                        "missing required input '%s' for action '%s'", spec.name(), action.name()));
                }
            }
        }
        return resolved;
    }
    
    /**
     * Static check that every required input without a default is declared in {@code with}.
     * Values are not inspected, since they may still be interpolated at run time.
     * 
     * @throws ConfigurationException naming the first missing required input
     */
    public static void checkDeclaredInputs(CompositeAction action, Map<String, String> with, String location) {
        for (InputSpec spec : action.inputs()) {
            if (spec.required() && !spec.hasDefault() && !with.containsKey(spec.name())) {
                throw new ConfigurationException(location, String.format(
                    "missing required input '%s' for action '%s'", spec.name(), action.name()));
            }
        }
    }
}
