package com.pipeline.engine.step;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.StepResult;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates step and job conditions written in Spring Expression Language.
 * 
 * Conditions see {@code success()}, {@code failure()}, {@code always()}, {@code steps},
 * {@code env}, {@code inputs} and {@code event}, for example
 * {@code steps.restore.outputs['cache-hit'] != 'true'}. A surrounding {@code ${{ }}} is
 * accepted. A missing condition means {@code success()}.
 * 
 * Evaluation runs in a read-only context: no type references, constructors or assignments.
 */
public class ConditionEvaluator {
    
    private static final String DEFAULT_CONDITION = "success()";
    
    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();
    
    /**
     * Evaluate a condition.
     * 
     * @param condition The expression, or null for the default
     * @param scope Values visible to the expression
     * @param location Declaration path used in diagnostics
     * @throws ConfigurationException if the expression is invalid or not boolean
     */
    public boolean evaluate(String condition, ExpressionScope scope, String location) {
        String source = normalize(condition);
        Expression expression = parse(source, location);
        EvaluationContext context = SimpleEvaluationContext
            .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
            .withInstanceMethods()
            .withRootObject(new ConditionRoot(scope))
            .build();
        try {
            Object value = expression.getValue(context);
            if (value instanceof Boolean result) {
                return result;
            }
            throw new ConfigurationException(location + ".if",
                "condition '" + source + "' did not evaluate to a boolean but to " + value);
        } catch (EvaluationException e) {
            throw new ConfigurationException(location + ".if",
                "cannot evaluate condition '" + source + "': " + e.getMessage());
        }
    }
    
    /**
     * Check that a condition parses.
     * 
     * @throws ConfigurationException if it does not
     */
    public void validate(String condition, String location) {
        parse(normalize(condition), location);
    }
    
    static String normalize(String condition) {
        if (condition == null || condition.isBlank()) {
            return DEFAULT_CONDITION;
        }
        String trimmed = condition.trim();
        if (trimmed.startsWith("${{") && trimmed.endsWith("}}")) {
            trimmed = trimmed.substring(3, trimmed.length() - 2).trim();
        }
        return trimmed;
    }
    
    private Expression parse(String source, String location) {
        Expression cached = cache.get(source);
        if (cached != null) {
            return cached;
        }
        try {
            Expression parsed = parser.parseExpression(source);
            cache.put(source, parsed);
            return parsed;
        } catch (ParseException e) {
            throw new ConfigurationException(location + ".if",
                "invalid condition '" + source + "': " + e.getMessage());
        }
    }
    
    /**
     * Root object of condition expressions.
     */
    public static class ConditionRoot {
        
        private final ExpressionScope scope;
        private final Map<String, StepView> steps;
        
        ConditionRoot(ExpressionScope scope) {
            this.scope = scope;
            Map<String, StepView> views = new LinkedHashMap<>();
            // Every declared step is addressable; steps not yet run have an empty outcome
            for (String stepId : scope.declaredStepIds()) {
                views.put(stepId, StepView.NOT_RUN);
            }
            scope.steps().forEach((id, result) -> views.put(id, StepView.of(result)));
            this.steps = Collections.unmodifiableMap(views);
        }
        
        public boolean success() {
            return !scope.hasFatalFailure();
        }
        
        public boolean failure() {
            return scope.hasFailure();
        }
        
        public boolean always() {
            return true;
        }
        
        public Map<String, StepView> getSteps() {
            return steps;
        }
        
        public Map<String, String> getEnv() {
            return scope.env();
        }
        
        public Map<String, String> getInputs() {
            return scope.inputs();
        }
        
        public EventView getEvent() {
            return new EventView(scope.event());
        }
    }
    
    /**
     * Outcome and outputs of an earlier step as seen from a condition.
     */
    public static class StepView {
        
        static final StepView NOT_RUN = new StepView("", "", Map.of());
        
        private final String outcome;
        private final String conclusion;
        private final Map<String, String> outputs;
        
        private StepView(String outcome, String conclusion, Map<String, String> outputs) {
            this.outcome = outcome;
            this.conclusion = conclusion;
            this.outputs = outputs;
        }
        
        static StepView of(StepResult result) {
            String outcome = result.outcome().label();
            String conclusion = result.isFailure() && result.bestEffort() ? "success" : outcome;
            return new StepView(outcome, conclusion, result.outputs());
        }
        
        public String getOutcome() {
            return outcome;
        }
        
        /**
         * Outcome after best-effort handling: a tolerated failure concludes as success.
         */
        public String getConclusion() {
            return conclusion;
        }
        
        public Map<String, String> getOutputs() {
            return outputs;
        }
    }
    
    /**
     * Triggering event fields as seen from a condition.
     */
    public static class EventView {
        
        private final RepositoryEvent event;
        
        EventView(RepositoryEvent event) {
            this.event = event;
        }
        
        public String getKind() {
            return event.kind().triggerName();
        }
        
        public String getRef() {
            return event.ref();
        }
        
        public String getBranch() {
            return event.branch();
        }
        
        public String getBaseBranch() {
            return event.baseBranch();
        }
        
        public String getSha() {
            return event.commitSha();
        }
        
        public String getActor() {
            return event.actor();
        }
        
        public boolean isPullRequest() {
            return event.kind().isPullRequest();
        }
    }
}
