package com.pipeline.actions.quality;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.QualityReport;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.RunEventType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code quality-gate}: analyzes the workspace and reports the verdict.
 * 
 * A failed gate does not fail the step: the verdict is exposed through the
 * {@code passed} and {@code status} outputs and, for pull requests, posted
 * to the change request. Merge policy is left to branch protection.
 */
public class QualityGateAction implements CompositeAction {
    
    public static final String NAME = "quality-gate";
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.optional("project-key", null, "Project key; overrides the properties file"),
        InputSpec.optional("organization", null, "Organization; overrides the properties file"),
        InputSpec.optional("sources", null, "Source directory; overrides the properties file"),
        InputSpec.optional("properties-file", AnalysisProject.DEFAULT_FILE, "Workspace file naming the project")
    );
    
    private final QualityGateReporter reporter;
    private final String defaultBranch;
    
    public QualityGateAction(QualityGateReporter reporter, String defaultBranch) {
        this.reporter = reporter;
        this.defaultBranch = defaultBranch;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<InputSpec> inputs() {
        return INPUTS;
    }
    
    @Override
    public ActionOutcome execute(ActionContext context) {
        AnalysisProject fromInputs = new AnalysisProject(
            context.getInput("project-key"), context.getInput("organization"), context.getInput("sources"));
        AnalysisProject project = fromInputs.orElse(
            AnalysisProject.load(context.resolve(context.getInput("properties-file"))), context.location());
        
        RepositoryEvent event = context.getRun().event();
        String baseBranch = event.kind().isPullRequest() && event.baseBranch() != null
            ? event.baseBranch()
            : defaultBranch;
        QualityReport baseline = reporter.baselineFor(project.projectKey(), baseBranch).orElse(null);
        
        QualityReport report = reporter.analyze(context.getWorkspace(), project, event.branch(), baseline);
        reporter.record(report);
        boolean posted = reporter.report(event, report);
        
        context.log("Quality gate " + report.status() + ": " + report.summary());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectKey", project.projectKey());
        payload.put("status", report.status().name());
        payload.put("findings", report.findings().size());
        payload.put("baselineBranch", baselineLabel(baseline, baseBranch));
        payload.put("posted", posted);
        context.record(RunEventType.QUALITY_REPORTED, payload);
        
        return ActionOutcome.of(Map.of(
            "passed", String.valueOf(report.passed()),
            "status", report.status().name().toLowerCase(),
            "findings", String.valueOf(report.findings().size())
        ));
    }
    
    private static String baselineLabel(QualityReport baseline, String baseBranch) {
        return baseline != null ? baseBranch : "none";
    }
}
