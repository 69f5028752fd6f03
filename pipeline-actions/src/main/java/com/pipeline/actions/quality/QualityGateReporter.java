package com.pipeline.actions.quality;

import com.pipeline.core.exception.AnalysisServiceUnavailableException;
import com.pipeline.core.model.Finding;
import com.pipeline.core.model.QualityReport;
import com.pipeline.core.model.QualityStatus;
import com.pipeline.core.model.RepositoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs analysis against a baseline and reports the verdict to change requests.
 * 
 * Findings whose fingerprint appears in the baseline are marked pre-existing and
 * never fail the gate. An unavailable analysis service yields an INDETERMINATE
 * report instead of a failure.
 */
public class QualityGateReporter {
    
    private static final Logger log = LoggerFactory.getLogger(QualityGateReporter.class);
    
    private final AnalysisService analysisService;
    private final ChangeRequestReporter changeRequestReporter;
    
    // Key: projectKey:branch
    private final Map<String, QualityReport> latestByBranch = new ConcurrentHashMap<>();
    
    public QualityGateReporter(AnalysisService analysisService, ChangeRequestReporter changeRequestReporter) {
        this.analysisService = analysisService;
        this.changeRequestReporter = changeRequestReporter;
    }
    
    /**
     * Analyze a code tree.
     * 
     * @param codeTree Root of the checked-out code
     * @param project Project identifiers
     * @param branch Branch the code tree belongs to
     * @param baseline Earlier report to compare against, or null
     */
    public QualityReport analyze(Path codeTree, AnalysisProject project, String branch, QualityReport baseline) {
        List<Finding> findings;
        try {
            findings = analysisService.analyze(codeTree, project);
        } catch (AnalysisServiceUnavailableException e) {
            log.warn("Analysis unavailable for {}: {}", project.projectKey(), e.getMessage());
            return QualityReport.indeterminate(project.projectKey(), branch, e.getMessage());
        }
        
        Set<String> known = baseline == null ? Set.of() : baseline.findings().stream()
            .map(Finding::fingerprint)
            .collect(Collectors.toSet());
        List<Finding> marked = findings.stream()
            .map(f -> f.withPreExisting(known.contains(f.fingerprint())))
            .toList();
        
        QualityReport report = QualityReport.of(project.projectKey(), branch, marked);
        log.info("Quality gate for {} on {}: {} ({})", project.projectKey(), branch, report.status(), report.summary());
        return report;
    }
    
    /**
     * Keep a report as the baseline for later change requests against its branch.
     * Indeterminate reports are not kept.
     */
    public void record(QualityReport report) {
        if (report.status() != QualityStatus.INDETERMINATE) {
            latestByBranch.put(key(report.projectKey(), report.branch()), report);
        }
    }
    
    public Optional<QualityReport> baselineFor(String projectKey, String branch) {
        if (branch == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestByBranch.get(key(projectKey, branch)));
    }
    
    /**
     * Post a report to the change request of a pull-request event. Other events are ignored.
     * 
     * @return true if the report was posted
     */
    public boolean report(RepositoryEvent event, QualityReport report) {
        if (!event.kind().isPullRequest()) {
            return false;
        }
        changeRequestReporter.post(event, report);
        return true;
    }
    
    private static String key(String projectKey, String branch) {
        return projectKey + ":" + branch;
    }
}
