package com.pipeline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of a quality analysis. Status is derived from new blocking findings only;
 * findings already present in the baseline do not fail the gate.
 */
public record QualityReport(
    String projectKey,
    String branch,
    QualityStatus status,
    List<Finding> findings,
    String summary,
    Instant analyzedAt
) {
    public QualityReport {
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    /**
     * Build a determinate report from findings.
     */
    public static QualityReport of(String projectKey, String branch, List<Finding> findings) {
        long blocking = findings.stream()
            .filter(f -> !f.preExisting() && f.severity().isBlocking())
            .count();
        long preExisting = findings.stream().filter(Finding::preExisting).count();
        QualityStatus status = blocking > 0 ? QualityStatus.FAILED : QualityStatus.PASSED;
        String summary = String.format("%d finding(s), %d new blocking, %d pre-existing",
            findings.size(), blocking, preExisting);
        return new QualityReport(projectKey, branch, status, findings, summary, Instant.now());
    }

    public static QualityReport indeterminate(String projectKey, String branch, String reason) {
        return new QualityReport(projectKey, branch, QualityStatus.INDETERMINATE, List.of(),
            "Analysis unavailable: " + reason, Instant.now());
    }

    public boolean passed() {
        return status == QualityStatus.PASSED;
    }
}
