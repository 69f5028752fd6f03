package com.pipeline.actions.quality;

import com.pipeline.core.model.Finding;
import com.pipeline.core.model.QualityReport;
import com.pipeline.core.model.RepositoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reporter that writes the status and annotations to the log and keeps the
 * posted reports, for deployments without a hosting platform integration.
 */
public class LoggingChangeRequestReporter implements ChangeRequestReporter {
    
    private static final Logger log = LoggerFactory.getLogger(LoggingChangeRequestReporter.class);
    
    private final List<Posted> posted = Collections.synchronizedList(new ArrayList<>());
    
    @Override
    public void post(RepositoryEvent event, QualityReport report) {
        log.info("Quality gate {} for {}#{}: {}", report.status(), event.repository(),
            event.changeRequestNumber(), report.summary());
        for (Finding finding : report.findings()) {
            if (!finding.preExisting()) {
                log.info("  {}:{} [{}] {} {}", finding.file(), finding.line(), finding.severity(),
                    finding.rule(), finding.message());
            }
        }
        posted.add(new Posted(event.repository(), event.changeRequestNumber(), report));
    }
    
    public List<Posted> getPosted() {
        synchronized (posted) {
            return List.copyOf(posted);
        }
    }
    
    public record Posted(String repository, Integer changeRequestNumber, QualityReport report) {
    }
}
