package com.pipeline.actions.quality;

import com.pipeline.core.model.QualityReport;
import com.pipeline.core.model.RepositoryEvent;

/**
 * Posts a quality report back to the originating change request
 * as a status plus inline annotations.
 */
public interface ChangeRequestReporter {

    void post(RepositoryEvent event, QualityReport report);
}
