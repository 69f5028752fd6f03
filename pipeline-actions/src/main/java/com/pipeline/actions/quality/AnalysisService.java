package com.pipeline.actions.quality;

import com.pipeline.core.exception.AnalysisServiceUnavailableException;
import com.pipeline.core.model.Finding;

import java.nio.file.Path;
import java.util.List;

/**
 * Static analysis over a code tree.
 */
public interface AnalysisService {

    /**
     * Analyze the project's sources below the code tree.
     * 
     * @param codeTree Root of the checked-out code
     * @param project Project identifiers
     * @return Findings, possibly empty
     * @throws AnalysisServiceUnavailableException if no analysis could be performed
     */
    List<Finding> analyze(Path codeTree, AnalysisProject project);
}
