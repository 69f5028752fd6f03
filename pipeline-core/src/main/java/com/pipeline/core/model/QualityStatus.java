package com.pipeline.core.model;

/**
 * Quality gate verdict. INDETERMINATE means no analysis could be performed.
 */
public enum QualityStatus {
    PASSED,
    FAILED,
    INDETERMINATE
}
