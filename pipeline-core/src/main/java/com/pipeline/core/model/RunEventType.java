package com.pipeline.core.model;

/**
 * Types of facts recorded in a run's log.
 */
public enum RunEventType {
    // Run lifecycle
    RUN_QUEUED,
    RUN_STARTED,
    RUN_COMPLETED,
    RUN_FAILED,
    RUN_CANCELLED,
    RUN_SKIPPED,
    
    // Job lifecycle
    JOB_STARTED,
    JOB_SUCCEEDED,
    JOB_FAILED,
    JOB_SKIPPED,
    JOB_CANCELLED,
    JOB_TIMED_OUT,
    
    // Step lifecycle
    STEP_SUCCEEDED,
    STEP_FAILED,
    STEP_SKIPPED,
    
    // Cache
    CACHE_HIT,
    CACHE_MISS,
    CACHE_STORED,
    
    // Artifacts
    ARTIFACT_UPLOADED,
    ARTIFACT_DOWNLOADED,
    
    // Deployment
    DEPLOYMENT_PUBLISHED,
    DEPLOYMENT_DENIED,
    
    // Quality
    QUALITY_REPORTED
}
