package com.pipeline.core.exception;

/**
 * A workflow definition or run lookup found nothing.
 */
public class NotFoundException extends PipelineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
