package com.taskgraph.core.exception;

/**
 * Thrown when a requested entity is not found.
 */
public class NotFoundException extends TaskGraphException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
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
