package com.taskgraph.core.exception;

/**
 * Thrown when an entity that must be unique already exists.
 */
public class DuplicateEntityException extends TaskGraphException {

    public static final String ERROR_CODE = "DUPLICATE_ENTITY";

    private final String existingId;

    public DuplicateEntityException(String entityType, String key, String existingId) {
        super(ERROR_CODE, String.format(
            "%s for '%s' already exists: %s",
            entityType, key, existingId
        ));
        this.existingId = existingId;
    }

    public String getExistingId() {
        return existingId;
    }
}
