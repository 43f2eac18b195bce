package com.taskgraph.core.model.dependency;

import com.taskgraph.core.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * A directed relationship between two tasks of the same project.
 *
 * Invariants:
 * - source and target differ and belong to projectId
 * - lagDays in [-365, 365]
 * - active scheduling edges of a project never form a cycle
 */
public record Dependency(
    // Identity
    String id,
    String projectId,

    // Edge
    String sourceTaskId,
    String targetTaskId,
    DependencyType type,
    int lagDays,

    // Metadata
    String notes,
    String createdBy,
    Instant createdAt,
    boolean active
) {
    public static final int MIN_LAG_DAYS = -365;
    public static final int MAX_LAG_DAYS = 365;

    public Dependency {
        if (sourceTaskId == null || targetTaskId == null) {
            throw new ValidationException("dependency", "source and target task are required");
        }
        if (type == null) {
            throw new ValidationException("type", "dependency type is required");
        }
        if (lagDays < MIN_LAG_DAYS || lagDays > MAX_LAG_DAYS) {
            throw new ValidationException("lagDays",
                String.format("must be between %d and %d, was %d", MIN_LAG_DAYS, MAX_LAG_DAYS, lagDays));
        }
    }

    /**
     * Create a new active dependency.
     */
    public static Dependency create(
            String projectId,
            String sourceTaskId,
            String targetTaskId,
            DependencyType type,
            int lagDays,
            String notes,
            String createdBy,
            Instant createdAt) {
        return new Dependency(
            UUID.randomUUID().toString(),
            projectId,
            sourceTaskId,
            targetTaskId,
            type,
            lagDays,
            notes,
            createdBy,
            createdAt,
            true
        );
    }

    public boolean isScheduling() {
        return type.isScheduling();
    }

    /**
     * The task that must finish first. Only meaningful for scheduling edges.
     */
    public String predecessorId() {
        return type == DependencyType.BLOCKED_BY ? targetTaskId : sourceTaskId;
    }

    /**
     * The task that waits. Only meaningful for scheduling edges.
     */
    public String successorId() {
        return type == DependencyType.BLOCKED_BY ? sourceTaskId : targetTaskId;
    }

    public boolean involves(String taskId) {
        return sourceTaskId.equals(taskId) || targetTaskId.equals(taskId);
    }

    public Dependency withActive(boolean newActive) {
        return new Dependency(
            id, projectId, sourceTaskId, targetTaskId, type, lagDays,
            notes, createdBy, createdAt, newActive
        );
    }
}
