package com.taskgraph.core.model.recurrence;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A generator that materializes copies of a template task on a rolling horizon.
 *
 * Invariants:
 * - nextOccurrence only moves forward
 * - an inactive generator has no next occurrence to materialize
 * - createdInstances keeps creation order
 */
public record RecurringTask(
    // Identity
    String id,
    String templateTaskId,
    String projectId,
    String boardId,
    String listId,

    // Schedule
    RecurrencePattern pattern,
    LocalDate anchorDate,
    int autoCreateDaysAhead,
    boolean skipWeekends,
    boolean adjustDueDate,

    // Template
    String titleTemplate,
    String descriptionTemplate,
    String assigneeId,
    String priority,
    List<String> tags,

    // Progress
    Instant nextOccurrence,
    Instant lastCreated,
    List<String> createdInstances,
    List<OccurrenceFailure> failures,
    boolean active,

    // Metadata
    String createdBy,
    Instant createdAt
) {
    public static final int DEFAULT_DAYS_AHEAD = 7;

    public RecurringTask {
        tags = tags == null ? List.of() : List.copyOf(tags);
        createdInstances = createdInstances == null ? List.of() : List.copyOf(createdInstances);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * A creation attempt that threw. The generator moved past the occurrence anyway.
     */
    public record OccurrenceFailure(
        Instant occurrence,
        String error,
        Instant failedAt
    ) {}

    public static RecurringTask create(
            String templateTaskId,
            String projectId,
            RecurrencePattern pattern,
            LocalDate anchorDate,
            String titleTemplate,
            String descriptionTemplate,
            String createdBy,
            Instant createdAt) {
        return new RecurringTask(
            UUID.randomUUID().toString(),
            templateTaskId,
            projectId,
            null,
            null,
            pattern,
            anchorDate,
            DEFAULT_DAYS_AHEAD,
            false,
            true,
            titleTemplate,
            descriptionTemplate,
            null,
            null,
            List.of(),
            null,
            null,
            List.of(),
            List.of(),
            true,
            createdBy,
            createdAt
        );
    }

    public int occurrencesCreated() {
        return createdInstances.size();
    }

    public RecurringTask withNextOccurrence(Instant next) {
        return new RecurringTask(
            id, templateTaskId, projectId, boardId, listId, pattern, anchorDate,
            autoCreateDaysAhead, skipWeekends, adjustDueDate,
            titleTemplate, descriptionTemplate, assigneeId, priority, tags,
            next, lastCreated, createdInstances, failures, active, createdBy, createdAt
        );
    }

    public RecurringTask withCreatedInstance(String taskId, Instant at) {
        List<String> instances = new ArrayList<>(createdInstances);
        instances.add(taskId);
        return new RecurringTask(
            id, templateTaskId, projectId, boardId, listId, pattern, anchorDate,
            autoCreateDaysAhead, skipWeekends, adjustDueDate,
            titleTemplate, descriptionTemplate, assigneeId, priority, tags,
            nextOccurrence, at, instances, failures, active, createdBy, createdAt
        );
    }

    public RecurringTask withFailure(OccurrenceFailure failure) {
        List<OccurrenceFailure> newFailures = new ArrayList<>(failures);
        newFailures.add(failure);
        return new RecurringTask(
            id, templateTaskId, projectId, boardId, listId, pattern, anchorDate,
            autoCreateDaysAhead, skipWeekends, adjustDueDate,
            titleTemplate, descriptionTemplate, assigneeId, priority, tags,
            nextOccurrence, lastCreated, createdInstances, newFailures, active, createdBy, createdAt
        );
    }

    public RecurringTask deactivated() {
        return new RecurringTask(
            id, templateTaskId, projectId, boardId, listId, pattern, anchorDate,
            autoCreateDaysAhead, skipWeekends, adjustDueDate,
            titleTemplate, descriptionTemplate, assigneeId, priority, tags,
            null, lastCreated, createdInstances, failures, false, createdBy, createdAt
        );
    }

    /**
     * Copy with placement and template overrides.
     */
    public RecurringTask withOptions(String newBoardId, String newListId, int daysAhead,
                                     boolean newSkipWeekends, boolean newAdjustDueDate,
                                     String newAssigneeId, String newPriority, List<String> newTags) {
        return new RecurringTask(
            id, templateTaskId, projectId, newBoardId, newListId, pattern, anchorDate,
            daysAhead, newSkipWeekends, newAdjustDueDate,
            titleTemplate, descriptionTemplate, newAssigneeId, newPriority, newTags,
            nextOccurrence, lastCreated, createdInstances, failures, active, createdBy, createdAt
        );
    }
}
