package com.taskgraph.core.repository;

import com.taskgraph.core.model.recurrence.RecurringTask;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for recurring-task generators.
 */
public interface RecurringTaskRepository {

    /**
     * Store a generator, replacing any with the same id.
     *
     * @param recurringTask The generator
     */
    void save(RecurringTask recurringTask);

    /**
     * Find a generator by ID.
     *
     * @param recurringTaskId The generator ID
     * @return The generator if found
     */
    Optional<RecurringTask> findById(String recurringTaskId);

    /**
     * List active generators whose next occurrence is at or before a horizon.
     *
     * @param horizon Latest next occurrence to include
     * @param limit Maximum number of results
     * @return Due generators, earliest first
     */
    List<RecurringTask> findDue(Instant horizon, int limit);

    /**
     * List generators of a project.
     *
     * @param projectId The project ID
     * @return Generators of the project
     */
    List<RecurringTask> findByProject(String projectId);

    /**
     * Count active generators.
     *
     * @return Number of active generators
     */
    long countActive();
}
