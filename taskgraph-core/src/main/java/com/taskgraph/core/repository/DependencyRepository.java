package com.taskgraph.core.repository;

import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyType;

import java.util.List;
import java.util.Optional;

/**
 * Repository for task dependencies.
 * Query results are snapshots; later writes do not affect a returned list.
 */
public interface DependencyRepository {

    /**
     * Store a new dependency.
     *
     * @param dependency The dependency to store
     */
    void save(Dependency dependency);

    /**
     * Find a dependency by ID.
     *
     * @param dependencyId The dependency ID
     * @return The dependency if found
     */
    Optional<Dependency> findById(String dependencyId);

    /**
     * Find the active dependency with the given endpoints and type.
     *
     * @param sourceTaskId The source task
     * @param targetTaskId The target task
     * @param type The dependency type
     * @return The matching dependency if one exists
     */
    Optional<Dependency> findActive(String sourceTaskId, String targetTaskId, DependencyType type);

    /**
     * List active dependencies of a project in insertion order.
     *
     * @param projectId The project ID
     * @return Active dependencies of the project
     */
    List<Dependency> findActiveByProject(String projectId);

    /**
     * List active dependencies touching a task, as source or target.
     *
     * @param taskId The task ID
     * @return Active dependencies involving the task
     */
    List<Dependency> findActiveByTask(String taskId);

    /**
     * Remove a dependency.
     *
     * @param dependencyId The dependency ID
     * @return true if a dependency was removed
     */
    boolean delete(String dependencyId);
}
