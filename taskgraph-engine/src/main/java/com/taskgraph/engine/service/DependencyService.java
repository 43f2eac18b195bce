package com.taskgraph.engine.service;

import com.taskgraph.core.model.dependency.Bottleneck;
import com.taskgraph.core.model.dependency.CriticalPathAnalysis;
import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyGraph;
import com.taskgraph.core.model.dependency.DependencyType;
import com.taskgraph.core.model.dependency.DependencyValidationResult;
import com.taskgraph.core.model.task.TaskRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Dependency graph operations: edge management, cycle detection and critical-path scheduling.
 */
public interface DependencyService {

    /**
     * Create a dependency between two tasks of the same project.
     *
     * @param request The dependency to add
     * @return The stored dependency
     * @throws com.taskgraph.core.exception.CycleDetectedException if a scheduling edge would close a cycle
     * @throws com.taskgraph.core.exception.DuplicateEntityException if an identical active edge exists
     */
    Dependency addDependency(AddDependencyRequest request);

    /**
     * Remove a dependency.
     *
     * @param dependencyId The dependency ID
     */
    void removeDependency(String dependencyId);

    Dependency getDependency(String dependencyId);

    /**
     * Active dependencies of a project, in creation order.
     */
    List<Dependency> listDependencies(String projectId);

    /**
     * Active dependencies touching a task as source or target.
     */
    List<Dependency> dependenciesOf(String taskId);

    /**
     * All distinct cycles among the project's scheduling edges.
     *
     * @param projectId The project ID
     * @return Cycles as task ids in edge order; empty for an acyclic project
     */
    List<List<String>> findCycles(String projectId);

    /**
     * Critical path with explicit durations.
     *
     * @param projectId The project ID
     * @param durations Duration in days per task; missing tasks take the default duration
     * @param startDate Calendar date of day zero
     * @return The analysis
     */
    CriticalPathAnalysis criticalPath(String projectId, Map<String, Integer> durations, LocalDate startDate);

    /**
     * Critical path with durations estimated from each task's due and creation dates, starting today.
     */
    CriticalPathAnalysis criticalPath(String projectId);

    /**
     * Export nodes, edges, slack and cycles for visualization.
     */
    DependencyGraph exportGraph(String projectId);

    /**
     * Check a project's dependencies for cycles, long chains and densely connected tasks.
     */
    DependencyValidationResult validateDependencies(String projectId);

    /**
     * Predecessors of a task that are not yet completed.
     */
    List<TaskRecord> blockingTasks(String taskId);

    /**
     * Whether every predecessor of a task is completed.
     */
    boolean canStart(String taskId);

    /**
     * Tasks that precede at least three others, most blocking first.
     */
    List<Bottleneck> identifyBottlenecks(String projectId);

    /**
     * Announce a completed task to each of its successors.
     *
     * @param taskId The completed task
     * @return Number of successors notified
     */
    int taskCompleted(String taskId);

    /**
     * Request to add a dependency.
     */
    record AddDependencyRequest(
        String sourceTaskId,
        String targetTaskId,
        DependencyType type,
        int lagDays,
        String notes,
        String actorId
    ) {}
}
