package com.taskgraph.core.model.dependency;

import java.time.LocalDate;
import java.util.List;

/**
 * Export of a project's dependency graph for visualization.
 */
public record DependencyGraph(
    String projectId,
    List<GraphNode> nodes,
    List<GraphEdge> edges,
    List<String> criticalPath,
    List<List<String>> cycles,
    GraphStats stats
) {
    public DependencyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        criticalPath = List.copyOf(criticalPath);
        cycles = List.copyOf(cycles);
    }

    /**
     * A task in the graph. Task fields are null when the task store no longer knows the task.
     */
    public record GraphNode(
        String taskId,
        String title,
        String status,
        String assigneeId,
        LocalDate dueDate,
        Integer slackDays,
        boolean critical
    ) {}

    public record GraphEdge(
        String dependencyId,
        String sourceTaskId,
        String targetTaskId,
        DependencyType type,
        int lagDays
    ) {}

    public record GraphStats(
        int totalTasks,
        int totalDependencies,
        int cycleCount
    ) {}
}
