package com.taskgraph.core.model.dependency;

import java.util.List;

/**
 * Health report of a project's dependencies.
 */
public record DependencyValidationResult(
    String projectId,
    boolean valid,
    List<List<String>> cycles,
    List<String> warnings,
    int totalDependencies,
    int tasksWithDependencies,
    int longestChain
) {
    public DependencyValidationResult {
        cycles = List.copyOf(cycles);
        warnings = List.copyOf(warnings);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
