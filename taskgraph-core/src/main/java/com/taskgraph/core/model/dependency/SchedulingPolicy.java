package com.taskgraph.core.model.dependency;

import java.util.Set;

/**
 * Tunables for dependency analysis.
 *
 * Invariants:
 * - defaultDurationDays >= 0
 * - longChainThreshold >= 1
 * - denseTaskThreshold >= 1
 */
public record SchedulingPolicy(
    int defaultDurationDays,
    Set<String> completedStatuses,
    int longChainThreshold,
    int denseTaskThreshold
) {
    public SchedulingPolicy {
        if (defaultDurationDays < 0) {
            throw new IllegalArgumentException("defaultDurationDays must be >= 0");
        }
        if (longChainThreshold < 1 || denseTaskThreshold < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
        completedStatuses = completedStatuses == null ? Set.of() : Set.copyOf(completedStatuses);
    }

    /**
     * One-day tasks, "done"/"completed" as finished statuses, warnings past 10 chained
     * tasks or 5 dependencies on one task.
     */
    public static SchedulingPolicy defaults() {
        return new SchedulingPolicy(1, Set.of("done", "completed"), 10, 5);
    }

    public boolean isCompleted(String status) {
        return status != null && completedStatuses.contains(status.toLowerCase());
    }
}
