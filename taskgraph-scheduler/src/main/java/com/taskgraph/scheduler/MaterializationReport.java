package com.taskgraph.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one materializer run.
 */
public record MaterializationReport(
    Instant ranAt,
    int generatorsProcessed,
    List<String> createdTaskIds,
    int failures,
    int deactivated
) {
    public MaterializationReport {
        createdTaskIds = List.copyOf(createdTaskIds);
    }

    public int created() {
        return createdTaskIds.size();
    }
}
