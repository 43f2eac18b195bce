package com.taskgraph.core.model.dependency;

import java.util.List;

/**
 * A task that holds up many others.
 */
public record Bottleneck(
    String taskId,
    List<String> blockedTaskIds,
    Severity severity
) {
    public static final int MEDIUM_THRESHOLD = 3;
    public static final int HIGH_THRESHOLD = 5;

    public enum Severity {
        MEDIUM,
        HIGH
    }

    public Bottleneck {
        blockedTaskIds = List.copyOf(blockedTaskIds);
    }

    public int blockingCount() {
        return blockedTaskIds.size();
    }

    /**
     * Classify a blocked-task count; below the medium threshold a task is no bottleneck.
     */
    public static Severity classify(int blockedCount) {
        if (blockedCount >= HIGH_THRESHOLD) {
            return Severity.HIGH;
        }
        return blockedCount >= MEDIUM_THRESHOLD ? Severity.MEDIUM : null;
    }
}
