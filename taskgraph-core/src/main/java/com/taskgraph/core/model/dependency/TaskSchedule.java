package com.taskgraph.core.model.dependency;

/**
 * Critical-path schedule of one task, in day offsets from the project start.
 */
public record TaskSchedule(
    String taskId,
    int durationDays,
    int earliestStart,
    int earliestFinish,
    int latestStart,
    int latestFinish
) {
    public int slack() {
        return latestStart - earliestStart;
    }

    public boolean isCritical() {
        return slack() == 0;
    }
}
