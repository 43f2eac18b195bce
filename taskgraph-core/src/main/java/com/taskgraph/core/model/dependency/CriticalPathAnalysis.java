package com.taskgraph.core.model.dependency;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a critical-path computation over a project's scheduling edges.
 *
 * Invariants:
 * - every schedule has slack >= 0
 * - criticalTasks holds exactly the zero-slack tasks, ordered by earliest start
 * - projectDurationDays is the maximum earliest finish
 */
public record CriticalPathAnalysis(
    String projectId,
    List<String> criticalTasks,
    int projectDurationDays,
    Map<String, TaskSchedule> schedules,
    LocalDate startDate,
    Instant analyzedAt
) {
    public CriticalPathAnalysis {
        criticalTasks = List.copyOf(criticalTasks);
        schedules = Map.copyOf(schedules);
    }

    public Optional<TaskSchedule> schedule(String taskId) {
        return Optional.ofNullable(schedules.get(taskId));
    }

    public Optional<LocalDate> earliestStartDate(String taskId) {
        return schedule(taskId).map(s -> startDate.plusDays(s.earliestStart()));
    }

    public Optional<LocalDate> latestFinishDate(String taskId) {
        return schedule(taskId).map(s -> startDate.plusDays(s.latestFinish()));
    }

    public LocalDate projectEndDate() {
        return startDate.plusDays(projectDurationDays);
    }
}
