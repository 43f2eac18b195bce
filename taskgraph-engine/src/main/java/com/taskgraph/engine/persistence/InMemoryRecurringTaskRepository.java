package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.recurrence.RecurringTask;
import com.taskgraph.core.repository.RecurringTaskRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RecurringTaskRepository.
 */
@Repository
public class InMemoryRecurringTaskRepository implements RecurringTaskRepository {

    private final Map<String, RecurringTask> recurringTasks = new ConcurrentHashMap<>();

    @Override
    public void save(RecurringTask recurringTask) {
        recurringTasks.put(recurringTask.id(), recurringTask);
    }

    @Override
    public Optional<RecurringTask> findById(String recurringTaskId) {
        return Optional.ofNullable(recurringTasks.get(recurringTaskId));
    }

    @Override
    public List<RecurringTask> findDue(Instant horizon, int limit) {
        return recurringTasks.values().stream()
            .filter(RecurringTask::active)
            .filter(r -> r.nextOccurrence() != null && !r.nextOccurrence().isAfter(horizon))
            .sorted(Comparator.comparing(RecurringTask::nextOccurrence))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<RecurringTask> findByProject(String projectId) {
        return recurringTasks.values().stream()
            .filter(r -> projectId.equals(r.projectId()))
            .sorted(Comparator.comparing(RecurringTask::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public long countActive() {
        return recurringTasks.values().stream()
            .filter(RecurringTask::active)
            .count();
    }
}
