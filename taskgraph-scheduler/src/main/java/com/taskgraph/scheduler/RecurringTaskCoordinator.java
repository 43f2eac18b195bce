package com.taskgraph.scheduler;

import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.recurrence.RecurrencePattern;
import com.taskgraph.core.model.recurrence.RecurrencePreview;
import com.taskgraph.core.model.recurrence.RecurringTask;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.repository.RecurringTaskRepository;
import com.taskgraph.core.spi.TaskStore;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Recurring-task coordinator: validates and stores generators and hands materialization
 * to the {@link RecurringTaskMaterializer}.
 */
public class RecurringTaskCoordinator implements RecurringTaskService {

    private static final Logger log = LoggerFactory.getLogger(RecurringTaskCoordinator.class);

    private static final String GENERATOR_SCOPE = "recurring-task";
    private static final int MAX_DAYS_AHEAD = 365;

    private final RecurringTaskRepository repository;
    private final TaskStore taskStore;
    private final RecurrenceCalculator calculator;
    private final RecurringTaskMaterializer materializer;
    private final KeyedLocks locks;
    private final EngineMetrics metrics;
    private final Clock clock;

    public RecurringTaskCoordinator(
            RecurringTaskRepository repository,
            TaskStore taskStore,
            RecurrenceCalculator calculator,
            RecurringTaskMaterializer materializer,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        this.repository = repository;
        this.taskStore = taskStore;
        this.calculator = calculator;
        this.materializer = materializer;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public RecurringTask createRecurringTask(CreateRecurringTaskRequest request) {
        RecurrencePattern pattern = request.pattern();
        calculator.validate(pattern);

        int daysAhead = request.autoCreateDaysAhead() != null
            ? request.autoCreateDaysAhead()
            : RecurringTask.DEFAULT_DAYS_AHEAD;
        if (daysAhead < 0 || daysAhead > MAX_DAYS_AHEAD) {
            throw new ValidationException("autoCreateDaysAhead", "must be between 0 and " + MAX_DAYS_AHEAD);
        }

        TaskRecord template = taskStore.get(request.templateTaskId())
            .orElseThrow(() -> new NotFoundException("Task", request.templateTaskId()));

        LocalDate anchor = request.anchorDate() != null
            ? request.anchorDate()
            : LocalDate.now(clock.withZone(pattern.zone()));

        // The anchor date itself may hold the first occurrence
        Instant beforeAnchor = anchor.atStartOfDay(pattern.zone()).toInstant().minusNanos(1);
        Instant first = calculator.nextOccurrence(pattern, beforeAnchor, anchor, 0)
            .map(ZonedDateTime::toInstant)
            .orElseThrow(() -> new ValidationException("pattern", "has no occurrence on or after " + anchor));

        RecurringTask recurringTask = RecurringTask.create(
                template.id(),
                template.projectId(),
                pattern,
                anchor,
                request.titleTemplate(),
                request.descriptionTemplate(),
                request.createdBy(),
                clock.instant())
            .withOptions(
                request.boardId(),
                request.listId(),
                daysAhead,
                request.skipWeekends(),
                request.adjustDueDate() == null || request.adjustDueDate(),
                request.assigneeId(),
                request.priority(),
                request.tags())
            .withNextOccurrence(first);

        try (var ctx = LoggingContext.forRecurringTask(recurringTask.id(), recurringTask.projectId())) {
            repository.save(recurringTask);
            metrics.setActiveGenerators(repository.countActive());
            log.info("Created recurring task {} from template {}: {}, first occurrence {}",
                recurringTask.id(), template.id(), calculator.describe(pattern), first);
        }
        return recurringTask;
    }

    @Override
    public RecurringTask getRecurringTask(String recurringTaskId) {
        return repository.findById(recurringTaskId)
            .orElseThrow(() -> new NotFoundException("RecurringTask", recurringTaskId));
    }

    @Override
    public List<RecurringTask> listRecurringTasks(String projectId) {
        return repository.findByProject(projectId);
    }

    @Override
    public RecurringTask deactivate(String recurringTaskId) {
        return locks.withLock(KeyedLocks.key(GENERATOR_SCOPE, recurringTaskId), () -> {
            RecurringTask existing = getRecurringTask(recurringTaskId);
            if (!existing.active()) {
                return existing;
            }
            RecurringTask stopped = existing.deactivated();
            repository.save(stopped);
            metrics.setActiveGenerators(repository.countActive());
            log.info("Deactivated recurring task {} after {} instance(s)",
                recurringTaskId, stopped.occurrencesCreated());
            return stopped;
        });
    }

    @Override
    public RecurrencePreview preview(RecurrencePattern pattern, LocalDate start, int count) {
        return calculator.preview(pattern, start, count);
    }

    @Override
    public MaterializationReport materializeNow() {
        return materializer.materializeNow();
    }
}
