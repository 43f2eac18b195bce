package com.taskgraph.scheduler;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.recurrence.EndType;
import com.taskgraph.core.model.recurrence.RecurrencePattern;
import com.taskgraph.core.model.recurrence.RecurringTask;
import com.taskgraph.core.model.recurrence.RecurringTask.OccurrenceFailure;
import com.taskgraph.core.model.task.TaskFields;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.repository.RecurringTaskRepository;
import com.taskgraph.core.spi.TaskStore;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic driver that turns due recurrence occurrences into tasks.
 *
 * Responsibilities:
 * - Poll active generators on a fixed delay
 * - Create one task per occurrence inside each generator's look-ahead window
 * - Skip excluded dates, holidays and (optionally) weekends
 * - Deactivate generators whose end condition is reached
 *
 * Each generator is processed under its own lock, so a run triggered by hand and a scheduled
 * run never create the same occurrence twice.
 */
public class RecurringTaskMaterializer {

    private static final Logger log = LoggerFactory.getLogger(RecurringTaskMaterializer.class);

    private static final String GENERATOR_SCOPE = "recurring-task";

    /**
     * Generators are fetched this far ahead; each one's own look-ahead window is applied after.
     */
    static final Duration MAX_LOOK_AHEAD = Duration.ofDays(365);

    private final RecurringTaskRepository repository;
    private final TaskStore taskStore;
    private final RecurrenceCalculator calculator;
    private final KeyedLocks locks;
    private final EngineMetrics metrics;
    private final MaterializerSettings settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final AtomicReference<MaterializationReport> lastRun = new AtomicReference<>();
    private volatile boolean running = false;

    public RecurringTaskMaterializer(
            RecurringTaskRepository repository,
            TaskStore taskStore,
            RecurrenceCalculator calculator,
            KeyedLocks locks,
            EngineMetrics metrics,
            MaterializerSettings settings,
            Clock clock) {
        this.repository = repository;
        this.taskStore = taskStore;
        this.calculator = calculator;
        this.locks = locks;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "recurring-task-materializer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the scheduled runs.
     */
    public void start() {
        if (running) {
            log.warn("Recurring-task materializer already running");
            return;
        }

        running = true;
        log.info("Starting recurring-task materializer, polling every {}", settings.pollInterval());

        long periodMillis = settings.pollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::poll, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the scheduled runs, waiting for one in progress.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recurring-task materializer stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<MaterializationReport> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    /**
     * Run once on the caller's thread.
     *
     * @return What this run created, failed and deactivated
     */
    public MaterializationReport materializeNow() {
        Instant now = clock.instant();
        List<RecurringTask> due = repository.findDue(now.plus(MAX_LOOK_AHEAD), settings.batchSize());

        List<String> created = new ArrayList<>();
        int failures = 0;
        int deactivated = 0;
        for (RecurringTask candidate : due) {
            GeneratorRun run = locks.withLock(KeyedLocks.key(GENERATOR_SCOPE, candidate.id()),
                () -> materialize(candidate.id(), now));
            created.addAll(run.created());
            failures += run.failed() ? 1 : 0;
            deactivated += run.deactivated() ? 1 : 0;
        }

        metrics.setActiveGenerators(repository.countActive());
        MaterializationReport report = new MaterializationReport(now, due.size(), created, failures, deactivated);
        lastRun.set(report);

        if (!created.isEmpty() || failures > 0 || deactivated > 0) {
            log.info("Materialized {} task(s) from {} generator(s); {} failed, {} deactivated",
                created.size(), due.size(), failures, deactivated);
        }
        return report;
    }

    // ========== Internal Methods ==========

    private void poll() {
        if (!running) return;

        try {
            materializeNow();
        } catch (Exception e) {
            log.error("Error materializing recurring tasks", e);
        } finally {
            LoggingContext.clearAll();
        }
    }

    private GeneratorRun materialize(String generatorId, Instant now) {
        // Re-read under the lock; another run may have advanced it
        RecurringTask generator = repository.findById(generatorId).orElse(null);
        if (generator == null || !generator.active() || generator.nextOccurrence() == null) {
            return GeneratorRun.NOTHING;
        }

        try (var ctx = LoggingContext.forRecurringTask(generator.id(), generator.projectId())) {
            RecurrencePattern pattern = generator.pattern();
            Instant horizon = now.plus(generator.autoCreateDaysAhead(), ChronoUnit.DAYS);
            List<String> created = new ArrayList<>();
            boolean failed = false;

            while (generator.active() && !generator.nextOccurrence().isAfter(horizon)) {
                Instant occurrence = generator.nextOccurrence();
                LocalDate date = occurrence.atZone(pattern.zone()).toLocalDate();

                if (endReached(generator, date)) {
                    generator = generator.deactivated();
                    log.info("Recurring task {} reached its end condition", generator.id());
                    break;
                }

                if (skipped(generator, date)) {
                    log.debug("Skipping occurrence {} of recurring task {}", date, generator.id());
                    generator = advance(generator, occurrence);
                    continue;
                }

                try {
                    String taskId = createInstance(generator, date);
                    generator = generator.withCreatedInstance(taskId, clock.instant());
                    created.add(taskId);
                    metrics.recurringInstanceCreated();
                    log.info("Created task {} for occurrence {} of recurring task {}",
                        taskId, date, generator.id());
                    generator = advance(generator, occurrence);
                } catch (RuntimeException e) {
                    log.warn("Failed to create occurrence {} of recurring task {}: {}",
                        date, generator.id(), e.getMessage());
                    metrics.recurringInstanceFailed();
                    generator = advance(
                        generator.withFailure(new OccurrenceFailure(occurrence, e.getMessage(), clock.instant())),
                        occurrence);
                    failed = true;
                    break;
                }
            }

            repository.save(generator);
            return new GeneratorRun(created, failed, !generator.active());
        }
    }

    private RecurringTask advance(RecurringTask generator, Instant occurrence) {
        Optional<Instant> next = calculator.nextOccurrence(
                generator.pattern(), occurrence, generator.anchorDate(), generator.occurrencesCreated())
            .map(ZonedDateTime::toInstant);
        if (next.isEmpty()) {
            log.info("Recurring task {} has no further occurrences", generator.id());
            return generator.deactivated();
        }
        return generator.withNextOccurrence(next.get());
    }

    private static boolean endReached(RecurringTask generator, LocalDate date) {
        RecurrencePattern pattern = generator.pattern();
        if (pattern.endType() == EndType.DATE && pattern.endDate() != null) {
            return date.isAfter(pattern.endDate());
        }
        if (pattern.endType() == EndType.COUNT && pattern.endCount() != null) {
            return generator.occurrencesCreated() >= pattern.endCount();
        }
        return false;
    }

    private boolean skipped(RecurringTask generator, LocalDate date) {
        return calculator.isExcluded(generator.pattern(), date)
            || (generator.skipWeekends() && RecurrenceCalculator.isWeekend(date));
    }

    private String createInstance(RecurringTask generator, LocalDate date) {
        TaskRecord template = taskStore.get(generator.templateTaskId())
            .orElseThrow(() -> new NotFoundException("Template task", generator.templateTaskId()));

        int count = generator.occurrencesCreated() + 1;
        String title = generator.titleTemplate() != null
            ? substitute(generator.titleTemplate(), date, count, template)
            : template.title();
        String description = generator.descriptionTemplate() != null
            ? substitute(generator.descriptionTemplate(), date, count, template)
            : template.description();

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put(TaskFields.PROJECT_ID, FieldValue.text(generator.projectId()));
        fields.put(TaskFields.BOARD_ID, FieldValue.text(
            generator.boardId() != null ? generator.boardId() : template.boardId()));
        if (generator.listId() != null) {
            fields.put(TaskFields.LIST_ID, FieldValue.text(generator.listId()));
        }
        fields.put(TaskFields.TITLE, FieldValue.text(title));
        fields.put(TaskFields.DESCRIPTION, FieldValue.text(description));
        fields.put(TaskFields.ASSIGNEE_ID, FieldValue.text(
            generator.assigneeId() != null ? generator.assigneeId() : template.assigneeId()));
        fields.put(TaskFields.PRIORITY, FieldValue.symbol(
            generator.priority() != null ? generator.priority() : template.priority()));
        fields.put(TaskFields.TAGS, FieldValue.of(
            generator.tags().isEmpty() ? template.tags() : generator.tags()));
        fields.put(TaskFields.DUE_DATE, FieldValue.date(dueDate(generator, template, date)));
        fields.put(TaskFields.RECURRING_TASK_ID, FieldValue.text(generator.id()));

        return taskStore.create(fields);
    }

    /**
     * The occurrence date, pushed out by the template's own span when due dates are adjusted.
     */
    private LocalDate dueDate(RecurringTask generator, TaskRecord template, LocalDate date) {
        if (!generator.adjustDueDate() || template.dueDate() == null || template.createdAt() == null) {
            return date;
        }
        LocalDate templateStart = template.createdAt().atZone(generator.pattern().zone()).toLocalDate();
        long span = Math.max(0, ChronoUnit.DAYS.between(templateStart, template.dueDate()));
        return date.plusDays(span);
    }

    private static String substitute(String text, LocalDate date, int count, TaskRecord template) {
        return text
            .replace("{date}", date.toString())
            .replace("{count}", String.valueOf(count))
            .replace("{title}", template.title() != null ? template.title() : "");
    }

    private record GeneratorRun(List<String> created, boolean failed, boolean deactivated) {
        static final GeneratorRun NOTHING = new GeneratorRun(List.of(), false, false);
    }
}
