package com.taskgraph.engine.coordinator;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.CycleDetectedException;
import com.taskgraph.core.exception.DuplicateEntityException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.automation.AutomationEvent;
import com.taskgraph.core.model.automation.TriggerType;
import com.taskgraph.core.model.dependency.Bottleneck;
import com.taskgraph.core.model.dependency.CriticalPathAnalysis;
import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyGraph;
import com.taskgraph.core.model.dependency.DependencyValidationResult;
import com.taskgraph.core.model.dependency.SchedulingPolicy;
import com.taskgraph.core.model.dependency.TaskSchedule;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.repository.DependencyRepository;
import com.taskgraph.core.spi.EventPublisher;
import com.taskgraph.core.spi.TaskStore;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.entity.TaskEntityAccessor;
import com.taskgraph.engine.graph.CriticalPathCalculator;
import com.taskgraph.engine.graph.CycleDetector;
import com.taskgraph.engine.graph.PrecedenceGraph;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.service.DependencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dependency graph coordinator.
 *
 * Inserts are the only check-then-act operation and run under the project's lock; every
 * analysis works on a snapshot of the project's active edges and takes no lock.
 */
public class DependencyCoordinator implements DependencyService {

    private static final Logger log = LoggerFactory.getLogger(DependencyCoordinator.class);

    private static final String PROJECT_SCOPE = "project";

    private final DependencyRepository dependencyRepository;
    private final TaskStore taskStore;
    private final EventPublisher eventPublisher;
    private final SchedulingPolicy policy;
    private final KeyedLocks locks;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final CycleDetector cycleDetector = new CycleDetector();
    private final CriticalPathCalculator criticalPathCalculator = new CriticalPathCalculator(cycleDetector);

    public DependencyCoordinator(
            DependencyRepository dependencyRepository,
            TaskStore taskStore,
            EventPublisher eventPublisher,
            SchedulingPolicy policy,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        this.dependencyRepository = dependencyRepository;
        this.taskStore = taskStore;
        this.eventPublisher = eventPublisher;
        this.policy = policy;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Dependency addDependency(AddDependencyRequest request) {
        if (request.type() == null) {
            throw new ValidationException("type", "dependency type is required");
        }
        if (request.lagDays() < Dependency.MIN_LAG_DAYS || request.lagDays() > Dependency.MAX_LAG_DAYS) {
            throw new ValidationException("lagDays", String.format("must be between %d and %d, was %d",
                Dependency.MIN_LAG_DAYS, Dependency.MAX_LAG_DAYS, request.lagDays()));
        }
        if (request.sourceTaskId() == null || request.sourceTaskId().equals(request.targetTaskId())) {
            throw new ValidationException("targetTaskId", "a task cannot depend on itself");
        }

        TaskRecord source = requireTask(request.sourceTaskId());
        TaskRecord target = requireTask(request.targetTaskId());
        if (source.projectId() == null || !source.projectId().equals(target.projectId())) {
            throw new ValidationException("targetTaskId",
                String.format("tasks belong to different projects (%s, %s)", source.projectId(), target.projectId()));
        }
        String projectId = source.projectId();

        try (var ctx = LoggingContext.forProject(projectId)) {
            return locks.withLock(KeyedLocks.key(PROJECT_SCOPE, projectId), () -> insert(projectId, request));
        }
    }

    @Override
    public void removeDependency(String dependencyId) {
        Dependency dependency = getDependency(dependencyId);
        try (var ctx = LoggingContext.forProject(dependency.projectId())) {
            locks.withLock(KeyedLocks.key(PROJECT_SCOPE, dependency.projectId()), () -> {
                if (!dependencyRepository.delete(dependencyId)) {
                    throw new NotFoundException("Dependency", dependencyId);
                }
            });
            log.info("Removed dependency {} ({} {} {})", dependencyId,
                dependency.sourceTaskId(), dependency.type(), dependency.targetTaskId());
        }
    }

    @Override
    public Dependency getDependency(String dependencyId) {
        return dependencyRepository.findById(dependencyId)
            .orElseThrow(() -> new NotFoundException("Dependency", dependencyId));
    }

    @Override
    public List<Dependency> listDependencies(String projectId) {
        return dependencyRepository.findActiveByProject(projectId);
    }

    @Override
    public List<Dependency> dependenciesOf(String taskId) {
        return dependencyRepository.findActiveByTask(taskId);
    }

    @Override
    public List<List<String>> findCycles(String projectId) {
        return cycleDetector.findCycles(PrecedenceGraph.of(dependencyRepository.findActiveByProject(projectId)));
    }

    @Override
    public CriticalPathAnalysis criticalPath(String projectId, Map<String, Integer> durations, LocalDate startDate) {
        Map<String, Integer> given = durations == null ? Map.of() : durations;
        PrecedenceGraph graph = PrecedenceGraph.of(dependencyRepository.findActiveByProject(projectId), given.keySet());
        return compute(projectId, graph, given, startDate);
    }

    @Override
    public CriticalPathAnalysis criticalPath(String projectId) {
        PrecedenceGraph graph = PrecedenceGraph.of(dependencyRepository.findActiveByProject(projectId));
        return compute(projectId, graph, estimateDurations(graph), LocalDate.now(clock));
    }

    @Override
    public DependencyGraph exportGraph(String projectId) {
        List<Dependency> dependencies = dependencyRepository.findActiveByProject(projectId);
        PrecedenceGraph graph = PrecedenceGraph.of(dependencies);
        List<List<String>> cycles = cycleDetector.findCycles(graph);

        Optional<CriticalPathAnalysis> analysis = cycles.isEmpty()
            ? Optional.of(compute(projectId, graph, estimateDurations(graph), LocalDate.now(clock)))
            : Optional.empty();

        Set<String> taskIds = new LinkedHashSet<>();
        dependencies.forEach(d -> {
            taskIds.add(d.sourceTaskId());
            taskIds.add(d.targetTaskId());
        });

        List<DependencyGraph.GraphNode> nodes = taskIds.stream()
            .map(taskId -> toNode(taskId, analysis.flatMap(a -> a.schedule(taskId))))
            .collect(Collectors.toList());
        List<DependencyGraph.GraphEdge> edges = dependencies.stream()
            .map(d -> new DependencyGraph.GraphEdge(d.id(), d.sourceTaskId(), d.targetTaskId(), d.type(), d.lagDays()))
            .collect(Collectors.toList());

        return new DependencyGraph(
            projectId,
            nodes,
            edges,
            analysis.map(CriticalPathAnalysis::criticalTasks).orElse(List.of()),
            cycles,
            new DependencyGraph.GraphStats(nodes.size(), edges.size(), cycles.size())
        );
    }

    @Override
    public DependencyValidationResult validateDependencies(String projectId) {
        List<Dependency> dependencies = dependencyRepository.findActiveByProject(projectId);
        PrecedenceGraph graph = PrecedenceGraph.of(dependencies);
        List<List<String>> cycles = cycleDetector.findCycles(graph);
        List<String> warnings = new ArrayList<>();

        int longestChain = longestChain(graph);
        if (longestChain > policy.longChainThreshold()) {
            warnings.add(String.format("Long dependency chain detected with %d tasks", longestChain));
        }

        Map<String, Integer> touching = new LinkedHashMap<>();
        for (Dependency dependency : dependencies) {
            touching.merge(dependency.sourceTaskId(), 1, Integer::sum);
            touching.merge(dependency.targetTaskId(), 1, Integer::sum);
        }
        touching.forEach((taskId, count) -> {
            if (count > policy.denseTaskThreshold()) {
                warnings.add(String.format("Task %s has %d dependencies", taskId, count));
            }
        });

        return new DependencyValidationResult(
            projectId,
            cycles.isEmpty(),
            cycles,
            warnings,
            dependencies.size(),
            touching.size(),
            longestChain
        );
    }

    @Override
    public List<TaskRecord> blockingTasks(String taskId) {
        return dependencyRepository.findActiveByTask(taskId).stream()
            .filter(Dependency::isScheduling)
            .filter(d -> d.successorId().equals(taskId))
            .map(d -> taskStore.get(d.predecessorId()))
            .flatMap(Optional::stream)
            .filter(task -> !policy.isCompleted(task.status()))
            .collect(Collectors.toList());
    }

    @Override
    public boolean canStart(String taskId) {
        return blockingTasks(taskId).isEmpty();
    }

    @Override
    public List<Bottleneck> identifyBottlenecks(String projectId) {
        Map<String, List<String>> blocked = new LinkedHashMap<>();
        for (Dependency dependency : dependencyRepository.findActiveByProject(projectId)) {
            if (dependency.isScheduling()) {
                blocked.computeIfAbsent(dependency.predecessorId(), k -> new ArrayList<>())
                    .add(dependency.successorId());
            }
        }

        List<Bottleneck> bottlenecks = new ArrayList<>();
        blocked.forEach((taskId, successors) -> {
            Bottleneck.Severity severity = Bottleneck.classify(successors.size());
            if (severity != null) {
                bottlenecks.add(new Bottleneck(taskId, successors, severity));
            }
        });
        bottlenecks.sort(Comparator.comparingInt(Bottleneck::blockingCount).reversed());
        return bottlenecks;
    }

    @Override
    public int taskCompleted(String taskId) {
        List<String> successors = dependencyRepository.findActiveByTask(taskId).stream()
            .filter(Dependency::isScheduling)
            .filter(d -> d.predecessorId().equals(taskId))
            .map(Dependency::successorId)
            .distinct()
            .collect(Collectors.toList());

        for (String successorId : successors) {
            eventPublisher.publish(new AutomationEvent(
                TriggerType.DEPENDENCY_COMPLETED,
                TaskEntityAccessor.TASK,
                successorId,
                Map.of(AutomationEvent.COMPLETED_TASK_ID, FieldValue.text(taskId)),
                clock.instant()
            ));
        }
        log.debug("Task {} completed, notified {} successor(s)", taskId, successors.size());
        return successors.size();
    }

    // ========== Internal Methods ==========

    private Dependency insert(String projectId, AddDependencyRequest request) {
        dependencyRepository.findActive(request.sourceTaskId(), request.targetTaskId(), request.type())
            .ifPresent(existing -> {
                throw new DuplicateEntityException("Dependency",
                    request.sourceTaskId() + " " + request.type() + " " + request.targetTaskId(), existing.id());
            });

        Dependency candidate = Dependency.create(
            projectId,
            request.sourceTaskId(),
            request.targetTaskId(),
            request.type(),
            request.lagDays(),
            request.notes(),
            request.actorId(),
            clock.instant()
        );

        if (candidate.isScheduling()) {
            List<Dependency> snapshot = new ArrayList<>(dependencyRepository.findActiveByProject(projectId));
            snapshot.add(candidate);
            List<List<String>> cycles = cycleDetector.findCycles(PrecedenceGraph.of(snapshot));
            if (!cycles.isEmpty()) {
                metrics.cycleRejected();
                log.warn("Rejected dependency {} {} {}: would create cycle {}",
                    request.sourceTaskId(), request.type(), request.targetTaskId(), cycles.get(0));
                throw new CycleDetectedException(cycles.get(0));
            }
        }

        dependencyRepository.save(candidate);
        metrics.dependencyAdded(candidate.type().name().toLowerCase());
        log.info("Added dependency {}: {} {} {} (lag {}d)", candidate.id(),
            candidate.sourceTaskId(), candidate.type(), candidate.targetTaskId(), candidate.lagDays());
        return candidate;
    }

    private CriticalPathAnalysis compute(String projectId, PrecedenceGraph graph,
                                         Map<String, Integer> durations, LocalDate startDate) {
        long started = System.nanoTime();
        CriticalPathAnalysis analysis = criticalPathCalculator.compute(
            projectId,
            graph,
            taskId -> durationOf(durations, taskId),
            startDate,
            clock.instant()
        );
        metrics.criticalPathComputed(Duration.ofNanos(System.nanoTime() - started));
        log.debug("Critical path for project {}: {} ({} days)",
            projectId, analysis.criticalTasks(), analysis.projectDurationDays());
        return analysis;
    }

    /**
     * A null entry counts as no duration given.
     */
    private int durationOf(Map<String, Integer> durations, String taskId) {
        Integer days = durations.get(taskId);
        return days != null ? days : policy.defaultDurationDays();
    }

    /**
     * Due date minus creation date, at least one day; the policy default when either is unknown.
     */
    private Map<String, Integer> estimateDurations(PrecedenceGraph graph) {
        Map<String, Integer> durations = new HashMap<>();
        for (String taskId : graph.taskIds()) {
            taskStore.get(taskId)
                .filter(task -> task.dueDate() != null && task.createdAt() != null)
                .ifPresent(task -> {
                    LocalDate created = task.createdAt().atZone(clock.getZone()).toLocalDate();
                    long days = ChronoUnit.DAYS.between(created, task.dueDate());
                    durations.put(taskId, (int) Math.max(1, days));
                });
        }
        return durations;
    }

    /**
     * Number of tasks on the longest precedence chain. Tasks on a cycle are left out.
     */
    private static int longestChain(PrecedenceGraph graph) {
        int n = graph.size();
        int[] inDegree = new int[n];
        int[] chain = new int[n];
        Deque<Integer> ready = new ArrayDeque<>();
        for (int v = 0; v < n; v++) {
            inDegree[v] = graph.predecessors(v).size();
            chain[v] = 1;
            if (inDegree[v] == 0) {
                ready.add(v);
            }
        }

        int longest = 0;
        while (!ready.isEmpty()) {
            int v = ready.poll();
            longest = Math.max(longest, chain[v]);
            for (PrecedenceGraph.Edge edge : graph.successors(v)) {
                chain[edge.to()] = Math.max(chain[edge.to()], chain[v] + 1);
                if (--inDegree[edge.to()] == 0) {
                    ready.add(edge.to());
                }
            }
        }
        return longest;
    }

    private TaskRecord requireTask(String taskId) {
        return taskStore.get(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    private DependencyGraph.GraphNode toNode(String taskId, Optional<TaskSchedule> schedule) {
        Optional<TaskRecord> task = taskStore.get(taskId);
        return new DependencyGraph.GraphNode(
            taskId,
            task.map(TaskRecord::title).orElse(null),
            task.map(TaskRecord::status).orElse(null),
            task.map(TaskRecord::assigneeId).orElse(null),
            task.map(TaskRecord::dueDate).orElse(null),
            schedule.map(TaskSchedule::slack).orElse(null),
            schedule.map(TaskSchedule::isCritical).orElse(false)
        );
    }
}
