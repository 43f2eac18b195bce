package com.taskgraph.engine.test;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.automation.AutomationPolicy;
import com.taskgraph.core.model.dependency.SchedulingPolicy;
import com.taskgraph.core.model.task.TaskFields;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.model.task.UserRecord;
import com.taskgraph.core.model.workflow.WorkflowPolicy;
import com.taskgraph.core.test.TimeController;
import com.taskgraph.engine.automation.StandardActionHandlers;
import com.taskgraph.engine.cache.AuthorizationCache;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.coordinator.AutomationCoordinator;
import com.taskgraph.engine.coordinator.DependencyCoordinator;
import com.taskgraph.engine.coordinator.WorkflowCoordinator;
import com.taskgraph.engine.entity.TaskEntityAccessor;
import com.taskgraph.engine.events.InMemoryEventPublisher;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.persistence.InMemoryAutomationLogRepository;
import com.taskgraph.engine.persistence.InMemoryAutomationRuleRepository;
import com.taskgraph.engine.persistence.InMemoryDependencyRepository;
import com.taskgraph.engine.persistence.InMemoryTaskStore;
import com.taskgraph.engine.persistence.InMemoryUserDirectory;
import com.taskgraph.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.taskgraph.engine.persistence.InMemoryWorkflowInstanceRepository;
import com.taskgraph.engine.workflow.TransitionAuthorizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The whole engine wired over in-memory stores and a controllable clock.
 */
public class EngineFixture {

    public final TimeController clock;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final EngineMetrics metrics = new EngineMetrics();
    public final KeyedLocks locks = new KeyedLocks();

    public final InMemoryTaskStore taskStore;
    public final InMemoryUserDirectory users = new InMemoryUserDirectory();
    public final RecordingNotificationSink notifications = new RecordingNotificationSink();
    public final InMemoryEventPublisher events = new InMemoryEventPublisher();

    public final InMemoryDependencyRepository dependencyRepository = new InMemoryDependencyRepository();
    public final InMemoryWorkflowDefinitionRepository definitionRepository = new InMemoryWorkflowDefinitionRepository();
    public final InMemoryWorkflowInstanceRepository instanceRepository = new InMemoryWorkflowInstanceRepository();
    public final InMemoryAutomationRuleRepository ruleRepository = new InMemoryAutomationRuleRepository();
    public final InMemoryAutomationLogRepository logRepository = new InMemoryAutomationLogRepository();

    public final AuthorizationCache authorizationCache = AuthorizationCache.withDefaults();
    public final TaskEntityAccessor entities;

    public final DependencyCoordinator dependencies;
    public final AutomationCoordinator automation;
    public final WorkflowCoordinator workflows;

    public EngineFixture() {
        this(TimeController.frozenAt("2025-03-03T09:00:00Z"));
    }

    public EngineFixture(TimeController clock) {
        this.clock = clock;
        metrics.bindTo(meterRegistry);
        taskStore = new InMemoryTaskStore(clock);
        entities = new TaskEntityAccessor(taskStore);

        dependencies = new DependencyCoordinator(
            dependencyRepository, taskStore, events, SchedulingPolicy.defaults(), locks, metrics, clock);
        automation = new AutomationCoordinator(
            ruleRepository, logRepository, entities,
            StandardActionHandlers.registry(entities, taskStore, notifications),
            AutomationPolicy.defaults(), locks, metrics, clock);
        workflows = new WorkflowCoordinator(
            definitionRepository, instanceRepository, entities, events, automation,
            authorizationCache, new TransitionAuthorizer(authorizationCache, users),
            WorkflowPolicy.defaults(), locks, metrics, clock);

        events.subscribe(automation);
    }

    // ========== Tasks ==========

    public TaskRecord task(String id, String projectId) {
        return task(id, projectId, "todo");
    }

    public TaskRecord task(String id, String projectId, String status) {
        TaskRecord task = new TaskRecord(id, projectId, "board-1", null, status, "Task " + id, null,
            null, "medium", List.of(), null, clock.instant(), Map.of());
        taskStore.put(task);
        return task;
    }

    public TaskRecord taskDue(String id, String projectId, LocalDate dueDate) {
        TaskRecord task = new TaskRecord(id, projectId, "board-1", null, "todo", "Task " + id, null,
            null, "medium", List.of(), dueDate, clock.instant(), Map.of());
        taskStore.put(task);
        return task;
    }

    public void setStatus(String taskId, String status) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put(TaskFields.STATUS, FieldValue.symbol(status));
        taskStore.update(taskId, fields);
    }

    public TaskRecord reload(String taskId) {
        return taskStore.get(taskId).orElseThrow();
    }

    public void user(String id, String role) {
        users.put(new UserRecord(id, role));
    }
}
