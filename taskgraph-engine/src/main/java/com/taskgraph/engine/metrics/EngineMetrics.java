package com.taskgraph.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the engine.
 *
 * Metrics exposed:
 * - Dependencies added and inserts rejected for cycles
 * - Critical-path computation time
 * - Workflow transitions, rejections by reason and completions
 * - Rule executions by outcome and failed actions
 * - Recurring instances created and failed occurrences
 */
public class EngineMetrics implements MeterBinder {

    // Metric names
    public static final String DEPENDENCIES_ADDED = "taskgraph.dependencies.added";
    public static final String CYCLES_REJECTED = "taskgraph.dependencies.cycles.rejected";
    public static final String CRITICAL_PATH_DURATION = "taskgraph.critical_path.duration";

    public static final String TRANSITIONS = "taskgraph.workflow.transitions";
    public static final String TRANSITIONS_REJECTED = "taskgraph.workflow.transitions.rejected";
    public static final String WORKFLOWS_COMPLETED = "taskgraph.workflow.completed";

    public static final String RULE_EXECUTIONS = "taskgraph.automation.executions";
    public static final String ACTION_FAILURES = "taskgraph.automation.action.failures";

    public static final String RECURRING_CREATED = "taskgraph.recurrence.instances.created";
    public static final String RECURRING_FAILURES = "taskgraph.recurrence.instances.failed";
    public static final String RECURRING_ACTIVE = "taskgraph.recurrence.generators.active";

    private MeterRegistry registry = Metrics.globalRegistry;
    private final AtomicLong activeGenerators = new AtomicLong();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(RECURRING_ACTIVE, activeGenerators, AtomicLong::get)
            .description("Active recurring-task generators")
            .register(registry);
    }

    // ========== Dependency Metrics ==========

    public void dependencyAdded(String type) {
        Counter.builder(DEPENDENCIES_ADDED)
            .tag("type", type)
            .description("Dependencies created")
            .register(registry)
            .increment();
    }

    public void cycleRejected() {
        Counter.builder(CYCLES_REJECTED)
            .description("Dependency inserts rejected because they would close a cycle")
            .register(registry)
            .increment();
    }

    public void criticalPathComputed(Duration duration) {
        Timer.builder(CRITICAL_PATH_DURATION)
            .description("Critical-path computation time")
            .register(registry)
            .record(duration);
    }

    // ========== Workflow Metrics ==========

    public void transitionPerformed(String workflowId) {
        Counter.builder(TRANSITIONS)
            .tag("workflow", workflowId)
            .description("Workflow transitions performed")
            .register(registry)
            .increment();
    }

    public void transitionRejected(String reason) {
        Counter.builder(TRANSITIONS_REJECTED)
            .tag("reason", reason)
            .description("Workflow transitions rejected")
            .register(registry)
            .increment();
    }

    public void workflowCompleted(String workflowId) {
        Counter.builder(WORKFLOWS_COMPLETED)
            .tag("workflow", workflowId)
            .description("Workflow instances that reached a final state")
            .register(registry)
            .increment();
    }

    // ========== Automation Metrics ==========

    public void ruleExecuted(String outcome) {
        Counter.builder(RULE_EXECUTIONS)
            .tag("outcome", outcome)
            .description("Automation rule executions by outcome")
            .register(registry)
            .increment();
    }

    public void actionFailed(String actionType) {
        Counter.builder(ACTION_FAILURES)
            .tag("action", actionType)
            .description("Automation actions that threw")
            .register(registry)
            .increment();
    }

    // ========== Recurrence Metrics ==========

    public void recurringInstanceCreated() {
        Counter.builder(RECURRING_CREATED)
            .description("Task instances materialized from recurring tasks")
            .register(registry)
            .increment();
    }

    public void recurringInstanceFailed() {
        Counter.builder(RECURRING_FAILURES)
            .description("Recurring occurrences whose task creation failed")
            .register(registry)
            .increment();
    }

    public void setActiveGenerators(long count) {
        activeGenerators.set(count);
    }
}
