package com.taskgraph.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the ids of the aggregate being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forWorkflowInstance(instanceId, entityId)) {
 *     log.info("Transitioning"); // Automatically includes workflowInstanceId, entityId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2025-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.t.e.c.WorkflowCoordinator - Transitioning
 *   workflowInstanceId=abc-123 entityId=task-42 traceId=5f1c9a2e
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PROJECT_ID = "projectId";
    public static final String WORKFLOW_INSTANCE_ID = "workflowInstanceId";
    public static final String ENTITY_ID = "entityId";
    public static final String RULE_ID = "ruleId";
    public static final String RECURRING_TASK_ID = "recurringTaskId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for dependency-graph operations.
     */
    public static LoggingContext forProject(String projectId) {
        LoggingContext ctx = new LoggingContext();
        put(PROJECT_ID, projectId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for workflow instance operations.
     */
    public static LoggingContext forWorkflowInstance(String instanceId, String entityId) {
        LoggingContext ctx = new LoggingContext();
        put(WORKFLOW_INSTANCE_ID, instanceId);
        put(ENTITY_ID, entityId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a rule execution.
     */
    public static LoggingContext forRule(String ruleId, String entityId) {
        LoggingContext ctx = new LoggingContext();
        put(RULE_ID, ruleId);
        put(ENTITY_ID, entityId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a recurring-task generator.
     */
    public static LoggingContext forRecurringTask(String recurringTaskId, String projectId) {
        LoggingContext ctx = new LoggingContext();
        put(RECURRING_TASK_ID, recurringTaskId);
        put(PROJECT_ID, projectId);
        ensureTraceId();
        return ctx;
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(PROJECT_ID);
        MDC.remove(WORKFLOW_INSTANCE_ID);
        MDC.remove(ENTITY_ID);
        MDC.remove(RULE_ID);
        MDC.remove(RECURRING_TASK_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or scheduler run.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
