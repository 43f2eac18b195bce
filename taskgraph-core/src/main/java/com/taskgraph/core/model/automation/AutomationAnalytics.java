package com.taskgraph.core.model.automation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Execution statistics of one rule over a time window.
 * Times are seconds; errorRate is a fraction of finished executions.
 */
public record AutomationAnalytics(
    String ruleId,
    Instant from,
    Instant to,

    // Counts
    int totalExecutions,
    int successfulExecutions,
    int failedExecutions,
    int skippedExecutions,

    // Timing
    Double averageExecutionSeconds,
    Double maxExecutionSeconds,
    Double minExecutionSeconds,

    // Impact
    int entitiesAffected,
    int changesMade,
    Map<TriggerType, Long> triggerCounts,
    Map<ActionType, Long> actionCounts,

    // Errors
    double errorRate,
    Map<String, Long> errorCategories,
    List<String> suggestions
) {}
