package com.taskgraph.core.model.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated statistics over the instances of one workflow started in a time window.
 * Rates are fractions in [0, 1]; times are minutes.
 */
public record WorkflowAnalytics(
    String workflowId,
    Instant from,
    Instant to,
    int totalInstances,
    int completedInstances,

    // States
    Map<String, Double> averageTimeInStateMinutes,
    Map<String, Long> stateVisitCounts,
    List<String> bottleneckStates,

    // Transitions
    Map<String, Long> transitionCounts,
    List<String> mostUsedTransitions,

    // Completion
    Double averageCompletionMinutes,
    double completionRate,
    double abandonmentRate,

    // Service level
    double slaComplianceRate,
    List<SlaViolation> slaViolations
) {
    public record SlaViolation(
        String instanceId,
        String entityId,
        String stateId,
        long minutesInState,
        long slaMinutes
    ) {}
}
