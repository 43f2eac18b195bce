package com.taskgraph.engine.workflow;

import com.taskgraph.core.model.workflow.StateDefinition;
import com.taskgraph.core.model.workflow.WorkflowAnalytics;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.model.workflow.WorkflowInstance;
import com.taskgraph.core.model.workflow.WorkflowPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregates the instances of one workflow started within a period.
 */
public class WorkflowAnalyticsCalculator {

    static final int BOTTLENECK_STATES = 3;
    static final int MOST_USED_TRANSITIONS = 5;

    private final WorkflowPolicy policy;

    public WorkflowAnalyticsCalculator(WorkflowPolicy policy) {
        this.policy = policy;
    }

    public WorkflowAnalytics calculate(WorkflowDefinition workflow, List<WorkflowInstance> instances,
                                       Instant from, Instant to, Instant now) {
        List<WorkflowInstance> inPeriod = instances.stream()
            .filter(i -> !i.startedAt().isBefore(from) && !i.startedAt().isAfter(to))
            .collect(Collectors.toList());
        int total = inPeriod.size();

        // States
        Map<String, Long> visits = new LinkedHashMap<>();
        Map<String, List<Long>> minutes = new LinkedHashMap<>();
        for (WorkflowInstance instance : inPeriod) {
            instance.stateHistory().forEach(entry -> visits.merge(entry.stateId(), 1L, Long::sum));
            instance.stateHistory().stream()
                .map(WorkflowInstance.StateEntry::stateId)
                .distinct()
                .forEach(stateId -> minutes.computeIfAbsent(stateId, k -> new ArrayList<>())
                    .add(instance.minutesInState(stateId, now)));
        }
        Map<String, Double> averageMinutes = new LinkedHashMap<>();
        minutes.forEach((stateId, values) -> averageMinutes.put(stateId, average(values)));

        List<String> bottlenecks = averageMinutes.entrySet().stream()
            .filter(e -> workflow.findState(e.getKey()).map(s -> !s.isFinal()).orElse(true))
            .filter(e -> e.getValue() > 0)
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
            .limit(BOTTLENECK_STATES)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

        // Transitions
        Map<String, Long> transitionCounts = new LinkedHashMap<>();
        for (WorkflowInstance instance : inPeriod) {
            for (WorkflowInstance.TransitionRecord record : instance.transitionHistory()) {
                transitionCounts.merge(transitionKey(record), 1L, Long::sum);
            }
        }
        List<String> mostUsed = transitionCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
            .limit(MOST_USED_TRANSITIONS)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

        // Completion
        List<WorkflowInstance> completed = inPeriod.stream()
            .filter(WorkflowInstance::completed)
            .collect(Collectors.toList());
        List<Long> completionMinutes = completed.stream()
            .filter(i -> i.completedAt() != null)
            .map(i -> Duration.between(i.startedAt(), i.completedAt()).toMinutes())
            .collect(Collectors.toList());
        long abandoned = inPeriod.stream()
            .filter(i -> !i.completed())
            .filter(i -> Duration.between(lastActivity(i), now).compareTo(policy.abandonAfter()) > 0)
            .count();

        // Service level
        List<WorkflowAnalytics.SlaViolation> violations = new ArrayList<>();
        int measured = 0;
        for (WorkflowInstance instance : inPeriod) {
            for (StateDefinition state : visitedStatesWithSla(workflow, instance)) {
                measured++;
                long spent = instance.minutesInState(state.id(), now);
                long sla = state.slaDuration().toMinutes();
                if (spent > sla) {
                    violations.add(new WorkflowAnalytics.SlaViolation(
                        instance.id(), instance.entityId(), state.id(), spent, sla));
                }
            }
        }

        return new WorkflowAnalytics(
            workflow.id(),
            from,
            to,
            total,
            completed.size(),
            averageMinutes,
            visits,
            bottlenecks,
            transitionCounts,
            mostUsed,
            completionMinutes.isEmpty() ? null : average(completionMinutes),
            ratio(completed.size(), total),
            ratio(abandoned, total),
            measured == 0 ? 1.0 : 1.0 - ratio(violations.size(), measured),
            violations
        );
    }

    // ========== Internal Methods ==========

    private static List<StateDefinition> visitedStatesWithSla(WorkflowDefinition workflow, WorkflowInstance instance) {
        Map<String, StateDefinition> visited = new HashMap<>();
        for (WorkflowInstance.StateEntry entry : instance.stateHistory()) {
            workflow.findState(entry.stateId())
                .filter(s -> s.slaDuration() != null)
                .ifPresent(s -> visited.putIfAbsent(s.id(), s));
        }
        return visited.values().stream()
            .sorted(Comparator.comparing(StateDefinition::id))
            .collect(Collectors.toList());
    }

    private static String transitionKey(WorkflowInstance.TransitionRecord record) {
        return record.transitionId() != null
            ? record.transitionId()
            : record.fromStateId() + "->" + record.toStateId();
    }

    private static Instant lastActivity(WorkflowInstance instance) {
        return instance.lastTransitionAt() != null ? instance.lastTransitionAt() : instance.startedAt();
    }

    private static double average(List<Long> values) {
        return values.stream().mapToLong(Long::longValue).average().orElse(0.0);
    }

    private static double ratio(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
