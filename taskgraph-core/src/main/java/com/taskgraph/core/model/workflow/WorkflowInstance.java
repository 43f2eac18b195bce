package com.taskgraph.core.model.workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A workflow definition applied to one entity.
 * Immutable; every transition produces a new copy with a higher sequence number.
 *
 * Unique Constraint: (entityType, entityId)
 *
 * Invariants:
 * - currentStateId is always in activeStates
 * - stateHistory and transitionHistory are append-only
 * - a completed instance never changes state again
 */
public record WorkflowInstance(
    // Identity
    String id,
    String workflowId,
    int workflowVersion,
    String entityType,
    String entityId,

    // State
    String currentStateId,
    String previousStateId,
    Set<String> activeStates,
    Map<String, Instant> activeSince,

    // History
    List<StateEntry> stateHistory,
    List<TransitionRecord> transitionHistory,
    Map<String, Long> timeInStateMinutes,
    Map<String, Set<String>> approvals,

    // Lifecycle
    boolean completed,
    Instant startedAt,
    Instant completedAt,
    Instant lastTransitionAt,

    long sequenceNumber
) {
    public WorkflowInstance {
        activeStates = Set.copyOf(activeStates);
        activeSince = Map.copyOf(activeSince);
        stateHistory = List.copyOf(stateHistory);
        transitionHistory = List.copyOf(transitionHistory);
        timeInStateMinutes = Map.copyOf(timeInStateMinutes);
        approvals = Map.copyOf(approvals);
    }

    /**
     * Entry of an instance into a state.
     */
    public record StateEntry(
        String stateId,
        String fromStateId,
        Instant enteredAt,
        String enteredBy,
        String comment
    ) {}

    /**
     * A performed transition. transitionId is null for ad-hoc moves in non-enforcing workflows.
     */
    public record TransitionRecord(
        String transitionId,
        String fromStateId,
        String toStateId,
        Instant transitionedAt,
        String transitionedBy,
        String comment
    ) {}

    /**
     * Create a new instance sitting in the initial state.
     */
    public static WorkflowInstance create(
            WorkflowDefinition definition,
            String entityId,
            String actorId,
            Instant now) {
        String initialStateId = definition.initialState().id();
        return new WorkflowInstance(
            UUID.randomUUID().toString(),
            definition.id(),
            definition.version(),
            definition.entityType(),
            entityId,
            initialStateId,
            null,
            Set.of(initialStateId),
            Map.of(initialStateId, now),
            List.of(new StateEntry(initialStateId, null, now, actorId, "Workflow started")),
            List.of(),
            Map.of(),
            Map.of(),
            false,
            now,
            null,
            null,
            0L
        );
    }

    public int totalTransitions() {
        return transitionHistory.size();
    }

    public int approvalCount(String stateId) {
        return approvals.getOrDefault(stateId, Set.of()).size();
    }

    /**
     * Whole minutes spent in a state, including the open stay if the state is active.
     */
    public long minutesInState(String stateId, Instant now) {
        long minutes = timeInStateMinutes.getOrDefault(stateId, 0L);
        Instant since = activeSince.get(stateId);
        if (since != null && !completed) {
            minutes += Duration.between(since, now).toMinutes();
        }
        return minutes;
    }

    /**
     * Copy with an approval recorded for a state.
     */
    public WorkflowInstance withApproval(String stateId, String userId) {
        Map<String, Set<String>> newApprovals = new LinkedHashMap<>(approvals);
        Set<String> approvers = new LinkedHashSet<>(approvals.getOrDefault(stateId, Set.of()));
        approvers.add(userId);
        newApprovals.put(stateId, approvers);
        return toBuilder().approvals(newApprovals).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder used by the engine to derive the next version of an instance.
     * build() increments the sequence number.
     */
    public static class Builder {
        private final WorkflowInstance base;
        private String currentStateId;
        private String previousStateId;
        private Set<String> activeStates;
        private Map<String, Instant> activeSince;
        private List<StateEntry> stateHistory;
        private List<TransitionRecord> transitionHistory;
        private Map<String, Long> timeInStateMinutes;
        private Map<String, Set<String>> approvals;
        private boolean completed;
        private Instant completedAt;
        private Instant lastTransitionAt;

        private Builder(WorkflowInstance base) {
            this.base = base;
            this.currentStateId = base.currentStateId;
            this.previousStateId = base.previousStateId;
            this.activeStates = base.activeStates;
            this.activeSince = base.activeSince;
            this.stateHistory = base.stateHistory;
            this.transitionHistory = base.transitionHistory;
            this.timeInStateMinutes = base.timeInStateMinutes;
            this.approvals = base.approvals;
            this.completed = base.completed;
            this.completedAt = base.completedAt;
            this.lastTransitionAt = base.lastTransitionAt;
        }

        public Builder currentStateId(String currentStateId) {
            this.currentStateId = currentStateId;
            return this;
        }

        public Builder previousStateId(String previousStateId) {
            this.previousStateId = previousStateId;
            return this;
        }

        public Builder activeStates(Set<String> activeStates) {
            this.activeStates = activeStates;
            return this;
        }

        public Builder activeSince(Map<String, Instant> activeSince) {
            this.activeSince = activeSince;
            return this;
        }

        public Builder stateHistory(List<StateEntry> stateHistory) {
            this.stateHistory = stateHistory;
            return this;
        }

        public Builder transitionHistory(List<TransitionRecord> transitionHistory) {
            this.transitionHistory = transitionHistory;
            return this;
        }

        public Builder timeInStateMinutes(Map<String, Long> timeInStateMinutes) {
            this.timeInStateMinutes = timeInStateMinutes;
            return this;
        }

        public Builder approvals(Map<String, Set<String>> approvals) {
            this.approvals = approvals;
            return this;
        }

        public Builder completed(Instant at) {
            this.completed = true;
            this.completedAt = at;
            return this;
        }

        public Builder lastTransitionAt(Instant lastTransitionAt) {
            this.lastTransitionAt = lastTransitionAt;
            return this;
        }

        public WorkflowInstance build() {
            return new WorkflowInstance(
                base.id, base.workflowId, base.workflowVersion, base.entityType, base.entityId,
                currentStateId, previousStateId, activeStates, activeSince,
                stateHistory, transitionHistory, timeInStateMinutes, approvals,
                completed, base.startedAt, completedAt, lastTransitionAt,
                base.sequenceNumber + 1
            );
        }
    }
}
