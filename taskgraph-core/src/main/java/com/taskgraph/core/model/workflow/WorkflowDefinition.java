package com.taskgraph.core.model.workflow;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A configurable state machine applied to entities of one type.
 * Versioned; an update bumps the version while running instances keep their state ids.
 *
 * Invariants:
 * - exactly one INITIAL state
 * - state ids are unique
 * - every transition references states of this definition
 */
public record WorkflowDefinition(
    // Identity
    String id,
    String name,
    String description,
    String entityType,
    int version,

    // Graph
    List<StateDefinition> states,
    List<TransitionDefinition> transitions,

    // Behaviour
    boolean allowParallelStates,
    boolean trackTimeInStates,
    boolean enforceTransitions,
    boolean active,

    // Metadata
    String createdBy,
    Instant createdAt
) {
    public WorkflowDefinition {
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    /**
     * Get the single initial state.
     */
    public StateDefinition initialState() {
        return states.stream()
            .filter(StateDefinition::isInitial)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Workflow " + id + " has no initial state"));
    }

    public Optional<StateDefinition> findState(String stateId) {
        return states.stream()
            .filter(s -> s.id().equals(stateId))
            .findFirst();
    }

    /**
     * Transitions leaving a state, in evaluation order.
     */
    public List<TransitionDefinition> transitionsFrom(String stateId) {
        return transitions.stream()
            .filter(t -> t.fromStateId().equals(stateId))
            .sorted(Comparator.comparingInt(TransitionDefinition::priority).reversed())
            .collect(Collectors.toList());
    }

    public Optional<TransitionDefinition> findTransition(String transitionId) {
        return transitions.stream()
            .filter(t -> t.id().equals(transitionId))
            .findFirst();
    }

    /**
     * Copy with engine-assigned identity.
     */
    public WorkflowDefinition withIdentity(String newId, int newVersion, Instant newCreatedAt) {
        return new WorkflowDefinition(
            newId, name, description, entityType, newVersion, states, transitions,
            allowParallelStates, trackTimeInStates, enforceTransitions, active,
            createdBy, newCreatedAt
        );
    }

    public WorkflowDefinition withActive(boolean newActive) {
        return new WorkflowDefinition(
            id, name, description, entityType, version, states, transitions,
            allowParallelStates, trackTimeInStates, enforceTransitions, newActive,
            createdBy, createdAt
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String entityType = "task";
        private int version = 1;
        private List<StateDefinition> states = List.of();
        private List<TransitionDefinition> transitions = List.of();
        private boolean allowParallelStates;
        private boolean trackTimeInStates = true;
        private boolean enforceTransitions = true;
        private boolean active = true;
        private String createdBy;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder states(List<StateDefinition> states) {
            this.states = states;
            return this;
        }

        public Builder transitions(List<TransitionDefinition> transitions) {
            this.transitions = transitions;
            return this;
        }

        public Builder allowParallelStates(boolean allowParallelStates) {
            this.allowParallelStates = allowParallelStates;
            return this;
        }

        public Builder trackTimeInStates(boolean trackTimeInStates) {
            this.trackTimeInStates = trackTimeInStates;
            return this;
        }

        public Builder enforceTransitions(boolean enforceTransitions) {
            this.enforceTransitions = enforceTransitions;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                id, name, description, entityType, version, states, transitions,
                allowParallelStates, trackTimeInStates, enforceTransitions, active,
                createdBy, createdAt
            );
        }
    }
}
