package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.Condition;
import com.taskgraph.core.condition.ConditionLogic;

import java.time.Instant;
import java.util.List;

/**
 * A trigger/condition/action rule.
 *
 * Invariants:
 * - at least one trigger and one action
 * - maxExecutionsPerDay is null or >= 1
 * - executionCount never decreases
 */
public record AutomationRule(
    // Identity
    String id,
    String name,
    String description,

    // When
    List<Trigger> triggers,
    ConditionLogic triggerLogic,
    List<Condition> conditions,
    ConditionLogic conditionLogic,

    // What
    List<Action> actions,
    RuleScope scope,

    // Control
    boolean stopOnError,
    Integer maxExecutionsPerDay,
    boolean active,

    // Statistics
    long executionCount,
    Instant lastExecution,

    // Metadata
    String createdBy,
    Instant createdAt
) {
    public AutomationRule {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = actions == null ? List.of() : List.copyOf(actions);
        triggerLogic = triggerLogic == null ? ConditionLogic.OR : triggerLogic;
        conditionLogic = conditionLogic == null ? ConditionLogic.AND : conditionLogic;
        scope = scope == null ? RuleScope.unrestricted() : scope;
    }

    public boolean firesOn(TriggerType type) {
        return triggers.stream().anyMatch(t -> t.type() == type);
    }

    /**
     * Copy recording one more successful execution.
     */
    public AutomationRule withExecution(Instant at) {
        return toBuilder().executionCount(executionCount + 1).lastExecution(at).build();
    }

    public AutomationRule withActive(boolean newActive) {
        return toBuilder().active(newActive).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).name(name).description(description)
            .triggers(triggers).triggerLogic(triggerLogic)
            .conditions(conditions).conditionLogic(conditionLogic)
            .actions(actions).scope(scope)
            .stopOnError(stopOnError).maxExecutionsPerDay(maxExecutionsPerDay).active(active)
            .executionCount(executionCount).lastExecution(lastExecution)
            .createdBy(createdBy).createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private List<Trigger> triggers = List.of();
        private ConditionLogic triggerLogic = ConditionLogic.OR;
        private List<Condition> conditions = List.of();
        private ConditionLogic conditionLogic = ConditionLogic.AND;
        private List<Action> actions = List.of();
        private RuleScope scope = RuleScope.unrestricted();
        private boolean stopOnError = true;
        private Integer maxExecutionsPerDay;
        private boolean active = true;
        private long executionCount;
        private Instant lastExecution;
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

        public Builder triggers(List<Trigger> triggers) {
            this.triggers = triggers;
            return this;
        }

        public Builder triggerLogic(ConditionLogic triggerLogic) {
            this.triggerLogic = triggerLogic;
            return this;
        }

        public Builder conditions(List<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder conditionLogic(ConditionLogic conditionLogic) {
            this.conditionLogic = conditionLogic;
            return this;
        }

        public Builder actions(List<Action> actions) {
            this.actions = actions;
            return this;
        }

        public Builder scope(RuleScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder maxExecutionsPerDay(Integer maxExecutionsPerDay) {
            this.maxExecutionsPerDay = maxExecutionsPerDay;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder executionCount(long executionCount) {
            this.executionCount = executionCount;
            return this;
        }

        public Builder lastExecution(Instant lastExecution) {
            this.lastExecution = lastExecution;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AutomationRule build() {
            return new AutomationRule(
                id, name, description, triggers, triggerLogic, conditions, conditionLogic,
                actions, scope, stopOnError, maxExecutionsPerDay, active,
                executionCount, lastExecution, createdBy, createdAt
            );
        }
    }
}
