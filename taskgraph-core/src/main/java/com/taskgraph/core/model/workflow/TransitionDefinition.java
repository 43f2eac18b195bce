package com.taskgraph.core.model.workflow;

import com.taskgraph.core.condition.Condition;
import com.taskgraph.core.condition.ConditionLogic;
import com.taskgraph.core.condition.FieldValue;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An allowed move between two states.
 *
 * Invariants:
 * - fromStateId and toStateId name states of the owning definition
 * - higher priority candidates are evaluated first
 */
public record TransitionDefinition(
    String id,
    String name,
    String fromStateId,
    String toStateId,

    // Guards
    List<Condition> conditions,
    ConditionLogic conditionLogic,
    boolean allowAll,
    Set<String> allowedUsers,
    Set<String> allowedRoles,
    boolean commentRequired,

    // Effects
    List<String> automationRuleIds,
    Map<String, FieldValue> updateFields,

    int priority
) {
    public TransitionDefinition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        conditionLogic = conditionLogic == null ? ConditionLogic.AND : conditionLogic;
        allowedUsers = allowedUsers == null ? Set.of() : Set.copyOf(allowedUsers);
        allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
        automationRuleIds = automationRuleIds == null ? List.of() : List.copyOf(automationRuleIds);
        updateFields = updateFields == null ? Map.of() : Map.copyOf(updateFields);
    }

    public boolean connects(String fromState, String toState) {
        return fromStateId.equals(fromState) && toStateId.equals(toState);
    }

    public static Builder builder(String id, String fromStateId, String toStateId) {
        return new Builder(id, fromStateId, toStateId);
    }

    public static class Builder {
        private final String id;
        private final String fromStateId;
        private final String toStateId;
        private String name;
        private List<Condition> conditions = List.of();
        private ConditionLogic conditionLogic = ConditionLogic.AND;
        private boolean allowAll = true;
        private Set<String> allowedUsers = Set.of();
        private Set<String> allowedRoles = Set.of();
        private boolean commentRequired;
        private List<String> automationRuleIds = List.of();
        private Map<String, FieldValue> updateFields = Map.of();
        private int priority;

        private Builder(String id, String fromStateId, String toStateId) {
            this.id = id;
            this.fromStateId = fromStateId;
            this.toStateId = toStateId;
            this.name = fromStateId + " -> " + toStateId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder conditions(List<Condition> conditions, ConditionLogic logic) {
            this.conditions = conditions;
            this.conditionLogic = logic;
            return this;
        }

        public Builder allowUsers(Set<String> users) {
            this.allowAll = false;
            this.allowedUsers = users;
            return this;
        }

        public Builder allowRoles(Set<String> roles) {
            this.allowAll = false;
            this.allowedRoles = roles;
            return this;
        }

        public Builder commentRequired(boolean commentRequired) {
            this.commentRequired = commentRequired;
            return this;
        }

        public Builder automationRuleIds(List<String> automationRuleIds) {
            this.automationRuleIds = automationRuleIds;
            return this;
        }

        public Builder updateFields(Map<String, FieldValue> updateFields) {
            this.updateFields = updateFields;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public TransitionDefinition build() {
            return new TransitionDefinition(
                id, name, fromStateId, toStateId, conditions, conditionLogic,
                allowAll, allowedUsers, allowedRoles, commentRequired,
                automationRuleIds, updateFields, priority
            );
        }
    }
}
