package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.FieldValue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of one rule execution.
 * Each status step is stored as a new copy under the same id.
 */
public record AutomationLog(
    // Identity
    String id,
    String ruleId,
    String ruleName,

    // Trigger
    TriggerType triggerType,
    String entityType,
    String entityId,
    Map<String, FieldValue> triggerData,

    // Outcome
    LogStatus status,
    List<ActionType> actionsExecuted,
    List<ChangeRecord> changes,
    String errorMessage,

    // Timing
    Instant triggeredAt,
    Instant executedAt,
    Instant completedAt
) {
    public AutomationLog {
        triggerData = triggerData == null ? Map.of() : Map.copyOf(triggerData);
        actionsExecuted = actionsExecuted == null ? List.of() : List.copyOf(actionsExecuted);
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    /**
     * Create the PENDING log written before a rule is evaluated.
     */
    public static AutomationLog pending(AutomationRule rule, TriggerType triggerType,
                                        String entityType, String entityId,
                                        Map<String, FieldValue> triggerData, Instant now) {
        return new AutomationLog(
            UUID.randomUUID().toString(),
            rule.id(),
            rule.name(),
            triggerType,
            entityType,
            entityId,
            triggerData,
            LogStatus.PENDING,
            List.of(),
            List.of(),
            null,
            now,
            null,
            null
        );
    }

    public AutomationLog running(Instant at) {
        return new AutomationLog(
            id, ruleId, ruleName, triggerType, entityType, entityId, triggerData,
            LogStatus.RUNNING, actionsExecuted, changes, errorMessage,
            triggeredAt, at, completedAt
        );
    }

    public AutomationLog skipped(String reason, Instant at) {
        return new AutomationLog(
            id, ruleId, ruleName, triggerType, entityType, entityId, triggerData,
            LogStatus.SKIPPED, actionsExecuted, changes, reason,
            triggeredAt, executedAt, at
        );
    }

    public AutomationLog finished(LogStatus outcome, List<ActionType> actions,
                                  List<ChangeRecord> newChanges, String error, Instant at) {
        return new AutomationLog(
            id, ruleId, ruleName, triggerType, entityType, entityId, triggerData,
            outcome, actions, newChanges, error,
            triggeredAt, executedAt, at
        );
    }

    /**
     * Time from start of action execution to completion, when both are known.
     */
    public Duration executionTime() {
        if (executedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(executedAt, completedAt);
    }
}
