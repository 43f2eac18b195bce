package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.FieldValue;

import java.time.Instant;
import java.util.Map;

/**
 * A domain event that may fire automation rules.
 */
public record AutomationEvent(
    TriggerType triggerType,
    String entityType,
    String entityId,
    Map<String, FieldValue> payload,
    Instant occurredAt
) {
    // Well-known payload keys matched by trigger filters
    public static final String FIELD_NAME = "fieldName";
    public static final String FROM_STATUS = "fromStatus";
    public static final String TO_STATUS = "toStatus";
    public static final String USER_ID = "userId";
    public static final String OLD_VALUE = "oldValue";
    public static final String NEW_VALUE = "newValue";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String COMPLETED_TASK_ID = "completedTaskId";

    public AutomationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static AutomationEvent statusChanged(String entityType, String entityId,
                                                String fromStatus, String toStatus, Instant at) {
        return new AutomationEvent(
            TriggerType.STATUS_CHANGED,
            entityType,
            entityId,
            Map.of(FROM_STATUS, FieldValue.symbol(fromStatus), TO_STATUS, FieldValue.symbol(toStatus)),
            at
        );
    }
}
