package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.FieldValue;

import java.time.Instant;

/**
 * The effect of one executed (or, in a dry run, planned) action.
 * error is set when the action threw.
 */
public record ChangeRecord(
    ActionType actionType,
    String entityType,
    String entityId,
    String field,
    FieldValue previousValue,
    FieldValue newValue,
    String detail,
    String error,
    Instant timestamp
) {
    public ChangeRecord {
        previousValue = previousValue == null ? FieldValue.EMPTY : previousValue;
        newValue = newValue == null ? FieldValue.EMPTY : newValue;
    }

    public static ChangeRecord fieldChange(ActionType type, String entityType, String entityId,
                                           String field, FieldValue previous, FieldValue next,
                                           Instant at) {
        return new ChangeRecord(type, entityType, entityId, field, previous, next, null, null, at);
    }

    public static ChangeRecord effect(ActionType type, String entityType, String entityId,
                                      String detail, Instant at) {
        return new ChangeRecord(type, entityType, entityId, null, null, null, detail, null, at);
    }

    public static ChangeRecord failure(ActionType type, String entityType, String entityId,
                                       String error, Instant at) {
        return new ChangeRecord(type, entityType, entityId, null, null, null, null, error, at);
    }

    public boolean failed() {
        return error != null;
    }
}
