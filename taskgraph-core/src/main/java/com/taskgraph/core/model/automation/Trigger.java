package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.FieldValue;

import java.util.Map;

/**
 * What fires a rule: an event type plus optional filters on the event payload.
 * A null filter matches anything.
 */
public record Trigger(
    TriggerType type,
    String fieldName,
    String fromStatus,
    String toStatus,
    String userId
) {
    public Trigger {
        if (type == null) {
            throw new IllegalArgumentException("trigger type must not be null");
        }
    }

    public static Trigger of(TriggerType type) {
        return new Trigger(type, null, null, null, null);
    }

    public static Trigger statusChanged(String fromStatus, String toStatus) {
        return new Trigger(TriggerType.STATUS_CHANGED, null, fromStatus, toStatus, null);
    }

    public static Trigger fieldUpdated(String fieldName) {
        return new Trigger(TriggerType.FIELD_UPDATED, fieldName, null, null, null);
    }

    /**
     * Check the firing type and every present filter against the event payload.
     */
    public boolean matches(TriggerType firing, Map<String, FieldValue> data) {
        if (type != firing) {
            return false;
        }
        return filterMatches(fieldName, data.get(AutomationEvent.FIELD_NAME))
            && filterMatches(fromStatus, data.get(AutomationEvent.FROM_STATUS))
            && filterMatches(toStatus, data.get(AutomationEvent.TO_STATUS))
            && filterMatches(userId, data.get(AutomationEvent.USER_ID));
    }

    private static boolean filterMatches(String expected, FieldValue actual) {
        if (expected == null) {
            return true;
        }
        return actual != null && expected.equalsIgnoreCase(actual.asText());
    }
}
