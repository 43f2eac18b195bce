package com.taskgraph.core.model.task;

/**
 * A user as seen by transition and approval authorization.
 */
public record UserRecord(String id, String role) {
}
