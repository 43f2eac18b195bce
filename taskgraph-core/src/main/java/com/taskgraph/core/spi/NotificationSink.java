package com.taskgraph.core.spi;

/**
 * Fire-and-forget delivery of user notifications.
 * Implementations may throw; the engine logs such failures and carries on.
 */
public interface NotificationSink {

    void notify(String userId, String message);
}
