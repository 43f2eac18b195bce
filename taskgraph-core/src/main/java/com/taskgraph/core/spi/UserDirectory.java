package com.taskgraph.core.spi;

import com.taskgraph.core.model.task.UserRecord;

import java.util.Optional;

/**
 * Lookup of users and their roles.
 */
public interface UserDirectory {

    Optional<UserRecord> get(String userId);
}
