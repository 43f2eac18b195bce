package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.task.UserRecord;
import com.taskgraph.core.spi.UserDirectory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory UserDirectory for running the engine standalone and for tests.
 */
@Repository
public class InMemoryUserDirectory implements UserDirectory {

    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();

    @Override
    public Optional<UserRecord> get(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public void put(UserRecord user) {
        users.put(user.id(), user);
    }
}
