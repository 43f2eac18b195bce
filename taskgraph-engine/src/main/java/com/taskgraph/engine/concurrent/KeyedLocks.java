package com.taskgraph.engine.concurrent;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per aggregate key (project, workflow instance, rule, generator).
 *
 * Locks are held weakly: a lock nobody references can be collected and is recreated on
 * the next request. A lock in use is always strongly reachable from its holder, so two
 * threads asking for the same key always see the same lock.
 */
public class KeyedLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build(key -> new ReentrantLock());

    /**
     * Run an action while holding the lock for a key.
     */
    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run an action if the lock for a key can be taken within the timeout.
     * For callers that already hold another key and must not wait on it indefinitely.
     *
     * @param onTimeout supplies the exception thrown when the lock is not acquired in time
     */
    public <T> T tryWithLock(String key, Duration timeout, Supplier<T> action,
                             Supplier<? extends RuntimeException> onTimeout) {
        ReentrantLock lock = locks.get(key);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw onTimeout.get();
        }
        if (!acquired) {
            throw onTimeout.get();
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Namespaced key, e.g. key("project", projectId).
     */
    public static String key(String scope, String id) {
        return scope + ":" + id;
    }
}
