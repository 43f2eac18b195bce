package com.taskgraph.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Time-bounded cache of authorization answers for transitions and approvals.
 *
 * Entries expire after the configured TTL. Role changes must call {@link #invalidateUser},
 * definition changes {@link #invalidateWorkflow}.
 */
public class AuthorizationCache {

    /**
     * What an answer authorizes.
     */
    public enum Subject {
        TRANSITION,
        APPROVAL
    }

    /**
     * Cache key: the user, and the transition or approval state of a workflow.
     */
    public record Key(String workflowId, Subject subject, String subjectId, String userId) {}

    private final Cache<Key, Boolean> cache;

    public AuthorizationCache(Duration ttl, long maximumSize) {
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maximumSize)
            .build();
    }

    /**
     * Five-minute TTL, ten thousand entries.
     */
    public static AuthorizationCache withDefaults() {
        return new AuthorizationCache(Duration.ofMinutes(5), 10_000);
    }

    /**
     * Return the cached answer, computing and storing it on a miss.
     */
    public boolean isAllowed(Key key, Supplier<Boolean> loader) {
        return cache.get(key, k -> loader.get());
    }

    public void invalidateUser(String userId) {
        cache.asMap().keySet().removeIf(k -> k.userId().equals(userId));
    }

    public void invalidateWorkflow(String workflowId) {
        cache.asMap().keySet().removeIf(k -> k.workflowId().equals(workflowId));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
