package com.taskgraph.engine.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AuthorizationCacheTest {

    private final AuthorizationCache cache = AuthorizationCache.withDefaults();

    private static AuthorizationCache.Key key(String workflowId, String userId) {
        return new AuthorizationCache.Key(workflowId, AuthorizationCache.Subject.TRANSITION, "t1", userId);
    }

    @Test
    @DisplayName("Answers are computed once per key")
    void testCachesAnswer() {
        AtomicInteger loads = new AtomicInteger();

        boolean first = cache.isAllowed(key("wf", "u1"), () -> {
            loads.incrementAndGet();
            return true;
        });
        boolean second = cache.isAllowed(key("wf", "u1"), () -> {
            loads.incrementAndGet();
            return false;
        });

        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(loads).hasValue(1);
    }

    @Test
    @DisplayName("Invalidating a user drops only that user's answers")
    void testInvalidateUser() {
        cache.isAllowed(key("wf", "u1"), () -> true);
        cache.isAllowed(key("wf", "u2"), () -> true);

        cache.invalidateUser("u1");

        assertThat(cache.isAllowed(key("wf", "u1"), () -> false)).isFalse();
        assertThat(cache.isAllowed(key("wf", "u2"), () -> false)).isTrue();
    }

    @Test
    @DisplayName("Invalidating a workflow drops its answers")
    void testInvalidateWorkflow() {
        cache.isAllowed(key("wf-a", "u1"), () -> true);
        cache.isAllowed(key("wf-b", "u1"), () -> true);

        cache.invalidateWorkflow("wf-a");

        assertThat(cache.isAllowed(key("wf-a", "u1"), () -> false)).isFalse();
        assertThat(cache.isAllowed(key("wf-b", "u1"), () -> false)).isTrue();
    }

    @Test
    @DisplayName("Approval and transition answers are kept apart")
    void testSubjectsSeparate() {
        cache.isAllowed(key("wf", "u1"), () -> true);

        var approval = new AuthorizationCache.Key("wf", AuthorizationCache.Subject.APPROVAL, "t1", "u1");

        assertThat(cache.isAllowed(approval, () -> false)).isFalse();
    }
}
