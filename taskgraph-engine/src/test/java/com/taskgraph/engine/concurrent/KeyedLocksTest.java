package com.taskgraph.engine.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class KeyedLocksTest {

    private final KeyedLocks locks = new KeyedLocks();

    @Test
    @DisplayName("Same key serializes concurrent updates")
    void testMutualExclusion() throws Exception {
        int threads = 8;
        int iterations = 500;
        int[] counter = {0};
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        locks.withLock(KeyedLocks.key("project", "p1"), () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            counter[0]++;
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(counter[0]).isEqualTo(threads * iterations);
        assertThat(maxInside).hasValue(1);
    }

    @Test
    @DisplayName("Locks are reentrant")
    void testReentrant() {
        String key = KeyedLocks.key("rule", "r1");

        String result = locks.withLock(key, () -> locks.withLock(key, () -> "inner"));

        assertThat(result).isEqualTo("inner");
    }

    @Test
    @DisplayName("Different keys do not block each other")
    void testIndependentKeys() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> locks.withLock("project:a", () -> {
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(locks.withLock("project:b", () -> "free")).isEqualTo("free");

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Exceptions release the lock")
    void testReleaseOnException() {
        assertThatThrownBy(() -> locks.withLock("k", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.withLock("k", () -> 1)).isEqualTo(1);
    }
}
