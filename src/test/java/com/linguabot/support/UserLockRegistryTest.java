package com.linguabot.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class UserLockRegistryTest {

    private final UserLockRegistry locks = new UserLockRegistry();

    @Test
    @DisplayName("callAs should never run two actions of the same user at once")
    void testSerializesPerUser() throws Exception {
        var inside = new AtomicInteger();
        var maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> locks.runAs("minji", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                })));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    @DisplayName("Locks should be re-entrant for nested calls by the same user")
    void testReentrant() {
        var result = locks.callAs("minji", () -> locks.callAs("minji", () -> locks.isHeldByCurrentThread("minji")));

        assertThat(result).isTrue();
        assertThat(locks.isHeldByCurrentThread("minji")).isFalse();
    }

    @Test
    @DisplayName("Locks of users with no call in flight should be released from the registry")
    void testIdleLocksEvicted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                String userId = "user-" + i;
                futures.add(pool.submit(() -> locks.runAs(userId, () -> {
                    assertThat(locks.isHeldByCurrentThread(userId)).isTrue();
                })));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(locks.size()).isZero();
        assertThat(locks.isHeldByCurrentThread("user-1")).isFalse();
    }

    @Test
    @DisplayName("A nested call should keep the lock registered until the outer call ends")
    void testNestedCallKeepsLock() {
        locks.runAs("minji", () -> {
            locks.runAs("minji", () -> assertThat(locks.size()).isEqualTo(1));
            assertThat(locks.isHeldByCurrentThread("minji")).isTrue();
            assertThat(locks.size()).isEqualTo(1);
        });

        assertThat(locks.size()).isZero();
    }
}
