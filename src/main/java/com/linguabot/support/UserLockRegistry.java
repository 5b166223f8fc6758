package com.linguabot.support;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per user id: at most one mutation of a user's context or proficiency record is
 * in flight at a time, while different users proceed in parallel.
 * <p>
 * Locks are re-entrant, so a facade call holding a user's lock may call into engines that take
 * the same lock again.
 * </p>
 */
@Component
public class UserLockRegistry {

    /**
     * A user's lock and the number of calls holding or waiting for it. The count is only read and
     * written inside the map's atomic compute functions.
     */
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    private final ConcurrentMap<String, UserLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} holding the user's lock. The lock is dropped from the registry once no
     * call holds or waits for it, so idle users cost nothing.
     */
    public <T> T callAs(String userId, Supplier<T> action) {
        var entry = locks.compute(userId, (id, existing) -> {
            var held = existing == null ? new UserLock() : existing;
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    public void runAs(String userId, Runnable action) {
        callAs(userId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String userId) {
        var entry = locks.get(userId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    int size() {
        return locks.size();
    }
}
