package com.example.oralexam.application.service;

import com.example.oralexam.domain.exception.ConcurrencyException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * One lock per exam session id. Work on different sessions never contends.
 * <p>
 * Idle locks can be dropped with {@link #release(Long)}. A caller that acquired a lock
 * which was dropped meanwhile retries with the current one, so at most one caller per
 * session runs at a time.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public SessionLockRegistry(@Value("${oralexam.assignment.lock-timeout-ms}") long timeoutMs) {
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    public <T> T withLock(Long sessionId, Supplier<T> action) {
        ReentrantLock lock = acquire(sessionId);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the lock of a session if nobody holds or waits for it.
     */
    public void release(Long sessionId) {
        locks.computeIfPresent(sessionId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    int size() {
        return locks.size();
    }

    private ReentrantLock acquire(Long sessionId) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
            boolean acquired;
            try {
                acquired = lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConcurrencyException("Interrupted while waiting for exam session " + sessionId, e);
            }
            if (!acquired) {
                throw new ConcurrencyException(
                        "Assignment for exam session " + sessionId + " is already in progress");
            }
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            // dropped while we were waiting
            lock.unlock();
        }
    }
}
