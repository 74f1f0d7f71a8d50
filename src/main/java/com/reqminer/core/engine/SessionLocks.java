package com.reqminer.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of per-session locks. Calls on one session run one at a time;
 * different sessions never contend.
 * <p>
 * Each entry counts the callers holding or waiting for its lock and is evicted
 * when the last one releases it. The count only changes inside the map's
 * per-key {@code compute}, so a new caller always joins the entry that the
 * current holder still owns.
 */
public class SessionLocks {

    private static final Logger log = LoggerFactory.getLogger(SessionLocks.class);

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public SessionLocks(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Acquires the lock of a session, waiting at most the configured timeout.
     *
     * @return a handle that releases the lock when closed
     * @throws SessionBusyException if the lock was not acquired in time
     */
    public Held acquire(String sessionId) {
        Entry entry = locks.compute(sessionId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });

        boolean acquired;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            leave(sessionId, entry);
            throw new SessionBusyException(sessionId, timeout);
        }
        if (!acquired) {
            leave(sessionId, entry);
            log.warn("Timed out waiting for lock on session {}", sessionId);
            throw new SessionBusyException(sessionId, timeout);
        }
        return () -> {
            entry.lock.unlock();
            leave(sessionId, entry);
        };
    }

    private void leave(String sessionId, Entry entry) {
        locks.computeIfPresent(sessionId, (id, current) -> {
            if (current != entry) {
                return current;
            }
            return --current.users == 0 ? null : current;
        });
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    /**
     * Lock held by the current thread.
     */
    @FunctionalInterface
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
