package com.reqminer.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class SessionLocksTest {

    private final SessionLocks locks = new SessionLocks(Duration.ofMillis(100));

    @Test
    @DisplayName("a second caller on the same session times out while the lock is held")
    void contention() throws Exception {
        try (var held = locks.acquire("s-1")) {
            var other = CompletableFuture.supplyAsync(() -> {
                try (var ignored = locks.acquire("s-1")) {
                    return "acquired";
                }
            });

            var ex = assertThrows(ExecutionException.class, () -> other.get(5, TimeUnit.SECONDS));
            var busy = assertInstanceOf(SessionBusyException.class, ex.getCause());
            assertEquals("s-1", busy.getSessionId());
        }
    }

    @Test
    @DisplayName("different sessions do not contend")
    void independentSessions() throws Exception {
        try (var held = locks.acquire("s-1")) {
            var other = CompletableFuture.supplyAsync(() -> {
                try (var ignored = locks.acquire("s-2")) {
                    return "acquired";
                }
            });

            assertEquals("acquired", other.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("a released lock can be taken by another thread")
    void release() throws Exception {
        locks.acquire("s-1").close();

        var other = CompletableFuture.supplyAsync(() -> {
            try (var ignored = locks.acquire("s-1")) {
                return "acquired";
            }
        });

        assertEquals("acquired", other.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("an idle session's lock entry is evicted")
    void idleEntriesAreEvicted() {
        var first = locks.acquire("s-1");
        var second = locks.acquire("s-2");
        assertEquals(2, locks.size());

        first.close();
        second.close();

        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("a timed-out caller does not leave an entry behind")
    void timeoutLeavesNoEntry() throws Exception {
        try (var held = locks.acquire("s-1")) {
            var other = CompletableFuture.runAsync(() -> locks.acquire("s-1").close());
            assertThrows(ExecutionException.class, () -> other.get(5, TimeUnit.SECONDS));
            assertEquals(1, locks.size());
        }
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("a caller arriving after a handover still waits for the new holder")
    void exclusionSurvivesHandover() throws Exception {
        var slowLocks = new SessionLocks(Duration.ofSeconds(2));
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            var first = slowLocks.acquire("s-1");
            var secondHolds = new CountDownLatch(1);
            var secondMayRelease = new CountDownLatch(1);
            var second = CompletableFuture.runAsync(() -> {
                try (var held = slowLocks.acquire("s-1")) {
                    secondHolds.countDown();
                    secondMayRelease.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, pool);

            first.close();
            assertTrue(secondHolds.await(5, TimeUnit.SECONDS));
            assertEquals(1, slowLocks.size());

            var third = CompletableFuture.supplyAsync(() -> {
                try (var held = slowLocks.acquire("s-1")) {
                    return "acquired";
                }
            }, pool);
            assertThrows(TimeoutException.class, () -> third.get(300, TimeUnit.MILLISECONDS));

            secondMayRelease.countDown();
            second.get(5, TimeUnit.SECONDS);
            assertEquals("acquired", third.get(5, TimeUnit.SECONDS));
            assertEquals(0, slowLocks.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
