package com.fleet.moderation.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimedLockTest {

    @Test
    @DisplayName("Should run the section and return its value")
    void testRunsSection() {
        TimedLock lock = new TimedLock("test", LockConfig.defaults());

        assertEquals("done", lock.withLock(() -> "done", () -> "fallback"));
    }

    @Test
    @DisplayName("Should allow re-entry from the same thread")
    void testReentrant() {
        TimedLock lock = new TimedLock("test", new LockConfig(50));

        String result = lock.withLock(() -> lock.withLock(() -> "inner", () -> "fallback"), () -> "outer-fallback");

        assertEquals("inner", result);
    }

    @Test
    @DisplayName("Should release the lock when the section throws")
    void testReleasesOnException() {
        TimedLock lock = new TimedLock("test", new LockConfig(50));

        assertThrows(IllegalStateException.class,
                () -> lock.withLock(() -> { throw new IllegalStateException("boom"); }, () -> null));
        assertEquals("again", lock.withLock(() -> "again", () -> "fallback"));
    }

    @Test
    @DisplayName("Should serialize concurrent sections")
    void testConcurrentBlocking() throws Exception {
        TimedLock lock = new TimedLock("shared", new LockConfig(2000));
        AtomicInteger concurrentCount = new AtomicInteger(0);
        AtomicInteger maxConcurrent = new AtomicInteger(0);

        int threadCount = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        try {
            Future<?>[] futures = new Future<?>[threadCount];
            for (int i = 0; i < threadCount; i++) {
                futures[i] = pool.submit(() -> {
                    startLatch.await();
                    return lock.withLock(() -> {
                        int current = concurrentCount.incrementAndGet();
                        maxConcurrent.accumulateAndGet(current, Math::max);
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        concurrentCount.decrementAndGet();
                        return null;
                    }, () -> null);
                });
            }
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxConcurrent.get());
    }

    @Test
    @DisplayName("Should answer with the fallback when the lock is not acquired in time")
    void testTimeoutFallback() throws Exception {
        TimedLock lock = new TimedLock("busy", new LockConfig(50));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> lock.withLock(() -> {
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }, () -> null));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertEquals("fallback", lock.withLock(() -> "section", () -> "fallback"));
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("Should answer with the fallback and keep the interrupt flag when interrupted")
    void testInterrupted() {
        TimedLock lock = new TimedLock("test", LockConfig.defaults());
        Thread.currentThread().interrupt();
        try {
            assertEquals("fallback", lock.withLock(() -> "section", () -> "fallback"));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0));
        assertEquals(60_000, LockConfig.defaults().timeoutMs());
    }
}
