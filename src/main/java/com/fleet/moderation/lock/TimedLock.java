package com.fleet.moderation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guards one expensive critical section. A caller waits at most the configured timeout;
 * if it cannot get in, it gets the fallback's answer instead of running the section.
 *
 * <pre>
 * List&lt;Scope&gt; scopes = lock.withLock(this::rebuild, this::lastKnownScopes);
 * </pre>
 */
public class TimedLock {
    private static final Logger log = LoggerFactory.getLogger(TimedLock.class);

    private final String name;
    private final LockConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    public TimedLock(String name, LockConfig config) {
        this.name = name;
        this.config = config;
    }

    /**
     * Runs {@code section} while holding the lock, or {@code onTimeout} if the lock is not
     * acquired in time or the wait is interrupted. The interrupt flag is restored.
     */
    public <T> T withLock(Supplier<T> section, Supplier<T> onTimeout) {
        boolean acquired;
        try {
            acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("lock.interrupted name={}", name);
            return onTimeout.get();
        }
        if (!acquired) {
            log.warn("lock.timeout name={} timeoutMs={}", name, config.timeoutMs());
            return onTimeout.get();
        }
        try {
            return section.get();
        } finally {
            lock.unlock();
        }
    }
}
