package com.fleet.moderation.lock;

/**
 * Configuration for {@link TimedLock}.
 *
 * @param timeoutMs maximum time to wait for lock acquisition
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 60s timeout, long enough to wait out a full scope refresh.
     */
    public static LockConfig defaults() {
        return new LockConfig(60_000);
    }
}
