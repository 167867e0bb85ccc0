package com.fleet.moderation.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the fleet caches.
 *
 * @param maxSize maximum number of entries per keyed cache
 * @param ttl     time-to-live for each entry; null means entries never expire until cleared
 */
public record CacheConfig(long maxSize, Duration ttl) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Default cache configuration: 100,000 entries, no expiry.
     */
    public static CacheConfig defaults() {
        return unbounded();
    }

    public static CacheConfig unbounded() {
        return new CacheConfig(100_000, null);
    }

    public static CacheConfig expiringAfter(Duration ttl) {
        return new CacheConfig(100_000, ttl);
    }

    public boolean isUnbounded() {
        return ttl == null;
    }

    public Optional<Duration> ttlIfBounded() {
        return Optional.ofNullable(ttl);
    }
}
