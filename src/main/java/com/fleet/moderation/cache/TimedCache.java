package com.fleet.moderation.cache;

import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed get-or-compute cache with an optional time-to-live.
 *
 * <p>Computation happens outside the cache: two concurrent misses on the same key may
 * both compute, and the last writer wins. Values are idempotent remote reads, so the
 * duplicate work is accepted in exchange for never blocking other keys on a slow call.
 * A {@code null} computed value is returned but not stored.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TimedCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(TimedCache.class);

    private final String name;
    private final Cache<K, V> cache;
    private final MetricsService metrics;

    public TimedCache(String name, CacheConfig config) {
        this(name, config, Ticker.systemTicker(), new NoOpMetricsService());
    }

    public TimedCache(String name, CacheConfig config, Ticker ticker, MetricsService metrics) {
        this.name = name;
        this.metrics = metrics;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .ticker(ticker);
        config.ttlIfBounded().ifPresent(builder::expireAfterWrite);
        this.cache = builder.build();
        log.debug("cache.initialized name={} maxSize={} ttl={}", name, config.maxSize(),
                config.isUnbounded() ? "unbounded" : config.ttl());
    }

    /**
     * Returns the cached value if fresh, otherwise computes, stores and returns a new one.
     */
    public V getOrCompute(K key, Function<? super K, ? extends V> computeFn) {
        V cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit(name);
            return cached;
        }
        metrics.recordCacheMiss(name);
        V computed = computeFn.apply(key);
        if (computed != null) {
            cache.put(key, computed);
        }
        return computed;
    }

    public Optional<V> getIfPresent(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(K key, V value) {
        cache.put(key, value);
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
        log.debug("cache.cleared name={}", name);
    }

    /**
     * Drops expired entries eagerly instead of waiting for the next access.
     */
    public void evictExpired() {
        cache.cleanUp();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public String getName() {
        return name;
    }
}
