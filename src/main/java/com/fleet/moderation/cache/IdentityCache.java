package com.fleet.moderation.cache;

import com.fleet.moderation.core.model.Identity;

import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Cache of resolved identities keyed by numeric id.
 */
public class IdentityCache {

    private final TimedCache<String, Identity> cache;

    public IdentityCache(TimedCache<String, Identity> cache) {
        this.cache = cache;
    }

    public Optional<Identity> get(long id) {
        return cache.getIfPresent(key(id));
    }

    /**
     * Returns the cached identity, or computes and stores it. A null result is not stored.
     */
    public Identity getOrCompute(long id, LongFunction<Identity> computeFn) {
        return cache.getOrCompute(key(id), k -> computeFn.apply(id));
    }

    public void put(long id, Identity identity) {
        cache.put(key(id), identity);
    }

    public void clear() {
        cache.clear();
    }

    public void evictExpired() {
        cache.evictExpired();
    }

    public long size() {
        return cache.size();
    }

    private static String key(long id) {
        return String.valueOf(id);
    }
}
