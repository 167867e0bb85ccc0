package com.fleet.moderation.cache;

import java.time.Duration;

/**
 * Point-in-time view of the fleet caches.
 *
 * @param scopesCached      whether an administered-scope list is cached
 * @param scopeCount        number of cached scopes (0 when nothing is cached)
 * @param unbounded         whether entries never expire
 * @param remainingTtl      time until the scope list goes stale; null when unbounded or empty
 * @param permissionEntries number of cached permission entries
 * @param identityEntries   number of cached identities
 */
public record CacheStatus(
        boolean scopesCached,
        int scopeCount,
        boolean unbounded,
        Duration remainingTtl,
        long permissionEntries,
        long identityEntries
) {
    @Override
    public String toString() {
        String ttl = !scopesCached ? "not built"
                : unbounded ? "permanent" : remainingTtl.toSeconds() + "s left";
        return "CacheStatus{scopes=" + scopeCount +
                ", ttl=" + ttl +
                ", permissions=" + permissionEntries +
                ", identities=" + identityEntries + '}';
    }
}
