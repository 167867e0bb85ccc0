package com.fleet.moderation.cache;

import com.fleet.moderation.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Process-wide home of the fleet caches. Built once and injected into every component
 * that needs cached state; exposes invalidation as an explicit lifecycle operation.
 */
public class FleetCacheStore {
    private static final Logger log = LoggerFactory.getLogger(FleetCacheStore.class);

    private final ScopeCache scopes;
    private final PermissionCache permissions;
    private final IdentityCache identities;

    public FleetCacheStore(ScopeCache scopes, PermissionCache permissions, IdentityCache identities) {
        this.scopes = scopes;
        this.permissions = permissions;
        this.identities = identities;
    }

    public ScopeCache scopes() {
        return scopes;
    }

    public PermissionCache permissions() {
        return permissions;
    }

    public IdentityCache identities() {
        return identities;
    }

    /**
     * Rebuilds the scope list, then drops permission and identity entries so they are
     * recomputed on demand.
     *
     * @return the rebuilt scopes
     */
    public List<Scope> refreshAll() {
        List<Scope> rebuilt = scopes.refresh();
        permissions.clear();
        identities.clear();
        log.info("caches.refreshed scopes={}", rebuilt.size());
        return rebuilt;
    }

    /**
     * Clears every cache without fetching anything.
     */
    public void invalidateAll() {
        scopes.invalidate();
        permissions.clear();
        identities.clear();
        log.info("caches.invalidated");
    }

    /**
     * Drops expired permission and identity entries. A no-op when entries never expire.
     */
    public void evictExpired() {
        permissions.evictExpired();
        identities.evictExpired();
    }

    public CacheStatus status() {
        List<Scope> cached = scopes.peek().orElse(null);
        return new CacheStatus(
                cached != null,
                cached != null ? cached.size() : 0,
                scopes.isUnbounded(),
                scopes.remainingTtl().orElse(null),
                permissions.size(),
                identities.size());
    }
}
