package com.fleet.moderation.cache;

import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.CurrentAccount;
import com.fleet.moderation.remote.RosterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongFunction;

/**
 * Per-scope cache of whether the agent may moderate that scope.
 * A failing probe answers {@code false} and is not cached.
 */
public class PermissionCache {
    private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

    private final TimedCache<Long, Boolean> cache;
    private final RosterService roster;
    private final CurrentAccount account;

    public PermissionCache(TimedCache<Long, Boolean> cache, RosterService roster, CurrentAccount account) {
        this.cache = cache;
        this.roster = roster;
        this.account = account;
    }

    /**
     * Returns whether the agent holds a moderation-capable role in the scope.
     */
    public boolean canModerate(long scopeId) {
        return Boolean.TRUE.equals(cache.getOrCompute(scopeId, this::probe));
    }

    /**
     * Returns the cached flag for the scope, or computes and stores it. A null result is not stored.
     */
    public Boolean getOrCompute(long scopeId, LongFunction<Boolean> computeFn) {
        return cache.getOrCompute(scopeId, id -> computeFn.apply(id));
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

    private Boolean probe(Long scopeId) {
        try {
            MembershipInfo self = roster.getMembership(scopeId, PeerRef.byId(account.id()));
            return self.canModerate();
        } catch (Exception e) {
            log.debug("permission.probe.failed scopeId={} error={}", scopeId, e.getMessage());
            return null;
        }
    }
}
