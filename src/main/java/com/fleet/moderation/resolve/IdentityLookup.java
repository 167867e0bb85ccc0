package com.fleet.moderation.resolve;

import com.fleet.moderation.cache.IdentityCache;
import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.remote.IdentityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Direct identity resolution through the {@link IdentityService}, backed by the
 * {@link IdentityCache}. Failed lookups return empty and are not cached.
 */
public class IdentityLookup {
    private static final Logger log = LoggerFactory.getLogger(IdentityLookup.class);

    private final IdentityService identityService;
    private final IdentityCache identities;

    public IdentityLookup(IdentityService identityService, IdentityCache identities) {
        this.identityService = identityService;
        this.identities = identities;
    }

    /**
     * Resolves a numeric id.
     */
    public Optional<Identity> byId(long id) {
        return Optional.ofNullable(identities.getOrCompute(id, this::fetchById));
    }

    /**
     * Resolves an {@code @handle}. A hit is cached under the identity's numeric id.
     */
    public Optional<Identity> byHandle(String handle) {
        try {
            Identity identity = identityService.resolveHandle(handle);
            if (identity != null) {
                identities.put(identity.id(), identity);
            }
            return Optional.ofNullable(identity);
        } catch (Exception e) {
            log.warn("identity.handle.unresolved handle={} error={}", handle, e.getMessage());
            return Optional.empty();
        }
    }

    private Identity fetchById(long id) {
        try {
            return identityService.resolveHandle(String.valueOf(id));
        } catch (Exception e) {
            log.debug("identity.id.unresolved id={} error={}", id, e.getMessage());
            return null;
        }
    }
}
