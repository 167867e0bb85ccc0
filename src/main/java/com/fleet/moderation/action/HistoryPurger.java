package com.fleet.moderation.action;

import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.resolve.IdentityLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Best-effort removal of a target's prior contributions from a scope's history.
 * Tries the bare id, then the resolved identity. Never throws.
 */
public class HistoryPurger {
    private static final Logger log = LoggerFactory.getLogger(HistoryPurger.class);

    private final RosterService roster;
    private final IdentityLookup lookup;

    public HistoryPurger(RosterService roster, IdentityLookup lookup) {
        this.roster = roster;
        this.lookup = lookup;
    }

    /**
     * @return true if either attempt succeeded
     */
    public boolean purge(long scopeId, long targetId) {
        try {
            roster.purgeHistory(scopeId, PeerRef.byId(targetId));
            log.info("history.purged scopeId={} targetId={}", scopeId, targetId);
            return true;
        } catch (Exception e) {
            log.warn("history.purge.direct-id.failed scopeId={} targetId={} error={}",
                    scopeId, targetId, e.getMessage());
        }

        Optional<Identity> identity = lookup.byId(targetId);
        if (identity.isEmpty()) {
            log.warn("history.purge.skipped scopeId={} targetId={} reason=identity-unresolvable",
                    scopeId, targetId);
            return false;
        }
        try {
            roster.purgeHistory(scopeId, PeerRef.byIdentity(identity.get()));
            log.info("history.purged scopeId={} targetId={} via=resolved-identity", scopeId, targetId);
            return true;
        } catch (Exception e) {
            log.warn("history.purge.resolved-identity.failed scopeId={} targetId={} error={}",
                    scopeId, targetId, e.getMessage());
            return false;
        }
    }
}
