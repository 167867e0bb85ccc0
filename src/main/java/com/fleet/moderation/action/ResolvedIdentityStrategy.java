package com.fleet.moderation.action;

import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.resolve.IdentityLookup;

import java.util.Optional;

/**
 * Resolves the id to a full identity and resubmits with it.
 */
public class ResolvedIdentityStrategy extends RemoteAddressingStrategy {

    private final IdentityLookup lookup;

    public ResolvedIdentityStrategy(RosterService roster, IdentityLookup lookup) {
        super(roster);
        this.lookup = lookup;
    }

    @Override
    public String name() {
        return "resolved-identity";
    }

    @Override
    public StrategyResult attempt(ActionContext context) {
        Optional<Identity> identity = lookup.byId(context.targetId());
        if (identity.isEmpty()) {
            return StrategyResult.skipped("identity not resolvable");
        }
        return submit(context, PeerRef.byIdentity(identity.get()));
    }
}
