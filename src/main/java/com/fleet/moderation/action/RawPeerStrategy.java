package com.fleet.moderation.action;

import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.resolve.IdentityLookup;

import java.util.Optional;

/**
 * Last resort: builds a minimal raw peer from the resolved identity's access hash.
 */
public class RawPeerStrategy extends RemoteAddressingStrategy {

    private final IdentityLookup lookup;

    public RawPeerStrategy(RosterService roster, IdentityLookup lookup) {
        super(roster);
        this.lookup = lookup;
    }

    @Override
    public String name() {
        return "raw-peer";
    }

    @Override
    public StrategyResult attempt(ActionContext context) {
        Optional<Identity> identity = lookup.byId(context.targetId());
        if (identity.isEmpty() || !identity.get().hasAccessHash()) {
            return StrategyResult.skipped("no access hash available");
        }
        return submit(context, PeerRef.raw(identity.get()));
    }
}
