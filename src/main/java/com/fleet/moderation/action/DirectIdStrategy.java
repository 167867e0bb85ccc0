package com.fleet.moderation.action;

import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;

/**
 * Submits the change addressed by the bare numeric id.
 */
public class DirectIdStrategy extends RemoteAddressingStrategy {

    public DirectIdStrategy(RosterService roster) {
        super(roster);
    }

    @Override
    public String name() {
        return "direct-id";
    }

    @Override
    public StrategyResult attempt(ActionContext context) {
        return submit(context, PeerRef.byId(context.targetId()));
    }
}
