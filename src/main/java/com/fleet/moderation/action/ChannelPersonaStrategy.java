package com.fleet.moderation.action;

import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;

import java.util.OptionalLong;

/**
 * Handles broadcast personas posing as participants: looks up the membership, takes
 * the underlying channel id and resubmits with it.
 */
public class ChannelPersonaStrategy extends RemoteAddressingStrategy {

    public ChannelPersonaStrategy(RosterService roster) {
        super(roster);
    }

    @Override
    public String name() {
        return "channel-persona";
    }

    @Override
    public StrategyResult attempt(ActionContext context) {
        OptionalLong channelId;
        try {
            MembershipInfo membership = roster.getMembership(context.scopeId(), PeerRef.byId(context.targetId()));
            channelId = membership.persona();
        } catch (Exception e) {
            return StrategyResult.failed("membership lookup failed: " + describe(e));
        }
        if (channelId.isEmpty()) {
            return StrategyResult.skipped("target is not a broadcast persona");
        }
        return submit(context, PeerRef.byChannel(channelId.getAsLong()));
    }
}
