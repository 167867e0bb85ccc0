package com.fleet.moderation.action;

import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.remote.RosterService;

/**
 * Base for strategies that end in a single {@code changeRights} call.
 */
abstract class RemoteAddressingStrategy implements AddressingStrategy {

    protected final RosterService roster;

    protected RemoteAddressingStrategy(RosterService roster) {
        this.roster = roster;
    }

    protected StrategyResult submit(ActionContext context, PeerRef target) {
        try {
            roster.changeRights(context.scopeId(), target, context.rights());
            return StrategyResult.applied();
        } catch (Exception e) {
            return StrategyResult.failed(describe(e));
        }
    }

    static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
