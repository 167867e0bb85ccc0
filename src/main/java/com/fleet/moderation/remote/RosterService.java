package com.fleet.moderation.remote;

import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.core.model.Scope;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Remote directory/roster service. Implementations wrap the protocol client and must be
 * safe for concurrent independent calls.
 *
 * <p>Every method may fail with {@link RemoteCallException} (or any other runtime
 * exception); callers in this library catch failures at the call site.</p>
 */
public interface RosterService {

    /**
     * Enumerates every collaborative space reachable by the agent's account.
     */
    Stream<Scope> enumerateScopes();

    /**
     * Looks up a single participant's membership in a scope.
     *
     * @param scopeId     the scope
     * @param participant the participant to look up
     * @return the membership, never null
     */
    MembershipInfo getMembership(long scopeId, PeerRef participant);

    /**
     * Lazily iterates at most {@code limit} members of a scope. The iterator is
     * not restartable; iteration steps may throw.
     */
    Iterator<Identity> iterMembers(long scopeId, int limit);

    /**
     * Applies a rights change to a participant.
     */
    void changeRights(long scopeId, PeerRef target, ModerationRights rights);

    /**
     * Deletes the participant's prior contributions from the scope's history.
     */
    void purgeHistory(long scopeId, PeerRef target);
}
