package com.fleet.moderation.core.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Result of a single membership lookup for one participant in one scope.
 *
 * @param role               the participant's role
 * @param canRestrictMembers whether the participant may change other members' rights
 * @param personaChannelId   underlying channel id when the participant is a broadcast persona, else null
 * @param identities         identities enumerated by the remote response
 */
public record MembershipInfo(
        MemberRole role,
        boolean canRestrictMembers,
        Long personaChannelId,
        List<Identity> identities
) {
    public MembershipInfo {
        role = role != null ? role : MemberRole.MEMBER;
        identities = identities != null ? List.copyOf(identities) : List.of();
    }

    public static MembershipInfo member(Identity identity) {
        return new MembershipInfo(MemberRole.MEMBER, false, null, List.of(identity));
    }

    public static MembershipInfo admin(Identity identity, boolean canRestrictMembers) {
        return new MembershipInfo(MemberRole.ADMIN, canRestrictMembers, null, List.of(identity));
    }

    public static MembershipInfo persona(long channelId, List<Identity> identities) {
        return new MembershipInfo(MemberRole.MEMBER, false, channelId, identities);
    }

    /**
     * Returns true when this membership grants moderation rights.
     */
    public boolean canModerate() {
        return role.isAdministrator() && canRestrictMembers;
    }

    public OptionalLong persona() {
        return personaChannelId != null ? OptionalLong.of(personaChannelId) : OptionalLong.empty();
    }

    /**
     * Finds the enumerated identity carrying the given id.
     */
    public Optional<Identity> identityFor(long id) {
        return identities.stream().filter(i -> i.id() == id).findFirst();
    }
}
