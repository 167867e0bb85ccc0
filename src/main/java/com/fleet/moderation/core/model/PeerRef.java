package com.fleet.moderation.core.model;

import java.util.Objects;

/**
 * How a target is addressed in a remote call. Each variant corresponds to one
 * addressing strategy of the fallback chain.
 */
public sealed interface PeerRef permits PeerRef.ById, PeerRef.ByIdentity, PeerRef.ByChannel, PeerRef.Raw {

    /**
     * Returns the numeric id this reference points at.
     */
    long id();

    static PeerRef byId(long id) {
        return new ById(id);
    }

    static PeerRef byIdentity(Identity identity) {
        return new ByIdentity(identity);
    }

    static PeerRef byChannel(long channelId) {
        return new ByChannel(channelId);
    }

    /**
     * Builds a raw peer from an identity's access credentials.
     *
     * @throws IllegalArgumentException if the identity carries no access hash
     */
    static PeerRef raw(Identity identity) {
        if (!identity.hasAccessHash()) {
            throw new IllegalArgumentException("identity " + identity.id() + " has no access hash");
        }
        Kind kind = identity instanceof Broadcast ? Kind.CHANNEL : Kind.PERSON;
        return new Raw(identity.id(), identity.accessHash(), kind);
    }

    enum Kind { PERSON, CHANNEL }

    record ById(long id) implements PeerRef {}

    record ByIdentity(Identity identity) implements PeerRef {
        public ByIdentity {
            Objects.requireNonNull(identity, "identity is required");
        }

        @Override
        public long id() {
            return identity.id();
        }
    }

    record ByChannel(long channelId) implements PeerRef {
        @Override
        public long id() {
            return channelId;
        }
    }

    record Raw(long id, long accessHash, Kind kind) implements PeerRef {}
}
