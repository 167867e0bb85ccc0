package com.fleet.moderation.core.model;

/**
 * A participant's resolvable representation.
 *
 * <p>A moderation target is either a natural {@link Person} or a channel-style
 * {@link Broadcast} persona posting under a broadcast name. Both live in the same
 * numeric id space.</p>
 */
public sealed interface Identity permits Person, Broadcast {

    long id();

    /**
     * Returns the public handle without the leading {@code @}, or null.
     */
    String username();

    /**
     * Returns the access credential used to build a raw peer reference, or 0 if unknown.
     */
    long accessHash();

    default boolean hasAccessHash() {
        return accessHash() != 0L;
    }

    /**
     * Returns a human-readable label such as {@code Jane Doe (@jane)}.
     */
    String displayName();

    /**
     * Renders a target for display, falling back to the bare id when the identity is unknown.
     */
    static String display(Identity identity, long id) {
        return identity != null ? identity.displayName() : String.valueOf(id);
    }
}
