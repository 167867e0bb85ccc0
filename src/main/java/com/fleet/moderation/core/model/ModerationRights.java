package com.fleet.moderation.core.model;

import java.time.Instant;

/**
 * A rights change submitted to the remote system. Each flag set to {@code true}
 * revokes the corresponding permission.
 *
 * @param viewMessages revoke read access (full exclusion)
 * @param sendMessages revoke posting
 * @param sendMedia    revoke media posting
 * @param sendStickers revoke stickers
 * @param sendGifs     revoke animations
 * @param sendGames    revoke games
 * @param sendInline   revoke inline bots
 * @param embedLinks   revoke link previews
 * @param until        when the restriction lapses; null means forever, {@link Instant#EPOCH} lifts it
 */
public record ModerationRights(
        boolean viewMessages,
        boolean sendMessages,
        boolean sendMedia,
        boolean sendStickers,
        boolean sendGifs,
        boolean sendGames,
        boolean sendInline,
        boolean embedLinks,
        Instant until
) {

    /**
     * Every permission revoked, forever. Used for fleet-wide bans.
     */
    public static ModerationRights fullBan() {
        return new ModerationRights(true, true, true, true, true, true, true, true, null);
    }

    /**
     * Read and post access revoked, forever.
     */
    public static ModerationRights ban() {
        return new ModerationRights(true, true, false, false, false, false, false, false, null);
    }

    /**
     * Read access revoked with an immediate-lift date; the first half of a kick.
     */
    public static ModerationRights expel() {
        return new ModerationRights(true, false, false, false, false, false, false, false, Instant.EPOCH);
    }

    /**
     * Nothing revoked.
     */
    public static ModerationRights unban() {
        return new ModerationRights(false, false, false, false, false, false, false, false, Instant.EPOCH);
    }

    /**
     * Posting revoked until the given instant.
     */
    public static ModerationRights mute(Instant until) {
        if (until == null) {
            throw new IllegalArgumentException("mute requires an end time");
        }
        return new ModerationRights(false, true, false, false, false, false, false, false, until);
    }

    public static ModerationRights unmute() {
        return unban();
    }

    /**
     * Returns true when read access is revoked, which makes the target's history eligible for purging.
     */
    public boolean isFullExclusion() {
        return viewMessages;
    }
}
