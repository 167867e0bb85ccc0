package com.fleet.moderation.core.model;

/**
 * A channel-style identity posting under a broadcast persona.
 *
 * @param id         numeric id of the underlying channel
 * @param title      channel title
 * @param username   optional handle without {@code @}
 * @param accessHash access credential, 0 if unknown
 */
public record Broadcast(long id, String title, String username, long accessHash) implements Identity {

    public static Broadcast of(long id, String title) {
        return new Broadcast(id, title, null, 0L);
    }

    @Override
    public String displayName() {
        String name = title != null ? title : String.valueOf(id);
        if (username != null && !username.isEmpty()) {
            name += " (@" + username + ")";
        }
        return "Channel: " + name;
    }
}
