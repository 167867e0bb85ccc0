package com.fleet.moderation.resolve;

import com.fleet.moderation.core.model.Identity;

/**
 * The message a command replied to, as seen by the command layer.
 *
 * @param senderId         the sender's numeric id
 * @param sender           the sender's identity if the client already has it, else null
 * @param personaChannelId channel id when the message was posted under a broadcast persona, else null
 */
public record ReplyContext(long senderId, Identity sender, Long personaChannelId) {

    public static ReplyContext from(Identity sender) {
        return new ReplyContext(sender.id(), sender, null);
    }

    public static ReplyContext persona(Identity sender, long channelId) {
        return new ReplyContext(sender != null ? sender.id() : channelId, sender, channelId);
    }

    /**
     * The id that moderation should target: the persona's channel when present.
     */
    public long targetId() {
        return personaChannelId != null ? personaChannelId : senderId;
    }
}
