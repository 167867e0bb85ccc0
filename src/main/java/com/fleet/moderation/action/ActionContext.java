package com.fleet.moderation.action;

import com.fleet.moderation.core.model.ModerationRights;

/**
 * Input of one addressing strategy: which rights change to apply to whom, where.
 *
 * @param scopeId  the scope to act in
 * @param targetId the target's numeric id
 * @param rights   the rights change
 */
public record ActionContext(long scopeId, long targetId, ModerationRights rights) {

    public ActionContext {
        if (rights == null) {
            throw new IllegalArgumentException("rights is required");
        }
    }
}
