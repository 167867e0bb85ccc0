package com.fleet.moderation.resolve;

import com.fleet.moderation.core.model.Identity;

/**
 * Outcome of resolving a command target.
 *
 * @param status   how resolution ended
 * @param id       the id to act on (0 unless {@link Status#RESOLVED})
 * @param identity the resolved identity, null when only the id is known
 */
public record TargetResolution(Status status, long id, Identity identity) {

    public enum Status {
        RESOLVED,
        /** no argument and no reply, or a handle that does not resolve */
        UNRESOLVED,
        /** a cross-scope search was needed but no administered scopes exist */
        NO_SCOPES,
        /** every administered scope was searched without a match */
        NOT_LOCATABLE
    }

    public static TargetResolution resolved(long id, Identity identity) {
        return new TargetResolution(Status.RESOLVED, id, identity);
    }

    public static TargetResolution failed(Status status) {
        return new TargetResolution(status, 0L, null);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public String display() {
        return Identity.display(identity, id);
    }
}
