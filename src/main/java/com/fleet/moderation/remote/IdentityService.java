package com.fleet.moderation.remote;

import com.fleet.moderation.core.model.Identity;

/**
 * Remote identity resolution service.
 */
public interface IdentityService {

    /**
     * Resolves an {@code @handle} or a numeric id (as a string) to an identity.
     *
     * @throws RemoteCallException if the handle cannot be resolved
     */
    Identity resolveHandle(String handleOrId);

    /**
     * Returns the identity of the account the agent operates as.
     */
    Identity currentAccount();
}
