package com.fleet.moderation.remote;

import com.fleet.moderation.core.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes the identity of the account the agent operates as. A failed lookup is not
 * remembered, so the next call retries.
 */
public class CurrentAccount {
    private static final Logger log = LoggerFactory.getLogger(CurrentAccount.class);

    private final IdentityService identityService;
    private volatile Identity self;

    public CurrentAccount(IdentityService identityService) {
        this.identityService = identityService;
    }

    /**
     * Returns the account identity.
     *
     * @throws RemoteCallException if the account cannot be looked up
     */
    public Identity get() {
        Identity current = self;
        if (current != null) {
            return current;
        }
        try {
            current = identityService.currentAccount();
        } catch (RemoteCallException e) {
            throw e;
        } catch (Exception e) {
            throw new RemoteCallException("Failed to look up current account: " + e.getMessage(), e);
        }
        if (current == null) {
            throw new RemoteCallException("Identity service returned no current account");
        }
        self = current;
        log.debug("account.resolved id={}", current.id());
        return current;
    }

    public long id() {
        return get().id();
    }
}
