package com.fleet.moderation.resolve;

import com.fleet.moderation.cache.ScopeCache;
import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the target of a moderation request.
 *
 * <p>An explicit argument always wins over the reply context. A positive numeric id that
 * does not resolve directly is searched for across every administered scope with the
 * {@link RacingResolver}.</p>
 */
public class TargetResolver {
    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    private final IdentityLookup lookup;
    private final RacingResolver racingResolver;
    private final ScopeCache scopes;
    private final int perScopeScanLimit;

    public TargetResolver(IdentityLookup lookup, RacingResolver racingResolver,
                          ScopeCache scopes, int perScopeScanLimit) {
        this.lookup = lookup;
        this.racingResolver = racingResolver;
        this.scopes = scopes;
        this.perScopeScanLimit = perScopeScanLimit;
    }

    public TargetResolution resolve(TargetSpec spec, ReplyContext reply) {
        return switch (spec.kind()) {
            case HANDLE -> lookup.byHandle(spec.handle())
                    .map(identity -> TargetResolution.resolved(identity.id(), identity))
                    .orElseGet(() -> TargetResolution.failed(TargetResolution.Status.UNRESOLVED));
            case NUMERIC -> resolveNumeric(spec.id());
            case NONE -> fromReply(reply);
        };
    }

    private TargetResolution resolveNumeric(long id) {
        Optional<Identity> direct = lookup.byId(id);
        if (direct.isPresent()) {
            return TargetResolution.resolved(id, direct.get());
        }
        if (id < 0) {
            // scope and channel ids are acted on as-is
            return TargetResolution.resolved(id, null);
        }

        log.info("target.locating id={}", id);
        List<Scope> administered = scopes.getScopes();
        if (administered.isEmpty()) {
            return TargetResolution.failed(TargetResolution.Status.NO_SCOPES);
        }
        return racingResolver.resolve(administered, id, perScopeScanLimit)
                .map(found -> TargetResolution.resolved(found.id(), found))
                .orElseGet(() -> TargetResolution.failed(TargetResolution.Status.NOT_LOCATABLE));
    }

    private TargetResolution fromReply(ReplyContext reply) {
        if (reply == null) {
            return TargetResolution.failed(TargetResolution.Status.UNRESOLVED);
        }
        if (reply.personaChannelId() != null) {
            // the sender identity belongs to whoever posted, not to the channel being targeted
            log.info("target.persona channelId={}", reply.personaChannelId());
            return TargetResolution.resolved(reply.personaChannelId(), null);
        }
        return TargetResolution.resolved(reply.senderId(), reply.sender());
    }
}
