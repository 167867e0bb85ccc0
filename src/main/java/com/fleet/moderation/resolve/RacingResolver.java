package com.fleet.moderation.resolve;

import com.fleet.moderation.cache.IdentityCache;
import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.logging.LogContext;
import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.tracing.Span;
import com.fleet.moderation.tracing.SpanAttributes;
import com.fleet.moderation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Locates an identity by numeric id by probing many scopes at once.
 *
 * <p>At most {@code parallelLimit} workers are started; each takes scopes from a shared
 * queue until it finds the target, the queue is empty or the race is decided, so every
 * scope is probed at most once and no more than {@code parallelLimit} threads are busy
 * with one resolution. A probe first
 * tries an exact membership lookup; only if that errors or does not enumerate the
 * target does it scan up to {@code perScopeScanLimit} members. The first probe to find
 * the target wins, the rest are cancelled and joined, and the hit is written to the
 * {@link IdentityCache}. This is a first-success race: which scope reports the match
 * depends on timing, not on scope order.</p>
 */
public class RacingResolver {
    private static final Logger log = LoggerFactory.getLogger(RacingResolver.class);

    public static final int DEFAULT_PARALLEL_LIMIT = 8;
    public static final int DEFAULT_SCAN_LIMIT = 2000;

    private final RosterService roster;
    private final IdentityCache identities;
    private final ExecutorService executor;
    private final int parallelLimit;
    private final boolean membershipProbeFirst;
    private final MetricsService metrics;
    private final TracingService tracing;

    public RacingResolver(RosterService roster, IdentityCache identities, ExecutorService executor,
                          int parallelLimit, boolean membershipProbeFirst,
                          MetricsService metrics, TracingService tracing) {
        if (parallelLimit <= 0) {
            throw new IllegalArgumentException("parallelLimit must be > 0");
        }
        this.roster = roster;
        this.identities = identities;
        this.executor = executor;
        this.parallelLimit = parallelLimit;
        this.membershipProbeFirst = membershipProbeFirst;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    public Optional<Identity> resolve(List<Scope> scopes, long targetId) {
        return resolve(scopes, targetId, DEFAULT_SCAN_LIMIT);
    }

    /**
     * Finds the identity with {@code targetId} in any of the given scopes.
     *
     * @return the identity, or empty if no scope could locate it
     * @throws IllegalArgumentException if {@code targetId} or {@code perScopeScanLimit} is not positive
     */
    public Optional<Identity> resolve(List<Scope> scopes, long targetId, int perScopeScanLimit) {
        if (targetId <= 0) {
            throw new IllegalArgumentException("targetId must be > 0, was " + targetId);
        }
        if (perScopeScanLimit <= 0) {
            throw new IllegalArgumentException("perScopeScanLimit must be > 0");
        }

        Optional<Identity> cached = identities.get(targetId);
        if (cached.isPresent()) {
            metrics.recordCacheHit("identities");
            return cached;
        }
        metrics.recordCacheMiss("identities");

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(), targetId);
             Span span = tracing.startSpan("fleet.resolve", targetId)) {
            span.setAttribute(SpanAttributes.SCOPE_COUNT, scopes.size());

            Queue<Scope> pending = new ConcurrentLinkedQueue<>(scopes);
            int workers = Math.min(parallelLimit, scopes.size());
            FirstMatchRace<Identity> race = new FirstMatchRace<>(executor);
            Optional<Identity> found;
            try {
                for (int i = 0; i < workers; i++) {
                    race.submit(signal -> drain(pending, targetId, perScopeScanLimit, signal));
                }
                found = race.awaitFirst();
            } catch (RejectedExecutionException e) {
                race.cancel();
                span.fail(e);
                log.warn("resolve.rejected targetId={} error={}", targetId, e.getMessage());
                return Optional.empty();
            }

            found.ifPresent(identity -> identities.put(targetId, identity));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordResolution(found.isPresent(), elapsed);
            span.setAttribute(SpanAttributes.FOUND, found.isPresent());
            span.setStatus(Span.SpanStatus.OK);
            log.info("resolve.completed targetId={} scopes={} found={} elapsedMs={}",
                    targetId, scopes.size(), found.isPresent(), elapsed.toMillis());
            return found;
        }
    }

    private Optional<Identity> drain(Queue<Scope> pending, long targetId, int scanLimit, RaceSignal signal) {
        Scope scope;
        while (!signal.isCancelled() && (scope = pending.poll()) != null) {
            Optional<Identity> hit = probe(scope, targetId, scanLimit, signal);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private Optional<Identity> probe(Scope scope, long targetId, int scanLimit, RaceSignal signal) {
        if (membershipProbeFirst) {
            Optional<Identity> direct = membershipLookup(scope, targetId);
            if (direct.isPresent()) {
                return direct;
            }
        }
        if (signal.isCancelled()) {
            return Optional.empty();
        }
        return scanMembers(scope, targetId, scanLimit, signal);
    }

    private Optional<Identity> membershipLookup(Scope scope, long targetId) {
        try {
            MembershipInfo info = roster.getMembership(scope.id(), PeerRef.byId(targetId));
            return info.identityFor(targetId);
        } catch (Exception e) {
            log.debug("resolve.membership.miss scopeId={} targetId={} error={}", scope.id(), targetId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Identity> scanMembers(Scope scope, long targetId, int scanLimit, RaceSignal signal) {
        try {
            Iterator<Identity> members = roster.iterMembers(scope.id(), scanLimit);
            int scanned = 0;
            while (scanned < scanLimit && !signal.isCancelled() && members.hasNext()) {
                Identity member = members.next();
                scanned++;
                if (member != null && member.id() == targetId) {
                    return Optional.of(member);
                }
            }
            return Optional.empty();
        } catch (Exception e) {
            if (signal.isCancelled()) {
                log.trace("resolve.scan.cancelled scopeId={}", scope.id());
            } else {
                log.warn("resolve.scan.failed scope='{}' targetId={} error={}", scope.title(), targetId, e.getMessage());
            }
            return Optional.empty();
        }
    }
}
