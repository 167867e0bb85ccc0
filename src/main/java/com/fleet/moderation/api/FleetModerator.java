package com.fleet.moderation.api;

import com.fleet.moderation.action.FallbackActionExecutor;
import com.fleet.moderation.cache.CacheConfig;
import com.fleet.moderation.cache.CacheStatus;
import com.fleet.moderation.cache.FleetCacheStore;
import com.fleet.moderation.cache.IdentityCache;
import com.fleet.moderation.cache.PermissionCache;
import com.fleet.moderation.cache.ScopeCache;
import com.fleet.moderation.cache.TimedCache;
import com.fleet.moderation.core.model.Identity;
import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.dispatch.BatchDispatcher;
import com.fleet.moderation.dispatch.BatchOutcome;
import com.fleet.moderation.dispatch.DispatchConfig;
import com.fleet.moderation.dispatch.ProgressCallback;
import com.fleet.moderation.lock.LockConfig;
import com.fleet.moderation.logging.LogContext;
import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.metrics.NoOpMetricsService;
import com.fleet.moderation.remote.CurrentAccount;
import com.fleet.moderation.remote.IdentityService;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.resolve.IdentityLookup;
import com.fleet.moderation.resolve.InvalidTargetException;
import com.fleet.moderation.resolve.RacingResolver;
import com.fleet.moderation.resolve.ReplyContext;
import com.fleet.moderation.resolve.TargetResolution;
import com.fleet.moderation.resolve.TargetResolver;
import com.fleet.moderation.resolve.TargetSpec;
import com.fleet.moderation.tracing.NoOpTracingService;
import com.fleet.moderation.tracing.TracingService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point of the fleet moderation library.
 *
 * <p>Resolves a target from a command argument or the replied-to message, then applies
 * a moderation action either in one scope or across every scope the agent administers.
 * Remote failures never escape: they come back as a {@link ModerationResult} status or
 * as failed scopes in its {@link BatchOutcome}.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (FleetModerator moderator = FleetModerator.builder()
 *         .rosterService(roster)
 *         .identityService(identities)
 *         .build()) {
 *     moderator.preload();
 *     ModerationResult result = moderator.superBan("@spammer", null, null);
 * }
 * </pre>
 */
public class FleetModerator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FleetModerator.class);

    static final int DEFAULT_MUTE_MINUTES = 60;
    static final int MAX_MUTE_MINUTES = 1440;

    private final RosterService roster;
    private final ModerationOptions options;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final FleetCacheStore caches;
    private final TargetResolver targets;
    private final RacingResolver racingResolver;
    private final FallbackActionExecutor actions;
    private final BatchDispatcher dispatcher;
    private final CurrentAccount account;
    private final Clock clock;

    private FleetModerator(Builder builder) {
        this.roster = builder.rosterService;
        this.options = builder.options;
        this.clock = builder.clock;
        this.ownsExecutor = builder.executor == null;
        this.executor = ownsExecutor ? Executors.newCachedThreadPool(new WorkerThreadFactory()) : builder.executor;

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        LockConfig lockConfig = new LockConfig(options.getLockTimeout().toMillis());
        Ticker ticker = builder.ticker;

        CacheConfig cacheConfig = new CacheConfig(options.getCacheMaxSize(), options.getCacheTtl());
        this.account = new CurrentAccount(builder.identityService);
        IdentityCache identityCache = new IdentityCache(
                new TimedCache<>("identities", cacheConfig, ticker, metrics));
        PermissionCache permissionCache = new PermissionCache(
                new TimedCache<>("permissions", cacheConfig, ticker, metrics), roster, account);
        ScopeCache scopeCache = new ScopeCache(roster, account, lockConfig, cacheConfig,
                options.getProbeBatchSize(), executor, ticker, metrics, tracing);
        this.caches = new FleetCacheStore(scopeCache, permissionCache, identityCache);

        IdentityLookup lookup = new IdentityLookup(builder.identityService, identityCache);
        this.racingResolver = new RacingResolver(roster, identityCache, executor,
                options.getParallelLimit(), options.isMembershipProbeFirst(), metrics, tracing);
        this.targets = new TargetResolver(lookup, racingResolver, scopeCache, options.getPerScopeScanLimit());
        this.actions = FallbackActionExecutor.withDefaultChain(roster, lookup, metrics);
        this.dispatcher = new BatchDispatcher(actions, executor,
                new DispatchConfig(options.getDispatchChunkSize(), options.getProgressInterval()),
                metrics, tracing);
    }

    // ========== Fleet-wide actions ==========

    /**
     * Fully bans the target in every administered scope.
     *
     * @param target the raw argument ({@code @handle}, numeric id) or null to use {@code reply}
     * @param reply  the replied-to message, or null
     * @param reason free-text reason, or null for the default
     */
    public ModerationResult superBan(String target, ReplyContext reply, String reason) {
        return superBan(target, reply, reason, ProgressCallback.NOOP);
    }

    public ModerationResult superBan(String target, ReplyContext reply, String reason, ProgressCallback progress) {
        return fleetWide(ModerationAction.SUPER_BAN, target, reply, reason, ModerationRights.fullBan(), progress);
    }

    /**
     * Lifts every restriction on the target in every administered scope.
     */
    public ModerationResult superUnban(String target, ReplyContext reply) {
        return superUnban(target, reply, ProgressCallback.NOOP);
    }

    public ModerationResult superUnban(String target, ReplyContext reply, ProgressCallback progress) {
        return fleetWide(ModerationAction.SUPER_UNBAN, target, reply, null, ModerationRights.unban(), progress);
    }

    // ========== Single-scope actions ==========

    public ModerationResult ban(long scopeId, String target, ReplyContext reply, String reason) {
        return inScope(ModerationAction.BAN, scopeId, target, reply, reason, null);
    }

    public ModerationResult unban(long scopeId, String target, ReplyContext reply) {
        return inScope(ModerationAction.UNBAN, scopeId, target, reply, null, null);
    }

    /**
     * Removes the target from the scope without a lasting ban.
     */
    public ModerationResult kick(long scopeId, String target, ReplyContext reply, String reason) {
        return inScope(ModerationAction.KICK, scopeId, target, reply, reason, null);
    }

    /**
     * Revokes posting for {@code minutes}, clamped to 1..1440; null means 60.
     */
    public ModerationResult mute(long scopeId, String target, ReplyContext reply, Integer minutes, String reason) {
        int clamped = clampMinutes(minutes);
        return inScope(ModerationAction.MUTE, scopeId, target, reply, reason, clock.instant().plus(Duration.ofMinutes(clamped)));
    }

    public ModerationResult unmute(long scopeId, String target, ReplyContext reply) {
        return inScope(ModerationAction.UNMUTE, scopeId, target, reply, null, null);
    }

    // ========== Cache lifecycle ==========

    /**
     * Rebuilds the administered-scope list and drops permission and identity entries.
     *
     * @return the number of administered scopes
     */
    public int refreshCaches() {
        return caches.refreshAll().size();
    }

    /**
     * Warms the scope cache and the current-account lookup.
     *
     * @return the number of administered scopes
     */
    public int preload() {
        List<Scope> scopes = caches.scopes().getScopes();
        try {
            account.get();
        } catch (RuntimeException e) {
            log.warn("preload.account.failed error={}", e.getMessage());
        }
        log.info("preload.completed scopes={}", scopes.size());
        return scopes.size();
    }

    public CacheStatus cacheStatus() {
        return caches.status();
    }

    public void evictExpired() {
        caches.evictExpired();
    }

    /**
     * Clears every cache without fetching anything.
     */
    public void invalidate() {
        caches.invalidateAll();
    }

    // ========== Lower-level access ==========

    public List<Scope> getScopes() {
        return caches.scopes().getScopes();
    }

    public Optional<Identity> locate(long targetId) {
        return racingResolver.resolve(getScopes(), targetId, options.getPerScopeScanLimit());
    }

    public BatchOutcome dispatch(List<Scope> scopes, long targetId, ModerationRights rights, String actionName) {
        return dispatcher.dispatch(scopes, targetId, rights, actionName);
    }

    public ModerationOptions getOptions() {
        return options;
    }

    FleetCacheStore caches() {
        return caches;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ModerationResult fleetWide(ModerationAction action, String rawTarget, ReplyContext reply,
                                       String reason, ModerationRights rights, ProgressCallback progress) {
        long start = System.nanoTime();
        String effectiveReason = reasonOrDefault(action, reason);

        TargetResolution target;
        try {
            target = targets.resolve(TargetSpec.parse(rawTarget), reply);
        } catch (InvalidTargetException e) {
            log.info("moderation.rejected action={} reason={}", action.label(), e.getMessage());
            return result(ModerationResult.Status.INVALID_TARGET, action, null, null, effectiveReason, null, start);
        }
        if (!target.isResolved()) {
            return result(statusFor(target), action, target, null, effectiveReason, null, start);
        }

        List<Scope> scopes = caches.scopes().getScopes();
        if (scopes.isEmpty()) {
            log.warn("moderation.no-scopes action={} targetId={}", action.label(), target.id());
            return result(ModerationResult.Status.NO_SCOPES, action, target, null, effectiveReason, null, start);
        }

        BatchOutcome outcome = dispatcher.dispatch(scopes, target.id(), rights, action.label(), progress);
        ModerationResult.Status status = outcome.succeeded() > 0
                ? ModerationResult.Status.COMPLETED : ModerationResult.Status.FAILED;
        ModerationResult result = result(status, action, target, outcome, effectiveReason, null, start);
        if (outcome.hasFailures()) {
            log.info("moderation.partial action={} targetId={} failed={} failedScopes={}", action.label(),
                    target.id(), outcome.failed(), result.failuresToShow(options.getMaxFailureNames()));
        }
        return result;
    }

    private ModerationResult inScope(ModerationAction action, long scopeId, String rawTarget, ReplyContext reply,
                                     String reason, Instant expiresAt) {
        long start = System.nanoTime();
        String effectiveReason = reasonOrDefault(action, reason);

        TargetResolution target;
        try {
            target = targets.resolve(TargetSpec.parse(rawTarget), reply);
        } catch (InvalidTargetException e) {
            log.info("moderation.rejected action={} scopeId={} reason={}", action.label(), scopeId, e.getMessage());
            return result(ModerationResult.Status.INVALID_TARGET, action, null, null, effectiveReason, null, start);
        }
        if (!target.isResolved()) {
            return result(statusFor(target), action, target, null, effectiveReason, null, start);
        }

        try (LogContext ctx = LogContext.forScopeAction(LogContext.generateCorrelationId(), action.label(), scopeId)) {
            if (action.refusesAdministrators() && isAdministrator(scopeId, target.id())) {
                log.info("moderation.refused action={} scopeId={} targetId={} reason=target-is-admin",
                        action.label(), scopeId, target.id());
                return result(ModerationResult.Status.TARGET_IS_ADMIN, action, target, null, effectiveReason, null, start);
            }
            if (!caches.permissions().canModerate(scopeId)) {
                log.info("moderation.refused action={} scopeId={} reason=insufficient-rights", action.label(), scopeId);
                return result(ModerationResult.Status.INSUFFICIENT_RIGHTS, action, target, null, effectiveReason, null, start);
            }

            boolean applied = apply(action, scopeId, target.id(), expiresAt);
            String title = String.valueOf(scopeId);
            BatchOutcome outcome = applied
                    ? new BatchOutcome(1, 0, List.of(), elapsedSince(start))
                    : new BatchOutcome(0, 1, List.of(title), elapsedSince(start));
            log.info("moderation.completed action={} scopeId={} targetId={} applied={}",
                    action.label(), scopeId, target.id(), applied);
            ModerationResult.Status status = applied ? ModerationResult.Status.COMPLETED : ModerationResult.Status.FAILED;
            return result(status, action, target, outcome, effectiveReason, expiresAt, start);
        }
    }

    private boolean apply(ModerationAction action, long scopeId, long targetId, Instant expiresAt) {
        return switch (action) {
            case BAN -> actions.applyAction(scopeId, targetId, ModerationRights.ban());
            case UNBAN -> actions.applyAction(scopeId, targetId, ModerationRights.unban());
            case KICK -> {
                boolean expelled = actions.applyAction(scopeId, targetId, ModerationRights.expel());
                // lift the exclusion so the target may rejoin; a failed lift is logged by the executor
                actions.applyAction(scopeId, targetId, ModerationRights.unban());
                yield expelled;
            }
            case MUTE -> actions.applyAction(scopeId, targetId, ModerationRights.mute(expiresAt));
            case UNMUTE -> actions.applyAction(scopeId, targetId, ModerationRights.unmute());
            case SUPER_BAN, SUPER_UNBAN -> throw new IllegalArgumentException(action + " is fleet-wide");
        };
    }

    private boolean isAdministrator(long scopeId, long targetId) {
        try {
            MembershipInfo membership = roster.getMembership(scopeId, PeerRef.byId(targetId));
            return membership.role().isAdministrator();
        } catch (Exception e) {
            log.debug("moderation.admin-check.failed scopeId={} targetId={} error={}", scopeId, targetId, e.getMessage());
            return false;
        }
    }

    private static ModerationResult.Status statusFor(TargetResolution target) {
        return switch (target.status()) {
            case NO_SCOPES -> ModerationResult.Status.NO_SCOPES;
            case NOT_LOCATABLE -> ModerationResult.Status.NOT_LOCATABLE;
            case UNRESOLVED, RESOLVED -> ModerationResult.Status.INVALID_TARGET;
        };
    }

    private static String reasonOrDefault(ModerationAction action, String reason) {
        return reason != null && !reason.isBlank() ? reason : action.defaultReason();
    }

    static int clampMinutes(Integer minutes) {
        if (minutes == null) {
            return DEFAULT_MUTE_MINUTES;
        }
        return Math.max(1, Math.min(minutes, MAX_MUTE_MINUTES));
    }

    private static ModerationResult result(ModerationResult.Status status, ModerationAction action,
                                           TargetResolution target, BatchOutcome outcome, String reason,
                                           Instant expiresAt, long startNanos) {
        return new ModerationResult(status, action, target, outcome, reason, expiresAt, elapsedSince(startNanos));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "fleet-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private RosterService rosterService;
        private IdentityService identityService;
        private ModerationOptions options = ModerationOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ExecutorService executor;
        private Ticker ticker = Ticker.systemTicker();
        private Clock clock = Clock.systemUTC();

        /**
         * Sets the roster service used for every scope-level remote call.
         */
        public Builder rosterService(RosterService rosterService) {
            this.rosterService = rosterService;
            return this;
        }

        /**
         * Sets the identity service used for handle resolution and the current account.
         */
        public Builder identityService(IdentityService identityService) {
            this.identityService = identityService;
            return this;
        }

        public Builder options(ModerationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service.
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses an external executor. It is not shut down by {@link FleetModerator#close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FleetModerator build() {
            if (rosterService == null) {
                throw new IllegalStateException("RosterService is required");
            }
            if (identityService == null) {
                throw new IllegalStateException("IdentityService is required");
            }
            if (options == null) {
                throw new IllegalStateException("ModerationOptions is required");
            }
            return new FleetModerator(this);
        }
    }
}
