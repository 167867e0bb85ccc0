package com.fleet.moderation.cache;

import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.PeerRef;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.lock.LockConfig;
import com.fleet.moderation.lock.TimedLock;
import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.remote.CurrentAccount;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.tracing.Span;
import com.fleet.moderation.tracing.SpanAttributes;
import com.fleet.moderation.tracing.TracingService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory cache of the scopes the agent administers.
 *
 * <p>The list is built by enumerating every reachable scope and probing the agent's own
 * membership in each; a scope is kept iff the probe reports a moderation-capable role.
 * Rebuilding is expensive, so it runs under a {@link TimedLock} and callers re-check
 * freshness once they hold the lock: N concurrent callers on a cold cache trigger exactly
 * one enumeration and all observe the same list.</p>
 *
 * <p>Every {@link #invalidate()} starts a new generation. A rebuild that began in an
 * older generation is returned to its own caller but never published, so the first
 * {@link #getScopes()} after an invalidation always enumerates again.</p>
 *
 * <p>Readers always get an immutable list, so a concurrent refresh never mutates data a
 * caller is iterating.</p>
 */
public class ScopeCache {
    private static final Logger log = LoggerFactory.getLogger(ScopeCache.class);

    private final RosterService roster;
    private final CurrentAccount account;
    private final TimedLock refreshLock;
    private final CacheConfig config;
    private final int probeBatchSize;
    private final ExecutorService executor;
    private final Ticker ticker;
    private final MetricsService metrics;
    private final TracingService tracing;

    private final AtomicLong generation = new AtomicLong();
    private volatile Snapshot snapshot;

    public ScopeCache(RosterService roster, CurrentAccount account, LockConfig lockConfig,
                      CacheConfig config, int probeBatchSize, ExecutorService executor,
                      Ticker ticker, MetricsService metrics, TracingService tracing) {
        if (probeBatchSize <= 0) {
            throw new IllegalArgumentException("probeBatchSize must be > 0");
        }
        this.roster = roster;
        this.account = account;
        this.refreshLock = new TimedLock("scope-refresh", lockConfig);
        this.config = config;
        this.probeBatchSize = probeBatchSize;
        this.executor = executor;
        this.ticker = ticker;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Returns the administered scopes, rebuilding the cache if it is empty or stale.
     * Never throws: a failed enumeration yields an empty list.
     */
    public List<Scope> getScopes() {
        Snapshot current = snapshot;
        if (isFresh(current)) {
            metrics.recordCacheHit("scopes");
            return current.scopes();
        }
        return loadUnderLock(false);
    }

    /**
     * Drops the cached scopes and rebuilds them.
     */
    public List<Scope> refresh() {
        return loadUnderLock(true);
    }

    /**
     * Clears the cached scopes without fetching. The next {@link #getScopes()} rebuilds.
     */
    public void invalidate() {
        long current = generation.incrementAndGet();
        snapshot = null;
        log.debug("scopes.invalidated generation={}", current);
    }

    /**
     * Returns the cached scopes without triggering a refresh.
     */
    public Optional<List<Scope>> peek() {
        Snapshot current = snapshot;
        return current != null ? Optional.of(current.scopes()) : Optional.empty();
    }

    /**
     * Returns how long the cached list stays fresh, or empty if nothing is cached or the
     * time-to-live is unbounded.
     */
    public Optional<Duration> remainingTtl() {
        Snapshot current = snapshot;
        if (current == null || config.isUnbounded()) {
            return Optional.empty();
        }
        long age = ticker.read() - current.fetchedAtNanos();
        long left = Math.max(0, config.ttl().toNanos() - age);
        return Optional.of(Duration.ofNanos(left));
    }

    public boolean isUnbounded() {
        return config.isUnbounded();
    }

    private List<Scope> loadUnderLock(boolean force) {
        return refreshLock.withLock(() -> rebuildIfStale(force), this::lastKnownScopes);
    }

    private List<Scope> rebuildIfStale(boolean force) {
        Snapshot current = snapshot;
        if (!force && isFresh(current)) {
            // another caller refreshed while we waited
            metrics.recordCacheHit("scopes");
            return current.scopes();
        }
        metrics.recordCacheMiss("scopes");
        if (force) {
            snapshot = null;
        }
        long startedIn = generation.get();
        Optional<List<Scope>> loaded = enumerateAndProbe();
        if (loaded.isEmpty()) {
            return List.of();
        }
        if (generation.get() == startedIn) {
            snapshot = new Snapshot(loaded.get(), ticker.read(), startedIn);
        } else {
            log.debug("scopes.refresh.superseded generation={}", startedIn);
        }
        return loaded.get();
    }

    private List<Scope> lastKnownScopes() {
        Snapshot stale = snapshot;
        return stale != null ? stale.scopes() : List.of();
    }

    private Optional<List<Scope>> enumerateAndProbe() {
        long start = System.nanoTime();
        try (Span span = tracing.startSpan("fleet.scopes.refresh")) {
            List<Scope> candidates;
            List<Scope> administered;
            try {
                long selfId = account.id();
                try (Stream<Scope> stream = roster.enumerateScopes()) {
                    candidates = stream.collect(Collectors.toList());
                }
                administered = probeInBatches(candidates, selfId);
            } catch (Exception e) {
                log.error("scopes.enumeration.failed error={}", e.getMessage());
                span.fail(e);
                return Optional.empty();
            }

            List<Scope> result = List.copyOf(administered);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            span.setAttribute(SpanAttributes.CANDIDATE_COUNT, candidates.size());
            span.setAttribute(SpanAttributes.SCOPE_COUNT, result.size());
            span.setStatus(Span.SpanStatus.OK);
            metrics.recordScopeRefresh(result.size(), elapsed);
            log.info("scopes.refreshed candidates={} administered={} elapsedMs={}",
                    candidates.size(), result.size(), elapsed.toMillis());
            return Optional.of(result);
        }
    }

    private List<Scope> probeInBatches(List<Scope> candidates, long selfId) {
        List<Scope> administered = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i += probeBatchSize) {
            List<Scope> batch = candidates.subList(i, Math.min(i + probeBatchSize, candidates.size()));
            List<CompletableFuture<Boolean>> probes = batch.stream()
                    .map(scope -> CompletableFuture.supplyAsync(() -> probe(scope, selfId), executor))
                    .collect(Collectors.toList());
            for (int j = 0; j < batch.size(); j++) {
                if (probes.get(j).join()) {
                    administered.add(batch.get(j));
                }
            }
        }
        return administered;
    }

    private boolean probe(Scope scope, long selfId) {
        try {
            MembershipInfo self = roster.getMembership(scope.id(), PeerRef.byId(selfId));
            return self.canModerate();
        } catch (Exception e) {
            log.debug("scopes.probe.failed scopeId={} title='{}' error={}", scope.id(), scope.title(), e.getMessage());
            return false;
        }
    }

    private boolean isFresh(Snapshot current) {
        if (current == null || current.generation() != generation.get()) {
            return false;
        }
        if (config.isUnbounded()) {
            return true;
        }
        return ticker.read() - current.fetchedAtNanos() < config.ttl().toNanos();
    }

    private record Snapshot(List<Scope> scopes, long fetchedAtNanos, long generation) {}
}
