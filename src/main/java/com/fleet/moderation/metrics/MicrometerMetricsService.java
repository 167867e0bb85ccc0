package com.fleet.moderation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fleet.dispatch.duration} - Timer (tag: action)</li>
 *   <li>{@code fleet.dispatch.scopes} - Counter (tags: action, outcome)</li>
 *   <li>{@code fleet.action.strategy} - Counter (tags: strategy, outcome)</li>
 *   <li>{@code fleet.resolve.duration} - Timer (tag: outcome)</li>
 *   <li>{@code fleet.scopes.refresh.duration} - Timer</li>
 *   <li>{@code fleet.scopes.administered} - DistributionSummary</li>
 *   <li>{@code fleet.cache.hit} / {@code fleet.cache.miss} - Counter (tag: cache)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer refreshTimer;
    private final DistributionSummary administeredSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.refreshTimer = Timer.builder("fleet.scopes.refresh.duration")
                .description("Duration of scope enumeration and permission probing")
                .register(registry);
        this.administeredSummary = DistributionSummary.builder("fleet.scopes.administered")
                .description("Number of administered scopes found per refresh")
                .register(registry);
    }

    @Override
    public void recordDispatch(String action, int succeeded, int failed, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("dispatch:" + action, k ->
                Timer.builder("fleet.dispatch.duration")
                        .description("Duration of fleet-wide dispatches")
                        .tag("action", action)
                        .register(registry));
        timer.record(duration);
        counter("scopes:" + action + ":success", "fleet.dispatch.scopes",
                "Per-scope action outcomes", "action", action, "outcome", "success").increment(succeeded);
        counter("scopes:" + action + ":failure", "fleet.dispatch.scopes",
                "Per-scope action outcomes", "action", action, "outcome", "failure").increment(failed);
    }

    @Override
    public void recordStrategyOutcome(String strategy, boolean applied) {
        String outcome = applied ? "applied" : "failed";
        counter("strategy:" + strategy + ":" + outcome, "fleet.action.strategy",
                "Addressing strategy attempts", "strategy", strategy, "outcome", outcome).increment();
    }

    @Override
    public void recordResolution(boolean found, Duration duration) {
        String outcome = found ? "found" : "not_found";
        Timer timer = timerCache.computeIfAbsent("resolve:" + outcome, k ->
                Timer.builder("fleet.resolve.duration")
                        .description("Duration of cross-scope identity resolution")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordScopeRefresh(int administeredScopes, Duration duration) {
        refreshTimer.record(duration);
        administeredSummary.record(administeredScopes);
    }

    @Override
    public void recordCacheHit(String cache) {
        counter("hit:" + cache, "fleet.cache.hit", "Cache hits", "cache", cache).increment();
    }

    @Override
    public void recordCacheMiss(String cache) {
        counter("miss:" + cache, "fleet.cache.miss", "Cache misses", "cache", cache).increment();
    }

    private Counter counter(String key, String name, String description, String... tags) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tags(tags)
                        .register(registry));
    }
}
