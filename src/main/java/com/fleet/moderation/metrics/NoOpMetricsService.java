package com.fleet.moderation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDispatch(String action, int succeeded, int failed, Duration duration) {
    }

    @Override
    public void recordStrategyOutcome(String strategy, boolean applied) {
    }

    @Override
    public void recordResolution(boolean found, Duration duration) {
    }

    @Override
    public void recordScopeRefresh(int administeredScopes, Duration duration) {
    }

    @Override
    public void recordCacheHit(String cache) {
    }

    @Override
    public void recordCacheMiss(String cache) {
    }
}
