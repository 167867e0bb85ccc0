package com.fleet.moderation.metrics;

import java.time.Duration;

/**
 * Interface for recording fleet moderation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordDispatch(String action, int succeeded, int failed, Duration duration);

    void recordStrategyOutcome(String strategy, boolean applied);

    void recordResolution(boolean found, Duration duration);

    void recordScopeRefresh(int administeredScopes, Duration duration);

    void recordCacheHit(String cache);

    void recordCacheMiss(String cache);
}
