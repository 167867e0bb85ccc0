package com.fleet.moderation.api;

import java.time.Duration;

/**
 * Options for fleet moderation.
 * Configures concurrency caps, search limits and cache lifetime.
 */
public class ModerationOptions {

    private static final int DEFAULT_PROBE_BATCH_SIZE = 10;
    private static final int DEFAULT_PARALLEL_LIMIT = 8;
    private static final int DEFAULT_SCAN_LIMIT = 2000;
    private static final int DEFAULT_DISPATCH_CHUNK_SIZE = 20;
    private static final int DEFAULT_PROGRESS_INTERVAL = 10;
    private static final long DEFAULT_CACHE_MAX_SIZE = 100_000;
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(60);
    private static final int DEFAULT_MAX_FAILURE_NAMES = 3;

    private final int probeBatchSize;
    private final int parallelLimit;
    private final int perScopeScanLimit;
    private final boolean membershipProbeFirst;
    private final int dispatchChunkSize;
    private final int progressInterval;
    private final long cacheMaxSize;
    private final Duration cacheTtl;
    private final Duration lockTimeout;
    private final int maxFailureNames;

    private ModerationOptions(Builder builder) {
        this.probeBatchSize = builder.probeBatchSize;
        this.parallelLimit = builder.parallelLimit;
        this.perScopeScanLimit = builder.perScopeScanLimit;
        this.membershipProbeFirst = builder.membershipProbeFirst;
        this.dispatchChunkSize = builder.dispatchChunkSize;
        this.progressInterval = builder.progressInterval;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheTtl = builder.cacheTtl;
        this.lockTimeout = builder.lockTimeout;
        this.maxFailureNames = builder.maxFailureNames;
    }

    public int getProbeBatchSize() {
        return probeBatchSize;
    }

    public int getParallelLimit() {
        return parallelLimit;
    }

    public int getPerScopeScanLimit() {
        return perScopeScanLimit;
    }

    public boolean isMembershipProbeFirst() {
        return membershipProbeFirst;
    }

    public int getDispatchChunkSize() {
        return dispatchChunkSize;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    /**
     * Returns the cache time-to-live, or null when entries never expire.
     */
    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public int getMaxFailureNames() {
        return maxFailureNames;
    }

    /**
     * Creates default options: unbounded cache lifetime, explicit invalidation only.
     */
    public static ModerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int probeBatchSize = DEFAULT_PROBE_BATCH_SIZE;
        private int parallelLimit = DEFAULT_PARALLEL_LIMIT;
        private int perScopeScanLimit = DEFAULT_SCAN_LIMIT;
        private boolean membershipProbeFirst = true;
        private int dispatchChunkSize = DEFAULT_DISPATCH_CHUNK_SIZE;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private long cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private Duration cacheTtl;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        private int maxFailureNames = DEFAULT_MAX_FAILURE_NAMES;

        /**
         * Number of scopes whose admin status is probed concurrently during a cache rebuild.
         */
        public Builder probeBatchSize(int probeBatchSize) {
            this.probeBatchSize = probeBatchSize;
            return this;
        }

        /**
         * Number of scopes searched concurrently when locating a target by id.
         */
        public Builder parallelLimit(int parallelLimit) {
            this.parallelLimit = parallelLimit;
            return this;
        }

        public Builder perScopeScanLimit(int perScopeScanLimit) {
            this.perScopeScanLimit = perScopeScanLimit;
            return this;
        }

        /**
         * Whether a search tries an exact membership lookup before scanning members.
         */
        public Builder membershipProbeFirst(boolean membershipProbeFirst) {
            this.membershipProbeFirst = membershipProbeFirst;
            return this;
        }

        public Builder dispatchChunkSize(int dispatchChunkSize) {
            this.dispatchChunkSize = dispatchChunkSize;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        /**
         * Sets the cache time-to-live; null keeps entries until explicitly invalidated.
         */
        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        /**
         * Upper bound on failed scope titles listed in a result summary.
         */
        public Builder maxFailureNames(int maxFailureNames) {
            this.maxFailureNames = maxFailureNames;
            return this;
        }

        public ModerationOptions build() {
            requirePositive(probeBatchSize, "probeBatchSize");
            requirePositive(parallelLimit, "parallelLimit");
            requirePositive(perScopeScanLimit, "perScopeScanLimit");
            requirePositive(dispatchChunkSize, "dispatchChunkSize");
            requirePositive(progressInterval, "progressInterval");
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be > 0");
            }
            if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be > 0");
            }
            if (maxFailureNames < 0) {
                throw new IllegalArgumentException("maxFailureNames must be >= 0");
            }
            return new ModerationOptions(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }
    }
}
