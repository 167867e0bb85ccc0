package com.fleet.moderation.dispatch;

/**
 * Configuration for fleet-wide dispatch.
 *
 * @param chunkSize        number of scopes acted on concurrently
 * @param progressInterval report progress after this many completed scopes
 */
public record DispatchConfig(int chunkSize, int progressInterval) {

    public static final int DEFAULT_CHUNK_SIZE = 20;
    public static final int DEFAULT_PROGRESS_INTERVAL = 10;

    public DispatchConfig {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be > 0");
        }
    }

    public static DispatchConfig defaults() {
        return new DispatchConfig(DEFAULT_CHUNK_SIZE, DEFAULT_PROGRESS_INTERVAL);
    }
}
