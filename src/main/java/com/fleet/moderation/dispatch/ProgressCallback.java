package com.fleet.moderation.dispatch;

/**
 * Callback for tracking progress of a fleet-wide dispatch.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress. Calls may come from worker threads, concurrently and
     * not necessarily in ascending order of {@code completed}; the final call, with
     * {@code completed == total}, always comes last.
     *
     * @param completed scopes finished so far
     * @param total     scopes in the dispatch
     * @param failed    scopes that failed so far
     */
    void onProgress(int completed, int total, int failed);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (completed, total, failed) -> {};
}
