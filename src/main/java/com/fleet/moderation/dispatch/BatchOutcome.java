package com.fleet.moderation.dispatch;

import java.time.Duration;
import java.util.List;

/**
 * Result of applying one action across many scopes.
 *
 * @param succeeded     number of scopes where the action applied
 * @param failed        number of scopes where it did not
 * @param failedScopeTitles titles of the failed scopes, in completion order
 * @param elapsed       wall-clock time of the dispatch
 */
public record BatchOutcome(int succeeded, int failed, List<String> failedScopeTitles, Duration elapsed) {

    public BatchOutcome {
        failedScopeTitles = failedScopeTitles != null ? List.copyOf(failedScopeTitles) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public static BatchOutcome empty() {
        return new BatchOutcome(0, 0, List.of(), Duration.ZERO);
    }

    public int total() {
        return succeeded + failed;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    /**
     * Returns at most {@code limit} failure titles, for user-facing summaries.
     */
    public List<String> failureSample(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return failedScopeTitles.size() <= limit ? failedScopeTitles : failedScopeTitles.subList(0, limit);
    }

    @Override
    public String toString() {
        return "BatchOutcome{" +
                "succeeded=" + succeeded +
                ", failed=" + failed +
                ", elapsedMs=" + elapsed.toMillis() +
                '}';
    }
}
