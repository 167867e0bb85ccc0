package com.fleet.moderation.api;

import com.fleet.moderation.dispatch.BatchOutcome;
import com.fleet.moderation.resolve.TargetResolution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of a moderation request.
 *
 * @param status    how the request ended
 * @param action    the requested action
 * @param target    the resolved target, null when the argument was rejected before resolution
 * @param outcome   per-scope tally; empty unless the action was attempted
 * @param reason    the recorded reason, null for lifting actions
 * @param expiresAt when a mute lapses, null otherwise
 * @param elapsed   wall-clock time of the request
 */
public record ModerationResult(
        Status status,
        ModerationAction action,
        TargetResolution target,
        BatchOutcome outcome,
        String reason,
        Instant expiresAt,
        Duration elapsed
) {
    public enum Status {
        /** the action was applied in at least one scope */
        COMPLETED,
        /** the action was attempted and applied nowhere */
        FAILED,
        /** the argument was malformed or did not resolve */
        INVALID_TARGET,
        /** a cross-scope search for the id found nothing */
        NOT_LOCATABLE,
        /** the agent administers no scopes */
        NO_SCOPES,
        /** restricting administrators is refused */
        TARGET_IS_ADMIN,
        /** the agent lacks moderation rights in the scope */
        INSUFFICIENT_RIGHTS
    }

    public ModerationResult {
        outcome = outcome != null ? outcome : BatchOutcome.empty();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    /**
     * Failed scope titles to show the caller; empty when there are more than {@code limit},
     * so a long list never floods the summary.
     */
    public List<String> failuresToShow(int limit) {
        List<String> titles = outcome.failedScopeTitles();
        return titles.size() <= limit ? titles : List.of();
    }

    @Override
    public String toString() {
        return "ModerationResult{" +
                "status=" + status +
                ", action=" + action.label() +
                ", target=" + (target != null ? target.display() : "-") +
                ", succeeded=" + outcome.succeeded() +
                ", failed=" + outcome.failed() +
                ", elapsedMs=" + elapsed.toMillis() +
                '}';
    }
}
