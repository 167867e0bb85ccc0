package com.fleet.moderation.action;

/**
 * Outcome of one addressing strategy.
 *
 * @param status what happened
 * @param detail failure or skip reason, null when applied
 */
public record StrategyResult(Status status, String detail) {

    public enum Status {
        /** the remote system accepted the change */
        APPLIED,
        /** the remote call was made and failed */
        FAILED,
        /** the strategy had nothing to submit, e.g. no resolvable identity */
        SKIPPED
    }

    private static final StrategyResult APPLIED_RESULT = new StrategyResult(Status.APPLIED, null);

    public static StrategyResult applied() {
        return APPLIED_RESULT;
    }

    public static StrategyResult failed(String detail) {
        return new StrategyResult(Status.FAILED, detail);
    }

    public static StrategyResult skipped(String detail) {
        return new StrategyResult(Status.SKIPPED, detail);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
