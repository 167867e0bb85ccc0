package com.fleet.moderation.action;

/**
 * One way of addressing the target when submitting a rights change.
 * Strategies never throw: every failure comes back as a {@link StrategyResult}.
 */
public interface AddressingStrategy {

    /**
     * Short name used in logs and metrics.
     */
    String name();

    StrategyResult attempt(ActionContext context);
}
