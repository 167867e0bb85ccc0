package com.fleet.moderation.action;

import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.remote.RosterService;
import com.fleet.moderation.resolve.IdentityLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies a rights change to one (scope, target) pair, trying addressing strategies
 * in order until one succeeds.
 *
 * <p>The default chain is: bare id, resolved identity, channel persona, raw peer.
 * Strategy failures are logged and the next strategy runs; only exhausting the chain
 * yields {@code false}. When the change is a full exclusion the target's history is
 * purged afterwards, best-effort; purge failures never change the returned result.</p>
 */
public class FallbackActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(FallbackActionExecutor.class);

    private final List<AddressingStrategy> strategies;
    private final HistoryPurger historyPurger;
    private final MetricsService metrics;

    public FallbackActionExecutor(List<AddressingStrategy> strategies, HistoryPurger historyPurger,
                                  MetricsService metrics) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.historyPurger = historyPurger;
        this.metrics = metrics;
    }

    /**
     * Builds an executor with the standard four-strategy chain.
     */
    public static FallbackActionExecutor withDefaultChain(RosterService roster, IdentityLookup lookup,
                                                          MetricsService metrics) {
        return new FallbackActionExecutor(defaultChain(roster, lookup), new HistoryPurger(roster, lookup), metrics);
    }

    public static List<AddressingStrategy> defaultChain(RosterService roster, IdentityLookup lookup) {
        return List.of(
                new DirectIdStrategy(roster),
                new ResolvedIdentityStrategy(roster, lookup),
                new ChannelPersonaStrategy(roster),
                new RawPeerStrategy(roster, lookup));
    }

    /**
     * Applies the rights change.
     *
     * @return true if any strategy succeeded
     */
    public boolean applyAction(long scopeId, long targetId, ModerationRights rights) {
        ActionContext context = new ActionContext(scopeId, targetId, rights);
        boolean applied = false;
        for (AddressingStrategy strategy : strategies) {
            StrategyResult result = attempt(strategy, context);
            if (result.isApplied()) {
                metrics.recordStrategyOutcome(strategy.name(), true);
                log.debug("action.applied scopeId={} targetId={} strategy={}", scopeId, targetId, strategy.name());
                applied = true;
                break;
            }
            if (result.status() == StrategyResult.Status.FAILED) {
                metrics.recordStrategyOutcome(strategy.name(), false);
                log.warn("action.strategy.failed scopeId={} targetId={} strategy={} error={}",
                        scopeId, targetId, strategy.name(), result.detail());
            } else {
                log.debug("action.strategy.skipped scopeId={} targetId={} strategy={} reason={}",
                        scopeId, targetId, strategy.name(), result.detail());
            }
        }
        if (!applied) {
            log.warn("action.exhausted scopeId={} targetId={} strategies={}", scopeId, targetId, strategies.size());
        }

        if (rights.isFullExclusion() && historyPurger != null) {
            historyPurger.purge(scopeId, targetId);
        }
        return applied;
    }

    public List<AddressingStrategy> getStrategies() {
        return strategies;
    }

    private StrategyResult attempt(AddressingStrategy strategy, ActionContext context) {
        try {
            StrategyResult result = strategy.attempt(context);
            return result != null ? result : StrategyResult.failed("strategy returned no result");
        } catch (Exception e) {
            return StrategyResult.failed(RemoteAddressingStrategy.describe(e));
        }
    }
}
