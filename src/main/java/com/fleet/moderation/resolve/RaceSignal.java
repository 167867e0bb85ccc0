package com.fleet.moderation.resolve;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared completion signal of a {@link FirstMatchRace}. Contenders poll it at each
 * step and stop without side effects once it is set.
 */
public final class RaceSignal {

    private final AtomicBoolean done = new AtomicBoolean(false);

    /**
     * Sets the signal. Returns true for the caller that set it first.
     */
    boolean set() {
        return done.compareAndSet(false, true);
    }

    /**
     * Returns true once the race is decided or the current thread was interrupted.
     */
    public boolean isCancelled() {
        return done.get() || Thread.currentThread().isInterrupted();
    }
}
