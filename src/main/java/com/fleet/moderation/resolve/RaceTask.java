package com.fleet.moderation.resolve;

import java.util.Optional;

/**
 * One contender of a {@link FirstMatchRace}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RaceTask<T> {

    /**
     * Runs the contender. An empty result means "no match here".
     *
     * @param signal polled between steps; the task should return as soon as it is cancelled
     */
    Optional<T> run(RaceSignal signal) throws Exception;
}
