package com.fleet.moderation.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Structured task group that races contenders for the first non-empty result.
 *
 * <p>Lifecycle: {@link #submit} starts contenders on the executor; {@link #awaitFirst()}
 * blocks until one contender reports a result or all of them finish, then sets the
 * shared {@link RaceSignal}, cancels whatever is still queued or running and waits for
 * every contender to terminate before returning. No contender outlives the call.</p>
 *
 * <p>Contender failures are logged and count as "no result". A group is single-use.</p>
 *
 * @param <T> result type
 */
public final class FirstMatchRace<T> {
    private static final Logger log = LoggerFactory.getLogger(FirstMatchRace.class);

    private final ExecutorService executor;
    private final RaceSignal signal = new RaceSignal();
    private final CompletableFuture<T> winner = new CompletableFuture<>();
    private final List<Contender> contenders = new ArrayList<>();
    // one party for the owner plus one per live contender
    private final Phaser terminated = new Phaser(1);
    // the owner's token keeps the race open until awaitFirst() is called
    private final AtomicInteger pending = new AtomicInteger(1);
    private final AtomicBoolean awaited = new AtomicBoolean(false);

    public FirstMatchRace(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Starts a contender.
     *
     * @throws IllegalStateException if {@link #awaitFirst()} was already called
     */
    public synchronized void submit(RaceTask<T> task) {
        if (awaited.get()) {
            throw new IllegalStateException("race already awaited");
        }
        Contender contender = new Contender(task);
        pending.incrementAndGet();
        terminated.register();
        try {
            contender.future = executor.submit(contender::runGuarded);
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            terminated.arriveAndDeregister();
            throw e;
        }
        contenders.add(contender);
    }

    /**
     * Waits for the first result, cancels the remaining contenders and joins them.
     *
     * @return the winning result, or empty if every contender finished without one
     */
    public Optional<T> awaitFirst() {
        synchronized (this) {
            if (!awaited.compareAndSet(false, true)) {
                throw new IllegalStateException("race already awaited");
            }
        }
        finishOne();

        T result;
        try {
            result = winner.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRemaining();
            log.warn("race.interrupted contenders={}", contenders.size());
            return Optional.empty();
        } catch (ExecutionException e) {
            // winner is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }

        cancelRemaining();
        join();
        return Optional.ofNullable(result);
    }

    /**
     * Abandons the race: signals every contender, cancels them and waits until each one
     * has terminated. Used when the race cannot be fully started.
     *
     * @throws IllegalStateException if the race was already awaited or cancelled
     */
    public void cancel() {
        synchronized (this) {
            if (!awaited.compareAndSet(false, true)) {
                throw new IllegalStateException("race already awaited");
            }
        }
        finishOne();
        cancelRemaining();
        join();
        log.debug("race.cancelled contenders={}", contenders.size());
    }

    /**
     * Returns the shared signal, mainly for diagnostics and tests.
     */
    public RaceSignal signal() {
        return signal;
    }

    private void cancelRemaining() {
        signal.set();
        for (Contender contender : contenders) {
            if (contender.started.compareAndSet(false, true)) {
                // never started: it will not run, so it terminates here
                contender.future.cancel(false);
                terminated.arriveAndDeregister();
            } else {
                contender.future.cancel(true);
            }
        }
    }

    private void join() {
        int phase = terminated.arrive();
        try {
            terminated.awaitAdvanceInterruptibly(phase);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("race.join.interrupted");
        }
    }

    private void finishOne() {
        if (pending.decrementAndGet() == 0) {
            winner.complete(null);
        }
    }

    private final class Contender {
        private final RaceTask<T> task;
        private final AtomicBoolean started = new AtomicBoolean(false);
        private volatile Future<?> future;

        private Contender(RaceTask<T> task) {
            this.task = task;
        }

        private void runGuarded() {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            try {
                if (signal.isCancelled()) {
                    return;
                }
                Optional<T> result = task.run(signal);
                if (result != null && result.isPresent() && signal.set()) {
                    winner.complete(result.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("race.contender.interrupted");
            } catch (Exception e) {
                if (signal.isCancelled()) {
                    log.trace("race.contender.cancelled error={}", e.getMessage());
                } else {
                    log.debug("race.contender.failed error={}", e.getMessage());
                }
            } finally {
                finishOne();
                terminated.arriveAndDeregister();
            }
        }
    }
}
