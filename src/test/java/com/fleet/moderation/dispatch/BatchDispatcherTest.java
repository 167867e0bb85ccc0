package com.fleet.moderation.dispatch;

import com.fleet.moderation.action.DirectIdStrategy;
import com.fleet.moderation.action.FallbackActionExecutor;
import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.metrics.MicrometerMetricsService;
import com.fleet.moderation.metrics.NoOpMetricsService;
import com.fleet.moderation.remote.RemoteCallException;
import com.fleet.moderation.support.InMemoryRoster;
import com.fleet.moderation.tracing.NoOpTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchDispatcherTest {

    private static final long TARGET = 4242L;

    private InMemoryRoster roster;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        roster = new InMemoryRoster();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<Scope> scopes(int count) {
        return LongStream.rangeClosed(1, count)
                .mapToObj(id -> Scope.of(id, "scope-" + id))
                .collect(Collectors.toList());
    }

    private BatchDispatcher newDispatcher(FallbackActionExecutor actions, DispatchConfig config) {
        return new BatchDispatcher(actions, executor, config, new NoOpMetricsService(), new NoOpTracingService());
    }

    private FallbackActionExecutor directOnly() {
        return new FallbackActionExecutor(List.of(new DirectIdStrategy(roster)), null, new NoOpMetricsService());
    }

    @Nested
    @DisplayName("Partial failure")
    class PartialFailure {

        @Test
        @DisplayName("Should count successes and failures and keep going")
        void testPartialFailure() {
            Set<Long> failing = Set.of(3L, 7L, 11L, 19L, 23L);
            roster.setRightsRule((scopeId, target, rights) -> {
                if (failing.contains(scopeId)) {
                    throw new RemoteCallException("no rights");
                }
            });

            BatchOutcome outcome = newDispatcher(directOnly(), DispatchConfig.defaults())
                    .dispatch(scopes(25), TARGET, ModerationRights.fullBan(), "superban");

            assertEquals(20, outcome.succeeded());
            assertEquals(5, outcome.failed());
            assertEquals(25, outcome.total());
            assertEquals(Set.of("scope-3", "scope-7", "scope-11", "scope-19", "scope-23"),
                    Set.copyOf(outcome.failedScopeTitles()));
        }

        @Test
        @DisplayName("An exception from the action marks the scope with an error suffix")
        void testExceptionTitle() {
            FallbackActionExecutor actions = mock(FallbackActionExecutor.class);
            ModerationRights rights = ModerationRights.fullBan();
            when(actions.applyAction(anyLong(), eq(TARGET), eq(rights))).thenReturn(true);
            when(actions.applyAction(eq(2L), eq(TARGET), eq(rights))).thenThrow(new IllegalStateException("boom"));
            when(actions.applyAction(eq(3L), eq(TARGET), eq(rights))).thenReturn(false);

            BatchOutcome outcome = newDispatcher(actions, DispatchConfig.defaults())
                    .dispatch(scopes(4), TARGET, rights, "superban");

            assertEquals(2, outcome.succeeded());
            assertEquals(Set.of("scope-2 (error)", "scope-3"), Set.copyOf(outcome.failedScopeTitles()));
        }

        @Test
        @DisplayName("An empty scope list yields an empty outcome")
        void testEmpty() {
            BatchOutcome outcome = newDispatcher(directOnly(), DispatchConfig.defaults())
                    .dispatch(List.of(), TARGET, ModerationRights.unban(), "superunban");

            assertEquals(0, outcome.total());
            assertFalse(outcome.hasFailures());
        }
    }

    @Nested
    @DisplayName("Chunking")
    class Chunking {

        @Test
        @DisplayName("No more than chunkSize actions are in flight at once")
        void testChunkBound() {
            roster.setChangeRightsDelayMs(20);

            BatchOutcome outcome = newDispatcher(directOnly(), new DispatchConfig(20, 10))
                    .dispatch(scopes(45), TARGET, ModerationRights.unban(), "superunban");

            assertEquals(45, outcome.succeeded());
            assertTrue(roster.maxConcurrentChanges() <= 20,
                    "peak concurrency was " + roster.maxConcurrentChanges());
            assertTrue(roster.maxConcurrentChanges() > 1);
        }

        @Test
        @DisplayName("A chunk starts only after the previous chunk fully completed")
        void testChunksAreSequential() {
            List<Long> completionOrder = new CopyOnWriteArrayList<>();
            roster.setRightsRule((scopeId, target, rights) -> completionOrder.add(scopeId));
            roster.setChangeRightsDelayMs(5);

            newDispatcher(directOnly(), new DispatchConfig(5, 10))
                    .dispatch(scopes(15), TARGET, ModerationRights.unban(), "superunban");

            for (int chunk = 0; chunk < 3; chunk++) {
                Set<Long> expected = LongStream.rangeClosed(chunk * 5L + 1, chunk * 5L + 5).boxed()
                        .collect(Collectors.toSet());
                assertEquals(expected, Set.copyOf(completionOrder.subList(chunk * 5, chunk * 5 + 5)));
            }
        }

        @Test
        @DisplayName("Should reject invalid configuration")
        void testConfigValidation() {
            assertThrows(IllegalArgumentException.class, () -> new DispatchConfig(0, 10));
            assertThrows(IllegalArgumentException.class, () -> new DispatchConfig(20, 0));
        }
    }

    @Nested
    @DisplayName("Progress and metrics")
    class Progress {

        @Test
        @DisplayName("Should report progress every interval and once at the end")
        void testProgress() {
            List<Integer> reported = new ArrayList<>();
            BatchOutcome outcome = newDispatcher(directOnly(), new DispatchConfig(20, 10))
                    .dispatch(scopes(25), TARGET, ModerationRights.unban(), "superunban",
                            (completed, total, failed) -> {
                                synchronized (reported) {
                                    reported.add(completed);
                                }
                                assertEquals(25, total);
                            });

            assertEquals(25, reported.get(reported.size() - 1));
            assertEquals(List.of(10, 20, 25), reported.stream().sorted().collect(Collectors.toList()));
            assertEquals(25, outcome.succeeded());
        }

        @Test
        @DisplayName("A failing progress callback does not abort the dispatch")
        void testFailingCallback() {
            BatchOutcome outcome = newDispatcher(directOnly(), new DispatchConfig(20, 1))
                    .dispatch(scopes(3), TARGET, ModerationRights.unban(), "superunban",
                            (completed, total, failed) -> {
                                throw new IllegalStateException("ui gone");
                            });

            assertEquals(3, outcome.succeeded());
        }

        @Test
        @DisplayName("A slow progress callback does not hold up other scopes")
        void testSlowCallback() {
            CountDownLatch nextReport = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            AtomicBoolean sawNext = new AtomicBoolean();
            BatchOutcome outcome = newDispatcher(directOnly(), new DispatchConfig(25, 5))
                    .dispatch(scopes(25), TARGET, ModerationRights.unban(), "superunban",
                            (completed, total, failed) -> {
                                if (calls.getAndIncrement() == 0) {
                                    try {
                                        sawNext.set(nextReport.await(2, TimeUnit.SECONDS));
                                    } catch (InterruptedException e) {
                                        Thread.currentThread().interrupt();
                                    }
                                } else {
                                    nextReport.countDown();
                                }
                            });

            assertTrue(sawNext.get());
            assertEquals(25, outcome.succeeded());
        }

        @Test
        @DisplayName("Should record per-scope outcome counters")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            roster.setRightsRule((scopeId, target, rights) -> {
                if (scopeId == 1L) {
                    throw new RemoteCallException("no rights");
                }
            });
            BatchDispatcher dispatcher = new BatchDispatcher(directOnly(), executor, DispatchConfig.defaults(),
                    new MicrometerMetricsService(registry), new NoOpTracingService());

            dispatcher.dispatch(scopes(4), TARGET, ModerationRights.fullBan(), "superban");

            assertEquals(3.0, registry.get("fleet.dispatch.scopes")
                    .tag("action", "superban").tag("outcome", "success").counter().count());
            assertEquals(1.0, registry.get("fleet.dispatch.scopes")
                    .tag("action", "superban").tag("outcome", "failure").counter().count());
            assertEquals(1, registry.get("fleet.dispatch.duration").tag("action", "superban").timer().count());
        }

        @Test
        @DisplayName("failureSample caps the listed titles")
        void testFailureSample() {
            BatchOutcome outcome = new BatchOutcome(1, 4, List.of("a", "b", "c", "d"), null);

            assertEquals(List.of("a", "b", "c"), outcome.failureSample(3));
            assertEquals(4, outcome.failureSample(10).size());
        }
    }
}
