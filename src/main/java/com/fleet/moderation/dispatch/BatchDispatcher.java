package com.fleet.moderation.dispatch;

import com.fleet.moderation.action.FallbackActionExecutor;
import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.logging.LogContext;
import com.fleet.moderation.metrics.MetricsService;
import com.fleet.moderation.tracing.Span;
import com.fleet.moderation.tracing.SpanAttributes;
import com.fleet.moderation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Applies one rights change to a target across many scopes.
 *
 * <p>Scopes are processed in chunks of {@link DispatchConfig#chunkSize()}: scopes within
 * a chunk run concurrently on the executor, and chunk <i>k</i> starts only after every
 * scope of chunk <i>k-1</i> finished. A failing scope never aborts the batch; the outcome
 * always reports partial success.</p>
 */
public class BatchDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final FallbackActionExecutor actions;
    private final ExecutorService executor;
    private final DispatchConfig config;
    private final MetricsService metrics;
    private final TracingService tracing;

    public BatchDispatcher(FallbackActionExecutor actions, ExecutorService executor, DispatchConfig config,
                           MetricsService metrics, TracingService tracing) {
        this.actions = actions;
        this.executor = executor;
        this.config = config;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    public BatchOutcome dispatch(List<Scope> scopes, long targetId, ModerationRights rights, String actionName) {
        return dispatch(scopes, targetId, rights, actionName, ProgressCallback.NOOP);
    }

    /**
     * Applies {@code rights} to {@code targetId} in every scope.
     *
     * @param progress told after every {@code progressInterval} completed scopes and once at the end
     */
    public BatchOutcome dispatch(List<Scope> scopes, long targetId, ModerationRights rights, String actionName,
                                 ProgressCallback progress) {
        if (scopes.isEmpty()) {
            return BatchOutcome.empty();
        }
        ProgressCallback callback = progress != null ? progress : ProgressCallback.NOOP;
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forDispatch(LogContext.generateCorrelationId(), actionName, targetId);
             Span span = tracing.startSpan("fleet.dispatch", targetId)) {
            span.setAttribute(SpanAttributes.ACTION, actionName);
            span.setAttribute(SpanAttributes.SCOPE_COUNT, scopes.size());

            Tally tally = new Tally(scopes.size(), config.progressInterval(), callback);
            int chunkSize = config.chunkSize();
            for (int i = 0; i < scopes.size(); i += chunkSize) {
                List<Scope> chunk = scopes.subList(i, Math.min(i + chunkSize, scopes.size()));
                runChunk(chunk, targetId, rights, actionName, tally);
                log.debug("dispatch.chunk.completed action={} chunkStart={} chunkSize={}",
                        actionName, i, chunk.size());
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            BatchOutcome outcome = tally.toOutcome(elapsed);
            tally.report(outcome.total(), outcome.failed());

            metrics.recordDispatch(actionName, outcome.succeeded(), outcome.failed(), elapsed);
            span.setAttribute(SpanAttributes.SUCCEEDED, outcome.succeeded());
            span.setAttribute(SpanAttributes.FAILED, outcome.failed());
            span.setStatus(Span.SpanStatus.OK);
            log.info("dispatch.completed action={} targetId={} succeeded={} failed={} elapsedMs={}",
                    actionName, targetId, outcome.succeeded(), outcome.failed(), elapsed.toMillis());
            return outcome;
        }
    }

    private void runChunk(List<Scope> chunk, long targetId, ModerationRights rights, String actionName,
                          Tally tally) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(chunk.size());
        for (Scope scope : chunk) {
            CompletableFuture<Void> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> actions.applyAction(scope.id(), targetId, rights), executor)
                        .handle((applied, error) -> {
                            record(scope, applied, error, actionName, tally);
                            return null;
                        });
            } catch (RuntimeException e) {
                record(scope, null, e, actionName, tally);
                continue;
            }
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private void record(Scope scope, Boolean applied, Throwable error, String actionName, Tally tally) {
        if (error != null) {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            log.error("dispatch.scope.error action={} scopeId={} title='{}' error={}",
                    actionName, scope.id(), scope.title(), cause.getMessage());
            tally.failure(scope.title() + " (error)");
        } else if (Boolean.TRUE.equals(applied)) {
            tally.success();
        } else {
            log.warn("dispatch.scope.failed action={} scopeId={} title='{}'", actionName, scope.id(), scope.title());
            tally.failure(scope.title());
        }
    }

    private static final class Tally {
        private final int total;
        private final int progressInterval;
        private final ProgressCallback callback;
        private final List<String> failedScopeTitles = new ArrayList<>();
        private int succeeded;
        private int completed;

        private Tally(int total, int progressInterval, ProgressCallback callback) {
            this.total = total;
            this.progressInterval = progressInterval;
            this.callback = callback;
        }

        void success() {
            Progress due;
            synchronized (this) {
                succeeded++;
                due = completed();
            }
            notifyIfDue(due);
        }

        void failure(String title) {
            Progress due;
            synchronized (this) {
                failedScopeTitles.add(title);
                due = completed();
            }
            notifyIfDue(due);
        }

        // caller holds the monitor; the callback itself runs outside it
        private Progress completed() {
            completed++;
            if (completed % progressInterval == 0 && completed < total) {
                return new Progress(completed, failedScopeTitles.size());
            }
            return null;
        }

        private void notifyIfDue(Progress due) {
            if (due != null) {
                report(due.done(), due.failed());
            }
        }

        void report(int done, int failed) {
            try {
                callback.onProgress(done, total, failed);
            } catch (RuntimeException e) {
                log.warn("dispatch.progress.callback.failed error={}", e.getMessage());
            }
        }

        synchronized BatchOutcome toOutcome(Duration elapsed) {
            return new BatchOutcome(succeeded, failedScopeTitles.size(), failedScopeTitles, elapsed);
        }

        private record Progress(int done, int failed) {}
    }
}
