package com.fleet.moderation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging. Entries are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDispatch(correlationId, "ban", targetId)) {
 *     log.info("dispatch.completed succeeded={} failed={}", ok, failed);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: worker threads do not inherit these entries.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forDispatch(String correlationId, String action, long targetId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "dispatch");
        ctx.put("action", action);
        ctx.put("targetId", String.valueOf(targetId));
        return ctx;
    }

    public static LogContext forResolution(String correlationId, long targetId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "resolve");
        ctx.put("targetId", String.valueOf(targetId));
        return ctx;
    }

    public static LogContext forScopeAction(String correlationId, String action, long scopeId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "scope-action");
        ctx.put("action", action);
        ctx.put("scopeId", String.valueOf(scopeId));
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
