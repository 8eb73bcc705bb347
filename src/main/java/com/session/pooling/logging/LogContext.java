package com.session.pooling.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forControl("weather-server", "drain")) {
 *     log.info("pool.drained retiring={}", retiring);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for session acquisition.
     */
    public static LogContext forAcquire(String target, String affinityKey) {
        LogContext ctx = new LogContext();
        ctx.put("target", target);
        ctx.put("operation", "acquire");
        if (affinityKey != null) {
            ctx.put("affinityKey", affinityKey);
        }
        return ctx;
    }

    /**
     * Creates a log context for an administrative control operation.
     */
    public static LogContext forControl(String target, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("target", target);
        ctx.put("operation", operation);
        ctx.put("correlationId", generateCorrelationId());
        return ctx;
    }

    /**
     * Creates a log context for a background maintenance cycle.
     */
    public static LogContext forMaintenance(String target, String task) {
        LogContext ctx = new LogContext();
        ctx.put("target", target);
        ctx.put("operation", task);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

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
