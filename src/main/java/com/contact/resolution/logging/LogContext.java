package com.contact.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "phone")) {
 *     log.info("resolve.hit tier={} key={}", tier, key);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, String lookupType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("lookupType", lookupType);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for a scheduled job run.
     */
    public static LogContext forJob(String jobName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("job", jobName);
        ctx.put("operation", "job");
        return ctx;
    }

    public static LogContext forInvalidation(String correlationId, String lookupType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("lookupType", lookupType);
        ctx.put("operation", "invalidate");
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
