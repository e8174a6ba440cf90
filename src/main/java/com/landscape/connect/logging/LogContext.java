package com.landscape.connect.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAdmission("42")) {
 *     log.info("distgraph.admitted minimumId={} edges={}", id, edges);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previous = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a connection session between two minima.
     */
    public static LogContext forSession(String sessionId, String startId, String endId) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("startMinimumId", startId);
        ctx.put("endMinimumId", endId);
        return ctx;
    }

    /**
     * Creates a log context for the admission of one minimum.
     */
    public static LogContext forAdmission(String minimumId) {
        LogContext ctx = new LogContext();
        ctx.put("minimumId", minimumId);
        ctx.put("operation", "admit");
        return ctx;
    }

    /**
     * Creates a log context for a duplicate merge.
     */
    public static LogContext forMerge(String correlationId, String keepId, String dropId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("keepMinimumId", keepId);
        ctx.put("dropMinimumId", dropId);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Creates a log context for a consistency pass.
     */
    public static LogContext forConsistencyCheck() {
        LogContext ctx = new LogContext();
        ctx.put("operation", "checkConsistency");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
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

    // Nested contexts may reuse a key; the outer value comes back on close
    private void put(String key, String value) {
        keys.add(key);
        previous.add(MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String before = previous.get(i);
            if (before == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), before);
            }
        }
        keys.clear();
        previous.clear();
    }
}
