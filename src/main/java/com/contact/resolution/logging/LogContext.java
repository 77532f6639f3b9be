package com.contact.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, restores whatever an enclosing
 * context had put under the same keys.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngest(correlationId, "calendly:evt-1")) {
 *     log.info("contact.merged contactId={} confidence={}", id, confidence);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forIngest(String correlationId, String sourceReference) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("source", sourceReference);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forAttribution(String correlationId, String contactId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("contactId", contactId);
        ctx.put("operation", "attribute");
        return ctx;
    }

    public static LogContext forBatch(String batchId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", operation);
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
        if (value == null) {
            return;
        }
        previous.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
