package com.connection.harness.logging;

import com.connection.harness.core.model.ConnectionKey;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forConnection(key, "create")) {
 *     log.info("connection.created provider={}", provider);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for an operation on a single connection.
     */
    public static LogContext forConnection(ConnectionKey key, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("serviceType", key.serviceType());
        ctx.put("connectionId", key.connectionId());
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for an operation spanning a whole service type.
     */
    public static LogContext forService(String serviceType, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("serviceType", serviceType);
        ctx.put("operation", operation);
        return ctx;
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
