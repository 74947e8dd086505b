package com.directory.pool.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forReconfigure("auth", 20)) {
 *     log.info("pool.reconfigured capacity={}", capacity);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a pool operation.
     */
    public static LogContext forPool(String poolName, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("pool", poolName);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a pool reconfiguration.
     */
    public static LogContext forReconfigure(String poolName, int newCapacity) {
        return forPool(poolName, "reconfigure")
                .with("newCapacity", Integer.toString(newCapacity));
    }

    /**
     * Creates a log context for a zombie sweep.
     */
    public static LogContext forZombieControl(String poolName) {
        return forPool(poolName, "zombieControl");
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
