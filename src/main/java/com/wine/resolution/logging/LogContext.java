package com.wine.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries added through a context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forImport(importId, "csv")) {
 *     log.info("import.started rows={}", rows.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, String wineName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("wineName", wineName);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forImport(String importId, String format) {
        LogContext ctx = new LogContext();
        ctx.put("importId", importId);
        ctx.put("format", format);
        ctx.put("operation", "import");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another entry that will be removed with the rest on close.
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
