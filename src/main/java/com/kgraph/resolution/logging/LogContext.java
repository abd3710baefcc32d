package com.kgraph.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngestion(correlationId, documentId)) {
 *     log.info("ingest.completed documentId={} merged={}", documentId, merged);
 * }
 * </pre>
 *
 * <p>The MDC is thread-local: work handed to another pool must open its own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for ingesting one document.
     */
    public static LogContext forIngestion(String correlationId, String documentId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("documentId", documentId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for the extraction of one chunk.
     */
    public static LogContext forChunk(String documentId, int chunkIndex) {
        LogContext ctx = new LogContext();
        ctx.put("documentId", documentId);
        ctx.put("chunkIndex", String.valueOf(chunkIndex));
        ctx.put("operation", "extract");
        return ctx;
    }

    /**
     * Creates a log context for applying a decision to the registry.
     */
    public static LogContext forMerge(String mentionId, String blockingKey) {
        LogContext ctx = new LogContext();
        ctx.put("mentionId", mentionId);
        ctx.put("blockingKey", blockingKey);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forSearch(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "search");
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
