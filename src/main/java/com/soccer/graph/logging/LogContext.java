package com.soccer.graph.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngestion(runId, "league-matches")) {
 *     log.info("ingest.completed processed={}", processed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for ingesting one source.
     */
    public static LogContext forIngestion(String runId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("source", source);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Context for merging one record.
     */
    public static LogContext forMerge(String source, long lineNumber) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("line", Long.toString(lineNumber));
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Context for folding one team into another.
     */
    public static LogContext forDeduplication(String sourceTeam, String targetTeam) {
        LogContext ctx = new LogContext();
        ctx.put("sourceTeam", sourceTeam);
        ctx.put("targetTeam", targetTeam);
        ctx.put("operation", "dedup");
        return ctx;
    }

    public static String generateRunId() {
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
