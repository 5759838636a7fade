package com.provider.linkage.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forShard(runId, "TX")) {
 *     log.debug("fuzzy.shard.started records={}", records.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";
    public static final String SHARD = "shard";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(STAGE, stage);
        return ctx;
    }

    /**
     * Context for work on one state shard, typically inside a worker thread.
     */
    public static LogContext forShard(String runId, String stateCode) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(SHARD, stateCode);
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
