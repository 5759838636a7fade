package com.provider.linkage.pipeline;

import com.provider.linkage.audit.AuditLedger;
import com.provider.linkage.cache.CacheConfig;
import com.provider.linkage.cache.NormalizationCache;
import com.provider.linkage.logging.LogContext;
import com.provider.linkage.rules.NameNormalizer;

/**
 * State owned by one pipeline run: its id, the normalization cache and the audit ledger.
 * Nothing here outlives the run.
 */
public class PipelineRun implements AutoCloseable {

    private final String runId;
    private final NormalizationCache names;
    private final AuditLedger ledger;

    public PipelineRun(NameNormalizer normalizer, CacheConfig cacheConfig) {
        this(LogContext.generateRunId(), normalizer, cacheConfig);
    }

    PipelineRun(String runId, NameNormalizer normalizer, CacheConfig cacheConfig) {
        this.runId = runId;
        this.names = new NormalizationCache(normalizer, cacheConfig);
        this.names.invalidateAll();
        this.ledger = new AuditLedger();
    }

    public String getRunId() {
        return runId;
    }

    public NormalizationCache getNames() {
        return names;
    }

    public AuditLedger getLedger() {
        return ledger;
    }

    @Override
    public void close() {
        names.close();
    }
}
