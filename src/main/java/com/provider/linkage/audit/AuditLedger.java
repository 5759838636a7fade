package com.provider.linkage.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Run-scoped collection of per-shard audit logs.
 *
 * <p>Workers obtain their own {@link ShardAuditLog} via {@link #shard(String)} and append to it
 * without synchronization. {@link #merge()} produces the final report in a deterministic order
 * regardless of how work was scheduled.</p>
 */
public class AuditLedger {
    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private final ConcurrentMap<String, ShardAuditLog> shards = new ConcurrentHashMap<>();

    /**
     * Returns the log for a shard key, creating it on first use. A shard key must be used by
     * one worker at a time.
     */
    public ShardAuditLog shard(String shardKey) {
        return shards.computeIfAbsent(shardKey, ShardAuditLog::new);
    }

    /**
     * Merges every shard into one list in report order.
     */
    public List<AuditEntry> merge() {
        List<AuditEntry> merged = new ArrayList<>();
        shards.values().forEach(shard -> merged.addAll(shard.getEntries()));
        merged.sort(AuditEntry.REPORT_ORDER);
        log.debug("audit.merged shards={} entries={}", shards.size(), merged.size());
        return List.copyOf(merged);
    }

    /**
     * Counts merged entries by action.
     */
    public Map<AuditAction, Long> countByAction() {
        Map<AuditAction, Long> counts = new EnumMap<>(AuditAction.class);
        for (AuditAction action : AuditAction.values()) {
            counts.put(action, 0L);
        }
        shards.values().forEach(shard -> shard.getEntries()
                .forEach(e -> counts.merge(e.action(), 1L, Long::sum)));
        return counts;
    }

    public int shardCount() {
        return shards.size();
    }
}
