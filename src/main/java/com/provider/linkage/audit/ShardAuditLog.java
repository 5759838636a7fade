package com.provider.linkage.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only audit log written by a single worker. Each shard of parallel work gets its own
 * log so no list is ever shared between writers; {@link AuditLedger} merges them.
 */
public class ShardAuditLog {

    private final String shardKey;
    private final List<AuditEntry> entries = new ArrayList<>();

    ShardAuditLog(String shardKey) {
        this.shardKey = shardKey;
    }

    public String getShardKey() {
        return shardKey;
    }

    public void record(AuditAction action, String sourceName, String recordKey, String orgId, String detail) {
        entries.add(new AuditEntry(action, sourceName, recordKey, orgId, detail));
    }

    public void record(AuditEntry entry) {
        entries.add(entry);
    }

    public List<AuditEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }
}
