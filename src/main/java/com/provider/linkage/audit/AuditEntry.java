package com.provider.linkage.audit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable record of one record-level event.
 *
 * @param action     what happened
 * @param sourceName dataset of the affected record
 * @param recordKey  key of the affected record
 * @param orgId      organization involved, or {@code null}
 * @param detail     human-readable detail
 */
public record AuditEntry(
        AuditAction action,
        String sourceName,
        String recordKey,
        String orgId,
        String detail
) {
    /**
     * Report order: source, record key, action, then organization.
     */
    public static final Comparator<AuditEntry> REPORT_ORDER = Comparator
            .comparing(AuditEntry::sourceName)
            .thenComparing(AuditEntry::recordKey)
            .thenComparing(AuditEntry::action)
            .thenComparing(e -> e.orgId() != null ? e.orgId() : "");

    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        sourceName = sourceName != null ? sourceName : "";
        recordKey = recordKey != null ? recordKey : "";
        detail = detail != null ? detail : "";
    }
}
