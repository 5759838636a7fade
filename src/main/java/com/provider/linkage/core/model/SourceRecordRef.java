package com.provider.linkage.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Reference to a raw record folded into an organization, kept for audit.
 */
public record SourceRecordRef(String sourceName, String recordKey) implements Comparable<SourceRecordRef> {

    private static final Comparator<SourceRecordRef> ORDER = Comparator
            .comparing(SourceRecordRef::sourceName)
            .thenComparing(SourceRecordRef::recordKey);

    public SourceRecordRef {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(recordKey, "recordKey is required");
    }

    @Override
    public int compareTo(SourceRecordRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceName + ":" + recordKey;
    }
}
