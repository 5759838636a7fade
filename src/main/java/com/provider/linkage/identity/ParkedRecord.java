package com.provider.linkage.identity;

import com.provider.linkage.core.model.IdentityRecord;

import java.util.Objects;

/**
 * Identity record without a primary identifier, held back from the spine pass until the fuzzy
 * matcher has had a chance to attach it to an existing organization.
 *
 * @param record         the original record
 * @param normalizedName its normalized name
 */
public record ParkedRecord(IdentityRecord record, String normalizedName) {
    public ParkedRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(normalizedName, "normalizedName is required");
    }

    public String stateCode() {
        return record.stateCode();
    }
}
