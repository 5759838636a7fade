package com.provider.linkage.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Raw identity-bearing record from a registry snapshot.
 *
 * @param sourceName        registry the record came from
 * @param recordKey         key of the record within its source (line number when none is given)
 * @param sourceOrder       position of the record in ascending source-file order
 * @param primaryIdentifier 10-digit registry number, or {@code null}
 * @param legalName         organization name as published
 * @param entityType        organization or individual
 * @param stateCode         two-letter state code
 * @param address           street address
 * @param zip               postal code as published (may include the +4 extension)
 * @param phone             phone number as published
 * @param taxonomyCode      semicolon-separated NUCC taxonomy codes
 */
public record IdentityRecord(
        String sourceName,
        String recordKey,
        long sourceOrder,
        String primaryIdentifier,
        String legalName,
        EntityType entityType,
        String stateCode,
        String address,
        String zip,
        String phone,
        String taxonomyCode
) {
    public IdentityRecord {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(recordKey, "recordKey is required");
        Objects.requireNonNull(entityType, "entityType is required");
        primaryIdentifier = blankToNull(primaryIdentifier);
        stateCode = stateCode != null ? stateCode.trim().toUpperCase(Locale.ROOT) : "";
    }

    public boolean hasPrimaryIdentifier() {
        return primaryIdentifier != null;
    }

    public SourceRecordRef recordRef() {
        return new SourceRecordRef(sourceName, recordKey);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceName = "registry";
        private String recordKey;
        private long sourceOrder;
        private String primaryIdentifier;
        private String legalName;
        private EntityType entityType = EntityType.ORGANIZATION;
        private String stateCode;
        private String address;
        private String zip;
        private String phone;
        private String taxonomyCode;

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder recordKey(String recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder sourceOrder(long sourceOrder) {
            this.sourceOrder = sourceOrder;
            return this;
        }

        public Builder primaryIdentifier(String primaryIdentifier) {
            this.primaryIdentifier = primaryIdentifier;
            return this;
        }

        public Builder legalName(String legalName) {
            this.legalName = legalName;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder stateCode(String stateCode) {
            this.stateCode = stateCode;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder zip(String zip) {
            this.zip = zip;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder taxonomyCode(String taxonomyCode) {
            this.taxonomyCode = taxonomyCode;
            return this;
        }

        public IdentityRecord build() {
            String key = recordKey != null ? recordKey : String.valueOf(sourceOrder);
            return new IdentityRecord(sourceName, key, sourceOrder, primaryIdentifier, legalName,
                    entityType, stateCode, address, zip, phone, taxonomyCode);
        }
    }
}
