package com.provider.linkage.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Raw metric-bearing record from a claims, cost-report, quality-program or designation dataset.
 * A record is keyed either by the registry's primary identifier or by a foreign key in some
 * crosswalk key space; name and state are carried for the fuzzy fallback.
 *
 * @param sourceName        dataset the record came from
 * @param recordKey         key of the record within its dataset
 * @param primaryIdentifier registry number, or {@code null}
 * @param keySpace          crosswalk key space of {@code foreignKey} (e.g. {@code ccn}), or {@code null}
 * @param foreignKey        identifier in {@code keySpace}, or {@code null}
 * @param orgName           organization name as published by the source, or {@code null}
 * @param stateCode         two-letter state code, or empty
 * @param metricName        metric contributed by this record
 * @param value             metric value; {@code null} means the source published no value
 * @param unit              unit of {@code value}
 * @param asOfPeriod        reporting period, sortable text such as {@code 2024} or {@code 2024-Q3}
 */
public record MetricRecord(
        String sourceName,
        String recordKey,
        String primaryIdentifier,
        String keySpace,
        String foreignKey,
        String orgName,
        String stateCode,
        String metricName,
        Double value,
        String unit,
        String asOfPeriod
) {
    public MetricRecord {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(recordKey, "recordKey is required");
        Objects.requireNonNull(metricName, "metricName is required");
        primaryIdentifier = blankToNull(primaryIdentifier);
        keySpace = blankToNull(keySpace);
        foreignKey = blankToNull(foreignKey);
        stateCode = stateCode != null ? stateCode.trim().toUpperCase(Locale.ROOT) : "";
        asOfPeriod = asOfPeriod != null ? asOfPeriod.trim() : "";
        unit = unit != null ? unit.trim() : "";
    }

    public boolean hasPrimaryIdentifier() {
        return primaryIdentifier != null;
    }

    public boolean hasForeignKey() {
        return keySpace != null && foreignKey != null;
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
        private String sourceName;
        private String recordKey;
        private String primaryIdentifier;
        private String keySpace;
        private String foreignKey;
        private String orgName;
        private String stateCode;
        private String metricName;
        private Double value;
        private String unit;
        private String asOfPeriod;

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder recordKey(String recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder primaryIdentifier(String primaryIdentifier) {
            this.primaryIdentifier = primaryIdentifier;
            return this;
        }

        public Builder foreignKey(String keySpace, String foreignKey) {
            this.keySpace = keySpace;
            this.foreignKey = foreignKey;
            return this;
        }

        public Builder orgName(String orgName) {
            this.orgName = orgName;
            return this;
        }

        public Builder stateCode(String stateCode) {
            this.stateCode = stateCode;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder asOfPeriod(String asOfPeriod) {
            this.asOfPeriod = asOfPeriod;
            return this;
        }

        public MetricRecord build() {
            return new MetricRecord(sourceName, recordKey, primaryIdentifier, keySpace, foreignKey,
                    orgName, stateCode, metricName, value, unit, asOfPeriod);
        }
    }
}
