package com.provider.linkage.core.model;

import java.util.Objects;

/**
 * One contribution of a source to a metric of an organization.
 * There is one per (orgId, metricName, source record); one-to-many crosswalk links
 * produce independent rows for every mapped organization.
 *
 * @param orgId              organization the value belongs to
 * @param metricName         metric name, e.g. {@code revenue}
 * @param sourceName         dataset that contributed the value
 * @param sourcePriorityRank position in the metric's hierarchy of truth, lower is more authoritative
 * @param value              contributed value, {@code null} when the source published none
 * @param unit               unit of the value
 * @param asOfPeriod         reporting period
 * @param linkMethod         how the contributing record was attached
 * @param linkConfidence     confidence of that link
 * @param sourceRecordKey    key of the contributing record
 */
public record MetricValue(
        String orgId,
        String metricName,
        String sourceName,
        int sourcePriorityRank,
        Double value,
        String unit,
        String asOfPeriod,
        LinkMethod linkMethod,
        double linkConfidence,
        String sourceRecordKey
) {
    public MetricValue {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(metricName, "metricName is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(linkMethod, "linkMethod is required");
        unit = unit != null ? unit : "";
        asOfPeriod = asOfPeriod != null ? asOfPeriod : "";
        sourceRecordKey = sourceRecordKey != null ? sourceRecordKey : "";
        if (value != null && (value.isNaN() || value.isInfinite())) {
            value = null;
        }
    }

    public boolean hasValue() {
        return value != null;
    }
}
