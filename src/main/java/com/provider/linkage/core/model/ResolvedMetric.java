package com.provider.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The single chosen value for an (organization, metric) pair after conflict resolution.
 * All contending values are kept for provenance.
 */
public record ResolvedMetric(
        String orgId,
        String metricName,
        Double value,
        String winningSource,
        ConfidenceTier confidenceTier,
        LinkMethod winningLinkMethod,
        String reason,
        List<MetricValue> contenders
) {
    public ResolvedMetric {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(metricName, "metricName is required");
        Objects.requireNonNull(confidenceTier, "confidenceTier is required");
        contenders = contenders != null ? List.copyOf(contenders) : List.of();
        if (value == null && confidenceTier != ConfidenceTier.MISSING) {
            throw new IllegalArgumentException("A resolved metric without a value must be MISSING");
        }
    }

    /**
     * Creates the resolution for a metric no source contributed a value to.
     * Distinct from a legitimate zero.
     */
    public static ResolvedMetric missing(String orgId, String metricName, List<MetricValue> contenders) {
        return new ResolvedMetric(orgId, metricName, null, null, ConfidenceTier.MISSING, null,
                "No non-null candidate values", contenders);
    }

    public boolean isMissing() {
        return confidenceTier == ConfidenceTier.MISSING;
    }

    public boolean isPresent() {
        return !isMissing();
    }

    /**
     * Returns the value, failing if the metric is missing.
     */
    public double requireValue() {
        if (value == null) {
            throw new IllegalStateException("Metric " + metricName + " is missing for " + orgId);
        }
        return value;
    }

    /**
     * True when the metric is present and positive; used for 0/1 flag metrics.
     */
    public boolean isFlagSet() {
        return value != null && value > 0.0;
    }
}
