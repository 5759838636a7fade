package com.provider.linkage.scoring;

import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;

import java.util.Map;
import java.util.Objects;

/**
 * Everything a category scorer may look at for one organization.
 *
 * @param orgId       the organization
 * @param segment     its segment, or {@code null} when unclassified
 * @param metrics     resolved metrics by name
 * @param percentiles corpus distribution for banded components
 */
public record ScoringInput(
        String orgId,
        Segment segment,
        Map<String, ResolvedMetric> metrics,
        PercentileTable percentiles
) {
    public ScoringInput {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(percentiles, "percentiles is required");
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    /**
     * The resolved metric, or a MISSING placeholder when nothing was resolved for it.
     */
    public ResolvedMetric metric(String metricName) {
        ResolvedMetric resolved = metrics.get(metricName);
        return resolved != null ? resolved : ResolvedMetric.missing(orgId, metricName, null);
    }
}
