package com.provider.linkage.aggregate;

import com.provider.linkage.core.model.Segment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Heuristic estimate of one metric from another, contributed as an extra candidate under its
 * own (low-ranked) source. The typical rule estimates {@code revenue} as
 * {@code patient_volume x revenue-per-patient}, with a higher rate for FQHCs.
 *
 * @param targetMetric metric the estimate is contributed to
 * @param inputMetric  metric the estimate is computed from
 * @param sourceName   source the estimate is attributed to
 * @param segmentRates rate per segment; segments without an entry use {@code defaultRate}
 * @param defaultRate  rate for unlisted or unknown segments
 */
public record DerivedEstimateRule(
        String targetMetric,
        String inputMetric,
        String sourceName,
        Map<Segment, Double> segmentRates,
        double defaultRate
) {
    public DerivedEstimateRule {
        Objects.requireNonNull(targetMetric, "targetMetric is required");
        Objects.requireNonNull(inputMetric, "inputMetric is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        if (targetMetric.equals(inputMetric)) {
            throw new IllegalArgumentException("A derived estimate cannot use its own target as input");
        }
        Map<Segment, Double> rates = new EnumMap<>(Segment.class);
        if (segmentRates != null) {
            rates.putAll(segmentRates);
        }
        segmentRates = Collections.unmodifiableMap(rates);
    }

    public double rateFor(Segment segment) {
        if (segment == null) {
            return defaultRate;
        }
        return segmentRates.getOrDefault(segment, defaultRate);
    }
}
