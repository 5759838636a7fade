package com.provider.linkage.scoring;

import com.provider.linkage.core.model.Segment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parameters of the strategic-value category.
 *
 * <p>Revenue at or above the segment's threshold earns {@code aboveThresholdBase} plus up to
 * {@code aboveThresholdSpan} by corpus percentile; below it, points scale linearly with revenue
 * up to {@code belowThresholdMax}.</p>
 *
 * @param ceiling                 category maximum
 * @param revenueThresholds       deal-size threshold per segment
 * @param defaultRevenueThreshold threshold for unlisted segments
 * @param aboveThresholdBase      base points at or above the threshold
 * @param aboveThresholdSpan      percentile modifier range above the threshold
 * @param belowThresholdMax       points approached just below the threshold
 * @param acoPoints               market-influence points for ACO participants
 * @param shortageAreaPoints      market-influence points for shortage-area locations
 */
public record StrategicValueRules(
        double ceiling,
        Map<Segment, Double> revenueThresholds,
        double defaultRevenueThreshold,
        double aboveThresholdBase,
        double aboveThresholdSpan,
        double belowThresholdMax,
        double acoPoints,
        double shortageAreaPoints
) {
    public StrategicValueRules {
        Map<Segment, Double> thresholds = new EnumMap<>(Segment.class);
        if (revenueThresholds != null) {
            thresholds.putAll(revenueThresholds);
        }
        revenueThresholds = Collections.unmodifiableMap(thresholds);
        if (ceiling <= 0) {
            throw new IllegalArgumentException("strategic_value ceiling must be positive");
        }
        if (defaultRevenueThreshold <= 0 || thresholds.values().stream().anyMatch(t -> t <= 0)) {
            throw new IllegalArgumentException("revenue thresholds must be positive");
        }
        if (belowThresholdMax > aboveThresholdBase) {
            throw new IllegalArgumentException("belowThresholdMax must not exceed aboveThresholdBase");
        }
    }

    public double thresholdFor(Segment segment) {
        if (segment == null) {
            return defaultRevenueThreshold;
        }
        return revenueThresholds.getOrDefault(segment, defaultRevenueThreshold);
    }
}
