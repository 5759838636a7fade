package com.provider.linkage.scoring;

import com.provider.linkage.core.model.AvailableEntry;
import com.provider.linkage.core.model.MissingEntry;
import com.provider.linkage.core.model.ResolvedMetric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Helpers for building bibliography entries with stable number rendering.
 */
final class Bibliography {

    static final String SEGMENT_SOURCE = "segment_classifier";

    private Bibliography() {
    }

    static AvailableEntry fromMetric(String category, String component, ResolvedMetric metric,
                                     double points, String explanation) {
        return new AvailableEntry(category, component,
                List.of(metric.metricName() + "@" + metric.winningSource()),
                render(metric.value()), round(points),
                explanation + " [" + metric.confidenceTier().code() + "]");
    }

    static AvailableEntry fromSegment(String category, String component, String segment,
                                      double points, String explanation) {
        return new AvailableEntry(category, component, List.of(SEGMENT_SOURCE), segment, round(points), explanation);
    }

    static MissingEntry missing(String category, String component, String metricName) {
        return new MissingEntry(category, component, List.of(metricName),
                "no value for " + metricName + " from any source");
    }

    /**
     * Rounds to two decimals, half up.
     */
    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static String render(Double value) {
        if (value == null) {
            return "";
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
