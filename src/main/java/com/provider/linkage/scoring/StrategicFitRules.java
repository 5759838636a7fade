package com.provider.linkage.scoring;

import com.provider.linkage.core.model.Segment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of the strategic-fit category.
 *
 * @param ceiling       category maximum
 * @param segmentPoints ideal-profile points per segment; unlisted segments earn nothing
 * @param providerCount provider-count bands
 * @param siteCount     site-count bands
 * @param qualityReadiness MIPS quality thresholds; {@code null} disables the component
 */
public record StrategicFitRules(
        double ceiling,
        Map<Segment, Double> segmentPoints,
        BandRule providerCount,
        BandRule siteCount,
        QualityReadiness qualityReadiness
) {
    public StrategicFitRules {
        Objects.requireNonNull(providerCount, "providerCount is required");
        Objects.requireNonNull(siteCount, "siteCount is required");
        Map<Segment, Double> points = new EnumMap<>(Segment.class);
        if (segmentPoints != null) {
            points.putAll(segmentPoints);
        }
        segmentPoints = Collections.unmodifiableMap(points);
        if (ceiling <= 0) {
            throw new IllegalArgumentException("strategic_fit ceiling must be positive");
        }
    }

    public double pointsFor(Segment segment) {
        if (segment == null) {
            return 0.0;
        }
        return segmentPoints.getOrDefault(segment, 0.0);
    }

    /**
     * MIPS quality readiness. A score above {@code highAbove} earns {@code highPoints} everywhere.
     * Below that, {@code moderateSegments} earn {@code moderatePoints} from {@code moderateAtOrAbove}
     * while other segments earn {@code distressedPoints} under {@code distressedBelow}.
     */
    public record QualityReadiness(
            double highAbove,
            double highPoints,
            double distressedBelow,
            double distressedPoints,
            double moderateAtOrAbove,
            double moderatePoints,
            List<Segment> moderateSegments
    ) {
        public QualityReadiness {
            moderateSegments = moderateSegments != null ? List.copyOf(moderateSegments) : List.of();
            if (distressedBelow > highAbove || moderateAtOrAbove > highAbove) {
                throw new IllegalArgumentException("qualityReadiness thresholds must sit below highAbove");
            }
            if (highPoints < 0 || distressedPoints < 0 || moderatePoints < 0) {
                throw new IllegalArgumentException("qualityReadiness points must not be negative");
            }
        }

        public double pointsFor(Segment segment, double mipsScore) {
            if (mipsScore > highAbove) {
                return highPoints;
            }
            if (segment != null && moderateSegments.contains(segment)) {
                return mipsScore >= moderateAtOrAbove ? moderatePoints : 0.0;
            }
            return mipsScore < distressedBelow ? distressedPoints : 0.0;
        }

        public String describe(Segment segment, double mipsScore) {
            if (mipsScore > highAbove) {
                return String.format(Locale.ROOT, "high MIPS quality %.1f", mipsScore);
            }
            if (segment != null && moderateSegments.contains(segment)) {
                return mipsScore >= moderateAtOrAbove
                        ? String.format(Locale.ROOT, "moderate MIPS quality %.1f", mipsScore)
                        : String.format(Locale.ROOT, "MIPS %.1f below readiness threshold", mipsScore);
            }
            return mipsScore < distressedBelow
                    ? String.format(Locale.ROOT, "distressed MIPS performer %.1f", mipsScore)
                    : String.format(Locale.ROOT, "MIPS %.1f in neutral range", mipsScore);
        }
    }
}
