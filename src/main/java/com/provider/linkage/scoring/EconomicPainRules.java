package com.provider.linkage.scoring;

import com.provider.linkage.core.model.Segment;

import java.util.List;
import java.util.Objects;

/**
 * Parameters of the economic-pain category.
 *
 * @param ceiling        category maximum
 * @param revenueLeakage undercoding component
 * @param volumeLoad     patient-volume bands
 * @param marginPressure net-margin component
 * @param psychRisk      behavioral-track coding risk replacing undercoding; {@code null} disables it
 */
public record EconomicPainRules(
        double ceiling,
        RevenueLeakage revenueLeakage,
        BandRule volumeLoad,
        MarginPressure marginPressure,
        PsychRisk psychRisk
) {
    public EconomicPainRules {
        Objects.requireNonNull(revenueLeakage, "revenueLeakage is required");
        Objects.requireNonNull(volumeLoad, "volumeLoad is required");
        Objects.requireNonNull(marginPressure, "marginPressure is required");
        if (ceiling <= 0) {
            throw new IllegalArgumentException("economic_pain ceiling must be positive");
        }
        if (psychRisk != null && psychRisk.maxPoints() > revenueLeakage.maxPoints()) {
            throw new IllegalArgumentException("psychRisk points exceed revenueLeakage maxPoints");
        }
    }

    /**
     * True when organizations of {@code segment} are scored on the behavioral track.
     */
    public boolean behavioralTrack(Segment segment) {
        return psychRisk != null && segment != null && psychRisk.segments().contains(segment);
    }

    /**
     * Ratios below {@code severeBelow} earn {@code severeBase} plus a modifier up to
     * {@code maxPoints} as the ratio approaches zero. Ratios between {@code severeBelow} and
     * {@code noneAbove} earn up to {@code moderateMax}, falling to zero at {@code noneAbove}.
     * Segments in {@code projectedSegments} without a ratio get {@code projectedPoints}.
     */
    public record RevenueLeakage(
            double severeBelow,
            double noneAbove,
            double severeBase,
            double maxPoints,
            double moderateMax,
            double projectedPoints,
            List<Segment> projectedSegments
    ) {
        public RevenueLeakage {
            projectedSegments = projectedSegments != null ? List.copyOf(projectedSegments) : List.of();
            if (!(severeBelow > 0 && noneAbove > severeBelow)) {
                throw new IllegalArgumentException("revenueLeakage requires 0 < severeBelow < noneAbove");
            }
            if (severeBase > maxPoints || moderateMax > severeBase || projectedPoints > maxPoints) {
                throw new IllegalArgumentException("revenueLeakage points must satisfy moderateMax <= severeBase <= maxPoints");
            }
        }
    }

    /**
     * Margins below {@code thinBelow} earn {@code thinBase} plus a modifier up to
     * {@code maxPoints} at {@code worstMargin}. Margins between {@code thinBelow} and
     * {@code healthyAbove} earn up to {@code thinBase}, falling to zero at {@code healthyAbove}.
     * Segments in {@code floorSegments} never score below {@code segmentFloor}.
     */
    public record MarginPressure(
            double thinBelow,
            double worstMargin,
            double healthyAbove,
            double thinBase,
            double maxPoints,
            double segmentFloor,
            List<Segment> floorSegments
    ) {
        public MarginPressure {
            floorSegments = floorSegments != null ? List.copyOf(floorSegments) : List.of();
            if (!(worstMargin < thinBelow && thinBelow < healthyAbove)) {
                throw new IllegalArgumentException("marginPressure requires worstMargin < thinBelow < healthyAbove");
            }
            if (thinBase > maxPoints || segmentFloor > maxPoints) {
                throw new IllegalArgumentException("marginPressure points exceed maxPoints");
            }
        }
    }

    /**
     * Psych coding risk on the behavioral track. Points are interpolated linearly between
     * ascending {@code breakpoints} and held flat outside them.
     */
    public record PsychRisk(
            List<Segment> segments,
            List<Double> breakpoints,
            List<Double> points
    ) {
        public PsychRisk {
            segments = segments != null ? List.copyOf(segments) : List.of();
            breakpoints = breakpoints != null ? List.copyOf(breakpoints) : List.of();
            points = points != null ? List.copyOf(points) : List.of();
            if (breakpoints.size() < 2 || breakpoints.size() != points.size()) {
                throw new IllegalArgumentException("psychRisk needs at least two breakpoints, one point value each");
            }
            for (int i = 1; i < breakpoints.size(); i++) {
                if (breakpoints.get(i) <= breakpoints.get(i - 1)) {
                    throw new IllegalArgumentException("psychRisk breakpoints must be ascending");
                }
                if (points.get(i) < points.get(i - 1)) {
                    throw new IllegalArgumentException("psychRisk points must not decrease");
                }
            }
        }

        public double maxPoints() {
            return points.get(points.size() - 1);
        }

        public double pointsFor(double ratio) {
            if (ratio <= breakpoints.get(0)) {
                return points.get(0);
            }
            for (int i = 1; i < breakpoints.size(); i++) {
                double upper = breakpoints.get(i);
                if (ratio < upper) {
                    double lower = breakpoints.get(i - 1);
                    double fraction = (ratio - lower) / (upper - lower);
                    return points.get(i - 1) + (points.get(i) - points.get(i - 1)) * fraction;
                }
            }
            return maxPoints();
        }
    }
}
