package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Economic pain: revenue leakage from undercoding, patient-volume load and margin pressure.
 * Behavioral-track segments with a psych risk ratio are scored on coding risk instead of undercoding.
 */
public class EconomicPainScorer implements CategoryScorer {

    public static final String CATEGORY = "economic_pain";

    private final EconomicPainRules rules;

    public EconomicPainScorer(EconomicPainRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules is required");
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    @Override
    public double ceiling() {
        return rules.ceiling();
    }

    @Override
    public CategoryResult score(ScoringInput input) {
        List<BibliographyEntry> entries = new ArrayList<>();
        double points = revenueLeakage(input, entries)
                + volumeLoad(input, entries)
                + marginPressure(input, entries);
        return CategoryResult.clamped(CATEGORY, rules.ceiling(), points, entries);
    }

    private double revenueLeakage(ScoringInput input, List<BibliographyEntry> entries) {
        EconomicPainRules.RevenueLeakage leakage = rules.revenueLeakage();
        ResolvedMetric ratio = input.metric(MetricCatalog.UNDERCODING_RATIO);
        Segment segment = input.segment();

        if (rules.behavioralTrack(segment)) {
            ResolvedMetric psych = input.metric(MetricCatalog.PSYCH_RISK_RATIO);
            if (psych.isPresent()) {
                double points = rules.psychRisk().pointsFor(psych.value());
                entries.add(Bibliography.fromMetric(CATEGORY, "revenue_leakage", psych, points,
                        String.format(Locale.ROOT, "behavioral track: psych coding risk ratio %.2f",
                                psych.value())));
                return points;
            }
        }

        if (ratio.isPresent()) {
            double value = ratio.value();
            double points;
            String explanation;
            if (value < leakage.severeBelow()) {
                double depth = BandedComponent.clamp((leakage.severeBelow() - value) / leakage.severeBelow());
                points = leakage.severeBase() + (leakage.maxPoints() - leakage.severeBase()) * depth;
                explanation = String.format(Locale.ROOT, "undercoding ratio below %.2f", leakage.severeBelow());
            } else {
                double span = leakage.noneAbove() - leakage.severeBelow();
                points = leakage.moderateMax() * BandedComponent.clamp((leakage.noneAbove() - value) / span);
                explanation = String.format(Locale.ROOT, "undercoding ratio between %.2f and %.2f",
                        leakage.severeBelow(), leakage.noneAbove());
            }
            entries.add(Bibliography.fromMetric(CATEGORY, "revenue_leakage", ratio, points, explanation));
            return points;
        }

        if (segment != null && leakage.projectedSegments().contains(segment)) {
            entries.add(Bibliography.fromSegment(CATEGORY, "revenue_leakage", segment.name(),
                    leakage.projectedPoints(), "no undercoding data; projected for segment " + segment.name()));
            return leakage.projectedPoints();
        }
        entries.add(Bibliography.missing(CATEGORY, "revenue_leakage", MetricCatalog.UNDERCODING_RATIO));
        return 0.0;
    }

    private double volumeLoad(ScoringInput input, List<BibliographyEntry> entries) {
        ResolvedMetric volume = input.metric(MetricCatalog.PATIENT_VOLUME);
        if (volume.isMissing()) {
            entries.add(Bibliography.missing(CATEGORY, "volume_load", MetricCatalog.PATIENT_VOLUME));
            return 0.0;
        }
        BandedComponent.BandScore band = BandedComponent.score(rules.volumeLoad(), input.percentiles(),
                MetricCatalog.PATIENT_VOLUME, volume.value());
        entries.add(Bibliography.fromMetric(CATEGORY, "volume_load", volume, band.points(),
                String.format(Locale.ROOT, "patient volume at p%.0f, band %d of %d",
                        band.percentile() * 100, band.band() + 1, rules.volumeLoad().bandCount())));
        return band.points();
    }

    private double marginPressure(ScoringInput input, List<BibliographyEntry> entries) {
        EconomicPainRules.MarginPressure pressure = rules.marginPressure();
        ResolvedMetric margin = input.metric(MetricCatalog.NET_MARGIN);
        Segment segment = input.segment();
        boolean floored = segment != null && pressure.floorSegments().contains(segment);

        if (margin.isMissing()) {
            if (floored) {
                entries.add(Bibliography.fromSegment(CATEGORY, "margin_pressure", segment.name(),
                        pressure.segmentFloor(), "no margin data; segment " + segment.name() + " floor"));
                return pressure.segmentFloor();
            }
            entries.add(Bibliography.missing(CATEGORY, "margin_pressure", MetricCatalog.NET_MARGIN));
            return 0.0;
        }

        double value = margin.value();
        double points;
        String explanation;
        if (value < pressure.thinBelow()) {
            double depth = BandedComponent.clamp(
                    (pressure.thinBelow() - value) / (pressure.thinBelow() - pressure.worstMargin()));
            points = pressure.thinBase() + (pressure.maxPoints() - pressure.thinBase()) * depth;
            explanation = String.format(Locale.ROOT, "net margin below %.2f", pressure.thinBelow());
        } else {
            double span = pressure.healthyAbove() - pressure.thinBelow();
            points = pressure.thinBase() * BandedComponent.clamp((pressure.healthyAbove() - value) / span);
            explanation = String.format(Locale.ROOT, "net margin at or above %.2f", pressure.thinBelow());
        }
        if (floored && points < pressure.segmentFloor()) {
            points = pressure.segmentFloor();
            explanation += "; raised to segment " + segment.name() + " floor";
        }
        entries.add(Bibliography.fromMetric(CATEGORY, "margin_pressure", margin, points, explanation));
        return points;
    }
}
