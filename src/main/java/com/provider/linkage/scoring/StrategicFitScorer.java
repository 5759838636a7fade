package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.MissingEntry;
import com.provider.linkage.core.model.ResolvedMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Strategic fit: ideal segment profile, operational complexity from provider and site counts,
 * and MIPS quality readiness.
 */
public class StrategicFitScorer implements CategoryScorer {

    public static final String CATEGORY = "strategic_fit";

    private final StrategicFitRules rules;

    public StrategicFitScorer(StrategicFitRules rules) {
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
        double points = 0.0;

        if (input.segment() == null) {
            entries.add(new MissingEntry(CATEGORY, "segment_profile",
                    List.of(Bibliography.SEGMENT_SOURCE), "organization has no segment"));
        } else {
            double profile = rules.pointsFor(input.segment());
            entries.add(Bibliography.fromSegment(CATEGORY, "segment_profile", input.segment().name(), profile,
                    "segment " + input.segment().name() + " profile"));
            points += profile;
        }

        points += banded(input, entries, "provider_complexity", MetricCatalog.PROVIDER_COUNT, rules.providerCount());
        points += banded(input, entries, "site_complexity", MetricCatalog.SITE_COUNT, rules.siteCount());
        if (rules.qualityReadiness() != null) {
            points += qualityReadiness(input, entries, rules.qualityReadiness());
        }
        return CategoryResult.clamped(CATEGORY, rules.ceiling(), points, entries);
    }

    private static double banded(ScoringInput input, List<BibliographyEntry> entries, String component,
                                 String metricName, BandRule rule) {
        ResolvedMetric metric = input.metric(metricName);
        if (metric.isMissing()) {
            entries.add(Bibliography.missing(CATEGORY, component, metricName));
            return 0.0;
        }
        BandedComponent.BandScore band = BandedComponent.score(rule, input.percentiles(), metricName, metric.value());
        entries.add(Bibliography.fromMetric(CATEGORY, component, metric, band.points(),
                String.format(Locale.ROOT, "%s at p%.0f, band %d of %d",
                        metricName, band.percentile() * 100, band.band() + 1, rule.bandCount())));
        return band.points();
    }

    private static double qualityReadiness(ScoringInput input, List<BibliographyEntry> entries,
                                           StrategicFitRules.QualityReadiness readiness) {
        ResolvedMetric mips = input.metric(MetricCatalog.MIPS_SCORE);
        if (mips.isMissing()) {
            entries.add(Bibliography.missing(CATEGORY, "quality_readiness", MetricCatalog.MIPS_SCORE));
            return 0.0;
        }
        double points = readiness.pointsFor(input.segment(), mips.value());
        entries.add(Bibliography.fromMetric(CATEGORY, "quality_readiness", mips, points,
                readiness.describe(input.segment(), mips.value())));
        return points;
    }
}
