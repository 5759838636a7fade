package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.ResolvedMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Strategic value: deal size from revenue against a per-segment threshold, and market influence
 * from ACO participation and shortage-area location.
 */
public class StrategicValueScorer implements CategoryScorer {

    public static final String CATEGORY = "strategic_value";

    private final StrategicValueRules rules;

    public StrategicValueScorer(StrategicValueRules rules) {
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
        double points = dealValue(input, entries) + marketInfluence(input, entries);
        return CategoryResult.clamped(CATEGORY, rules.ceiling(), points, entries);
    }

    private double dealValue(ScoringInput input, List<BibliographyEntry> entries) {
        ResolvedMetric revenue = input.metric(MetricCatalog.REVENUE);
        if (revenue.isMissing()) {
            entries.add(Bibliography.missing(CATEGORY, "deal_value", MetricCatalog.REVENUE));
            return 0.0;
        }
        double threshold = rules.thresholdFor(input.segment());
        double value = revenue.value();
        double points;
        String explanation;
        if (value >= threshold) {
            double percentile = input.percentiles().rankOf(MetricCatalog.REVENUE, value);
            points = rules.aboveThresholdBase() + rules.aboveThresholdSpan() * percentile;
            explanation = String.format(Locale.ROOT, "revenue at or above %.0f threshold, p%.0f",
                    threshold, percentile * 100);
        } else {
            points = rules.belowThresholdMax() * BandedComponent.clamp(value / threshold);
            explanation = String.format(Locale.ROOT, "revenue below %.0f threshold", threshold);
        }
        entries.add(Bibliography.fromMetric(CATEGORY, "deal_value", revenue, points, explanation));
        return points;
    }

    private double marketInfluence(ScoringInput input, List<BibliographyEntry> entries) {
        ResolvedMetric aco = input.metric(MetricCatalog.ACO_MEMBER);
        ResolvedMetric shortage = input.metric(MetricCatalog.SHORTAGE_AREA_FLAG);
        if (aco.isMissing() && shortage.isMissing()) {
            entries.add(Bibliography.missing(CATEGORY, "market_influence", MetricCatalog.ACO_MEMBER));
            return 0.0;
        }
        double points = 0.0;
        if (aco.isPresent()) {
            double awarded = aco.isFlagSet() ? rules.acoPoints() : 0.0;
            entries.add(Bibliography.fromMetric(CATEGORY, "market_influence", aco, awarded,
                    aco.isFlagSet() ? "ACO participant" : "not an ACO participant"));
            points += awarded;
        }
        if (shortage.isPresent()) {
            double awarded = shortage.isFlagSet() ? rules.shortageAreaPoints() : 0.0;
            entries.add(Bibliography.fromMetric(CATEGORY, "market_influence", shortage, awarded,
                    shortage.isFlagSet() ? "located in a shortage area" : "not in a shortage area"));
            points += awarded;
        }
        return points;
    }
}
