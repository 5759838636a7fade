package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.AvailableEntry;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.MissingEntry;
import com.provider.linkage.core.model.ResolvedMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compliance risk from exclusion, FQHC and ACO flags plus segment. An exclusion on record
 * awards the category maximum outright.
 */
public class ComplianceRiskScorer implements CategoryScorer {

    public static final String CATEGORY = "compliance_risk";

    private final ComplianceRiskRules rules;

    public ComplianceRiskScorer(ComplianceRiskRules rules) {
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
        ResolvedMetric exclusion = input.metric(MetricCatalog.OIG_EXCLUSION_FLAG);
        if (exclusion.isFlagSet()) {
            entries.add(Bibliography.fromMetric(CATEGORY, "oig_exclusion", exclusion,
                    rules.oigExclusionPoints(), "exclusion on record"));
            return CategoryResult.clamped(CATEGORY, rules.ceiling(), rules.oigExclusionPoints(), entries);
        }

        ResolvedMetric fqhc = input.metric(MetricCatalog.FQHC_FLAG);
        ResolvedMetric aco = input.metric(MetricCatalog.ACO_MEMBER);
        List<ResolvedMetric> known = new ArrayList<>();
        for (ResolvedMetric flag : List.of(exclusion, fqhc, aco)) {
            if (flag.isPresent()) {
                known.add(flag);
            }
        }

        double points = 0.0;
        if (fqhc.isFlagSet()) {
            entries.add(Bibliography.fromMetric(CATEGORY, "fqhc_reporting", fqhc, rules.fqhcPoints(),
                    "FQHC cost-report and UDS obligations"));
            points += rules.fqhcPoints();
        }
        if (aco.isFlagSet()) {
            entries.add(Bibliography.fromMetric(CATEGORY, "aco_reporting", aco, rules.acoPoints(),
                    "ACO quality reporting"));
            points += rules.acoPoints();
        }
        if (input.segment() != null && rules.specialtySegments().contains(input.segment())) {
            entries.add(Bibliography.fromSegment(CATEGORY, "segment_risk", input.segment().name(),
                    rules.segmentPoints(), "segment " + input.segment().name() + " documentation risk"));
            points += rules.segmentPoints();
        }

        if (known.isEmpty()) {
            entries.add(new MissingEntry(CATEGORY, "flags",
                    List.of(MetricCatalog.OIG_EXCLUSION_FLAG, MetricCatalog.FQHC_FLAG, MetricCatalog.ACO_MEMBER),
                    "no compliance flags from any source"));
        } else if (points == 0.0) {
            List<String> sources = new ArrayList<>();
            for (ResolvedMetric flag : known) {
                sources.add(flag.metricName() + "@" + flag.winningSource());
            }
            entries.add(new AvailableEntry(CATEGORY, "baseline", sources,
                    "all flags negative", Bibliography.round(rules.baselinePoints()), "known flags, none set"));
            points = rules.baselinePoints();
        }
        return CategoryResult.clamped(CATEGORY, rules.ceiling(), points, entries);
    }
}
