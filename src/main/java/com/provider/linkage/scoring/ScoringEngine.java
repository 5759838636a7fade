package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.ScoreRecord;
import com.provider.linkage.core.model.Segment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic, versioned scoring of resolved organizations.
 *
 * <p>Each category is scored independently and rounded to two decimals; the total is the sum of
 * the rounded category points clamped to the ruleset's global maximum. Identical inputs and
 * ruleset always produce an identical {@link ScoreRecord}. One engine is built per run because
 * it holds that run's {@link PercentileTable}; it is safe to call from several workers.</p>
 */
public class ScoringEngine {

    /**
     * Metrics whose corpus distribution the scorers read.
     */
    public static final List<String> PERCENTILE_METRICS = List.of(
            MetricCatalog.PATIENT_VOLUME, MetricCatalog.PROVIDER_COUNT, MetricCatalog.SITE_COUNT, MetricCatalog.REVENUE);

    /**
     * Category names of the default scorers, in scoring order.
     */
    public static final List<String> CATEGORIES = List.of(
            EconomicPainScorer.CATEGORY, StrategicFitScorer.CATEGORY,
            StrategicValueScorer.CATEGORY, ComplianceRiskScorer.CATEGORY);

    private final String rulesetVersion;
    private final double globalMaximum;
    private final TierTable tiers;
    private final List<CategoryScorer> scorers;
    private final PercentileTable percentiles;

    public ScoringEngine(ScoringRules rules, PercentileTable percentiles) {
        this(rules, percentiles, List.of(
                new EconomicPainScorer(rules.economicPain()),
                new StrategicFitScorer(rules.strategicFit()),
                new StrategicValueScorer(rules.strategicValue()),
                new ComplianceRiskScorer(rules.complianceRisk())));
    }

    public ScoringEngine(ScoringRules rules, PercentileTable percentiles, List<CategoryScorer> scorers) {
        Objects.requireNonNull(rules, "rules is required");
        this.percentiles = Objects.requireNonNull(percentiles, "percentiles is required");
        this.rulesetVersion = rules.version();
        this.globalMaximum = rules.globalMaximum();
        this.tiers = rules.tierTable();
        this.scorers = List.copyOf(scorers);
    }

    /**
     * Scores one organization.
     *
     * @param orgId   the organization
     * @param segment its segment, or {@code null}
     * @param metrics its resolved metrics by name
     */
    public ScoreRecord score(String orgId, Segment segment, Map<String, ResolvedMetric> metrics) {
        ScoringInput input = new ScoringInput(orgId, segment, metrics, percentiles);
        Map<String, Double> categoryScores = new LinkedHashMap<>();
        List<BibliographyEntry> bibliography = new ArrayList<>();
        double total = 0.0;

        for (CategoryScorer scorer : scorers) {
            CategoryResult result = scorer.score(input);
            double points = Bibliography.round(Math.max(0.0, Math.min(scorer.ceiling(), result.points())));
            categoryScores.put(scorer.category(), points);
            bibliography.addAll(result.entries());
            total += points;
        }

        double totalScore = Bibliography.round(Math.min(globalMaximum, total));
        TierRule tier = tiers.tierFor(totalScore);
        return new ScoreRecord(orgId, totalScore, categoryScores, tier.tier(), tier.label(), rulesetVersion, bibliography);
    }

    public TierTable getTiers() {
        return tiers;
    }

    public List<CategoryScorer> getScorers() {
        return scorers;
    }

    public String getRulesetVersion() {
        return rulesetVersion;
    }
}
