package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.config.ConfigLoader;
import com.provider.linkage.core.model.AvailableEntry;
import com.provider.linkage.core.model.BibliographyEntry;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.MissingEntry;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.ScoreRecord;
import com.provider.linkage.core.model.Segment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private static final String ORG = "org_1234567890";

    private ScoringRules rules;
    private ScoringEngine engine;

    @BeforeEach
    void setUp() {
        rules = new ConfigLoader().loadDefaults().scoring();
        PercentileTable percentiles = PercentileTable.of(Map.of(
                MetricCatalog.REVENUE, List.of(1_000_000.0, 3_000_000.0, 5_000_000.0),
                MetricCatalog.PATIENT_VOLUME, List.of(1_000.0, 5_000.0, 20_000.0),
                MetricCatalog.PROVIDER_COUNT, List.of(5.0, 20.0, 150.0),
                MetricCatalog.SITE_COUNT, List.of(1.0, 3.0, 12.0)));
        engine = new ScoringEngine(rules, percentiles);
    }

    private static ResolvedMetric metric(String name, double value, String source) {
        return new ResolvedMetric(ORG, name, value, source, ConfidenceTier.VERIFIED, LinkMethod.EXACT_ID,
                "rank 1", List.of());
    }

    private static Map<String, ResolvedMetric> allMissing() {
        Map<String, ResolvedMetric> metrics = new HashMap<>();
        for (String name : MetricCatalog.ALL) {
            metrics.put(name, ResolvedMetric.missing(ORG, name, List.of()));
        }
        return metrics;
    }

    @Nested
    @DisplayName("Explainability")
    class Explainability {

        @Test
        @DisplayName("Missing inputs should yield missing entries and no points, never an error")
        void testAllMissing() {
            ScoreRecord score = engine.score(ORG, Segment.D, allMissing());

            assertEquals(ScoringEngine.CATEGORIES, List.copyOf(score.categoryScores().keySet()));
            assertEquals(0.0, score.categoryScore(ComplianceRiskScorer.CATEGORY));
            assertEquals(0.0, score.categoryScore(StrategicValueScorer.CATEGORY));
            assertTrue(score.entriesFor(StrategicValueScorer.CATEGORY).stream().allMatch(BibliographyEntry::missing));
            assertEquals(3, score.tier());
            assertEquals("Tier 3 - Monitor", score.tierLabel());
            assertEquals("9.0.0", score.rulesetVersion());
        }

        @Test
        @DisplayName("Every category should cite at least one entry and every available entry a source")
        void testBibliographyCompleteness() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.REVENUE, metric(MetricCatalog.REVENUE, 3_000_000.0, "cost_report"));
            metrics.put(MetricCatalog.PATIENT_VOLUME, metric(MetricCatalog.PATIENT_VOLUME, 20_000.0, "hrsa_uds"));
            metrics.put(MetricCatalog.ACO_MEMBER, metric(MetricCatalog.ACO_MEMBER, 1.0, "aco_roster"));

            ScoreRecord score = engine.score(ORG, Segment.B, metrics);

            for (String category : ScoringEngine.CATEGORIES) {
                assertFalse(score.entriesFor(category).isEmpty(), category);
            }
            for (BibliographyEntry entry : score.bibliography()) {
                if (entry instanceof AvailableEntry available) {
                    assertFalse(available.sources().isEmpty());
                    assertTrue(available.pointsAwarded() >= 0.0);
                } else {
                    assertInstanceOf(MissingEntry.class, entry);
                    assertEquals(0.0, entry.pointsAwarded());
                }
            }
            double categorySum = score.categoryScores().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(Bibliography.round(categorySum), score.totalScore(), 1e-9);
        }

        @Test
        @DisplayName("Available entries should cite the winning source of their metric")
        void testSourceCitation() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.REVENUE, metric(MetricCatalog.REVENUE, 3_000_000.0, "cost_report"));

            ScoreRecord score = engine.score(ORG, Segment.B, metrics);

            AvailableEntry dealValue = (AvailableEntry) score.entriesFor(StrategicValueScorer.CATEGORY).stream()
                    .filter(e -> e.component().equals("deal_value"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(List.of("revenue@cost_report"), dealValue.sources());
            assertEquals("3000000", dealValue.inputValue());
        }
    }

    @Nested
    @DisplayName("Category rules")
    class CategoryRules {

        @Test
        @DisplayName("Revenue at the segment threshold should earn the base plus its percentile span")
        void testStrategicValue() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.REVENUE, metric(MetricCatalog.REVENUE, 3_000_000.0, "cost_report"));
            metrics.put(MetricCatalog.ACO_MEMBER, metric(MetricCatalog.ACO_MEMBER, 1.0, "aco_roster"));

            ScoreRecord score = engine.score(ORG, Segment.B, metrics);

            // 10 base + 5 * rank 2/3, plus 6 for ACO participation
            assertEquals(19.33, score.categoryScore(StrategicValueScorer.CATEGORY), 1e-9);
        }

        @Test
        @DisplayName("An exclusion on record should max out compliance risk")
        void testOigExclusion() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.OIG_EXCLUSION_FLAG, metric(MetricCatalog.OIG_EXCLUSION_FLAG, 1.0, "oig_leie"));

            ScoreRecord score = engine.score(ORG, Segment.D, metrics);

            assertEquals(10.0, score.categoryScore(ComplianceRiskScorer.CATEGORY));
        }

        @Test
        @DisplayName("Known but negative flags should earn the baseline")
        void testComplianceBaseline() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.FQHC_FLAG, metric(MetricCatalog.FQHC_FLAG, 0.0, "hrsa_uds"));
            metrics.put(MetricCatalog.ACO_MEMBER, metric(MetricCatalog.ACO_MEMBER, 0.0, "aco_roster"));

            ScoreRecord score = engine.score(ORG, Segment.D, metrics);

            assertEquals(2.0, score.categoryScore(ComplianceRiskScorer.CATEGORY));
        }

        @Test
        @DisplayName("Segment should drive the strategic fit profile")
        void testSegmentProfile() {
            assertEquals(12.0, engine.score(ORG, Segment.A, allMissing()).categoryScore(StrategicFitScorer.CATEGORY));
            assertEquals(4.0, engine.score(ORG, Segment.D, allMissing()).categoryScore(StrategicFitScorer.CATEGORY));
        }

        @Test
        @DisplayName("Category points should be clamped to the scorer ceiling")
        void testCeilingClamp() {
            CategoryScorer greedy = new CategoryScorer() {
                @Override
                public String category() {
                    return "greedy";
                }

                @Override
                public double ceiling() {
                    return 5.0;
                }

                @Override
                public CategoryResult score(ScoringInput input) {
                    return new CategoryResult("greedy", 500.0, List.of());
                }
            };
            ScoringEngine custom = new ScoringEngine(rules, PercentileTable.of(Map.of()), List.of(greedy));

            ScoreRecord score = custom.score(ORG, Segment.D, Map.of());

            assertEquals(5.0, score.categoryScore("greedy"));
            assertEquals(5.0, score.totalScore());
        }
    }

    @Nested
    @DisplayName("Behavioral track and quality readiness")
    class BehavioralTrack {

        @ParameterizedTest
        @CsvSource({
                "0.10, 5.25",
                "0.25, 7.5",
                "0.60, 12.75",
                "0.90, 15.0"
        })
        @DisplayName("Psych risk ratio should drive revenue leakage for behavioral segments")
        void testPsychRiskPoints(double ratio, double expected) {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.PSYCH_RISK_RATIO,
                    metric(MetricCatalog.PSYCH_RISK_RATIO, ratio, "claims_utilization"));

            ScoreRecord score = engine.score(ORG, Segment.A, metrics);

            assertEquals(expected, score.categoryScore(EconomicPainScorer.CATEGORY), 1e-9);
        }

        @Test
        @DisplayName("Behavioral segments should ignore undercoding when a psych ratio is known")
        void testPsychRiskReplacesUndercoding() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.UNDERCODING_RATIO,
                    metric(MetricCatalog.UNDERCODING_RATIO, 0.0, "claims_utilization"));
            metrics.put(MetricCatalog.PSYCH_RISK_RATIO,
                    metric(MetricCatalog.PSYCH_RISK_RATIO, 0.0, "claims_utilization"));

            ScoreRecord score = engine.score(ORG, Segment.A, metrics);

            AvailableEntry leakage = (AvailableEntry) score.entriesFor(EconomicPainScorer.CATEGORY).stream()
                    .filter(e -> e.component().equals("revenue_leakage"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(List.of("psych_risk_ratio@claims_utilization"), leakage.sources());
            assertEquals(3.75, leakage.pointsAwarded(), 1e-9);
        }

        @Test
        @DisplayName("Other segments should keep scoring undercoding")
        void testAmbulatoryIgnoresPsychRisk() {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.UNDERCODING_RATIO,
                    metric(MetricCatalog.UNDERCODING_RATIO, 0.0, "claims_utilization"));
            metrics.put(MetricCatalog.PSYCH_RISK_RATIO,
                    metric(MetricCatalog.PSYCH_RISK_RATIO, 0.0, "claims_utilization"));

            ScoreRecord score = engine.score(ORG, Segment.D, metrics);

            assertEquals(15.0, score.categoryScore(EconomicPainScorer.CATEGORY), 1e-9);
        }

        @ParameterizedTest
        @CsvSource({
                "A, 85.0, 17.0",
                "A, 65.0, 15.0",
                "A, 40.0, 12.0",
                "D, 85.0, 9.0",
                "D, 40.0, 9.0",
                "D, 65.0, 4.0"
        })
        @DisplayName("MIPS score should add quality readiness points to strategic fit")
        void testQualityReadiness(Segment segment, double mips, double expected) {
            Map<String, ResolvedMetric> metrics = allMissing();
            metrics.put(MetricCatalog.MIPS_SCORE, metric(MetricCatalog.MIPS_SCORE, mips, "mips"));

            ScoreRecord score = engine.score(ORG, segment, metrics);

            assertEquals(expected, score.categoryScore(StrategicFitScorer.CATEGORY), 1e-9);
        }

        @Test
        @DisplayName("A missing MIPS score should be cited as missing")
        void testMissingMips() {
            ScoreRecord score = engine.score(ORG, Segment.A, allMissing());

            BibliographyEntry readiness = score.entriesFor(StrategicFitScorer.CATEGORY).stream()
                    .filter(e -> e.component().equals("quality_readiness"))
                    .findFirst()
                    .orElseThrow();
            assertInstanceOf(MissingEntry.class, readiness);
        }

        @Test
        @DisplayName("Psych risk curve should reject descending breakpoints")
        void testPsychRiskValidation() {
            assertThrows(IllegalArgumentException.class, () -> new EconomicPainRules.PsychRisk(
                    List.of(Segment.A), List.of(0.5, 0.25), List.of(1.0, 2.0)));
            assertThrows(IllegalArgumentException.class, () -> new EconomicPainRules.PsychRisk(
                    List.of(Segment.A), List.of(0.0), List.of(1.0)));
        }
    }

    @Test
    @DisplayName("Scoring should be deterministic")
    void testDeterminism() {
        Map<String, ResolvedMetric> metrics = allMissing();
        metrics.put(MetricCatalog.PROVIDER_COUNT, metric(MetricCatalog.PROVIDER_COUNT, 20.0, "pecos"));
        metrics.put(MetricCatalog.SITE_COUNT, metric(MetricCatalog.SITE_COUNT, 12.0, "hrsa_uds"));

        assertEquals(engine.score(ORG, Segment.C, metrics), engine.score(ORG, Segment.C, Map.copyOf(metrics)));
    }

    @Test
    @DisplayName("Tier table should pick the highest tier whose floor the score reaches")
    void testTiers() {
        TierTable tiers = rules.tierTable();

        assertEquals(1, tiers.tierFor(70.0).tier());
        assertEquals(2, tiers.tierFor(69.99).tier());
        assertEquals(3, tiers.tierFor(0.0).tier());
        assertThrows(IllegalArgumentException.class, () -> new TierTable(List.of(new TierRule(1, "x", 10.0))));
    }
}
