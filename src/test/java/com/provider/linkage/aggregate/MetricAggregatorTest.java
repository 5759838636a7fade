package com.provider.linkage.aggregate;

import com.provider.linkage.config.ConfigurationException;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.MetricRecord;
import com.provider.linkage.core.model.MetricValue;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MetricAggregatorTest {

    private static final String ORG = "org_1234567890";

    private SourcePriorityTable priorities;
    private MetricAggregator aggregator;

    @BeforeEach
    void setUp() {
        priorities = SourcePriorityTable.builder()
                .version("test")
                .source("cost_report", ConfidenceTier.VERIFIED)
                .source("claims_estimate", ConfidenceTier.DERIVED)
                .source("hrsa_uds", ConfidenceTier.VERIFIED)
                .source("population_heuristic", ConfidenceTier.ESTIMATED)
                .entry(MetricCatalog.REVENUE, "cost_report", 1)
                .entry(MetricCatalog.REVENUE, "claims_estimate", 2, 3.0)
                .entry(MetricCatalog.REVENUE, "population_heuristic", 3)
                .entry(MetricCatalog.PATIENT_VOLUME, "hrsa_uds", 1)
                .derivedRule(new DerivedEstimateRule(MetricCatalog.REVENUE, MetricCatalog.PATIENT_VOLUME,
                        "population_heuristic", Map.of(Segment.B, 300.0), 100.0))
                .build();
        aggregator = new MetricAggregator(priorities);
    }

    private static MetricValue value(String metric, String source, int rank, Double value, LinkMethod method,
                                     double confidence, String key) {
        return new MetricValue(ORG, metric, source, rank, value, "USD", "2023", method, confidence, key);
    }

    private static MetricValue revenue(String source, int rank, Double value) {
        return value(MetricCatalog.REVENUE, source, rank, value, LinkMethod.EXACT_ID, 1.0, source + "-1");
    }

    @Nested
    @DisplayName("Hierarchy of truth")
    class Hierarchy {

        @Test
        @DisplayName("The top-ranked source should win even when a lower rank reports a larger value")
        void testRankWins() {
            ResolvedMetric resolved = aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of(
                    revenue("claims_estimate", 2, 8_000_000.0),
                    revenue("cost_report", 1, 5_000_000.0)));

            assertEquals(5_000_000.0, resolved.value());
            assertEquals("cost_report", resolved.winningSource());
            assertEquals(ConfidenceTier.VERIFIED, resolved.confidenceTier());
            assertEquals(2, resolved.contenders().size());
            assertEquals("cost_report", resolved.contenders().get(0).sourceName());
            assertTrue(resolved.reason().contains("over 1 other candidate(s)"));
        }

        @Test
        @DisplayName("Null values should never win, even from the top-ranked source")
        void testNullNeverWins() {
            ResolvedMetric resolved = aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of(
                    revenue("cost_report", 1, null),
                    revenue("claims_estimate", 2, 1_000_000.0)));

            assertEquals("claims_estimate", resolved.winningSource());
            assertEquals(3_000_000.0, resolved.value(), 1e-6);
            assertEquals(ConfidenceTier.DERIVED, resolved.confidenceTier());
            assertTrue(resolved.reason().contains("x3.00"));
        }

        @Test
        @DisplayName("A legitimate zero should win over lower ranks")
        void testZeroIsAValue() {
            ResolvedMetric resolved = aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of(
                    revenue("cost_report", 1, 0.0),
                    revenue("claims_estimate", 2, 1_000_000.0)));

            assertTrue(resolved.isPresent());
            assertEquals(0.0, resolved.value());
        }

        @Test
        @DisplayName("No candidates or only nulls should resolve to missing")
        void testMissing() {
            assertTrue(aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of()).isMissing());

            ResolvedMetric onlyNulls = aggregator.resolve(ORG, MetricCatalog.REVENUE,
                    List.of(revenue("cost_report", 1, null)));
            assertTrue(onlyNulls.isMissing());
            assertNull(onlyNulls.value());
            assertNull(onlyNulls.winningSource());
            assertEquals(1, onlyNulls.contenders().size());
        }

        @Test
        @DisplayName("Within a rank exact links should beat fuzzy links")
        void testLinkMethodTieBreak() {
            ResolvedMetric resolved = aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of(
                    value(MetricCatalog.REVENUE, "cost_report", 1, 9.0, LinkMethod.FUZZY, 0.95, "a"),
                    value(MetricCatalog.REVENUE, "cost_report", 1, 7.0, LinkMethod.EXACT_ID, 1.0, "b")));

            assertEquals(7.0, resolved.value());
            assertEquals(LinkMethod.EXACT_ID, resolved.winningLinkMethod());
        }

        @Test
        @DisplayName("A fuzzy-linked value from a verified source should be downgraded to derived")
        void testFuzzyDowngrade() {
            ResolvedMetric resolved = aggregator.resolve(ORG, MetricCatalog.REVENUE, List.of(
                    value(MetricCatalog.REVENUE, "cost_report", 1, 9.0, LinkMethod.FUZZY, 0.93, "a")));

            assertEquals(ConfidenceTier.DERIVED, resolved.confidenceTier());
        }

        @Test
        @DisplayName("Resolution should not depend on candidate order")
        void testOrderIndependence() {
            List<MetricValue> candidates = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                candidates.add(value(MetricCatalog.REVENUE, i % 2 == 0 ? "cost_report" : "claims_estimate",
                        i % 2 == 0 ? 1 : 2, (double) (i * 1000), i % 3 == 0 ? LinkMethod.CROSSWALK : LinkMethod.EXACT_ID,
                        1.0, "k" + i));
            }
            ResolvedMetric expected = aggregator.resolve(ORG, MetricCatalog.REVENUE, candidates);

            Random random = new Random(7);
            for (int round = 0; round < 10; round++) {
                List<MetricValue> shuffled = new ArrayList<>(candidates);
                Collections.shuffle(shuffled, random);
                assertEquals(expected, aggregator.resolve(ORG, MetricCatalog.REVENUE, shuffled));
            }
        }
    }

    @Nested
    @DisplayName("Derived estimates")
    class Derived {

        @Test
        @DisplayName("Revenue should be estimated from patient volume with the segment rate")
        void testDerivedRevenue() {
            List<MetricValue> contributions = List.of(
                    value(MetricCatalog.PATIENT_VOLUME, "hrsa_uds", 1, 10_000.0, LinkMethod.EXACT_ID, 1.0, "u1"));

            Map<String, ResolvedMetric> fqhc = aggregator.resolveAll(ORG, Segment.B, contributions);
            Map<String, ResolvedMetric> other = aggregator.resolveAll(ORG, Segment.D, contributions);

            assertEquals(3_000_000.0, fqhc.get(MetricCatalog.REVENUE).value(), 1e-6);
            assertEquals(ConfidenceTier.ESTIMATED, fqhc.get(MetricCatalog.REVENUE).confidenceTier());
            assertEquals("population_heuristic", fqhc.get(MetricCatalog.REVENUE).winningSource());
            assertEquals(1_000_000.0, other.get(MetricCatalog.REVENUE).value(), 1e-6);
        }

        @Test
        @DisplayName("A reported revenue should outrank the estimate")
        void testReportedBeatsEstimate() {
            List<MetricValue> contributions = List.of(
                    value(MetricCatalog.PATIENT_VOLUME, "hrsa_uds", 1, 10_000.0, LinkMethod.EXACT_ID, 1.0, "u1"),
                    revenue("cost_report", 1, 4_000_000.0));

            ResolvedMetric revenue = aggregator.resolveAll(ORG, Segment.B, contributions).get(MetricCatalog.REVENUE);

            assertEquals(4_000_000.0, revenue.value());
            assertEquals(2, revenue.contenders().size());
        }

        @Test
        @DisplayName("Every catalog metric should be present in catalog order")
        void testCatalogCompleteness() {
            Map<String, ResolvedMetric> resolved = aggregator.resolveAll(ORG, null, List.of());

            assertEquals(MetricCatalog.ALL, List.copyOf(resolved.keySet()));
            assertTrue(resolved.values().stream().allMatch(ResolvedMetric::isMissing));
        }
    }

    @Nested
    @DisplayName("Contributions and configuration")
    class Contributions {

        @Test
        @DisplayName("A linked record should become a candidate carrying its rank and link")
        void testContribution() {
            MetricRecord record = MetricRecord.builder()
                    .sourceName("claims_estimate")
                    .recordKey("c-9")
                    .metricName(MetricCatalog.REVENUE)
                    .value(2_000_000.0)
                    .asOfPeriod("2023")
                    .build();

            MetricValue candidate = aggregator.contribution(record, LinkEdge.fuzzy(ORG, "claims_estimate", "c-9", 0.91))
                    .orElseThrow();

            assertEquals(2, candidate.sourcePriorityRank());
            assertEquals(LinkMethod.FUZZY, candidate.linkMethod());
            assertEquals(0.91, candidate.linkConfidence());
            assertEquals("c-9", candidate.sourceRecordKey());
        }

        @Test
        @DisplayName("Unranked sources should not contribute")
        void testUnrankedSource() {
            MetricRecord record = MetricRecord.builder()
                    .sourceName("hrsa_uds")
                    .recordKey("u-1")
                    .metricName(MetricCatalog.NET_MARGIN)
                    .value(0.05)
                    .build();

            assertTrue(aggregator.contribution(record, LinkEdge.exact(ORG, "hrsa_uds", "u-1")).isEmpty());
        }

        @Test
        @DisplayName("Invalid tables should be refused at build time")
        void testTableValidation() {
            assertThrows(ConfigurationException.class, () -> SourcePriorityTable.builder()
                    .version("v").entry(MetricCatalog.REVENUE, "undeclared", 1).build());
            assertThrows(ConfigurationException.class, () -> SourcePriorityTable.builder()
                    .version("v").source("a", ConfidenceTier.VERIFIED).entry("bogus_metric", "a", 1).build());
            assertThrows(ConfigurationException.class, () -> SourcePriorityTable.builder()
                    .version("v").source("a", ConfidenceTier.VERIFIED)
                    .entry(MetricCatalog.REVENUE, "a", 1).entry(MetricCatalog.REVENUE, "a", 2).build());
            assertThrows(IllegalArgumentException.class, () -> new PriorityEntry("a", 0, 1.0));
        }
    }
}
