package com.provider.linkage.identity;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SegmentClassifierTest {

    private final SegmentClassifier classifier = new SegmentClassifier();

    private static Organization org(String normalizedName, String taxonomy) {
        return Organization.builder()
                .orgId("org_1")
                .legalName(normalizedName)
                .normalizedName(normalizedName)
                .stateCode("TX")
                .taxonomyCode(taxonomy)
                .build();
    }

    private static ResolvedMetric metric(String name, double value) {
        return new ResolvedMetric("org_1", name, value, "hrsa_uds", ConfidenceTier.VERIFIED, LinkMethod.EXACT_ID,
                "test", List.of());
    }

    @ParameterizedTest(name = "{0} / {1} -> {2}")
    @CsvSource({
            "sunrise clinic, 261QF0400X, B",
            "valley rural health clinic, , B",
            "lakeside behavioral health, , A",
            "sunrise clinic, 251G00000X, A",
            "sunrise clinic, 2084P0800X, A",
            "st mary hospital, , C",
            "sunrise clinic, 282N00000X, C",
            "sunrise clinic, 207Q00000X, D",
            "sunrise clinic, , D"
    })
    @DisplayName("Should classify from taxonomy and name keywords")
    void testClassifyFromTaxonomyAndName(String name, String taxonomy, Segment expected) {
        assertEquals(expected, classifier.classify(org(name, taxonomy), Map.of()));
    }

    @Test
    @DisplayName("FQHC flag should take priority over specialty and size signals")
    void testFqhcPriority() {
        Map<String, ResolvedMetric> metrics = Map.of(
                MetricCatalog.FQHC_FLAG, metric(MetricCatalog.FQHC_FLAG, 1),
                MetricCatalog.PROVIDER_COUNT, metric(MetricCatalog.PROVIDER_COUNT, 500));

        assertEquals(Segment.B, classifier.classify(org("lakeside behavioral health", null), metrics));
    }

    @Test
    @DisplayName("Large provider or site counts should make an organization enterprise")
    void testSizeSignals() {
        assertEquals(Segment.C, classifier.classify(org("sunrise clinic", null),
                Map.of(MetricCatalog.PROVIDER_COUNT, metric(MetricCatalog.PROVIDER_COUNT, 100))));
        assertEquals(Segment.C, classifier.classify(org("sunrise clinic", null),
                Map.of(MetricCatalog.SITE_COUNT, metric(MetricCatalog.SITE_COUNT, 12))));
        assertEquals(Segment.D, classifier.classify(org("sunrise clinic", null),
                Map.of(MetricCatalog.PROVIDER_COUNT, metric(MetricCatalog.PROVIDER_COUNT, 99))));
    }

    @Test
    @DisplayName("Missing and zero flags should count as unknown")
    void testMissingFlag() {
        Map<String, ResolvedMetric> metrics = Map.of(
                MetricCatalog.FQHC_FLAG, metric(MetricCatalog.FQHC_FLAG, 0),
                MetricCatalog.SITE_COUNT, ResolvedMetric.missing("org_1", MetricCatalog.SITE_COUNT, List.of()));

        assertEquals(Segment.D, classifier.classify(org("sunrise clinic", null), metrics));
    }

    @Test
    @DisplayName("Taxonomy field should split on semicolons and drop malformed codes")
    void testTaxonomyCodes() {
        assertEquals(List.of("261QF0400X", "207Q00000X"),
                SegmentClassifier.taxonomyCodes(" 261qf0400x ; 207Q00000X;bad;;"));
        assertTrue(SegmentClassifier.taxonomyCodes(null).isEmpty());
        assertTrue(SegmentClassifier.taxonomyCodes("  ").isEmpty());
    }
}
