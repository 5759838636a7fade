package com.provider.linkage.pipeline;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.audit.AuditEntry;
import com.provider.linkage.config.ConfigLoader;
import com.provider.linkage.config.LinkageConfig;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.Network;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;
import com.provider.linkage.core.model.SourceRecordRef;
import com.provider.linkage.identity.OrgIdGenerator;
import com.provider.linkage.metrics.PipelineMetrics;
import com.provider.linkage.scoring.ScoringEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.provider.linkage.pipeline.PipelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkagePipelineTest {

    private static LinkageConfig config;
    private static PipelineResult result;

    @Mock
    private PipelineMetrics metrics;

    @BeforeAll
    static void runPipeline() {
        config = new ConfigLoader().loadDefaults();
        result = run(4);
    }

    private static PipelineResult run(int parallelism) {
        PipelineOptions options = PipelineOptions.from(config.pipeline()).parallelism(parallelism).build();
        return new LinkagePipeline(config, options).run(PipelineFixtures.input());
    }

    private static long audited(AuditAction action) {
        return result.audit().stream().filter(e -> e.action() == action).count();
    }

    @Nested
    @DisplayName("Identity")
    class Identity {

        @Test
        @DisplayName("Should build one organization per identifier plus name-keyed organizations")
        void testOrganizations() {
            List<String> ids = result.organizations().stream().map(Organization::getOrgId).toList();

            assertEquals(7, ids.size());
            assertTrue(ids.containsAll(List.of(SUNRISE, VALLEY_TX, VALLEY_OK, LAKESIDE,
                    "org_6666666666", "org_7777777777")));
            assertTrue(ids.contains(OrgIdGenerator.forNameAndState("prairie wellness", "KS")));
            assertFalse(ids.contains("org_5555555555"));
            assertEquals(1, result.report().nameKeyedOrganizations());
        }

        @Test
        @DisplayName("First-seen record should win and the collision should be audited")
        void testCollision() {
            Organization sunrise = result.organization(SUNRISE).orElseThrow();

            assertEquals("TX", sunrise.getStateCode());
            assertEquals(1, result.report().collisions());
            assertTrue(sunrise.getLinkedRecords().contains(new SourceRecordRef("nppes", "n5")));
        }

        @Test
        @DisplayName("Parked registry records should attach by name, and ties should be audited, not guessed")
        void testParkedRecords() {
            Organization sunrise = result.organization(SUNRISE).orElseThrow();

            assertTrue(sunrise.getLinkedRecords().contains(new SourceRecordRef("nppes", "n7")));
            AuditEntry tie = result.audit().stream()
                    .filter(e -> e.action() == AuditAction.AMBIGUOUS_LINK)
                    .findFirst()
                    .orElseThrow();
            assertEquals("n11", tie.recordKey());
            assertTrue(result.organizations().stream()
                    .noneMatch(o -> o.getLinkedRecords().contains(new SourceRecordRef("nppes", "n11"))));
        }

        @Test
        @DisplayName("Organizations should be sealed once the run completes")
        void testSealed() {
            assertTrue(result.organizations().stream().allMatch(Organization::isSealed));
        }

        @Test
        @DisplayName("Segments should come from taxonomy and names")
        void testSegments() {
            assertEquals(Segment.B, result.organization(SUNRISE).orElseThrow().getSegment());
            assertEquals(Segment.A, result.organization(LAKESIDE).orElseThrow().getSegment());
        }
    }

    @Nested
    @DisplayName("Linking and aggregation")
    class Linking {

        @Test
        @DisplayName("Links should be counted by method")
        void testLinkCounts() {
            assertEquals(2, result.report().links(LinkMethod.EXACT_ID));
            assertEquals(2, result.report().links(LinkMethod.CROSSWALK));
            assertEquals(2, result.report().links(LinkMethod.FUZZY));
            assertTrue(result.links().stream()
                    .filter(e -> e.linkMethod() == LinkMethod.FUZZY)
                    .allMatch(e -> e.confidence() >= 0.88 && e.confidence() <= 1.0));
        }

        @Test
        @DisplayName("Authoritative revenue should beat the larger estimate")
        void testHierarchyOfTruth() {
            ResolvedMetric revenue = result.metricsFor(SUNRISE).get("revenue");

            assertEquals(5_000_000.0, revenue.value());
            assertEquals("cost_report", revenue.winningSource());
            assertEquals(ConfidenceTier.VERIFIED, revenue.confidenceTier());
        }

        @Test
        @DisplayName("A one-to-many crosswalk key should feed every mapped organization")
        void testCrosswalkFanOut() {
            for (String orgId : List.of(VALLEY_TX, VALLEY_OK)) {
                ResolvedMetric revenue = result.metricsFor(orgId).get("revenue");
                assertEquals(2_000_000.0, revenue.value());
                assertEquals(LinkMethod.CROSSWALK, revenue.winningLinkMethod());
            }
        }

        @Test
        @DisplayName("A fuzzy-linked value from a verified source should be downgraded")
        void testFuzzyMetric() {
            ResolvedMetric volume = result.metricsFor(SUNRISE).get("patient_volume");

            assertEquals(20_000.0, volume.value());
            assertEquals(LinkMethod.FUZZY, volume.winningLinkMethod());
            assertEquals(ConfidenceTier.DERIVED, volume.confidenceTier());
        }

        @Test
        @DisplayName("Records that cannot be linked should be audited with a reason")
        void testUnlinked() {
            assertEquals(2, audited(AuditAction.UNLINKED));
            assertEquals(1, audited(AuditAction.DISCARDED_INDIVIDUAL));
            assertEquals(1, audited(AuditAction.REJECTED_MALFORMED));
            assertEquals(1, audited(AuditAction.CREATED_FROM_NAME));
            assertEquals(0, audited(AuditAction.UNRANKED_CONTRIBUTION));
            assertTrue(result.audit().stream()
                    .filter(e -> e.action() == AuditAction.UNLINKED)
                    .allMatch(e -> !e.detail().isEmpty()));
        }

        @Test
        @DisplayName("A linked value from a source without a rank for its metric should be audited, not used")
        void testUnrankedContribution() {
            PipelineResult unranked = new LinkagePipeline(config).run(PipelineFixtures.inputWithUnrankedRevenue());

            List<AuditEntry> entries = unranked.audit().stream()
                    .filter(e -> e.action() == AuditAction.UNRANKED_CONTRIBUTION)
                    .toList();
            assertEquals(1, entries.size());
            AuditEntry entry = entries.get(0);
            assertEquals("pecos", entry.sourceName());
            assertEquals("p9", entry.recordKey());
            assertEquals(SUNRISE, entry.orgId());
            assertTrue(entry.detail().contains("revenue"));
            assertEquals(1, unranked.report().count(AuditAction.UNRANKED_CONTRIBUTION));
            assertTrue(unranked.report().summary().contains("unranked values:      1"));

            assertTrue(unranked.links().stream()
                    .anyMatch(e -> e.sourceName().equals("pecos") && e.sourceRecordKey().equals("p9")));
            ResolvedMetric revenue = unranked.metricsFor(SUNRISE).get("revenue");
            assertEquals(5_000_000.0, revenue.value());
            assertEquals("cost_report", revenue.winningSource());
        }

        @Test
        @DisplayName("Every linked edge should point at an existing organization")
        void testEdgesResolve() {
            for (LinkEdge edge : result.links()) {
                assertTrue(result.organization(edge.orgId()).isPresent(), edge.toString());
            }
        }
    }

    @Nested
    @DisplayName("Scoring and networks")
    class ScoringAndNetworks {

        @Test
        @DisplayName("Every organization should be scored with a complete bibliography")
        void testScores() {
            assertEquals(result.organizations().size(), result.scores().size());
            result.scores().values().forEach(score -> {
                assertEquals(config.scoring().version(), score.rulesetVersion());
                assertTrue(score.totalScore() >= 0.0 && score.totalScore() <= 100.0);
                for (String category : ScoringEngine.CATEGORIES) {
                    assertFalse(score.entriesFor(category).isEmpty());
                }
            });
        }

        @Test
        @DisplayName("Siblings across two states should form a network")
        void testNetwork() {
            assertEquals(1, result.networks().networks().size());
            Network network = result.networks().networks().get(0);

            assertEquals(List.of(VALLEY_TX, VALLEY_OK), network.memberOrgIds());
            assertEquals(List.of("OK", "TX"), network.stateSet());
            assertTrue(result.networks().assignmentFor(VALLEY_OK).isPresent());
            assertTrue(result.networks().assignmentFor("org_6666666666").isEmpty());
        }
    }

    @Test
    @DisplayName("Output should be identical whatever the parallelism")
    void testDeterminism() {
        PipelineResult sequential = run(1);
        PipelineResult parallel = run(8);

        assertEquals(sequential.scores(), parallel.scores());
        assertEquals(sequential.metrics(), parallel.metrics());
        assertEquals(sequential.links(), parallel.links());
        assertEquals(sequential.audit(), parallel.audit());
        assertEquals(sequential.networks(), parallel.networks());
        assertEquals(ids(sequential), ids(parallel));
        assertNotEquals(sequential.runId(), parallel.runId());
    }

    @Test
    @DisplayName("Run metrics should be published through the metrics seam")
    void testMetricsPublished() {
        PipelineOptions options = PipelineOptions.from(config.pipeline()).metrics(metrics).build();

        new LinkagePipeline(config, options).run(PipelineFixtures.input());

        verify(metrics).incrementOrganizationsCreated(7);
        verify(metrics, times(2)).incrementLinks(LinkMethod.FUZZY);
        verify(metrics, times(2)).recordFuzzyConfidence(anyDouble());
        verify(metrics).incrementCollisions();
        verify(metrics, times(2)).incrementRejected(AuditAction.UNLINKED);
        verify(metrics).recordNetworks(1);
        verify(metrics, atLeast(10)).recordStageDuration(anyString(), any());
    }

    @Test
    @DisplayName("Empty input should produce an empty, valid result")
    void testEmptyInput() {
        PipelineResult empty = new LinkagePipeline(config).run(PipelineInput.builder().build());

        assertTrue(empty.organizations().isEmpty());
        assertTrue(empty.networks().networks().isEmpty());
        assertEquals(0, empty.report().rejected());
    }

    private static Map<String, List<SourceRecordRef>> ids(PipelineResult r) {
        return r.organizations().stream().collect(Collectors.toMap(
                Organization::getOrgId, o -> List.copyOf(o.getLinkedRecords()), (a, b) -> a, TreeMap::new));
    }
}
