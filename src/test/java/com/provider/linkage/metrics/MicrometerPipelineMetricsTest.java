package com.provider.linkage.metrics;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.core.model.LinkMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineMetrics Tests")
class MicrometerPipelineMetricsTest {

    @Nested
    @DisplayName("NoOpPipelineMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            PipelineMetrics noOp = NoOpPipelineMetrics.INSTANCE;

            assertDoesNotThrow(() -> {
                noOp.incrementOrganizationsCreated(10);
                noOp.incrementLinks(LinkMethod.FUZZY);
                noOp.incrementRejected(AuditAction.UNLINKED);
                noOp.incrementCollisions();
                noOp.recordFuzzyConfidence(0.93);
                noOp.recordStageDuration("spine", Duration.ofMillis(5));
                noOp.recordNetworks(2);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPipelineMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerPipelineMetrics metrics = new MicrometerPipelineMetrics(registry);

        @Test
        @DisplayName("Should count links by method code")
        void incrementLinks() {
            metrics.incrementLinks(LinkMethod.EXACT_ID);
            metrics.incrementLinks(LinkMethod.EXACT_ID);
            metrics.incrementLinks(LinkMethod.FUZZY);

            Counter exact = registry.find("linkage.links").tag("method", LinkMethod.EXACT_ID.getCode()).counter();
            Counter fuzzy = registry.find("linkage.links").tag("method", LinkMethod.FUZZY.getCode()).counter();

            assertNotNull(exact);
            assertEquals(2.0, exact.count());
            assertNotNull(fuzzy);
            assertEquals(1.0, fuzzy.count());
        }

        @Test
        @DisplayName("Should count rejections by kind")
        void incrementRejected() {
            metrics.incrementRejected(AuditAction.UNLINKED);
            metrics.incrementRejected(AuditAction.AMBIGUOUS_LINK);
            metrics.incrementRejected(AuditAction.UNLINKED);

            Counter unlinked = registry.find("linkage.records.rejected").tag("kind", "UNLINKED").counter();

            assertNotNull(unlinked);
            assertEquals(2.0, unlinked.count());
        }

        @Test
        @DisplayName("Should add organization and network counts")
        void counts() {
            metrics.incrementOrganizationsCreated(120);
            metrics.incrementOrganizationsCreated(5);
            metrics.recordNetworks(3);
            metrics.incrementCollisions();

            assertEquals(125.0, registry.find("linkage.organizations.created").counter().count());
            assertEquals(3.0, registry.find("linkage.networks").counter().count());
            assertEquals(1.0, registry.find("linkage.identifier.collisions").counter().count());
        }

        @Test
        @DisplayName("Should record fuzzy confidence as a distribution")
        void recordFuzzyConfidence() {
            metrics.recordFuzzyConfidence(0.9);
            metrics.recordFuzzyConfidence(1.0);

            DistributionSummary summary = registry.find("linkage.fuzzy.confidence").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.9, summary.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should time each stage separately")
        void recordStageDuration() {
            metrics.recordStageDuration("spine", Duration.ofMillis(40));
            metrics.recordStageDuration("spine", Duration.ofMillis(60));
            metrics.recordStageDuration("score", Duration.ofMillis(10));

            Timer spine = registry.find("linkage.stage.duration").tag("stage", "spine").timer();
            Timer score = registry.find("linkage.stage.duration").tag("stage", "score").timer();

            assertNotNull(spine);
            assertEquals(2, spine.count());
            assertNotNull(score);
            assertEquals(1, score.count());
        }
    }
}
