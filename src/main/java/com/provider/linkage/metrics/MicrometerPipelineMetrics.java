package com.provider.linkage.metrics;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.core.model.LinkMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.organizations.created} Counter</li>
 *   <li>{@code linkage.links} Counter (tag: method)</li>
 *   <li>{@code linkage.records.rejected} Counter (tag: kind)</li>
 *   <li>{@code linkage.identifier.collisions} Counter</li>
 *   <li>{@code linkage.fuzzy.confidence} DistributionSummary</li>
 *   <li>{@code linkage.stage.duration} Timer (tag: stage)</li>
 *   <li>{@code linkage.networks} Counter</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter organizationsCreated;
    private final Counter collisions;
    private final Counter networks;
    private final DistributionSummary fuzzyConfidence;

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.organizationsCreated = Counter.builder("linkage.organizations.created")
                .description("Organizations added to the spine")
                .register(registry);
        this.collisions = Counter.builder("linkage.identifier.collisions")
                .description("Primary identifiers seen with conflicting attributes")
                .register(registry);
        this.networks = Counter.builder("linkage.networks")
                .description("Networks materialized")
                .register(registry);
        this.fuzzyConfidence = DistributionSummary.builder("linkage.fuzzy.confidence")
                .description("Similarity of accepted fuzzy links")
                .register(registry);
    }

    @Override
    public void incrementOrganizationsCreated(int count) {
        organizationsCreated.increment(count);
    }

    @Override
    public void incrementLinks(LinkMethod method) {
        counterCache.computeIfAbsent("links:" + method.name(), k ->
                Counter.builder("linkage.links")
                        .description("Records linked to an organization")
                        .tag("method", method.getCode())
                        .register(registry)).increment();
    }

    @Override
    public void incrementRejected(AuditAction kind) {
        counterCache.computeIfAbsent("rejected:" + kind.name(), k ->
                Counter.builder("linkage.records.rejected")
                        .description("Records not attached to any organization")
                        .tag("kind", kind.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementCollisions() {
        collisions.increment();
    }

    @Override
    public void recordFuzzyConfidence(double confidence) {
        fuzzyConfidence.record(confidence);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        timerCache.computeIfAbsent(stage, k ->
                Timer.builder("linkage.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .register(registry)).record(duration);
    }

    @Override
    public void recordNetworks(int count) {
        networks.increment(count);
    }
}
