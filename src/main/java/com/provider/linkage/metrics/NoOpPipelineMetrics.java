package com.provider.linkage.metrics;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.core.model.LinkMethod;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    public static final NoOpPipelineMetrics INSTANCE = new NoOpPipelineMetrics();

    @Override
    public void incrementOrganizationsCreated(int count) {
    }

    @Override
    public void incrementLinks(LinkMethod method) {
    }

    @Override
    public void incrementRejected(AuditAction kind) {
    }

    @Override
    public void incrementCollisions() {
    }

    @Override
    public void recordFuzzyConfidence(double confidence) {
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void recordNetworks(int count) {
    }
}
