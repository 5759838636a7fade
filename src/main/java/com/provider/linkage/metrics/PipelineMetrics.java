package com.provider.linkage.metrics;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.core.model.LinkMethod;

import java.time.Duration;

/**
 * Counters and timers of a linkage run.
 * The default {@link NoOpPipelineMetrics} records nothing, so no registry is needed to run.
 */
public interface PipelineMetrics {

    void incrementOrganizationsCreated(int count);

    void incrementLinks(LinkMethod method);

    void incrementRejected(AuditAction kind);

    void incrementCollisions();

    void recordFuzzyConfidence(double confidence);

    void recordStageDuration(String stage, Duration duration);

    void recordNetworks(int count);
}
