package com.provider.linkage.pipeline;

import com.provider.linkage.audit.AuditEntry;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.ScoreRecord;
import com.provider.linkage.network.NetworkGrouping;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Output of a completed run. Every organization is sealed; every collection is sorted.
 *
 * @param runId          run id
 * @param rulesetVersion version of the scoring rules used
 * @param organizations  organizations sorted by id
 * @param metrics        resolved metrics per organization, in catalog order
 * @param scores         score per organization
 * @param networks       materialized networks and memberships
 * @param links          link edges sorted by organization, source, record key and method
 * @param audit          merged audit entries in report order
 * @param report         summary counts
 */
public record PipelineResult(
        String runId,
        String rulesetVersion,
        List<Organization> organizations,
        Map<String, Map<String, ResolvedMetric>> metrics,
        Map<String, ScoreRecord> scores,
        NetworkGrouping networks,
        List<LinkEdge> links,
        List<AuditEntry> audit,
        PipelineReport report
) {
    public PipelineResult {
        organizations = List.copyOf(organizations);
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
        scores = Collections.unmodifiableMap(new TreeMap<>(scores));
        links = List.copyOf(links);
        audit = List.copyOf(audit);
    }

    public Optional<Organization> organization(String orgId) {
        return organizations.stream().filter(o -> o.getOrgId().equals(orgId)).findFirst();
    }

    public Optional<ScoreRecord> score(String orgId) {
        return Optional.ofNullable(scores.get(orgId));
    }

    public Map<String, ResolvedMetric> metricsFor(String orgId) {
        Map<String, ResolvedMetric> resolved = metrics.get(orgId);
        return resolved != null ? resolved : Map.of();
    }
}
