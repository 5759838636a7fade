package com.provider.linkage.pipeline;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.core.model.LinkMethod;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Summary counts of a run.
 *
 * @param runId                run id
 * @param organizations        organizations in the final spine
 * @param nameKeyedOrganizations organizations created from parked records without a registry match
 * @param linksByMethod        metric and identity links by method
 * @param auditByAction        audit entries by action, rejections included
 * @param networks             networks materialized
 * @param stageDurations       wall time per stage, in execution order
 */
public record PipelineReport(
        String runId,
        int organizations,
        int nameKeyedOrganizations,
        Map<LinkMethod, Long> linksByMethod,
        Map<AuditAction, Long> auditByAction,
        int networks,
        Map<String, Duration> stageDurations
) {
    public PipelineReport {
        linksByMethod = Collections.unmodifiableMap(filled(LinkMethod.class, linksByMethod));
        auditByAction = Collections.unmodifiableMap(filled(AuditAction.class, auditByAction));
        stageDurations = Collections.unmodifiableMap(new LinkedHashMap<>(stageDurations));
    }

    public long links(LinkMethod method) {
        return linksByMethod.get(method);
    }

    public long count(AuditAction action) {
        return auditByAction.get(action);
    }

    public long collisions() {
        return count(AuditAction.IDENTIFIER_COLLISION);
    }

    public long rejected() {
        return auditByAction.entrySet().stream()
                .filter(e -> e.getKey().isRejection())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    /**
     * Multi-line summary printed at the end of a CLI run.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(runId).append('\n');
        sb.append("  organizations:        ").append(organizations)
                .append(" (").append(nameKeyedOrganizations).append(" name-keyed)\n");
        sb.append("  links:               ");
        for (Map.Entry<LinkMethod, Long> entry : linksByMethod.entrySet()) {
            sb.append(' ').append(entry.getKey().getCode()).append('=').append(entry.getValue());
        }
        sb.append('\n');
        sb.append("  rejected:             ").append(rejected()).append(" (");
        boolean first = true;
        for (Map.Entry<AuditAction, Long> entry : auditByAction.entrySet()) {
            if (!entry.getKey().isRejection()) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey().name().toLowerCase(Locale.ROOT)).append('=').append(entry.getValue());
            first = false;
        }
        sb.append(")\n");
        sb.append("  collisions:           ").append(collisions()).append('\n');
        sb.append("  individuals skipped:  ").append(count(AuditAction.DISCARDED_INDIVIDUAL)).append('\n');
        sb.append("  unranked values:      ").append(count(AuditAction.UNRANKED_CONTRIBUTION)).append('\n');
        sb.append("  networks:             ").append(networks).append('\n');
        return sb.toString();
    }

    private static <E extends Enum<E>> EnumMap<E, Long> filled(Class<E> type, Map<E, Long> counts) {
        EnumMap<E, Long> result = new EnumMap<>(type);
        for (E constant : type.getEnumConstants()) {
            Long count = counts != null ? counts.get(constant) : null;
            result.put(constant, count != null ? count : 0L);
        }
        return result;
    }
}
