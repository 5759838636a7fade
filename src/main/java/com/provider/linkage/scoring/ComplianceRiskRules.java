package com.provider.linkage.scoring;

import com.provider.linkage.core.model.Segment;

import java.util.List;

/**
 * Parameters of the compliance-risk category.
 *
 * @param ceiling                category maximum
 * @param oigExclusionPoints     awarded outright when an exclusion is on record
 * @param fqhcPoints             FQHC designation
 * @param acoPoints              ACO participation
 * @param segmentPoints          points for organizations in {@code specialtySegments}
 * @param specialtySegments      segments carrying elevated documentation risk
 * @param baselinePoints         awarded when flags are known but all negative
 */
public record ComplianceRiskRules(
        double ceiling,
        double oigExclusionPoints,
        double fqhcPoints,
        double acoPoints,
        double segmentPoints,
        List<Segment> specialtySegments,
        double baselinePoints
) {
    public ComplianceRiskRules {
        specialtySegments = specialtySegments != null ? List.copyOf(specialtySegments) : List.of();
        if (ceiling <= 0) {
            throw new IllegalArgumentException("compliance_risk ceiling must be positive");
        }
    }
}
