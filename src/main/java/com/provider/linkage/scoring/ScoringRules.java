package com.provider.linkage.scoring;

import java.util.List;
import java.util.Objects;

/**
 * Versioned scoring ruleset, read from {@code scoring.json}.
 *
 * @param version        ruleset version stamped on every score record
 * @param globalMaximum  cap on the total score
 * @param tiers          tier boundaries
 * @param economicPain   economic-pain parameters
 * @param strategicFit   strategic-fit parameters
 * @param strategicValue strategic-value parameters
 * @param complianceRisk compliance-risk parameters
 */
public record ScoringRules(
        String version,
        double globalMaximum,
        List<TierRule> tiers,
        EconomicPainRules economicPain,
        StrategicFitRules strategicFit,
        StrategicValueRules strategicValue,
        ComplianceRiskRules complianceRisk
) {
    public ScoringRules {
        Objects.requireNonNull(economicPain, "economicPain is required");
        Objects.requireNonNull(strategicFit, "strategicFit is required");
        Objects.requireNonNull(strategicValue, "strategicValue is required");
        Objects.requireNonNull(complianceRisk, "complianceRisk is required");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Scoring ruleset version is required");
        }
        if (globalMaximum <= 0) {
            throw new IllegalArgumentException("globalMaximum must be positive");
        }
        tiers = tiers != null ? List.copyOf(tiers) : List.of();
    }

    public TierTable tierTable() {
        return new TierTable(tiers);
    }
}
