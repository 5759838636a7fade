package com.provider.linkage.core.model;

import java.util.Locale;

/**
 * Confidence of a resolved metric, taken from the winning source's declared tier.
 */
public enum ConfidenceTier {
    VERIFIED,
    DERIVED,
    ESTIMATED,
    MISSING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Tier for a value attached by fuzzy matching. Fuzzy links never yield verified data.
     */
    public ConfidenceTier forLinkMethod(LinkMethod method) {
        if (method == LinkMethod.FUZZY && this == VERIFIED) {
            return DERIVED;
        }
        return this;
    }

    public static ConfidenceTier fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("confidence tier is required");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
