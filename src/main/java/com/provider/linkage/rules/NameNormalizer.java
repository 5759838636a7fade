package com.provider.linkage.rules;

import java.util.regex.Pattern;

/**
 * Canonicalizes names, phone numbers and postal codes into keys usable for exact and fuzzy
 * matching. All operations are idempotent.
 */
public class NameNormalizer {
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final NormalizationEngine engine;

    public NameNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public NameNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Lowercases, strips trailing legal-entity suffixes, removes punctuation except internal
     * hyphens and collapses whitespace.
     */
    public String normalizeName(String raw) {
        return engine.normalize(raw);
    }

    /**
     * Digits only; a leading country code 1 on an 11-digit number is dropped.
     * Returns the empty string when the input has no digits.
     */
    public String normalizePhone(String raw) {
        if (raw == null) {
            return "";
        }
        String digits = NON_DIGITS.matcher(raw).replaceAll("");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return digits.substring(1);
        }
        return digits;
    }

    /**
     * First five digits of a postal code; the +4 extension is dropped for matching.
     * Returns the empty string when fewer than five digits are present.
     */
    public String normalizeZip(String raw) {
        if (raw == null) {
            return "";
        }
        String digits = NON_DIGITS.matcher(raw).replaceAll("");
        return digits.length() >= 5 ? digits.substring(0, 5) : "";
    }

    public NormalizationEngine getEngine() {
        return engine;
    }
}
