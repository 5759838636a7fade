package com.provider.linkage.identity;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assigns the outreach segment from resolved metrics, NUCC taxonomy codes and name keywords.
 * Segments are mutually exclusive and checked in priority order B, A, C, D.
 */
public class SegmentClassifier {

    static final Set<String> FQHC_TAXONOMY_CODES = Set.of(
            "261QF0400X", // federally qualified health center
            "261QR1300X"  // rural health clinic
    );
    static final List<Pattern> SPECIALTY_TAXONOMY = List.of(
            Pattern.compile("^251G"), // home health agency
            Pattern.compile("^251E"), // home infusion
            Pattern.compile("^251F"), // hospice
            Pattern.compile("H0002X$"), // hospice and palliative medicine
            Pattern.compile("^2084"), // psychiatry and neurology
            Pattern.compile("^101Y"), // counselor
            Pattern.compile("^103T"), // psychologist
            Pattern.compile("^106H"), // marriage and family therapist
            Pattern.compile("^261QM"), // mental health clinic
            Pattern.compile("^261QS") // substance abuse clinic
    );
    static final List<Pattern> HOSPITAL_TAXONOMY = List.of(
            Pattern.compile("^282N"),
            Pattern.compile("^281P"),
            Pattern.compile("^283"),
            Pattern.compile("^208M00000X$") // hospitalist
    );

    static final List<String> FQHC_KEYWORDS = List.of(
            "fqhc", "federally qualified", "rural health clinic", "hrsa", "community health center");
    static final List<String> SPECIALTY_KEYWORDS = List.of(
            "behavioral health", "mental health", "substance abuse", "psychiatry", "psychiatric",
            "home health", "hospice", "palliative");
    static final List<String> HOSPITAL_KEYWORDS = List.of(
            "hospital", "health system", "medical center", "health network");

    static final double LARGE_PROVIDER_COUNT = 100;
    static final double LARGE_SITE_COUNT = 10;

    private static final int NUCC_CODE_LENGTH = 10;

    /**
     * Classifies one organization.
     *
     * @param organization the organization
     * @param metrics      its resolved metrics by name; absent or missing metrics count as unknown
     */
    public Segment classify(Organization organization, Map<String, ResolvedMetric> metrics) {
        List<String> codes = taxonomyCodes(organization.getTaxonomyCode());
        String name = organization.getNormalizedName().toLowerCase(Locale.ROOT);

        if (flagSet(metrics, MetricCatalog.FQHC_FLAG)
                || codes.stream().anyMatch(FQHC_TAXONOMY_CODES::contains)
                || containsAny(name, FQHC_KEYWORDS)) {
            return Segment.B;
        }
        if (matchesAny(codes, SPECIALTY_TAXONOMY) || containsAny(name, SPECIALTY_KEYWORDS)) {
            return Segment.A;
        }
        if (atLeast(metrics, MetricCatalog.PROVIDER_COUNT, LARGE_PROVIDER_COUNT)
                || atLeast(metrics, MetricCatalog.SITE_COUNT, LARGE_SITE_COUNT)
                || matchesAny(codes, HOSPITAL_TAXONOMY)
                || containsAny(name, HOSPITAL_KEYWORDS)) {
            return Segment.C;
        }
        return Segment.D;
    }

    /**
     * Splits a semicolon-separated taxonomy field, keeping only well-formed 10-character codes.
     */
    static List<String> taxonomyCodes(String field) {
        List<String> codes = new ArrayList<>();
        if (field == null || field.isBlank()) {
            return codes;
        }
        for (String part : field.split(";")) {
            String code = part.trim().toUpperCase(Locale.ROOT);
            if (code.length() == NUCC_CODE_LENGTH) {
                codes.add(code);
            }
        }
        return codes;
    }

    private static boolean flagSet(Map<String, ResolvedMetric> metrics, String metric) {
        ResolvedMetric resolved = metrics.get(metric);
        return resolved != null && resolved.isFlagSet();
    }

    private static boolean atLeast(Map<String, ResolvedMetric> metrics, String metric, double minimum) {
        ResolvedMetric resolved = metrics.get(metric);
        return resolved != null && resolved.value() != null && resolved.value() >= minimum;
    }

    private static boolean matchesAny(List<String> codes, List<Pattern> patterns) {
        for (String code : codes) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(code).find()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
