package com.provider.linkage.aggregate;

import java.util.List;
import java.util.Set;

/**
 * Names of the metrics the pipeline resolves and scores. Priority tables and scoring rules may
 * only refer to these.
 */
public final class MetricCatalog {

    public static final String REVENUE = "revenue";
    public static final String PATIENT_VOLUME = "patient_volume";
    public static final String NET_MARGIN = "net_margin";
    public static final String UNDERCODING_RATIO = "undercoding_ratio";
    public static final String PROVIDER_COUNT = "provider_count";
    public static final String SITE_COUNT = "site_count";
    public static final String FQHC_FLAG = "fqhc_flag";
    public static final String ACO_MEMBER = "aco_member";
    public static final String OIG_EXCLUSION_FLAG = "oig_exclusion_flag";
    public static final String SHORTAGE_AREA_FLAG = "shortage_area_flag";
    public static final String MIPS_SCORE = "mips_score";
    public static final String PSYCH_RISK_RATIO = "psych_risk_ratio";

    /**
     * Every metric, in resolution order.
     */
    public static final List<String> ALL = List.of(
            REVENUE, PATIENT_VOLUME, NET_MARGIN, UNDERCODING_RATIO, PROVIDER_COUNT, SITE_COUNT,
            FQHC_FLAG, ACO_MEMBER, OIG_EXCLUSION_FLAG, SHORTAGE_AREA_FLAG, MIPS_SCORE, PSYCH_RISK_RATIO);

    private static final Set<String> NAMES = Set.copyOf(ALL);

    private MetricCatalog() {
    }

    public static boolean isKnown(String metricName) {
        return metricName != null && NAMES.contains(metricName);
    }
}
