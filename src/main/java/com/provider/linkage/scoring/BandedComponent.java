package com.provider.linkage.scoring;

/**
 * Scores a value against a {@link BandRule}: the band supplies a discrete base, the position
 * inside the band a continuous modifier, so organizations in the same band still differ.
 */
final class BandedComponent {

    private BandedComponent() {
    }

    /**
     * @param band       zero-based band index
     * @param percentile fraction of the corpus at or below the value
     * @param points     points awarded
     */
    record BandScore(int band, double percentile, double points) {
    }

    static BandScore score(BandRule rule, PercentileTable table, String metric, double value) {
        int boundaryCount = rule.boundaries().size();
        double[] cuts = new double[boundaryCount + 2];
        cuts[0] = table.min(metric);
        for (int i = 0; i < boundaryCount; i++) {
            cuts[i + 1] = table.valueAt(metric, rule.boundaries().get(i));
        }
        cuts[boundaryCount + 1] = table.max(metric);

        int band = 0;
        for (int i = 1; i <= boundaryCount; i++) {
            if (value >= cuts[i]) {
                band = i;
            }
        }
        double lower = cuts[band];
        double upper = cuts[band + 1];
        double fraction = upper > lower ? clamp((value - lower) / (upper - lower)) : 0.0;

        double floor = rule.floors().get(band);
        double top = band + 1 < rule.bandCount() ? rule.floors().get(band + 1) : rule.max();
        double points = floor + (top - floor) * fraction;
        return new BandScore(band, table.rankOf(metric, value), points);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
