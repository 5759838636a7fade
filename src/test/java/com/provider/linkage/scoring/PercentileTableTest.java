package com.provider.linkage.scoring;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.ResolvedMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PercentileTableTest {

    private static final String METRIC = MetricCatalog.PATIENT_VOLUME;

    @Test
    @DisplayName("Should interpolate linearly between sorted corpus values")
    void testValueAt() {
        PercentileTable table = PercentileTable.of(Map.of(METRIC, List.of(40.0, 10.0, 30.0, 20.0)));

        assertEquals(10.0, table.valueAt(METRIC, 0.0));
        assertEquals(40.0, table.valueAt(METRIC, 1.0));
        assertEquals(25.0, table.valueAt(METRIC, 0.5), 1e-9);
        assertEquals(10.0, table.min(METRIC));
        assertEquals(40.0, table.max(METRIC));
    }

    @Test
    @DisplayName("Rank should be the share of corpus values at or below the value")
    void testRankOf() {
        PercentileTable table = PercentileTable.of(Map.of(METRIC, List.of(10.0, 20.0, 20.0, 40.0)));

        assertEquals(0.0, table.rankOf(METRIC, 5.0));
        assertEquals(0.75, table.rankOf(METRIC, 20.0));
        assertEquals(1.0, table.rankOf(METRIC, 40.0));
    }

    @Test
    @DisplayName("Missing metrics should be left out of the corpus")
    void testComputeSkipsMissing() {
        ResolvedMetric present = new ResolvedMetric("org_1", METRIC, 12.0, "hrsa_uds", ConfidenceTier.VERIFIED,
                LinkMethod.EXACT_ID, "rank 1", List.of());
        ResolvedMetric missing = ResolvedMetric.missing("org_2", METRIC, List.of());

        PercentileTable table = PercentileTable.compute(List.of(Map.of(METRIC, present), Map.of(METRIC, missing)),
                List.of(METRIC, MetricCatalog.REVENUE));

        assertEquals(1, table.count(METRIC));
        assertEquals(0, table.count(MetricCatalog.REVENUE));
        assertEquals(12.0, table.valueAt(METRIC, 0.9));
        assertThrows(IllegalStateException.class, () -> table.valueAt(MetricCatalog.REVENUE, 0.5));
    }
}
