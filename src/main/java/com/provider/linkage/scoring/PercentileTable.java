package com.provider.linkage.scoring;

import com.provider.linkage.core.model.ResolvedMetric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Corpus-wide distribution of selected metrics, computed once per run after aggregation.
 * Missing values are not part of the distribution. Immutable.
 */
public final class PercentileTable {

    private final Map<String, double[]> sortedValues;

    private PercentileTable(Map<String, double[]> sortedValues) {
        this.sortedValues = sortedValues;
    }

    /**
     * Builds the table from every organization's resolved metrics.
     *
     * @param corpus  resolved metrics per organization
     * @param metrics metrics to index
     */
    public static PercentileTable compute(Collection<Map<String, ResolvedMetric>> corpus, Collection<String> metrics) {
        Map<String, List<Double>> collected = new HashMap<>();
        for (String metric : metrics) {
            collected.put(metric, new ArrayList<>());
        }
        for (Map<String, ResolvedMetric> resolved : corpus) {
            for (String metric : metrics) {
                ResolvedMetric value = resolved.get(metric);
                if (value != null && value.isPresent()) {
                    collected.get(metric).add(value.value());
                }
            }
        }
        Map<String, double[]> sorted = new HashMap<>();
        collected.forEach((metric, values) -> {
            double[] array = values.stream().mapToDouble(Double::doubleValue).toArray();
            Arrays.sort(array);
            sorted.put(metric, array);
        });
        return new PercentileTable(Collections.unmodifiableMap(sorted));
    }

    public static PercentileTable of(Map<String, List<Double>> values) {
        Map<String, double[]> sorted = new HashMap<>();
        values.forEach((metric, list) -> {
            double[] array = list.stream().mapToDouble(Double::doubleValue).toArray();
            Arrays.sort(array);
            sorted.put(metric, array);
        });
        return new PercentileTable(Collections.unmodifiableMap(sorted));
    }

    public Set<String> metrics() {
        return sortedValues.keySet();
    }

    public int count(String metric) {
        double[] values = sortedValues.get(metric);
        return values != null ? values.length : 0;
    }

    /**
     * Value at percentile {@code q}, interpolating linearly between neighbouring observations.
     */
    public double valueAt(String metric, double q) {
        double[] values = require(metric);
        if (values.length == 1) {
            return values[0];
        }
        double position = Math.max(0.0, Math.min(1.0, q)) * (values.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(values.length - 1, lower + 1);
        double fraction = position - lower;
        return values[lower] + (values[upper] - values[lower]) * fraction;
    }

    public double min(String metric) {
        return require(metric)[0];
    }

    public double max(String metric) {
        double[] values = require(metric);
        return values[values.length - 1];
    }

    /**
     * Fraction of the corpus at or below {@code value}, in [0, 1].
     */
    public double rankOf(String metric, double value) {
        double[] values = require(metric);
        int lo = 0;
        int hi = values.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (values[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return (double) lo / values.length;
    }

    private double[] require(String metric) {
        double[] values = sortedValues.get(metric);
        if (values == null || values.length == 0) {
            throw new IllegalStateException("No corpus values for metric " + metric);
        }
        return values;
    }
}
