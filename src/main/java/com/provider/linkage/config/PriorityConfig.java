package com.provider.linkage.config;

import com.provider.linkage.aggregate.DerivedEstimateRule;
import com.provider.linkage.aggregate.SourcePriorityTable;
import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.Segment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code priorities.json}: declared sources, per-metric hierarchies of truth and
 * derived-estimate rules.
 *
 * @param version          ruleset version, shared with the scoring rules
 * @param sources          declared sources and their confidence tiers
 * @param metrics          hierarchy per metric name
 * @param derivedEstimates heuristic estimates
 */
public record PriorityConfig(
        String version,
        List<SourceEntry> sources,
        Map<String, List<RankEntry>> metrics,
        List<DerivedEntry> derivedEstimates
) {
    public PriorityConfig {
        sources = sources != null ? List.copyOf(sources) : List.of();
        metrics = metrics != null ? new LinkedHashMap<>(metrics) : Map.of();
        derivedEstimates = derivedEstimates != null ? List.copyOf(derivedEstimates) : List.of();
    }

    /**
     * @param name source name
     * @param tier {@code verified}, {@code derived} or {@code estimated}
     */
    public record SourceEntry(String name, String tier) {
    }

    /**
     * @param source     source name
     * @param rank       position in the hierarchy, 1 wins
     * @param multiplier applied to winning values; 1 when absent
     */
    public record RankEntry(String source, int rank, Double multiplier) {
    }

    /**
     * @param target       metric the estimate contributes to
     * @param input        metric the estimate is computed from
     * @param source       source the estimate is attributed to
     * @param segmentRates rate per segment
     * @param defaultRate  rate for other segments
     */
    public record DerivedEntry(String target, String input, String source,
                               Map<Segment, Double> segmentRates, double defaultRate) {
    }

    /**
     * Builds and validates the priority table.
     *
     * @throws ConfigurationException on an unknown tier, metric or source
     */
    public SourcePriorityTable toTable() {
        SourcePriorityTable.Builder builder = SourcePriorityTable.builder().version(version);
        for (SourceEntry source : sources) {
            ConfidenceTier tier;
            try {
                tier = ConfidenceTier.fromCode(source.tier());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown confidence tier '" + source.tier()
                        + "' for source " + source.name(), e);
            }
            if (tier == ConfidenceTier.MISSING) {
                throw new ConfigurationException("Source " + source.name() + " cannot declare tier missing");
            }
            builder.source(source.name(), tier);
        }
        for (Map.Entry<String, List<RankEntry>> metric : metrics.entrySet()) {
            for (RankEntry entry : metric.getValue()) {
                double multiplier = entry.multiplier() != null ? entry.multiplier() : 1.0;
                try {
                    builder.entry(metric.getKey(), entry.source(), entry.rank(), multiplier);
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new ConfigurationException("Invalid hierarchy entry for " + metric.getKey()
                            + ": " + e.getMessage(), e);
                }
            }
        }
        for (DerivedEntry derived : derivedEstimates) {
            try {
                builder.derivedRule(new DerivedEstimateRule(derived.target(), derived.input(), derived.source(),
                        derived.segmentRates(), derived.defaultRate()));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException("Invalid derived estimate: " + e.getMessage(), e);
            }
        }
        return builder.build();
    }
}
