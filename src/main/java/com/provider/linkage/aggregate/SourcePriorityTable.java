package com.provider.linkage.aggregate;

import com.provider.linkage.config.ConfigurationException;
import com.provider.linkage.core.model.ConfidenceTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declared sources, per-metric hierarchies of truth and derived-estimate rules.
 *
 * <p>Validated once at construction: every metric must be in the {@link MetricCatalog} and every
 * referenced source must be declared. Immutable and shared read-only by all workers.</p>
 */
public final class SourcePriorityTable {

    private final String version;
    private final Map<String, SourceDefinition> sources;
    private final Map<String, List<PriorityEntry>> hierarchies;
    private final List<DerivedEstimateRule> derivedRules;

    private SourcePriorityTable(Builder builder) {
        this.version = builder.version;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sources));
        Map<String, List<PriorityEntry>> frozen = new LinkedHashMap<>();
        builder.hierarchies.forEach((metric, entries) -> {
            List<PriorityEntry> sorted = new ArrayList<>(entries);
            sorted.sort(Comparator.comparingInt(PriorityEntry::rank).thenComparing(PriorityEntry::sourceName));
            frozen.put(metric, List.copyOf(sorted));
        });
        this.hierarchies = Collections.unmodifiableMap(frozen);
        this.derivedRules = List.copyOf(builder.derivedRules);
    }

    public String getVersion() {
        return version;
    }

    public Map<String, SourceDefinition> getSources() {
        return sources;
    }

    /**
     * Hierarchy of {@code metricName}, most authoritative first. Empty when none is declared.
     */
    public List<PriorityEntry> entries(String metricName) {
        return hierarchies.getOrDefault(metricName, List.of());
    }

    public Optional<PriorityEntry> entry(String metricName, String sourceName) {
        for (PriorityEntry entry : entries(metricName)) {
            if (entry.sourceName().equals(sourceName)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public ConfidenceTier tierOf(String sourceName) {
        SourceDefinition source = sources.get(sourceName);
        if (source == null) {
            throw new IllegalArgumentException("Undeclared source: " + sourceName);
        }
        return source.tier();
    }

    public List<DerivedEstimateRule> getDerivedRules() {
        return derivedRules;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String version = "unversioned";
        private final Map<String, SourceDefinition> sources = new LinkedHashMap<>();
        private final Map<String, List<PriorityEntry>> hierarchies = new LinkedHashMap<>();
        private final List<DerivedEstimateRule> derivedRules = new ArrayList<>();

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder source(String name, ConfidenceTier tier) {
            sources.put(name, new SourceDefinition(name, tier));
            return this;
        }

        public Builder entry(String metricName, String sourceName, int rank, double multiplier) {
            hierarchies.computeIfAbsent(metricName, k -> new ArrayList<>())
                    .add(new PriorityEntry(sourceName, rank, multiplier));
            return this;
        }

        public Builder entry(String metricName, String sourceName, int rank) {
            return entry(metricName, sourceName, rank, 1.0);
        }

        public Builder derivedRule(DerivedEstimateRule rule) {
            derivedRules.add(rule);
            return this;
        }

        /**
         * Validates and builds the table.
         *
         * @throws ConfigurationException if a metric or source reference is unknown, or a source
         *                                appears twice in one hierarchy
         */
        public SourcePriorityTable build() {
            if (version == null || version.isBlank()) {
                throw new ConfigurationException("Priority table version is required");
            }
            for (Map.Entry<String, List<PriorityEntry>> hierarchy : hierarchies.entrySet()) {
                String metric = hierarchy.getKey();
                requireKnownMetric(metric, "hierarchy");
                Set<String> seen = new HashSet<>();
                for (PriorityEntry entry : hierarchy.getValue()) {
                    requireDeclaredSource(entry.sourceName(), "hierarchy of " + metric);
                    if (!seen.add(entry.sourceName())) {
                        throw new ConfigurationException("Source " + entry.sourceName()
                                + " appears twice in the hierarchy of " + metric);
                    }
                }
            }
            for (DerivedEstimateRule rule : derivedRules) {
                requireKnownMetric(rule.targetMetric(), "derived estimate target");
                requireKnownMetric(rule.inputMetric(), "derived estimate input");
                requireDeclaredSource(rule.sourceName(), "derived estimate for " + rule.targetMetric());
                boolean ranked = hierarchies.getOrDefault(rule.targetMetric(), List.of()).stream()
                        .anyMatch(e -> e.sourceName().equals(rule.sourceName()));
                if (!ranked) {
                    throw new ConfigurationException("Derived estimate source " + rule.sourceName()
                            + " has no rank in the hierarchy of " + rule.targetMetric());
                }
            }
            return new SourcePriorityTable(this);
        }

        private static void requireKnownMetric(String metric, String where) {
            if (!MetricCatalog.isKnown(metric)) {
                throw new ConfigurationException("Unknown metric '" + metric + "' in " + where);
            }
        }

        private void requireDeclaredSource(String source, String where) {
            if (!sources.containsKey(source)) {
                throw new ConfigurationException("Unknown source '" + source + "' in " + where);
            }
        }
    }
}
