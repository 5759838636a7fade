package com.provider.linkage.config;

import com.provider.linkage.cache.CacheConfig;
import com.provider.linkage.fuzzy.FuzzyMatchOptions;
import com.provider.linkage.similarity.SimilarityWeights;

import java.util.List;
import java.util.Objects;

/**
 * Contents of {@code pipeline.json}: input files, fuzzy matching and worker settings.
 * File names are relative to the input directory given to the CLI.
 *
 * @param identitySources registry snapshots, in ascending source order
 * @param crosswalks      crosswalk tables, one per key space
 * @param metricSources   metric-bearing datasets
 * @param fuzzy           fuzzy matching settings; defaults when absent
 * @param parallelism     worker threads after the spine pass
 * @param cache           normalization cache settings; defaults when absent
 */
public record PipelineConfig(
        List<IdentitySource> identitySources,
        List<CrosswalkSource> crosswalks,
        List<MetricSource> metricSources,
        FuzzySettings fuzzy,
        int parallelism,
        CacheSettings cache
) {
    public PipelineConfig {
        identitySources = identitySources != null ? List.copyOf(identitySources) : List.of();
        crosswalks = crosswalks != null ? List.copyOf(crosswalks) : List.of();
        metricSources = metricSources != null ? List.copyOf(metricSources) : List.of();
        fuzzy = fuzzy != null ? fuzzy : new FuzzySettings(FuzzyMatchOptions.DEFAULT_THRESHOLD, null);
        cache = cache != null ? cache : new CacheSettings(CacheConfig.defaults().maxSize(), true);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    public FuzzyMatchOptions toFuzzyMatchOptions() {
        FuzzyMatchOptions.Builder builder = FuzzyMatchOptions.builder().threshold(fuzzy.threshold());
        if (fuzzy.weights() != null) {
            builder.weights(fuzzy.weights());
        }
        return builder.build();
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(cache.maxSize(), cache.enabled());
    }

    /**
     * @param source registry name recorded on every record of the file
     * @param file   CSV file name
     */
    public record IdentitySource(String source, String file) {
        public IdentitySource {
            requireText(source, "identity source name");
            requireText(file, "identity source file");
        }
    }

    /**
     * @param keySpace foreign key space, e.g. {@code ccn}
     * @param file     CSV file name
     */
    public record CrosswalkSource(String keySpace, String file) {
        public CrosswalkSource {
            requireText(keySpace, "crosswalk key space");
            requireText(file, "crosswalk file");
        }
    }

    /**
     * @param source source name; must be declared in the priority table
     * @param file   CSV file name
     */
    public record MetricSource(String source, String file) {
        public MetricSource {
            requireText(source, "metric source name");
            requireText(file, "metric source file");
        }
    }

    /**
     * @param threshold minimum similarity for a fuzzy link
     * @param weights   similarity weights, or {@code null} for the defaults
     */
    public record FuzzySettings(double threshold, SimilarityWeights weights) {
    }

    /**
     * @param maxSize maximum cached names
     * @param enabled whether the cache is used
     */
    public record CacheSettings(int maxSize, boolean enabled) {
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }

    public static PipelineConfig of(List<IdentitySource> identitySources, List<CrosswalkSource> crosswalks,
                                    List<MetricSource> metricSources, int parallelism) {
        Objects.requireNonNull(identitySources, "identitySources is required");
        return new PipelineConfig(identitySources, crosswalks, metricSources, null, parallelism, null);
    }
}
