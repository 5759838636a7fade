package com.provider.linkage.pipeline;

import com.provider.linkage.cache.CacheConfig;
import com.provider.linkage.config.PipelineConfig;
import com.provider.linkage.fuzzy.FuzzyMatchOptions;
import com.provider.linkage.metrics.NoOpPipelineMetrics;
import com.provider.linkage.metrics.PipelineMetrics;

/**
 * Runtime options of a {@link LinkagePipeline}.
 */
public class PipelineOptions {
    private final int parallelism;
    private final FuzzyMatchOptions fuzzyMatchOptions;
    private final CacheConfig cacheConfig;
    private final PipelineMetrics metrics;

    private PipelineOptions(Builder builder) {
        this.parallelism = builder.parallelism;
        this.fuzzyMatchOptions = builder.fuzzyMatchOptions;
        this.cacheConfig = builder.cacheConfig;
        this.metrics = builder.metrics;
    }

    public int getParallelism() {
        return parallelism;
    }

    public FuzzyMatchOptions getFuzzyMatchOptions() {
        return fuzzyMatchOptions;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from {@code pipeline.json}.
     */
    public static Builder from(PipelineConfig config) {
        return builder()
                .parallelism(config.parallelism())
                .fuzzyMatchOptions(config.toFuzzyMatchOptions())
                .cacheConfig(config.toCacheConfig());
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "parallelism=" + parallelism +
                ", fuzzy=" + fuzzyMatchOptions +
                ", cache=" + cacheConfig +
                '}';
    }

    public static class Builder {
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private FuzzyMatchOptions fuzzyMatchOptions = FuzzyMatchOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private PipelineMetrics metrics = NoOpPipelineMetrics.INSTANCE;

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder fuzzyMatchOptions(FuzzyMatchOptions fuzzyMatchOptions) {
            this.fuzzyMatchOptions = fuzzyMatchOptions;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public PipelineOptions build() {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1");
            }
            if (fuzzyMatchOptions == null) {
                throw new IllegalArgumentException("fuzzyMatchOptions is required");
            }
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            if (metrics == null) {
                metrics = NoOpPipelineMetrics.INSTANCE;
            }
            return new PipelineOptions(this);
        }
    }
}
