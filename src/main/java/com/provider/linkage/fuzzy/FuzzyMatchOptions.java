package com.provider.linkage.fuzzy;

import com.provider.linkage.similarity.SimilarityWeights;

import java.util.Objects;

/**
 * Options for the fuzzy name fallback.
 */
public class FuzzyMatchOptions {

    /**
     * Minimum composite similarity for a fuzzy link. Chosen so that a single-letter typo in a
     * three-word name still links while sibling organizations sharing only a leading word do not.
     */
    public static final double DEFAULT_THRESHOLD = 0.88;

    /**
     * Scores closer than this are treated as equal when detecting ties.
     */
    public static final double TIE_EPSILON = 1e-9;

    private final double threshold;
    private final SimilarityWeights weights;

    private FuzzyMatchOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.weights = builder.weights;
    }

    public double getThreshold() {
        return threshold;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public static FuzzyMatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FuzzyMatchOptions{threshold=" + threshold + ", weights=" + weights + '}';
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private SimilarityWeights weights = SimilarityWeights.defaults();

        public Builder threshold(double threshold) {
            if (threshold <= 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be in (0.0, 1.0]");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder weights(SimilarityWeights weights) {
            this.weights = weights;
            return this;
        }

        public FuzzyMatchOptions build() {
            Objects.requireNonNull(weights, "weights is required");
            return new FuzzyMatchOptions(this);
        }
    }
}
