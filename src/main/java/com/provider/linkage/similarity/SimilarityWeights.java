package com.provider.linkage.similarity;

/**
 * Weights of the three measures combined by {@link CompositeNameSimilarity}.
 * Each weight is non-negative and together they sum to 1.
 */
public record SimilarityWeights(
        double levenshtein,
        double jaroWinkler,
        double tokenJaccard
) {
    private static final double SUM_TOLERANCE = 1e-6;

    public SimilarityWeights {
        if (levenshtein < 0 || jaroWinkler < 0 || tokenJaccard < 0) {
            throw new IllegalArgumentException("Similarity weights must be non-negative");
        }
        double sum = levenshtein + jaroWinkler + tokenJaccard;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Similarity weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.40 edit distance, 0.45 Jaro-Winkler, 0.15 token overlap.
     */
    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.40, 0.45, 0.15);
    }
}
