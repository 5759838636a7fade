package com.provider.linkage.similarity;

import java.util.Objects;

/**
 * Weighted blend of edit distance, Jaro-Winkler and token Jaccard similarity.
 * Stateless and safe to share between worker threads.
 */
public class CompositeNameSimilarity implements NameSimilarity {

    private final NameSimilarity levenshtein = new LevenshteinSimilarity();
    private final NameSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final NameSimilarity tokenJaccard = new TokenJaccardSimilarity();
    private final SimilarityWeights weights;

    public CompositeNameSimilarity() {
        this(SimilarityWeights.defaults());
    }

    public CompositeNameSimilarity(SimilarityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    @Override
    public double score(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        double blended = weights.levenshtein() * levenshtein.score(left, right)
                + weights.jaroWinkler() * jaroWinkler.score(left, right)
                + weights.tokenJaccard() * tokenJaccard.score(left, right);
        return Math.max(0.0, Math.min(1.0, blended));
    }

    @Override
    public String name() {
        return "composite";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}
