package com.provider.linkage.similarity;

/**
 * A similarity measure over two normalized organization names.
 * Implementations return a score in [0, 1] where 1 means identical.
 */
public interface NameSimilarity {

    /**
     * Scores two names. {@code null} on either side scores 0.
     */
    double score(String left, String right);

    /**
     * Short name used in logs and match explanations.
     */
    String name();
}
