package com.provider.linkage.scoring;

/**
 * One independently computable scoring category.
 * Implementations are pure functions of their input and clamp their own output.
 */
public interface CategoryScorer {

    /**
     * Category name, e.g. {@code economic_pain}.
     */
    String category();

    /**
     * Maximum points this category can contribute.
     */
    double ceiling();

    /**
     * Scores one organization. Missing inputs yield zero points and a missing entry, never an
     * exception.
     */
    CategoryResult score(ScoringInput input);
}
