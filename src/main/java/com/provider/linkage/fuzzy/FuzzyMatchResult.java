package com.provider.linkage.fuzzy;

import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.SourceRecordRef;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Detailed result of a fuzzy match attempt.
 *
 * @param outcome     classification of the attempt
 * @param bestOrgId   highest-scoring candidate, or {@code null} when there were none
 * @param bestScore   score of the best candidate, 0 when there were none
 * @param tiedOrgIds  every candidate sharing the best score when {@code outcome} is TIE, sorted
 * @param comparisons number of candidates scored
 */
public record FuzzyMatchResult(
        FuzzyMatchOutcome outcome,
        String bestOrgId,
        double bestScore,
        List<String> tiedOrgIds,
        int comparisons
) {
    public FuzzyMatchResult {
        Objects.requireNonNull(outcome, "outcome is required");
        tiedOrgIds = tiedOrgIds != null ? List.copyOf(tiedOrgIds) : List.of();
    }

    static FuzzyMatchResult noCandidates() {
        return new FuzzyMatchResult(FuzzyMatchOutcome.NO_CANDIDATES, null, 0.0, List.of(), 0);
    }

    public boolean isMatched() {
        return outcome == FuzzyMatchOutcome.MATCHED;
    }

    /**
     * The accepted link for {@code record}, or empty unless the outcome is MATCHED.
     */
    public Optional<LinkEdge> toLinkEdge(SourceRecordRef record) {
        if (!isMatched()) {
            return Optional.empty();
        }
        return Optional.of(LinkEdge.fuzzy(bestOrgId, record.sourceName(), record.recordKey(), bestScore));
    }

    /**
     * Short text for audit entries.
     */
    public String describe() {
        return switch (outcome) {
            case MATCHED -> String.format(Locale.ROOT, "matched %s score=%.4f", bestOrgId, bestScore);
            case BELOW_THRESHOLD -> String.format(Locale.ROOT,
                    "best candidate %s score=%.4f below threshold", bestOrgId, bestScore);
            case TIE -> String.format(Locale.ROOT, "tie at score=%.4f between %s", bestScore, tiedOrgIds);
            case NO_CANDIDATES -> "no candidate organizations in state";
        };
    }
}
