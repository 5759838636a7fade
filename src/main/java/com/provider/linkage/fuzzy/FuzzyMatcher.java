package com.provider.linkage.fuzzy;

import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.SourceRecordRef;
import com.provider.linkage.similarity.CompositeNameSimilarity;
import com.provider.linkage.similarity.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Name-based fallback linker for records that carry neither a primary identifier nor a
 * crosswalk key.
 *
 * <p>Only candidates in the record's own state are compared. A link is accepted when the best
 * composite similarity reaches the threshold and no other candidate shares that score; ties and
 * sub-threshold matches produce no link rather than an arbitrary pick. Stateless apart from its
 * options, so one instance serves every worker.</p>
 */
public class FuzzyMatcher {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatcher.class);

    private final FuzzyMatchOptions options;
    private final NameSimilarity similarity;

    public FuzzyMatcher() {
        this(FuzzyMatchOptions.defaults());
    }

    public FuzzyMatcher(FuzzyMatchOptions options) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.similarity = new CompositeNameSimilarity(options.getWeights());
    }

    /**
     * Links a record by name.
     *
     * @param record         the record being linked, used for the edge's provenance
     * @param normalizedName the record's normalized organization name
     * @param stateCode      the record's state code
     * @param candidates     organizations to compare against; any outside {@code stateCode} are ignored
     * @return the accepted fuzzy edge, or empty when no unique candidate reaches the threshold
     */
    public Optional<LinkEdge> match(SourceRecordRef record, String normalizedName, String stateCode,
                                    Collection<Organization> candidates) {
        return evaluate(normalizedName, stateCode, candidates).toLinkEdge(record);
    }

    /**
     * Scores a name against the same-state candidates and classifies the outcome.
     */
    public FuzzyMatchResult evaluate(String normalizedName, String stateCode,
                                     Collection<Organization> candidates) {
        if (stateCode == null || stateCode.isEmpty() || candidates == null || candidates.isEmpty()) {
            return FuzzyMatchResult.noCandidates();
        }

        String bestOrgId = null;
        double bestScore = -1.0;
        List<String> tied = new ArrayList<>();
        int comparisons = 0;

        for (Organization candidate : candidates) {
            if (!stateCode.equals(candidate.getStateCode())) {
                continue;
            }
            comparisons++;
            double score = normalizedName == null || normalizedName.isEmpty()
                    ? 0.0
                    : similarity.score(normalizedName, candidate.getNormalizedName());

            if (score > bestScore + FuzzyMatchOptions.TIE_EPSILON) {
                bestScore = score;
                bestOrgId = candidate.getOrgId();
                tied.clear();
                tied.add(candidate.getOrgId());
            } else if (Math.abs(score - bestScore) <= FuzzyMatchOptions.TIE_EPSILON) {
                tied.add(candidate.getOrgId());
                if (candidate.getOrgId().compareTo(bestOrgId) < 0) {
                    bestOrgId = candidate.getOrgId();
                }
            }
        }

        if (comparisons == 0) {
            return FuzzyMatchResult.noCandidates();
        }
        if (bestScore < options.getThreshold()) {
            return new FuzzyMatchResult(FuzzyMatchOutcome.BELOW_THRESHOLD, bestOrgId, bestScore, List.of(), comparisons);
        }
        if (tied.size() > 1) {
            tied.sort(String::compareTo);
            log.debug("fuzzy.tie name={} state={} score={} candidates={}", normalizedName, stateCode, bestScore, tied);
            return new FuzzyMatchResult(FuzzyMatchOutcome.TIE, bestOrgId, bestScore, tied, comparisons);
        }
        log.trace("fuzzy.matched name={} orgId={} score={}", normalizedName, bestOrgId, bestScore);
        return new FuzzyMatchResult(FuzzyMatchOutcome.MATCHED, bestOrgId, Math.min(1.0, bestScore), List.of(), comparisons);
    }

    public FuzzyMatchOptions getOptions() {
        return options;
    }
}
