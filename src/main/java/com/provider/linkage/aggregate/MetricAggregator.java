package com.provider.linkage.aggregate;

import com.provider.linkage.core.model.ConfidenceTier;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.MetricRecord;
import com.provider.linkage.core.model.MetricValue;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.Segment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves conflicting metric values with the hierarchy of truth.
 *
 * <p>Pure: the result depends only on the priority table and the set of candidates, never on
 * their order, the clock or any shared state.</p>
 */
public class MetricAggregator {

    /**
     * Total order over candidates: values before nulls, rank, then link method (exact before
     * crosswalk before fuzzy), then higher link confidence, then later period, then source and
     * record key, then value.
     */
    static final Comparator<MetricValue> PRECEDENCE = Comparator
            .comparing(MetricValue::hasValue, Comparator.reverseOrder())
            .thenComparingInt(MetricValue::sourcePriorityRank)
            .thenComparing(MetricValue::linkMethod)
            .thenComparing(Comparator.comparingDouble(MetricValue::linkConfidence).reversed())
            .thenComparing(MetricValue::asOfPeriod, Comparator.reverseOrder())
            .thenComparing(MetricValue::sourceName)
            .thenComparing(MetricValue::sourceRecordKey)
            .thenComparing(MetricValue::value, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SourcePriorityTable priorities;

    public MetricAggregator(SourcePriorityTable priorities) {
        this.priorities = Objects.requireNonNull(priorities, "priorities is required");
    }

    /**
     * Converts a linked metric record into a candidate value for the linked organization.
     *
     * @return the candidate, or empty when the record's source is not ranked for its metric
     */
    public Optional<MetricValue> contribution(MetricRecord record, LinkEdge edge) {
        return priorities.entry(record.metricName(), record.sourceName())
                .map(entry -> new MetricValue(
                        edge.orgId(),
                        record.metricName(),
                        record.sourceName(),
                        entry.rank(),
                        record.value(),
                        record.unit(),
                        record.asOfPeriod(),
                        edge.linkMethod(),
                        edge.confidence(),
                        record.recordKey()));
    }

    /**
     * Picks the winning value for one metric of one organization.
     *
     * @param orgId      the organization
     * @param metricName the metric
     * @param candidates every contributed value, in any order; null values never win
     */
    public ResolvedMetric resolve(String orgId, String metricName, List<MetricValue> candidates) {
        List<MetricValue> sorted = new ArrayList<>(candidates);
        sorted.sort(PRECEDENCE);

        if (sorted.isEmpty() || !sorted.get(0).hasValue()) {
            return ResolvedMetric.missing(orgId, metricName, sorted);
        }
        MetricValue winner = sorted.get(0);

        double multiplier = priorities.entry(metricName, winner.sourceName())
                .map(PriorityEntry::multiplier)
                .orElse(1.0);
        ConfidenceTier tier = priorities.tierOf(winner.sourceName()).forLinkMethod(winner.linkMethod());
        return new ResolvedMetric(
                orgId,
                metricName,
                winner.value() * multiplier,
                winner.sourceName(),
                tier,
                winner.linkMethod(),
                reason(winner, multiplier, sorted),
                sorted);
    }

    /**
     * Resolves every catalog metric for an organization without derived estimates. Used where the
     * segment is not known yet.
     */
    public Map<String, ResolvedMetric> resolveBase(String orgId, List<MetricValue> contributions) {
        Map<String, List<MetricValue>> byMetric = groupByMetric(contributions);
        Map<String, ResolvedMetric> resolved = new LinkedHashMap<>();
        for (String metric : MetricCatalog.ALL) {
            resolved.put(metric, resolve(orgId, metric, byMetric.getOrDefault(metric, List.of())));
        }
        return resolved;
    }

    /**
     * Resolves every catalog metric, then adds the derived estimates and re-resolves their targets.
     *
     * @param orgId         the organization
     * @param segment       its segment, selecting the derived-estimate rates; may be {@code null}
     * @param contributions every value contributed to the organization
     * @return resolved metrics in catalog order
     */
    public Map<String, ResolvedMetric> resolveAll(String orgId, Segment segment, List<MetricValue> contributions) {
        Map<String, List<MetricValue>> byMetric = groupByMetric(contributions);
        Map<String, ResolvedMetric> resolved = resolveBase(orgId, contributions);

        for (DerivedEstimateRule rule : priorities.getDerivedRules()) {
            ResolvedMetric input = resolved.get(rule.inputMetric());
            if (input == null || input.isMissing()) {
                continue;
            }
            int rank = priorities.entry(rule.targetMetric(), rule.sourceName())
                    .map(PriorityEntry::rank)
                    .orElseThrow(() -> new IllegalStateException("Unranked derived source " + rule.sourceName()));
            MetricValue estimate = new MetricValue(
                    orgId,
                    rule.targetMetric(),
                    rule.sourceName(),
                    rank,
                    input.value() * rule.rateFor(segment),
                    "",
                    "",
                    input.winningLinkMethod(),
                    linkConfidenceOf(input),
                    rule.inputMetric() + "@" + input.winningSource());

            List<MetricValue> targetCandidates = new ArrayList<>(byMetric.getOrDefault(rule.targetMetric(), List.of()));
            targetCandidates.add(estimate);
            byMetric.put(rule.targetMetric(), targetCandidates);
            resolved.put(rule.targetMetric(), resolve(orgId, rule.targetMetric(), targetCandidates));
        }
        return resolved;
    }

    private static Map<String, List<MetricValue>> groupByMetric(List<MetricValue> contributions) {
        Map<String, List<MetricValue>> byMetric = new HashMap<>();
        for (MetricValue value : contributions) {
            byMetric.computeIfAbsent(value.metricName(), k -> new ArrayList<>()).add(value);
        }
        return byMetric;
    }

    private static double linkConfidenceOf(ResolvedMetric metric) {
        return metric.contenders().stream()
                .filter(MetricValue::hasValue)
                .findFirst()
                .map(MetricValue::linkConfidence)
                .orElse(1.0);
    }

    private static String reason(MetricValue winner, double multiplier, List<MetricValue> sorted) {
        long others = sorted.stream().filter(MetricValue::hasValue).count() - 1;
        StringBuilder sb = new StringBuilder();
        sb.append("rank ").append(winner.sourcePriorityRank())
                .append(" source ").append(winner.sourceName())
                .append(" via ").append(winner.linkMethod().getCode());
        if (multiplier != 1.0) {
            sb.append(String.format(Locale.ROOT, " x%.2f", multiplier));
        }
        if (others > 0) {
            sb.append(" over ").append(others).append(" other candidate(s)");
        }
        return sb.toString();
    }
}
