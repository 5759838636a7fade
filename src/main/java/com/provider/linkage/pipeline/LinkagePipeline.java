package com.provider.linkage.pipeline;

import com.provider.linkage.aggregate.MetricAggregator;
import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.audit.AuditEntry;
import com.provider.linkage.audit.AuditLedger;
import com.provider.linkage.audit.ShardAuditLog;
import com.provider.linkage.config.LinkageConfig;
import com.provider.linkage.core.MalformedRecordException;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.LinkMethod;
import com.provider.linkage.core.model.MetricRecord;
import com.provider.linkage.core.model.MetricValue;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.ScoreRecord;
import com.provider.linkage.crosswalk.CrosswalkLinker;
import com.provider.linkage.crosswalk.CrosswalkTable;
import com.provider.linkage.fuzzy.FuzzyMatchOutcome;
import com.provider.linkage.fuzzy.FuzzyMatchResult;
import com.provider.linkage.fuzzy.FuzzyMatcher;
import com.provider.linkage.fuzzy.StateBlockingIndex;
import com.provider.linkage.identity.IdentityResolver;
import com.provider.linkage.identity.OrganizationSpine;
import com.provider.linkage.identity.ParkedRecord;
import com.provider.linkage.identity.SegmentClassifier;
import com.provider.linkage.identity.SpineResult;
import com.provider.linkage.logging.LogContext;
import com.provider.linkage.metrics.PipelineMetrics;
import com.provider.linkage.network.NetworkGrouper;
import com.provider.linkage.network.NetworkGrouping;
import com.provider.linkage.network.NetworkMember;
import com.provider.linkage.rules.NameNormalizer;
import com.provider.linkage.scoring.PercentileTable;
import com.provider.linkage.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the linkage pipeline over fully loaded input.
 *
 * <p>Stages, in order:</p>
 * <ol>
 *     <li>{@code spine}: sequential identity pass building organizations keyed by primary identifier</li>
 *     <li>{@code link}: exact and crosswalk linking of metric records, in parallel chunks</li>
 *     <li>{@code fuzzy-identity}: parked registry records matched by name, one task per state</li>
 *     <li>{@code name-keyed}: organizations created for parked records nothing matched</li>
 *     <li>{@code fuzzy-metrics}: remaining metric records matched by name against the full spine, per state</li>
 *     <li>{@code aggregate}: hierarchy-of-truth resolution and segment classification, per organization</li>
 *     <li>{@code percentiles}: corpus distribution of the banded metrics</li>
 *     <li>{@code score}: category scoring, per organization</li>
 *     <li>{@code networks}: grouping of sibling organizations</li>
 *     <li>{@code seal}: every organization becomes read-only</li>
 * </ol>
 *
 * <p>Parallel results are always merged in a fixed order (input order, state code or org id), so
 * the result does not depend on thread scheduling or on {@code parallelism}.</p>
 */
public class LinkagePipeline {
    private static final Logger log = LoggerFactory.getLogger(LinkagePipeline.class);

    private static final String NO_STATE = "-";
    private static final int CHUNKS_PER_WORKER = 4;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    static final Comparator<LinkEdge> LINK_ORDER = Comparator
            .comparing(LinkEdge::orgId)
            .thenComparing(LinkEdge::sourceName)
            .thenComparing(LinkEdge::sourceRecordKey)
            .thenComparing(LinkEdge::linkMethod);

    private final LinkageConfig config;
    private final PipelineOptions options;
    private final PipelineMetrics metrics;
    private final NameNormalizer normalizer;
    private final FuzzyMatcher matcher;
    private final MetricAggregator aggregator;
    private final SegmentClassifier classifier;

    public LinkagePipeline(LinkageConfig config) {
        this(config, PipelineOptions.from(config.pipeline()).build());
    }

    public LinkagePipeline(LinkageConfig config, PipelineOptions options) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metrics = options.getMetrics();
        this.normalizer = new NameNormalizer();
        this.matcher = new FuzzyMatcher(options.getFuzzyMatchOptions());
        this.aggregator = new MetricAggregator(config.priorities());
        this.classifier = new SegmentClassifier();
    }

    /**
     * Executes one run. Each call gets its own run id, cache, audit ledger and worker pool.
     */
    public PipelineResult run(PipelineInput input) {
        Objects.requireNonNull(input, "input is required");
        ExecutorService executor = Executors.newFixedThreadPool(options.getParallelism(), workerThreads());
        try (PipelineRun run = new PipelineRun(normalizer, options.getCacheConfig());
             LogContext ignored = LogContext.forRun(run.getRunId())) {
            log.info("pipeline.started runId={} identityRecords={} metricRecords={} options={}",
                    run.getRunId(), input.identityRecords().size(), input.metricRecords().size(), options);
            PipelineResult result = execute(run, input, executor);
            log.info("pipeline.completed runId={} organizations={} links={} networks={}",
                    run.getRunId(), result.organizations().size(), result.links().size(),
                    result.networks().networks().size());
            return result;
        } finally {
            shutdown(executor);
        }
    }

    private PipelineResult execute(PipelineRun run, PipelineInput input, ExecutorService executor) {
        String runId = run.getRunId();
        AuditLedger ledger = run.getLedger();
        Map<String, Duration> durations = new LinkedHashMap<>();
        List<LinkEdge> links = new ArrayList<>();

        recordReadRejections(input.readRejections(), ledger.shard("input"));

        SpineResult spineResult = timed(runId, "spine", durations, () ->
                new IdentityResolver(run.getNames()).resolve(input.identityRecords(), ledger.shard("spine")));
        OrganizationSpine spine = spineResult.spine();

        CrosswalkLinker linker = new CrosswalkLinker(spine);
        List<LinkedRecord> keyLinked = timed(runId, "link", durations, () ->
                linkByKey(input.metricRecords(), input.crosswalks(), linker, executor));

        List<ParkedRecord> unmatchedParked = timed(runId, "fuzzy-identity", durations, () ->
                matchParked(run, spineResult.parked(), spine, links, executor));

        int nameKeyed = timed(runId, "name-keyed", durations, () ->
                new IdentityResolver(run.getNames())
                        .createNameKeyed(unmatchedParked, spine, ledger.shard("name-keyed"))
                        .size());

        List<LinkedRecord> metricLinks = timed(runId, "fuzzy-metrics", durations, () ->
                matchMetrics(run, keyLinked, spine, executor));
        for (LinkedRecord linked : metricLinks) {
            for (LinkEdge edge : linked.edges()) {
                spine.get(edge.orgId()).ifPresent(org -> org.link(linked.record().recordRef()));
                links.add(edge);
            }
        }

        List<Organization> organizations = spine.organizations();
        Map<String, Map<String, ResolvedMetric>> resolved = timed(runId, "aggregate", durations, () ->
                aggregate(runId, organizations, metricLinks, executor, ledger.shard("aggregate")));

        PercentileTable percentiles = timed(runId, "percentiles", durations, () ->
                PercentileTable.compute(resolved.values(), ScoringEngine.PERCENTILE_METRICS));

        ScoringEngine engine = new ScoringEngine(config.scoring(), percentiles);
        Map<String, ScoreRecord> scores = timed(runId, "score", durations, () ->
                score(runId, engine, organizations, resolved, executor));

        NetworkGrouping grouping = timed(runId, "networks", durations, () ->
                new NetworkGrouper(engine.getTiers()).group(networkMembers(organizations, resolved, scores)));

        timed(runId, "seal", durations, () -> {
            spine.sealAll();
            return null;
        });

        links.sort(LINK_ORDER);
        List<AuditEntry> audit = ledger.merge();
        PipelineReport report = new PipelineReport(runId, spine.size(), nameKeyed, countLinks(links),
                ledger.countByAction(), grouping.networks().size(), durations);
        publishMetrics(spine.size(), links, audit, grouping);

        return new PipelineResult(runId, engine.getRulesetVersion(), spine.organizations(), resolved, scores,
                grouping, links, audit, report);
    }

    private void recordReadRejections(List<MalformedRecordException> rejections, ShardAuditLog audit) {
        for (MalformedRecordException rejection : rejections) {
            audit.record(AuditAction.REJECTED_MALFORMED, rejection.getSourceName(), rejection.getRecordKey(),
                    null, rejection.getMessage());
        }
    }

    private List<LinkedRecord> linkByKey(List<MetricRecord> records, Map<String, CrosswalkTable> crosswalks,
                                         CrosswalkLinker linker, ExecutorService executor) {
        List<List<LinkedRecord>> chunks = runAll(executor, partition(records), chunk -> {
            List<LinkedRecord> linked = new ArrayList<>(chunk.size());
            for (MetricRecord record : chunk) {
                linked.add(new LinkedRecord(record, linkByKey(record, crosswalks, linker)));
            }
            return linked;
        });
        List<LinkedRecord> all = new ArrayList<>(records.size());
        chunks.forEach(all::addAll);
        return all;
    }

    private static List<LinkEdge> linkByKey(MetricRecord record, Map<String, CrosswalkTable> crosswalks,
                                            CrosswalkLinker linker) {
        Optional<LinkEdge> exact = linker.linkExact(record);
        if (exact.isPresent()) {
            return List.of(exact.get());
        }
        if (record.hasForeignKey()) {
            return linker.link(record, crosswalks.get(record.keySpace()));
        }
        return List.of();
    }

    /**
     * Matches parked registry records against registry organizations. Matched records are linked
     * and their edges appended to {@code links}; ties are audited and dropped.
     *
     * @return records nothing matched, in source order
     */
    private List<ParkedRecord> matchParked(PipelineRun run, List<ParkedRecord> parked, OrganizationSpine spine,
                                           List<LinkEdge> links, ExecutorService executor) {
        Map<String, List<ParkedRecord>> byState = new TreeMap<>();
        for (ParkedRecord record : parked) {
            byState.computeIfAbsent(shardKey(record.stateCode()), k -> new ArrayList<>()).add(record);
        }
        StateBlockingIndex index = new StateBlockingIndex(spine.organizations());

        List<List<ParkedMatch>> shards = runAll(executor, new ArrayList<>(byState.entrySet()), shard -> {
            try (LogContext ignored = LogContext.forShard(run.getRunId(), shard.getKey())) {
                ShardAuditLog audit = run.getLedger().shard("fuzzy-identity:" + shard.getKey());
                List<ParkedMatch> matches = new ArrayList<>(shard.getValue().size());
                for (ParkedRecord record : shard.getValue()) {
                    FuzzyMatchResult result = matcher.evaluate(record.normalizedName(), record.stateCode(),
                            index.candidates(record.stateCode()));
                    if (result.outcome() == FuzzyMatchOutcome.TIE) {
                        audit.record(AuditAction.AMBIGUOUS_LINK, record.record().sourceName(),
                                record.record().recordKey(), null, result.describe());
                    }
                    matches.add(new ParkedMatch(record, result));
                }
                log.debug("fuzzy.identity.shard records={}", matches.size());
                return matches;
            }
        });

        List<ParkedRecord> unmatched = new ArrayList<>();
        for (List<ParkedMatch> shard : shards) {
            for (ParkedMatch match : shard) {
                if (match.result().isMatched()) {
                    LinkEdge edge = match.result().toLinkEdge(match.parked().record().recordRef()).orElseThrow();
                    spine.get(edge.orgId()).orElseThrow().link(match.parked().record().recordRef());
                    links.add(edge);
                } else if (match.result().outcome() != FuzzyMatchOutcome.TIE) {
                    unmatched.add(match.parked());
                }
            }
        }
        unmatched.sort(Comparator.comparingLong(p -> p.record().sourceOrder()));
        return unmatched;
    }

    /**
     * Sends metric records without a key link through the fuzzy matcher.
     *
     * @return every metric record with its final edges, in input order
     */
    private List<LinkedRecord> matchMetrics(PipelineRun run, List<LinkedRecord> keyLinked, OrganizationSpine spine,
                                            ExecutorService executor) {
        Map<String, List<Integer>> byState = new TreeMap<>();
        for (int i = 0; i < keyLinked.size(); i++) {
            LinkedRecord linked = keyLinked.get(i);
            if (linked.edges().isEmpty()) {
                byState.computeIfAbsent(shardKey(linked.record().stateCode()), k -> new ArrayList<>()).add(i);
            }
        }
        StateBlockingIndex index = new StateBlockingIndex(spine.organizations());

        List<Map<Integer, LinkEdge>> shards = runAll(executor, new ArrayList<>(byState.entrySet()), shard -> {
            try (LogContext ignored = LogContext.forShard(run.getRunId(), shard.getKey())) {
                ShardAuditLog audit = run.getLedger().shard("fuzzy-metrics:" + shard.getKey());
                Map<Integer, LinkEdge> matched = new HashMap<>();
                for (int position : shard.getValue()) {
                    MetricRecord record = keyLinked.get(position).record();
                    matchMetric(run, record, index, audit).ifPresent(edge -> matched.put(position, edge));
                }
                log.debug("fuzzy.metrics.shard records={} matched={}", shard.getValue().size(), matched.size());
                return matched;
            }
        });

        Map<Integer, LinkEdge> matched = new HashMap<>();
        shards.forEach(matched::putAll);
        List<LinkedRecord> all = new ArrayList<>(keyLinked.size());
        for (int i = 0; i < keyLinked.size(); i++) {
            LinkedRecord linked = keyLinked.get(i);
            LinkEdge edge = matched.get(i);
            all.add(edge != null ? new LinkedRecord(linked.record(), List.of(edge)) : linked);
        }
        return all;
    }

    private Optional<LinkEdge> matchMetric(PipelineRun run, MetricRecord record, StateBlockingIndex index,
                                           ShardAuditLog audit) {
        if (record.orgName() == null || record.orgName().isBlank()) {
            audit.record(AuditAction.UNLINKED, record.sourceName(), record.recordKey(), null,
                    "no key link and no name for fuzzy fallback");
            return Optional.empty();
        }
        String normalizedName = run.getNames().normalizeName(record.orgName());
        FuzzyMatchResult result = matcher.evaluate(normalizedName, record.stateCode(),
                index.candidates(record.stateCode()));
        switch (result.outcome()) {
            case MATCHED -> {
                return result.toLinkEdge(record.recordRef());
            }
            case TIE -> audit.record(AuditAction.AMBIGUOUS_LINK, record.sourceName(), record.recordKey(), null,
                    result.describe());
            default -> audit.record(AuditAction.UNLINKED, record.sourceName(), record.recordKey(), null,
                    result.describe());
        }
        return Optional.empty();
    }

    private Map<String, Map<String, ResolvedMetric>> aggregate(String runId, List<Organization> organizations,
                                                               List<LinkedRecord> metricLinks,
                                                               ExecutorService executor, ShardAuditLog audit) {
        Map<String, List<MetricValue>> contributions = new HashMap<>();
        for (LinkedRecord linked : metricLinks) {
            for (LinkEdge edge : linked.edges()) {
                Optional<MetricValue> value = aggregator.contribution(linked.record(), edge);
                if (value.isPresent()) {
                    contributions.computeIfAbsent(edge.orgId(), k -> new ArrayList<>()).add(value.get());
                } else {
                    log.debug("aggregate.unranked source={} metric={} key={}", linked.record().sourceName(),
                            linked.record().metricName(), linked.record().recordKey());
                    audit.record(AuditAction.UNRANKED_CONTRIBUTION, linked.record().sourceName(),
                            linked.record().recordKey(), edge.orgId(), "no rank for metric "
                                    + linked.record().metricName() + " from source " + linked.record().sourceName());
                }
            }
        }

        List<Map<String, Map<String, ResolvedMetric>>> chunks = runAll(executor, partition(organizations), chunk -> {
            try (LogContext ignored = LogContext.forStage(runId, "aggregate")) {
                Map<String, Map<String, ResolvedMetric>> resolved = new HashMap<>();
                for (Organization org : chunk) {
                    List<MetricValue> values = contributions.getOrDefault(org.getOrgId(), List.of());
                    Map<String, ResolvedMetric> base = aggregator.resolveBase(org.getOrgId(), values);
                    org.assignSegment(classifier.classify(org, base));
                    resolved.put(org.getOrgId(), aggregator.resolveAll(org.getOrgId(), org.getSegment(), values));
                }
                return resolved;
            }
        });
        Map<String, Map<String, ResolvedMetric>> resolved = new TreeMap<>();
        chunks.forEach(resolved::putAll);
        return resolved;
    }

    private Map<String, ScoreRecord> score(String runId, ScoringEngine engine, List<Organization> organizations,
                                           Map<String, Map<String, ResolvedMetric>> resolved,
                                           ExecutorService executor) {
        List<Map<String, ScoreRecord>> chunks = runAll(executor, partition(organizations), chunk -> {
            try (LogContext ignored = LogContext.forStage(runId, "score")) {
                Map<String, ScoreRecord> scores = new HashMap<>();
                for (Organization org : chunk) {
                    scores.put(org.getOrgId(), engine.score(org.getOrgId(), org.getSegment(),
                            resolved.get(org.getOrgId())));
                }
                return scores;
            }
        });
        Map<String, ScoreRecord> scores = new TreeMap<>();
        chunks.forEach(scores::putAll);
        return scores;
    }

    private static List<NetworkMember> networkMembers(List<Organization> organizations,
                                                      Map<String, Map<String, ResolvedMetric>> resolved,
                                                      Map<String, ScoreRecord> scores) {
        List<NetworkMember> members = new ArrayList<>(organizations.size());
        for (Organization org : organizations) {
            ScoreRecord score = scores.get(org.getOrgId());
            ResolvedMetric sites = resolved.get(org.getOrgId()).get(MetricCatalog.SITE_COUNT);
            members.add(new NetworkMember(org.getOrgId(), org.getNormalizedName(), org.getStateCode(),
                    org.getSegment(), score.totalScore(), score.categoryScores(),
                    sites != null && sites.isPresent() ? sites.value() : null));
        }
        return members;
    }

    private static Map<LinkMethod, Long> countLinks(List<LinkEdge> links) {
        Map<LinkMethod, Long> counts = new EnumMap<>(LinkMethod.class);
        for (LinkEdge edge : links) {
            counts.merge(edge.linkMethod(), 1L, Long::sum);
        }
        return counts;
    }

    private void publishMetrics(int organizations, List<LinkEdge> links, List<AuditEntry> audit,
                                NetworkGrouping grouping) {
        metrics.incrementOrganizationsCreated(organizations);
        for (LinkEdge edge : links) {
            metrics.incrementLinks(edge.linkMethod());
            if (edge.linkMethod() == LinkMethod.FUZZY) {
                metrics.recordFuzzyConfidence(edge.confidence());
            }
        }
        for (AuditEntry entry : audit) {
            if (entry.action().isRejection()) {
                metrics.incrementRejected(entry.action());
            } else if (entry.action() == AuditAction.IDENTIFIER_COLLISION) {
                metrics.incrementCollisions();
            }
        }
        metrics.recordNetworks(grouping.networks().size());
    }

    private <T> T timed(String runId, String stage, Map<String, Duration> durations, Supplier<T> work) {
        try (LogContext ignored = LogContext.forStage(runId, stage)) {
            long start = System.nanoTime();
            T result = work.get();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            durations.put(stage, elapsed);
            metrics.recordStageDuration(stage, elapsed);
            log.debug("pipeline.stage stage={} durationMs={}", stage, elapsed.toMillis());
            return result;
        }
    }

    /**
     * Splits work into contiguous chunks, a few per worker.
     */
    private <T> List<List<T>> partition(List<T> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        int chunks = options.getParallelism() * CHUNKS_PER_WORKER;
        int size = Math.max(1, (items.size() + chunks - 1) / chunks);
        List<List<T>> partitions = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            partitions.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return partitions;
    }

    /**
     * Applies {@code work} to every unit on the pool and returns the results in unit order.
     */
    private static <T, R> List<R> runAll(ExecutorService executor, List<T> units, Function<T, R> work) {
        List<CompletableFuture<R>> futures = units.stream()
                .map(unit -> CompletableFuture.supplyAsync(() -> work.apply(unit), executor))
                .toList();
        try {
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .thenApply(v -> futures.stream()
                            .map(CompletableFuture::join)
                            .toList())
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Pipeline worker failed", cause);
        }
    }

    private static String shardKey(String stateCode) {
        return stateCode == null || stateCode.isEmpty() ? NO_STATE : stateCode;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "linkage-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record LinkedRecord(MetricRecord record, List<LinkEdge> edges) {
    }

    private record ParkedMatch(ParkedRecord parked, FuzzyMatchResult result) {
    }
}
