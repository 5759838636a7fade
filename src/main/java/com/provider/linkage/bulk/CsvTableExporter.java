package com.provider.linkage.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.audit.AuditEntry;
import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.Network;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.ResolvedMetric;
import com.provider.linkage.core.model.ScoreRecord;
import com.provider.linkage.network.NetworkAssignment;
import com.provider.linkage.pipeline.PipelineResult;
import com.provider.linkage.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Writes the tables of a completed run.
 *
 * <p>All four files are written into a staging directory next to the output directory, which is
 * then moved into place; a failed export leaves the previous output untouched. An existing output
 * directory is only replaced when it is empty or holds nothing but the tables and the
 * {@value #MARKER_FILE} marker of an earlier export. Nulls are written as empty fields and numbers
 * without exponent or trailing zeros.</p>
 *
 * <p>{@code organizations.csv}, one row per organization sorted by id:</p>
 * <pre>
 * org_id,primary_identifier,legal_name,normalized_name,state,address,zip,phone,taxonomy,segment,
 * &lt;metric&gt;,&lt;metric&gt;_source,&lt;metric&gt;_tier  (for every catalog metric)
 * economic_pain,strategic_fit,strategic_value,compliance_risk,
 * total_score,tier,tier_label,ruleset_version,network_id,is_network_anchor,linked_record_count,bibliography
 * </pre>
 * <p>{@code bibliography} is the score's audit trail as a JSON array.</p>
 *
 * <p>{@code networks.csv}, sorted by network id:</p>
 * <pre>
 * network_id,network_name,member_count,member_org_ids,states,anchor_org_id,network_score,
 * economic_pain,strategic_fit,strategic_value,compliance_risk,tier,tier_label,dominant_segment,total_site_weight
 * </pre>
 * <p>Member ids and states are joined with {@code ;}.</p>
 *
 * <p>{@code links.csv}: {@code org_id,source,record_key,link_method,confidence}.</p>
 *
 * <p>{@code rejections.csv}: {@code action,source,record_key,org_id,detail}, every audit entry
 * of the run including collisions and name-keyed creations.</p>
 */
public class CsvTableExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableExporter.class);

    public static final String ORGANIZATIONS_FILE = "organizations.csv";
    public static final String NETWORKS_FILE = "networks.csv";
    public static final String LINKS_FILE = "links.csv";
    public static final String REJECTIONS_FILE = "rejections.csv";
    public static final String MARKER_FILE = ".provider-linkage-output";

    private static final Set<String> OWNED_FILES = Set.of(
            ORGANIZATIONS_FILE, NETWORKS_FILE, LINKS_FILE, REJECTIONS_FILE, MARKER_FILE);

    private final ObjectMapper mapper;

    public CsvTableExporter() {
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Writes every table and publishes them at {@code outputDir}, replacing what was there.
     *
     * @throws IOException if writing or publishing fails, or if {@code outputDir} holds anything
     *                     this exporter did not write; the previous output is left in place
     */
    public ExportResult export(PipelineResult result, Path outputDir, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Path target = outputDir.toAbsolutePath().normalize();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        checkReplaceable(target);
        Path staging = target.resolveSibling(target.getFileName() + ".staging-" + result.runId());
        Files.createDirectory(staging);

        ExportResult exported;
        try {
            Files.writeString(staging.resolve(MARKER_FILE), result.runId() + "\n", StandardCharsets.UTF_8);
            long organizations = writeOrganizations(result, staging.resolve(ORGANIZATIONS_FILE));
            cb.onProgress(1, 4, "Wrote " + ORGANIZATIONS_FILE);
            long networks = writeNetworks(result, staging.resolve(NETWORKS_FILE));
            cb.onProgress(2, 4, "Wrote " + NETWORKS_FILE);
            long links = writeLinks(result, staging.resolve(LINKS_FILE));
            cb.onProgress(3, 4, "Wrote " + LINKS_FILE);
            long audit = writeRejections(result, staging.resolve(REJECTIONS_FILE));
            cb.onProgress(4, 4, "Wrote " + REJECTIONS_FILE);
            exported = new ExportResult(target, organizations, networks, links, audit);
        } catch (IOException | RuntimeException e) {
            log.error("export.failed runId={} error={}", result.runId(), e.getMessage());
            deleteOwned(staging);
            throw e;
        }

        publish(staging, target, result.runId());
        log.info("export.completed runId={} outputDir={} result={}", result.runId(), target, exported);
        return exported;
    }

    private long writeOrganizations(PipelineResult result, Path file) throws IOException {
        List<String> header = new ArrayList<>(List.of("org_id", "primary_identifier", "legal_name",
                "normalized_name", "state", "address", "zip", "phone", "taxonomy", "segment"));
        for (String metric : MetricCatalog.ALL) {
            header.add(metric);
            header.add(metric + "_source");
            header.add(metric + "_tier");
        }
        header.addAll(ScoringEngine.CATEGORIES);
        header.addAll(List.of("total_score", "tier", "tier_label", "ruleset_version", "network_id",
                "is_network_anchor", "linked_record_count", "bibliography"));

        long rows = 0;
        try (PrintWriter pw = writer(file)) {
            pw.println(CsvSupport.join(header));
            for (Organization org : result.organizations()) {
                Map<String, ResolvedMetric> metrics = result.metricsFor(org.getOrgId());
                Optional<ScoreRecord> score = result.score(org.getOrgId());
                Optional<NetworkAssignment> network = result.networks().assignmentFor(org.getOrgId());

                List<String> row = new ArrayList<>(header.size());
                row.add(org.getOrgId());
                row.add(org.getPrimaryIdentifier());
                row.add(org.getLegalName());
                row.add(org.getNormalizedName());
                row.add(org.getStateCode());
                row.add(org.getAddress());
                row.add(org.getDisplayZip());
                row.add(org.getPhone());
                row.add(org.getTaxonomyCode());
                row.add(org.getSegment() != null ? org.getSegment().name() : null);
                for (String metric : MetricCatalog.ALL) {
                    ResolvedMetric resolved = metrics.get(metric);
                    boolean present = resolved != null && resolved.isPresent();
                    row.add(present ? CsvSupport.number(resolved.value()) : null);
                    row.add(present ? resolved.winningSource() : null);
                    row.add(resolved != null ? resolved.confidenceTier().code() : null);
                }
                for (String category : ScoringEngine.CATEGORIES) {
                    row.add(score.map(s -> CsvSupport.number(s.categoryScore(category))).orElse(null));
                }
                row.add(score.map(s -> CsvSupport.number(s.totalScore())).orElse(null));
                row.add(score.map(s -> String.valueOf(s.tier())).orElse(null));
                row.add(score.map(ScoreRecord::tierLabel).orElse(null));
                row.add(score.map(ScoreRecord::rulesetVersion).orElse(null));
                row.add(network.map(NetworkAssignment::networkId).orElse(null));
                row.add(String.valueOf(network.map(NetworkAssignment::isNetworkAnchor).orElse(false)));
                row.add(String.valueOf(org.getLinkedRecordCount()));
                row.add(score.isPresent() ? bibliographyJson(score.get()) : null);
                pw.println(CsvSupport.join(row));
                rows++;
            }
            checkError(pw, file);
        }
        return rows;
    }

    private long writeNetworks(PipelineResult result, Path file) throws IOException {
        List<String> header = new ArrayList<>(List.of("network_id", "network_name", "member_count",
                "member_org_ids", "states", "anchor_org_id", "network_score"));
        header.addAll(ScoringEngine.CATEGORIES);
        header.addAll(List.of("tier", "tier_label", "dominant_segment", "total_site_weight"));

        long rows = 0;
        try (PrintWriter pw = writer(file)) {
            pw.println(CsvSupport.join(header));
            for (Network network : result.networks().networks()) {
                List<String> row = new ArrayList<>(header.size());
                row.add(network.networkId());
                row.add(network.normalizedNetworkName());
                row.add(String.valueOf(network.memberCount()));
                row.add(String.join(";", network.memberOrgIds()));
                row.add(String.join(";", network.stateSet()));
                row.add(network.anchorOrgId());
                row.add(CsvSupport.number(network.networkScore()));
                for (String category : ScoringEngine.CATEGORIES) {
                    row.add(CsvSupport.number(network.categoryScores().get(category)));
                }
                row.add(String.valueOf(network.tier()));
                row.add(network.tierLabel());
                row.add(network.dominantSegment() != null ? network.dominantSegment().name() : null);
                row.add(CsvSupport.number(network.totalSiteWeight()));
                pw.println(CsvSupport.join(row));
                rows++;
            }
            checkError(pw, file);
        }
        return rows;
    }

    private long writeLinks(PipelineResult result, Path file) throws IOException {
        long rows = 0;
        try (PrintWriter pw = writer(file)) {
            pw.println("org_id,source,record_key,link_method,confidence");
            for (LinkEdge edge : result.links()) {
                pw.println(CsvSupport.join(List.of(edge.orgId(), edge.sourceName(), edge.sourceRecordKey(),
                        edge.linkMethod().getCode(), CsvSupport.number(edge.confidence()))));
                rows++;
            }
            checkError(pw, file);
        }
        return rows;
    }

    private long writeRejections(PipelineResult result, Path file) throws IOException {
        long rows = 0;
        try (PrintWriter pw = writer(file)) {
            pw.println("action,source,record_key,org_id,detail");
            for (AuditEntry entry : result.audit()) {
                pw.println(CsvSupport.join(List.of(entry.action().name(), entry.sourceName(), entry.recordKey(),
                        entry.orgId(), entry.detail())));
                rows++;
            }
            checkError(pw, file);
        }
        return rows;
    }

    String bibliographyJson(ScoreRecord score) {
        try {
            return mapper.writeValueAsString(score.bibliography());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize bibliography of " + score.orgId(), e);
        }
    }

    /**
     * Fails unless {@code target} is absent, an empty directory, or a directory holding only
     * files of an earlier export next to its marker.
     */
    static void checkReplaceable(Path target) throws IOException {
        if (!Files.exists(target)) {
            return;
        }
        if (!Files.isDirectory(target)) {
            throw new IOException("Output path is not a directory: " + target);
        }
        List<String> names;
        try (Stream<Path> entries = Files.list(target)) {
            names = entries.map(p -> p.getFileName().toString()).sorted().toList();
        }
        if (names.isEmpty()) {
            return;
        }
        List<String> foreign = names.stream().filter(name -> !OWNED_FILES.contains(name)).toList();
        if (!names.contains(MARKER_FILE) || !foreign.isEmpty()) {
            throw new IOException("Refusing to replace " + target + ": not an output directory of this tool"
                    + (foreign.isEmpty() ? "" : " (found " + String.join(", ", foreign) + ")"));
        }
    }

    /**
     * Replaces {@code target} with {@code staging}. The previous output is kept aside until the
     * new one is in place and restored if the move fails.
     */
    private void publish(Path staging, Path target, String runId) throws IOException {
        Path backup = null;
        if (Files.exists(target)) {
            backup = target.resolveSibling(target.getFileName() + ".previous-" + runId);
            move(target, backup);
        }
        try {
            move(staging, target);
        } catch (IOException e) {
            log.error("export.publish.failed target={} error={}", target, e.getMessage());
            if (backup != null) {
                move(backup, target);
            }
            deleteOwned(staging);
            throw e;
        }
        if (backup != null) {
            try {
                deleteOwned(backup);
            } catch (IOException e) {
                log.warn("export.backup.retained path={} error={}", backup, e.getMessage());
            }
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("export.move.nonatomic from={} to={}", from, to);
            Files.move(from, to);
        }
    }

    /**
     * Deletes the files this exporter writes, then the directory itself. Anything else left
     * inside makes the directory delete fail.
     */
    private static void deleteOwned(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        for (String name : OWNED_FILES) {
            Files.deleteIfExists(dir.resolve(name));
        }
        Files.delete(dir);
    }

    private static PrintWriter writer(Path file) throws IOException {
        return new PrintWriter(new BufferedWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8)));
    }

    private static void checkError(PrintWriter pw, Path file) throws IOException {
        if (pw.checkError()) {
            throw new IOException("Failed writing " + file);
        }
    }
}
