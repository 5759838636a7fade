package com.provider.linkage.pipeline;

import com.provider.linkage.bulk.CrosswalkReader;
import com.provider.linkage.bulk.IdentityRecordReader;
import com.provider.linkage.bulk.MetricRecordReader;
import com.provider.linkage.bulk.ProgressCallback;
import com.provider.linkage.bulk.ReadResult;
import com.provider.linkage.config.PipelineConfig;
import com.provider.linkage.core.model.IdentityRecord;
import com.provider.linkage.core.model.MetricRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads every file named in {@code pipeline.json} from an input directory.
 */
public class PipelineInputLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineInputLoader.class);

    /**
     * Gap between the source orders of consecutive registry files; larger than any snapshot.
     */
    static final long SOURCE_ORDER_STRIDE = 1_000_000_000L;

    private final PipelineConfig config;

    public PipelineInputLoader(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    /**
     * @throws IOException if a configured file is missing or cannot be read
     */
    public PipelineInput load(Path inputDir, ProgressCallback callback) throws IOException {
        PipelineInput.Builder input = PipelineInput.builder();

        long startOrder = 0;
        for (PipelineConfig.IdentitySource source : config.identitySources()) {
            ReadResult<IdentityRecord> result = new IdentityRecordReader(source.source(), startOrder)
                    .read(resolve(inputDir, source.file()), callback);
            input.identityRecords(result.records()).readRejections(result.rejections());
            startOrder += SOURCE_ORDER_STRIDE;
        }

        for (PipelineConfig.CrosswalkSource source : config.crosswalks()) {
            CrosswalkReader reader = new CrosswalkReader(source.keySpace());
            ReadResult<CrosswalkReader.Pair> result = reader.read(resolve(inputDir, source.file()), callback);
            input.crosswalk(reader.toTable(result)).readRejections(result.rejections());
        }

        for (PipelineConfig.MetricSource source : config.metricSources()) {
            ReadResult<MetricRecord> result = new MetricRecordReader(source.source())
                    .read(resolve(inputDir, source.file()), callback);
            input.metricRecords(result.records()).readRejections(result.rejections());
        }

        PipelineInput loaded = input.build();
        log.info("input.loaded identityRecords={} crosswalks={} metricRecords={} rejected={}",
                loaded.identityRecords().size(), loaded.crosswalks().size(),
                loaded.metricRecords().size(), loaded.readRejections().size());
        return loaded;
    }

    private static Path resolve(Path inputDir, String file) throws IOException {
        Path path = inputDir.resolve(file);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return path;
    }
}
