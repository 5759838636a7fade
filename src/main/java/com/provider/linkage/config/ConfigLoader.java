package com.provider.linkage.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provider.linkage.aggregate.SourcePriorityTable;
import com.provider.linkage.scoring.ScoringRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and validates {@code pipeline.json}, {@code priorities.json} and {@code scoring.json}.
 *
 * <p>Files present in the config directory override the defaults bundled on the classpath.
 * Every problem surfaces as a {@link ConfigurationException} before any input record is read.</p>
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String PIPELINE_FILE = "pipeline.json";
    public static final String PRIORITIES_FILE = "priorities.json";
    public static final String SCORING_FILE = "scoring.json";

    static final String DEFAULT_PIPELINE = "/default-pipeline.json";
    static final String DEFAULT_PRIORITIES = "/default-priorities.json";
    static final String DEFAULT_SCORING = "/default-scoring.json";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * Loads the bundled defaults.
     */
    public LinkageConfig loadDefaults() {
        return load(null);
    }

    /**
     * Loads configuration from {@code configDir}, falling back to the bundled default for any
     * file the directory does not contain.
     *
     * @param configDir directory holding overrides, or {@code null} for defaults only
     * @throws ConfigurationException if a file is unreadable or fails validation
     */
    public LinkageConfig load(Path configDir) {
        if (configDir != null && !Files.isDirectory(configDir)) {
            throw new ConfigurationException("Config directory does not exist: " + configDir);
        }
        PipelineConfig pipeline = read(configDir, PIPELINE_FILE, DEFAULT_PIPELINE, PipelineConfig.class);
        PriorityConfig priorityConfig = read(configDir, PRIORITIES_FILE, DEFAULT_PRIORITIES, PriorityConfig.class);
        ScoringRules scoring = read(configDir, SCORING_FILE, DEFAULT_SCORING, ScoringRules.class);

        SourcePriorityTable priorities = priorityConfig.toTable();
        validate(pipeline, priorities, scoring);
        log.info("config.loaded dir={} rulesetVersion={} sources={} metricFiles={}",
                configDir, scoring.version(), priorities.getSources().size(), pipeline.metricSources().size());
        return new LinkageConfig(pipeline, priorities, scoring);
    }

    private void validate(PipelineConfig pipeline, SourcePriorityTable priorities, ScoringRules scoring) {
        if (!priorities.getVersion().equals(scoring.version())) {
            throw new ConfigurationException("Priority table version " + priorities.getVersion()
                    + " does not match scoring ruleset version " + scoring.version());
        }
        for (PipelineConfig.MetricSource source : pipeline.metricSources()) {
            if (!priorities.getSources().containsKey(source.source())) {
                throw new ConfigurationException("Unknown source '" + source.source()
                        + "' for metric file " + source.file());
            }
        }
        try {
            scoring.tierTable();
            pipeline.toFuzzyMatchOptions();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private <T> T read(Path configDir, String fileName, String defaultResource, Class<T> type) {
        if (configDir != null) {
            Path file = configDir.resolve(fileName);
            if (Files.exists(file)) {
                try (InputStream in = Files.newInputStream(file)) {
                    return parse(in, file.toString(), type);
                } catch (IOException e) {
                    throw new ConfigurationException("Cannot read " + file + ": " + e.getMessage(), e);
                }
            }
        }
        try (InputStream in = ConfigLoader.class.getResourceAsStream(defaultResource)) {
            if (in == null) {
                throw new ConfigurationException("Missing bundled default " + defaultResource);
            }
            return parse(in, defaultResource, type);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + defaultResource + ": " + e.getMessage(), e);
        }
    }

    private <T> T parse(InputStream in, String origin, Class<T> type) throws IOException {
        T value = mapper.readValue(in, type);
        if (value == null) {
            throw new ConfigurationException(origin + " is empty");
        }
        log.debug("config.parsed origin={} type={}", origin, type.getSimpleName());
        return value;
    }

    ObjectMapper getMapper() {
        return mapper;
    }
}
