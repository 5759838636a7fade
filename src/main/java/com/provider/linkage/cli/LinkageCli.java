package com.provider.linkage.cli;

import com.provider.linkage.bulk.CsvTableExporter;
import com.provider.linkage.bulk.ExportResult;
import com.provider.linkage.config.ConfigLoader;
import com.provider.linkage.config.ConfigurationException;
import com.provider.linkage.config.LinkageConfig;
import com.provider.linkage.metrics.MicrometerPipelineMetrics;
import com.provider.linkage.pipeline.LinkagePipeline;
import com.provider.linkage.pipeline.PipelineInput;
import com.provider.linkage.pipeline.PipelineInputLoader;
import com.provider.linkage.pipeline.PipelineOptions;
import com.provider.linkage.pipeline.PipelineResult;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Batch entry point.
 *
 * <pre>
 * LinkageCli [--config &lt;dir&gt;] --input &lt;dir&gt; --output &lt;dir&gt; [--parallelism N]
 * </pre>
 *
 * <p>Exit codes: {@value #EXIT_OK} success, {@value #EXIT_IO} input or output failure,
 * {@value #EXIT_CONFIG} configuration error, {@value #EXIT_USAGE} usage error.</p>
 */
public final class LinkageCli {
    private static final Logger log = LoggerFactory.getLogger(LinkageCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO = 1;
    public static final int EXIT_CONFIG = 2;
    public static final int EXIT_USAGE = 64;

    private static final Set<String> KNOWN_OPTIONS = Set.of("config", "input", "output", "parallelism");

    private final PrintStream out;
    private final PrintStream err;

    public LinkageCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new LinkageCli(System.out, System.err).run(args));
    }

    /**
     * Runs the whole batch and returns the process exit code.
     */
    public int run(String[] args) {
        Map<String, String> options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (options.containsKey("help")) {
            printUsage(out);
            return EXIT_OK;
        }
        if (!options.containsKey("input") || !options.containsKey("output")) {
            err.println("--input and --output are required");
            printUsage(err);
            return EXIT_USAGE;
        }

        LinkageConfig config;
        PipelineOptions pipelineOptions;
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try {
            ConfigLoader loader = new ConfigLoader();
            config = options.containsKey("config")
                    ? loader.load(Path.of(options.get("config")))
                    : loader.loadDefaults();
            PipelineOptions.Builder builder = PipelineOptions.from(config.pipeline())
                    .metrics(new MicrometerPipelineMetrics(registry));
            if (options.containsKey("parallelism")) {
                builder.parallelism(parseParallelism(options.get("parallelism")));
            }
            pipelineOptions = builder.build();
        } catch (ConfigurationException e) {
            log.error("cli.config.failed error={}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        Path inputDir = Path.of(options.get("input"));
        Path outputDir = Path.of(options.get("output"));
        if (!Files.isDirectory(inputDir)) {
            log.error("cli.input.missing inputDir={}", inputDir);
            err.println("Input directory not found: " + inputDir);
            return EXIT_IO;
        }
        try {
            Path clash = overlapping(outputDir, inputDir,
                    options.containsKey("config") ? Path.of(options.get("config")) : null);
            if (clash != null) {
                log.error("cli.output.overlap outputDir={} protectedDir={}", outputDir, clash);
                err.println("--output must not be, or contain, the input or config directory: " + clash);
                printUsage(err);
                return EXIT_USAGE;
            }
        } catch (IOException e) {
            log.error("cli.path.failed error={}", e.getMessage(), e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }

        try {
            PipelineInput input = new PipelineInputLoader(config.pipeline()).load(inputDir, null);
            PipelineResult result = new LinkagePipeline(config, pipelineOptions).run(input);
            ExportResult exported = new CsvTableExporter().export(result, outputDir, null);
            out.print(result.report().summary());
            out.println("Output written to " + exported.outputDir());
            logMeters(registry);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("cli.io.failed error={}", e.getMessage(), e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        } finally {
            registry.close();
        }
    }

    /**
     * Returns the first of {@code protectedDirs} that {@code outputDir} equals or contains, after
     * resolving symbolic links, or {@code null} when none does.
     */
    static Path overlapping(Path outputDir, Path... protectedDirs) throws IOException {
        Path output = canonical(outputDir);
        for (Path dir : protectedDirs) {
            if (dir != null && canonical(dir).startsWith(output)) {
                return dir;
            }
        }
        return null;
    }

    private static Path canonical(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        return Files.exists(absolute) ? absolute.toRealPath() : absolute;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--help") || arg.equals("-h")) {
                options.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String key = arg.substring(2);
            if (!KNOWN_OPTIONS.contains(key)) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
            if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            options.put(key, args[++i]);
        }
        return options;
    }

    private static int parseParallelism(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--parallelism must be a number: " + value, e);
        }
    }

    private static void logMeters(SimpleMeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            log.debug("cli.meter name={} tags={} values={}", meter.getId().getName(), meter.getId().getTags(),
                    meter.measure());
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: LinkageCli [--config <dir>] --input <dir> --output <dir> [--parallelism N]");
        stream.println("  --config       Directory with pipeline.json, priorities.json, scoring.json (bundled defaults when absent)");
        stream.println("  --input        Directory holding the input files named in pipeline.json");
        stream.println("  --output       Directory to publish organizations.csv, networks.csv, links.csv, rejections.csv");
        stream.println("  --parallelism  Worker threads, overrides pipeline.json");
    }
}
