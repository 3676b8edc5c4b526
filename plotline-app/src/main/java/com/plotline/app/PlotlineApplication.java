package com.plotline.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.plotline.config.ConfigurationException;
import com.plotline.config.ConfigurationLoader;
import com.plotline.config.PlotlineConfig;
import com.plotline.engine.PipelineDriver;
import com.plotline.engine.PipelineListener;
import com.plotline.features.metrics.MetricsPipelineListener;
import com.plotline.registry.ArtifactType;
import com.plotline.registry.CleanupResult;
import com.plotline.registry.RegistryIoException;
import com.plotline.registry.RegistryMaintenance;
import com.plotline.registry.RegistryValidationReport;
import com.plotline.result.Result;
import com.plotline.result.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 * <pre>
 *   run [config.json]
 *   cleanup &lt;type&gt; &lt;keepCount&gt; [--dry-run] [config.json]
 *   validate [--check-hashes] [config.json]
 * </pre>
 * The configuration file defaults to {@code plotline.json} in the working directory.
 */
public final class PlotlineApplication {

    private static final Logger log = LoggerFactory.getLogger(PlotlineApplication.class);

    static final String USAGE = "Usage: plotline run [config.json]"
            + " | cleanup <raw_data|plot|report|serialized_object> <keepCount> [--dry-run] [config.json]"
            + " | validate [--check-hashes] [config.json]";

    private PlotlineApplication() {
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.getenv()));
    }

    /** Runs one command and returns the process exit code. */
    static int execute(String[] args, Map<String, String> env) {
        if (args.length == 0) {
            log.error(USAGE);
            return ExitCodes.USAGE;
        }
        List<String> rest = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
        try {
            switch (args[0]) {
                case "run":
                    return run(rest, env);
                case "cleanup":
                    return cleanup(rest, env);
                case "validate":
                    return validate(rest, env);
                default:
                    log.error("Unknown command '{}'. {}", args[0], USAGE);
                    return ExitCodes.USAGE;
            }
        } catch (ConfigurationException e) {
            log.error("Configuration error in {}: {}", e.getSource(), e.getMessage());
            return ExitCodes.FAILED;
        } catch (RegistryIoException e) {
            log.error("Registry error at {}: {}", e.getPath(), e.getMessage(), e);
            return ExitCodes.FAILED;
        }
    }

    private static int run(List<String> args, Map<String, String> env) {
        if (args.size() > 1) {
            log.error(USAGE);
            return ExitCodes.USAGE;
        }
        PlotlineConfig config = PlotlineBootstrap.loadConfig(configPath(args), env);
        MetricsPipelineListener metrics = new MetricsPipelineListener();
        PipelineListener listener = PipelineListener.composite(List.of(new LoggingPipelineListener(), metrics));
        PipelineDriver driver = PlotlineBootstrap.createDriver(config, PlotlineBootstrap.createCatalog(), listener);

        Result result = driver.run();
        Map<String, Object> meters = metrics.snapshot();
        meters.forEach((meter, value) -> log.info("Metric {} = {}", meter, value));
        result.putAttribute("metrics", meters);
        writeSummary(config, result);
        if (result.getStatus() == ResultStatus.PARTIAL) {
            log.warn("Run finished with status partial: {} ({} error(s), {} warning(s))", result.getMessage(),
                    result.getErrors().size(), result.getWarnings().size());
        } else if (result.getStatus() == ResultStatus.FAILED) {
            log.error("Run failed: {}", result.getMessage());
            result.getErrors().forEach(e -> log.error("  {}", e));
        } else {
            log.info("Run succeeded: {}", result.getMessage());
        }
        return ExitCodes.forStatus(result.getStatus());
    }

    private static int cleanup(List<String> args, Map<String, String> env) {
        boolean dryRun = args.remove("--dry-run");
        if (args.size() < 2 || args.size() > 3) {
            log.error(USAGE);
            return ExitCodes.USAGE;
        }
        ArtifactType type;
        int keep;
        try {
            type = ArtifactType.fromValue(args.get(0));
            keep = Integer.parseInt(args.get(1));
        } catch (IllegalArgumentException e) {
            log.error("Invalid cleanup arguments {}: {}. {}", args, e.getMessage(), USAGE);
            return ExitCodes.USAGE;
        }
        if (keep < 0) {
            log.error("keepCount must not be negative: {}", keep);
            return ExitCodes.USAGE;
        }
        PlotlineConfig config = PlotlineBootstrap.loadConfig(configPath(args.subList(2, args.size())), env);
        RegistryMaintenance maintenance = new RegistryMaintenance(PlotlineBootstrap.createStore(config), config.getRegistryPath());
        CleanupResult result = maintenance.cleanup(type, keep, dryRun);
        log.info("{}Cleanup of {}: {} artifact(s), {} bytes; kept groups {}", dryRun ? "[dry run] " : "",
                type.getValue(), result.deletedCount(), result.freedBytes(), result.retainedGroups());
        result.failures().forEach(f -> log.warn("  {}", f));
        return ExitCodes.SUCCESS;
    }

    private static int validate(List<String> args, Map<String, String> env) {
        boolean checkHashes = args.remove("--check-hashes");
        if (args.size() > 1) {
            log.error(USAGE);
            return ExitCodes.USAGE;
        }
        PlotlineConfig config = PlotlineBootstrap.loadConfig(configPath(args), env);
        RegistryMaintenance maintenance = new RegistryMaintenance(PlotlineBootstrap.createStore(config), config.getRegistryPath());
        RegistryValidationReport report = maintenance.validate(List.of(ArtifactType.RAW_DATA, ArtifactType.PLOT), checkHashes);
        report.errors().forEach(e -> log.error("  {}", e));
        report.warnings().forEach(w -> log.warn("  {}", w));
        log.info("Registry {} is {}", config.getRegistryPath(), report.valid() ? "valid" : "invalid");
        return report.valid() ? ExitCodes.SUCCESS : ExitCodes.FAILED;
    }

    private static Path configPath(List<String> args) {
        return args.isEmpty() ? Paths.get(ConfigurationLoader.DEFAULT_CONFIG_FILE) : Paths.get(args.get(0));
    }

    /**
     * Writes {@code run_summary_<runId>.json} next to the run's outputs, including the run's meter
     * values; failure is logged only.
     */
    static Path writeSummary(PlotlineConfig config, Result result) {
        Object runId = result.getAttributes().get("run_id");
        Path file = config.getOutputRoot().resolve("run_summary_" + runId + ".json");
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            mapper.writeValue(file.toFile(), result);
            log.info("Run summary written to {}", file);
            return file;
        } catch (IOException e) {
            log.warn("Run summary not written to {}: {}", file, e.getMessage(), e);
            return null;
        }
    }
}
