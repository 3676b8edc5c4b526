package com.plotline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Builds a {@link PlotlineConfig} from defaults, a JSON file and the environment, in that order.
 * A missing file means defaults; a file that cannot be parsed is an error.
 */
public final class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "plotline.json";

    private final ObjectMapper mapper;

    public ConfigurationLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /** File layer over defaults, without environment overrides. */
    public PlotlineConfig load(Path file) {
        return applyFile(PlotlineConfig.builder(), file).build();
    }

    /**
     * Defaults, then {@code file}, then {@code env}.
     *
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    public PlotlineConfig load(Path file, Map<String, String> env) {
        PlotlineConfig config = load(file).withEnvironment(env);
        log.info("Configuration: {}", config);
        return config;
    }

    private PlotlineConfig.Builder applyFile(PlotlineConfig.Builder b, Path file) {
        if (file == null || !Files.exists(file)) {
            log.info("No configuration file at {}; using defaults", file);
            return b;
        }
        ConfigFile f;
        try {
            f = mapper.readValue(file.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + file + ": " + e.getMessage(), file, e);
        }
        if (f == null) return b;
        if (f.dataPath() != null) b.dataPath(Paths.get(f.dataPath()));
        if (f.requiredColumns() != null) b.requiredColumns(f.requiredColumns());
        if (f.numericColumns() != null) b.numericColumns(f.numericColumns());
        if (f.columnRanges() != null) b.columnRanges(f.columnRanges());
        if (f.minRows() != null) b.minRows(f.minRows());
        if (f.modulesRoot() != null) b.modulesRoot(Paths.get(f.modulesRoot()));
        if (f.outputRoot() != null) b.outputRoot(Paths.get(f.outputRoot()));
        if (f.registryPath() != null) b.registryPath(Paths.get(f.registryPath()));
        if (f.useRegistry() != null) b.useRegistry(f.useRegistry());
        if (f.dpi() != null) b.dpi(f.dpi());
        if (f.continueOnError() != null) b.continueOnError(f.continueOnError());
        if (f.itemTimeoutSeconds() != null) b.itemTimeoutSeconds(f.itemTimeoutSeconds());
        if (f.includeReports() != null) b.includeReports(f.includeReports());
        if (f.reportTemplatesDir() != null) b.reportTemplatesDir(Paths.get(f.reportTemplatesDir()));
        if (f.reportTemplates() != null) b.reportTemplates(f.reportTemplates());
        if (f.reportOutputDir() != null) b.reportOutputDir(Paths.get(f.reportOutputDir()));
        if (f.reportExecutable() != null) b.reportExecutable(f.reportExecutable());
        if (f.reportTimeoutSeconds() != null) b.reportTimeoutSeconds(f.reportTimeoutSeconds());
        if (f.dataArtifactName() != null) b.dataArtifactName(f.dataArtifactName());
        if (f.successQualityThreshold() != null) b.successQualityThreshold(f.successQualityThreshold());
        if (f.pipelineVersion() != null) b.pipelineVersion(f.pipelineVersion());
        if (f.pipelineName() != null) b.pipelineName(f.pipelineName());
        log.debug("Applied configuration file {}", file);
        return b;
    }
}
