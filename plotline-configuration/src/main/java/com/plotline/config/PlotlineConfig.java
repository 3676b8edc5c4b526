package com.plotline.config;

import com.plotline.data.ColumnRange;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Run configuration: defaults, then {@code plotline.json} (see {@link ConfigurationLoader}),
 * then {@code PLOTLINE_*} environment variables. Relative paths resolve against the working directory.
 */
public final class PlotlineConfig {

    static final String ENV_DATA_PATH = "PLOTLINE_DATA_PATH";
    static final String ENV_REQUIRED_COLUMNS = "PLOTLINE_REQUIRED_COLUMNS";
    static final String ENV_MODULES_ROOT = "PLOTLINE_MODULES_ROOT";
    static final String ENV_OUTPUT_ROOT = "PLOTLINE_OUTPUT_ROOT";
    static final String ENV_REGISTRY_PATH = "PLOTLINE_REGISTRY_PATH";
    static final String ENV_DPI = "PLOTLINE_DPI";
    static final String ENV_CONTINUE_ON_ERROR = "PLOTLINE_CONTINUE_ON_ERROR";
    static final String ENV_ITEM_TIMEOUT_SECONDS = "PLOTLINE_ITEM_TIMEOUT_SECONDS";
    static final String ENV_INCLUDE_REPORTS = "PLOTLINE_INCLUDE_REPORTS";
    static final String ENV_REPORT_EXECUTABLE = "PLOTLINE_REPORT_EXECUTABLE";
    static final String ENV_USE_REGISTRY = "PLOTLINE_USE_REGISTRY";

    public static final String DEFAULT_DATA_PATH = "data/data.csv";
    public static final String DEFAULT_MODULES_ROOT = "modules";
    public static final String DEFAULT_OUTPUT_ROOT = "output";
    public static final String DEFAULT_REGISTRY_PATH = "output/artifact_registry.yaml";
    public static final String DEFAULT_REPORT_TEMPLATES_DIR = "reports";
    public static final String DEFAULT_REPORT_OUTPUT_DIR = "output/reports";
    public static final String DEFAULT_REPORT_EXECUTABLE = "quarto";
    public static final List<String> DEFAULT_REPORT_TEMPLATES =
            List.of("full_analysis_report", "plot_gallery", "data_quality_report");
    public static final int DEFAULT_MIN_ROWS = 10;
    public static final int DEFAULT_DPI = 300;
    public static final int DEFAULT_REPORT_TIMEOUT_SECONDS = 300;
    public static final double DEFAULT_SUCCESS_QUALITY_THRESHOLD = 90.0;
    public static final String DEFAULT_DATA_ARTIFACT_NAME = "raw_data";
    public static final String DEFAULT_PIPELINE_VERSION = "1.0.0";
    public static final String DEFAULT_PIPELINE_NAME = "plotline";

    private final Path dataPath;
    private final List<String> requiredColumns;
    private final List<String> numericColumns;
    private final Map<String, ColumnRange> columnRanges;
    private final int minRows;
    private final Path modulesRoot;
    private final Path outputRoot;
    private final Path registryPath;
    private final boolean useRegistry;
    private final int dpi;
    private final boolean continueOnError;
    private final int itemTimeoutSeconds;
    private final boolean includeReports;
    private final Path reportTemplatesDir;
    private final List<String> reportTemplates;
    private final Path reportOutputDir;
    private final String reportExecutable;
    private final int reportTimeoutSeconds;
    private final String dataArtifactName;
    private final double successQualityThreshold;
    private final String pipelineVersion;
    private final String pipelineName;

    private PlotlineConfig(Builder b) {
        this.dataPath = Objects.requireNonNull(b.dataPath, "dataPath");
        this.requiredColumns = List.copyOf(b.requiredColumns);
        this.numericColumns = List.copyOf(b.numericColumns);
        this.columnRanges = Collections.unmodifiableMap(new LinkedHashMap<>(b.columnRanges));
        this.minRows = Math.max(1, b.minRows);
        this.modulesRoot = Objects.requireNonNull(b.modulesRoot, "modulesRoot");
        this.outputRoot = Objects.requireNonNull(b.outputRoot, "outputRoot");
        this.registryPath = Objects.requireNonNull(b.registryPath, "registryPath");
        this.useRegistry = b.useRegistry;
        if (b.dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive: " + b.dpi);
        }
        this.dpi = b.dpi;
        this.continueOnError = b.continueOnError;
        this.itemTimeoutSeconds = Math.max(0, b.itemTimeoutSeconds);
        this.includeReports = b.includeReports;
        this.reportTemplatesDir = Objects.requireNonNull(b.reportTemplatesDir, "reportTemplatesDir");
        this.reportTemplates = List.copyOf(b.reportTemplates);
        this.reportOutputDir = Objects.requireNonNull(b.reportOutputDir, "reportOutputDir");
        this.reportExecutable = b.reportExecutable;
        this.reportTimeoutSeconds = Math.max(1, b.reportTimeoutSeconds);
        this.dataArtifactName = b.dataArtifactName;
        this.successQualityThreshold = b.successQualityThreshold;
        this.pipelineVersion = b.pipelineVersion;
        this.pipelineName = b.pipelineName;
    }

    public static PlotlineConfig defaults() {
        return builder().build();
    }

    /** Defaults overlaid with the process environment. */
    public static PlotlineConfig fromEnvironment() {
        return defaults().withEnvironment(System.getenv());
    }

    /**
     * Copy with {@code PLOTLINE_*} overrides applied. Blank and unparseable values keep the current setting.
     */
    public PlotlineConfig withEnvironment(Map<String, String> env) {
        if (env == null || env.isEmpty()) return this;
        List<String> required = parseCommaSeparated(env.get(ENV_REQUIRED_COLUMNS));
        return toBuilder()
                .dataPath(getPath(env, ENV_DATA_PATH, dataPath))
                .requiredColumns(required.isEmpty() ? requiredColumns : required)
                .modulesRoot(getPath(env, ENV_MODULES_ROOT, modulesRoot))
                .outputRoot(getPath(env, ENV_OUTPUT_ROOT, outputRoot))
                .registryPath(getPath(env, ENV_REGISTRY_PATH, registryPath))
                .dpi(parseInt(env.get(ENV_DPI), dpi))
                .continueOnError(parseBoolean(env.get(ENV_CONTINUE_ON_ERROR), continueOnError))
                .itemTimeoutSeconds(parseInt(env.get(ENV_ITEM_TIMEOUT_SECONDS), itemTimeoutSeconds))
                .includeReports(parseBoolean(env.get(ENV_INCLUDE_REPORTS), includeReports))
                .reportExecutable(getEnv(env, ENV_REPORT_EXECUTABLE, reportExecutable))
                .useRegistry(parseBoolean(env.get(ENV_USE_REGISTRY), useRegistry))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .dataPath(dataPath)
                .requiredColumns(requiredColumns)
                .numericColumns(numericColumns)
                .columnRanges(columnRanges)
                .minRows(minRows)
                .modulesRoot(modulesRoot)
                .outputRoot(outputRoot)
                .registryPath(registryPath)
                .useRegistry(useRegistry)
                .dpi(dpi)
                .continueOnError(continueOnError)
                .itemTimeoutSeconds(itemTimeoutSeconds)
                .includeReports(includeReports)
                .reportTemplatesDir(reportTemplatesDir)
                .reportTemplates(reportTemplates)
                .reportOutputDir(reportOutputDir)
                .reportExecutable(reportExecutable)
                .reportTimeoutSeconds(reportTimeoutSeconds)
                .dataArtifactName(dataArtifactName)
                .successQualityThreshold(successQualityThreshold)
                .pipelineVersion(pipelineVersion)
                .pipelineName(pipelineName);
    }

    public Path getDataPath() {
        return dataPath;
    }

    public List<String> getRequiredColumns() {
        return requiredColumns;
    }

    public List<String> getNumericColumns() {
        return numericColumns;
    }

    public Map<String, ColumnRange> getColumnRanges() {
        return columnRanges;
    }

    public int getMinRows() {
        return minRows;
    }

    public Path getModulesRoot() {
        return modulesRoot;
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    public boolean isUseRegistry() {
        return useRegistry;
    }

    public int getDpi() {
        return dpi;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public int getItemTimeoutSeconds() {
        return itemTimeoutSeconds;
    }

    /** Per-item time bound, or null when items run unbounded (0 seconds). */
    public Duration getItemTimeout() {
        return itemTimeoutSeconds > 0 ? Duration.ofSeconds(itemTimeoutSeconds) : null;
    }

    public boolean isIncludeReports() {
        return includeReports;
    }

    public Path getReportTemplatesDir() {
        return reportTemplatesDir;
    }

    /** Template base names (without {@code .qmd}) rendered in order. */
    public List<String> getReportTemplates() {
        return reportTemplates;
    }

    public Path getReportOutputDir() {
        return reportOutputDir;
    }

    public String getReportExecutable() {
        return reportExecutable;
    }

    public int getReportTimeoutSeconds() {
        return reportTimeoutSeconds;
    }

    public String getDataArtifactName() {
        return dataArtifactName;
    }

    /** Minimum data quality for an otherwise clean run to count as success. */
    public double getSuccessQualityThreshold() {
        return successQualityThreshold;
    }

    public String getPipelineVersion() {
        return pipelineVersion;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    @Override
    public String toString() {
        return "PlotlineConfig{data=" + dataPath + ", modules=" + modulesRoot + ", output=" + outputRoot
                + ", registry=" + (useRegistry ? registryPath : "disabled") + ", dpi=" + dpi
                + ", continueOnError=" + continueOnError + ", itemTimeoutSeconds=" + itemTimeoutSeconds
                + ", reports=" + (includeReports ? reportTemplates : "disabled") + "}";
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static Path getPath(Map<String, String> env, String key, Path defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? Paths.get(v.trim()) : defaultValue;
    }

    public static final class Builder {
        private Path dataPath = Paths.get(DEFAULT_DATA_PATH);
        private List<String> requiredColumns = List.of();
        private List<String> numericColumns = List.of();
        private Map<String, ColumnRange> columnRanges = Map.of();
        private int minRows = DEFAULT_MIN_ROWS;
        private Path modulesRoot = Paths.get(DEFAULT_MODULES_ROOT);
        private Path outputRoot = Paths.get(DEFAULT_OUTPUT_ROOT);
        private Path registryPath = Paths.get(DEFAULT_REGISTRY_PATH);
        private boolean useRegistry = true;
        private int dpi = DEFAULT_DPI;
        private boolean continueOnError = true;
        private int itemTimeoutSeconds;
        private boolean includeReports = true;
        private Path reportTemplatesDir = Paths.get(DEFAULT_REPORT_TEMPLATES_DIR);
        private List<String> reportTemplates = DEFAULT_REPORT_TEMPLATES;
        private Path reportOutputDir = Paths.get(DEFAULT_REPORT_OUTPUT_DIR);
        private String reportExecutable = DEFAULT_REPORT_EXECUTABLE;
        private int reportTimeoutSeconds = DEFAULT_REPORT_TIMEOUT_SECONDS;
        private String dataArtifactName = DEFAULT_DATA_ARTIFACT_NAME;
        private double successQualityThreshold = DEFAULT_SUCCESS_QUALITY_THRESHOLD;
        private String pipelineVersion = DEFAULT_PIPELINE_VERSION;
        private String pipelineName = DEFAULT_PIPELINE_NAME;

        public Builder dataPath(Path dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder requiredColumns(List<String> requiredColumns) {
            this.requiredColumns = requiredColumns != null ? new ArrayList<>(requiredColumns) : List.of();
            return this;
        }

        public Builder numericColumns(List<String> numericColumns) {
            this.numericColumns = numericColumns != null ? new ArrayList<>(numericColumns) : List.of();
            return this;
        }

        public Builder columnRanges(Map<String, ColumnRange> columnRanges) {
            this.columnRanges = columnRanges != null ? new LinkedHashMap<>(columnRanges) : Map.of();
            return this;
        }

        public Builder minRows(int minRows) {
            this.minRows = minRows;
            return this;
        }

        public Builder modulesRoot(Path modulesRoot) {
            this.modulesRoot = modulesRoot;
            return this;
        }

        public Builder outputRoot(Path outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder registryPath(Path registryPath) {
            this.registryPath = registryPath;
            return this;
        }

        public Builder useRegistry(boolean useRegistry) {
            this.useRegistry = useRegistry;
            return this;
        }

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder itemTimeoutSeconds(int itemTimeoutSeconds) {
            this.itemTimeoutSeconds = itemTimeoutSeconds;
            return this;
        }

        public Builder includeReports(boolean includeReports) {
            this.includeReports = includeReports;
            return this;
        }

        public Builder reportTemplatesDir(Path reportTemplatesDir) {
            this.reportTemplatesDir = reportTemplatesDir;
            return this;
        }

        public Builder reportTemplates(List<String> reportTemplates) {
            this.reportTemplates = reportTemplates != null ? new ArrayList<>(reportTemplates) : List.of();
            return this;
        }

        public Builder reportOutputDir(Path reportOutputDir) {
            this.reportOutputDir = reportOutputDir;
            return this;
        }

        public Builder reportExecutable(String reportExecutable) {
            this.reportExecutable = reportExecutable;
            return this;
        }

        public Builder reportTimeoutSeconds(int reportTimeoutSeconds) {
            this.reportTimeoutSeconds = reportTimeoutSeconds;
            return this;
        }

        public Builder dataArtifactName(String dataArtifactName) {
            this.dataArtifactName = dataArtifactName;
            return this;
        }

        public Builder successQualityThreshold(double successQualityThreshold) {
            this.successQualityThreshold = successQualityThreshold;
            return this;
        }

        public Builder pipelineVersion(String pipelineVersion) {
            this.pipelineVersion = pipelineVersion;
            return this;
        }

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName;
            return this;
        }

        public PlotlineConfig build() {
            return new PlotlineConfig(this);
        }
    }
}
