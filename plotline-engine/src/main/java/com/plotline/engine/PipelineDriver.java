package com.plotline.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.plotline.config.PlotlineConfig;
import com.plotline.data.DataLoadResult;
import com.plotline.data.DataLoader;
import com.plotline.module.PlotResult;
import com.plotline.registry.Artifact;
import com.plotline.registry.ArtifactRequest;
import com.plotline.registry.ArtifactType;
import com.plotline.registry.RegistrySession;
import com.plotline.report.ReportRenderer;
import com.plotline.result.ErrorKind;
import com.plotline.result.Result;
import com.plotline.result.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one pipeline pass: load data, generate plots through the {@link BatchOrchestrator},
 * render reports, register every produced artifact and return the run's {@link Result}.
 * <p>
 * Only a failed data load, or a run that produces no item at all, fails the run. Module, item,
 * registry and report problems are recorded on the result and degrade it to partial.
 * <p>
 * Files of a run live under {@code <outputRoot>/<runId>/}: the data snapshot and one directory per
 * module. Registry cleanup can then drop a generation group without touching another one.
 */
public final class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    public static final String PHASE_DATA_LOAD = "data_load";
    public static final String PHASE_PLOT_GENERATION = "plot_generation";
    public static final String PHASE_REPORTING = "reporting";
    public static final String PHASE_REGISTRY = "registry";

    static final String WORKFLOW_DATA = "data_load";
    static final String WORKFLOW_REPORTING = "reporting";
    static final String WORKFLOW_PLOT_RESULTS = "plot_generation";

    private final PlotlineConfig config;
    private final DataLoader dataLoader;
    private final BatchOrchestrator orchestrator;
    private final RegistrySession registry;
    private final ReportRenderer reportRenderer;
    private final PipelineListener listener;
    private final Supplier<String> runIds;
    private final ObjectMapper mapper;

    private PipelineState state = PipelineState.INITIALIZED;

    private PipelineDriver(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.dataLoader = Objects.requireNonNull(b.dataLoader, "dataLoader");
        this.orchestrator = Objects.requireNonNull(b.orchestrator, "orchestrator");
        this.registry = b.registry != null ? b.registry : RegistrySession.inMemory(config.getPipelineVersion());
        this.reportRenderer = b.reportRenderer;
        this.listener = b.listener != null ? b.listener : PipelineListener.noOp();
        this.runIds = b.runIds != null ? b.runIds : RunIds::next;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Directory holding the data snapshot and module outputs of {@code runId}. */
    public static Path runDirectory(Path outputRoot, String runId) {
        return outputRoot.resolve(runId);
    }

    /** Current state; {@link PipelineState#INITIALIZED} until {@link #run()} is called. */
    public PipelineState getState() {
        return state;
    }

    public RegistrySession getRegistry() {
        return registry;
    }

    /**
     * Runs the pipeline once. Never throws for pipeline conditions; the returned result carries
     * every error and warning encountered.
     *
     * @throws IllegalStateException if this driver already ran
     */
    public Result run() {
        if (state != PipelineState.INITIALIZED) {
            throw new IllegalStateException("Pipeline driver already used; state=" + state.toValue());
        }
        String runId = runIds.get();
        Result result = Result.create(config.getPipelineName());
        result.putAttribute("run_id", runId);
        result.putAttribute("pipeline_version", config.getPipelineVersion());
        log.info("Pipeline {} run {} started", config.getPipelineName(), runId);
        listener.onRunStarted(runId);

        DataLoadResult data = loadData(result);
        if (data.getStatus() == ResultStatus.FAILED) {
            return fail(result, "Data load failed: " + data.getMessage());
        }
        moveTo(PipelineState.DATA_LOADED);
        String dataArtifact = registerData(result, data, runId);

        BatchResult batch = generatePlots(result, data, runId);
        List<String> plotArtifacts = registerPlots(batch, dataArtifact, runId);
        registerPlotResults(batch, plotArtifacts, runId);
        double overall = QualityScores.overall(data.getQualityScore(), batch.getQualityScore());
        result.setQualityScore(overall);
        result.putAttribute("data_quality", data.getQualityScore());
        result.putAttribute("plot_quality", batch.getQualityScore());
        if (batch.getPlotsGenerated() == 0) {
            result.addError(ErrorKind.ITEM_GENERATION.format("No plots were generated"));
            return fail(result, "Pipeline failed: no plots generated");
        }
        moveTo(PipelineState.PLOTS_GENERATED);
        applyRunStatus(result, data, batch);

        renderReports(result, dataArtifact, runId);
        moveTo(PipelineState.REPORTS_RENDERED);

        finishRegistry(result);
        moveTo(PipelineState.FINALIZED);
        result.finish();
        log.info("Pipeline {} run {} finished: {} (quality {}, {} error(s), {} warning(s))",
                config.getPipelineName(), runId, result.getStatus().toValue(), overall,
                result.getErrors().size(), result.getWarnings().size());
        listener.onRunFinished(result);
        return result;
    }

    private DataLoadResult loadData(Result result) {
        long start = System.nanoTime();
        Path path = config.getDataPath();
        DataLoadResult data;
        try {
            data = dataLoader.load(path, config.getRequiredColumns());
            if (data == null) {
                data = DataLoadResult.failed(path.toString(), "Data loader returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Data loader raised for {}", path, e);
            data = DataLoadResult.failed(path.toString(), e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
        result.putPhaseResult(PHASE_DATA_LOAD, data);
        for (String w : data.getWarnings()) {
            result.addWarning(ErrorKind.DATA_LOAD.format(w));
        }
        if (data.getStatus() == ResultStatus.FAILED) {
            if (data.getErrors().isEmpty()) {
                result.addError(ErrorKind.DATA_LOAD.format(data.getMessage()));
            }
            for (String e : data.getErrors()) {
                result.addError(ErrorKind.DATA_LOAD.format(e));
            }
            log.error("Data load failed for {}: {}", path, data.getMessage());
        } else {
            log.info("Data loaded from {}: {} rows, {} columns, quality {}", path, data.getRowCount(),
                    data.getColumnCount(), data.getQualityScore());
        }
        listener.onPhaseCompleted(PHASE_DATA_LOAD, data.getStatus().toValue(), millisSince(start));
        return data;
    }

    private BatchResult generatePlots(Result result, DataLoadResult data, String runId) {
        BatchOptions options = BatchOptions.builder()
                .dpi(config.getDpi())
                .continueOnError(config.isContinueOnError())
                .itemTimeout(config.getItemTimeout())
                .runId(runId)
                .listener(listener)
                .build();
        BatchResult batch = orchestrator.orchestrate(data.getData(), config.getModulesRoot(),
                runDirectory(config.getOutputRoot(), runId), options);
        result.putPhaseResult(PHASE_PLOT_GENERATION, batch);
        for (String e : batch.getErrors()) {
            result.addRecoverableError(e);
        }
        for (String w : batch.getWarnings()) {
            result.addWarning(w);
        }
        listener.onPhaseCompleted(PHASE_PLOT_GENERATION, batch.getStatus().toValue(), batch.getDurationMillis());
        return batch;
    }

    private void applyRunStatus(Result result, DataLoadResult data, BatchResult batch) {
        boolean clean = batch.getStatus() == ResultStatus.SUCCESS
                && data.getStatus() == ResultStatus.SUCCESS
                && data.getQualityScore() >= config.getSuccessQualityThreshold();
        if (clean) {
            result.setStatus(ResultStatus.SUCCESS, "Pipeline complete: " + batch.getPlotsGenerated() + " plots generated");
        } else {
            result.setStatus(ResultStatus.PARTIAL, "Pipeline partial: " + batch.getPlotsGenerated() + " plots generated, "
                    + batch.getPlotsFailed() + " failed, " + batch.getModulesFailed() + " module(s) failed");
        }
    }

    private void renderReports(Result result, String dataArtifact, String runId) {
        long start = System.nanoTime();
        ReportPhaseResult phase;
        if (!config.isIncludeReports()) {
            phase = ReportPhaseResult.skipped("Reports disabled");
        } else {
            phase = new ReportStage(reportRenderer, config.getReportTemplatesDir(), config.getReportTemplates(),
                    config.getReportOutputDir()).run();
        }
        if (ReportPhaseResult.UNAVAILABLE.equals(phase.status())) {
            result.addWarning(ErrorKind.REPORT_RENDER.format(phase.message() + "; reports skipped"));
        }
        for (ReportOutcome outcome : phase.reports()) {
            if (outcome.isRendered()) {
                registry.register(ArtifactRequest.builder(outcome.name(), ArtifactType.REPORT, Path.of(outcome.outputPath()))
                        .workflow(WORKFLOW_REPORTING)
                        .input(dataArtifact)
                        .metadata("format", "HTML")
                        .metadata("template", outcome.template())
                        .runId(runId)
                        .build());
            } else {
                result.addWarning(ErrorKind.REPORT_RENDER.format("Report " + outcome.name() + " failed: " + outcome.error()));
                result.setStatus(ResultStatus.PARTIAL, result.getMessage());
            }
        }
        result.putPhaseResult(PHASE_REPORTING, phase);
        listener.onPhaseCompleted(PHASE_REPORTING, phase.status(), millisSince(start));
    }

    /**
     * Registers a per-run copy of the source data, never the source file itself, so cleanup of
     * raw data cannot delete the user's input.
     */
    private String registerData(Result result, DataLoadResult data, String runId) {
        String name = config.getDataArtifactName();
        Path source = config.getDataPath();
        Path snapshot = runDirectory(config.getOutputRoot(), runId).resolve(source.getFileName());
        try {
            Files.createDirectories(snapshot.toAbsolutePath().getParent());
            Files.copy(source, snapshot, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Data snapshot not written to {}; execution continues", snapshot, e);
            result.addWarning(ErrorKind.REGISTRY_IO.format("Data snapshot not written: " + e.getMessage()));
            return name;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rows", data.getRowCount());
        metadata.put("columns", data.getColumnCount());
        metadata.put("quality_score", data.getQualityScore());
        metadata.put("source", source.toAbsolutePath().toString());
        registry.register(ArtifactRequest.builder(name, ArtifactType.RAW_DATA, snapshot)
                .workflow(WORKFLOW_DATA)
                .metadata(metadata)
                .dataHash(data.getData().contentHash())
                .runId(runId)
                .build());
        return name;
    }

    private List<String> registerPlots(BatchResult batch, String dataArtifact, String runId) {
        List<String> names = new ArrayList<>();
        for (ModuleBatchResult module : batch.getModules().values()) {
            for (PlotResult item : module.getItems().values()) {
                if (!item.isGenerated() || item.getOutputPath() == null) continue;
                String name = module.getModuleName() + "/" + item.getItemId() + "@" + runId;
                Artifact artifact = registry.register(ArtifactRequest.builder(name, ArtifactType.PLOT, Path.of(item.getOutputPath()))
                        .workflow(module.getModuleName())
                        .input(dataArtifact)
                        .metadata("module", module.getModuleName())
                        .metadata("item_id", item.getItemId())
                        .metadata("status", item.getStatus().toValue())
                        .metadata("quality_score", item.getQualityScore())
                        .metadata("dpi", config.getDpi())
                        .runId(runId)
                        .build());
                if (artifact != null) names.add(name);
            }
        }
        return names;
    }

    /** Writes {@code plot_results_<runId>.json} and registers it as a serialized object. */
    private void registerPlotResults(BatchResult batch, List<String> plotArtifacts, String runId) {
        Path file = config.getOutputRoot().resolve("plot_results_" + runId + ".json");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            mapper.writeValue(file.toFile(), batch);
        } catch (IOException e) {
            log.warn("Plot results not written to {}; execution continues", file, e);
            return;
        }
        registry.register(ArtifactRequest.builder("plot_results_" + runId, ArtifactType.SERIALIZED_OBJECT, file)
                .workflow(WORKFLOW_PLOT_RESULTS)
                .inputs(plotArtifacts)
                .metadata("format", "JSON")
                .metadata("plots_generated", batch.getPlotsGenerated())
                .metadata("plots_failed", batch.getPlotsFailed())
                .runId(runId)
                .build());
    }

    private void finishRegistry(Result result) {
        registry.persist();
        Map<String, Object> phase = new LinkedHashMap<>();
        phase.put("path", registry.getPath() != null ? registry.getPath().toString() : null);
        phase.put("registered", registry.getRegisteredCount());
        phase.put("total_artifacts", registry.getRegistry().size());
        phase.put("warnings", registry.getWarnings());
        result.putPhaseResult(PHASE_REGISTRY, phase);
        for (String w : registry.getWarnings()) {
            result.addWarning(ErrorKind.REGISTRY_IO.format(w));
        }
    }

    private Result fail(Result result, String message) {
        result.setMessage(message);
        finishRegistry(result);
        moveTo(PipelineState.FAILED);
        result.finish();
        log.error("Pipeline {} failed: {}", config.getPipelineName(), message);
        listener.onRunFinished(result);
        return result;
    }

    private void moveTo(PipelineState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state.toValue() + " -> " + next.toValue());
        }
        PipelineState previous = state;
        state = next;
        log.debug("Pipeline state {} -> {}", previous.toValue(), next.toValue());
        listener.onStateChanged(previous, next);
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public static final class Builder {
        private PlotlineConfig config;
        private DataLoader dataLoader;
        private BatchOrchestrator orchestrator;
        private RegistrySession registry;
        private ReportRenderer reportRenderer;
        private PipelineListener listener;
        private Supplier<String> runIds;

        public Builder config(PlotlineConfig config) {
            this.config = config;
            return this;
        }

        public Builder dataLoader(DataLoader dataLoader) {
            this.dataLoader = dataLoader;
            return this;
        }

        public Builder orchestrator(BatchOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        /** Registry session; defaults to an in-memory one. */
        public Builder registry(RegistrySession registry) {
            this.registry = registry;
            return this;
        }

        /** Report renderer; null makes the reporting phase report the tool as unavailable. */
        public Builder reportRenderer(ReportRenderer reportRenderer) {
            this.reportRenderer = reportRenderer;
            return this;
        }

        public Builder listener(PipelineListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder runIds(Supplier<String> runIds) {
            this.runIds = runIds;
            return this;
        }

        public PipelineDriver build() {
            return new PipelineDriver(this);
        }
    }
}
