package com.plotline.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotline.module.PlotResult;
import com.plotline.result.ResultStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one orchestration pass over all discovered modules. Filled in by
 * {@link BatchOrchestrator}; read-only for everyone else.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BatchResult {

    private final String runId;
    private final Instant timestamp;
    private ResultStatus status = ResultStatus.SUCCESS;
    private int modulesFound;
    private int modulesLoaded;
    private int modulesFailed;
    private int plotsGenerated;
    private int plotsFailed;
    private int skippedItems;
    private double successRate;
    private double qualityScore;
    private long durationMillis;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, ModuleBatchResult> modules = new LinkedHashMap<>();

    BatchResult(String runId, Instant timestamp) {
        this.runId = runId;
        this.timestamp = timestamp;
    }

    void setModulesFound(int modulesFound) {
        this.modulesFound = modulesFound;
    }

    void moduleLoaded() {
        modulesLoaded++;
    }

    void moduleFailed() {
        modulesFailed++;
    }

    void addError(String error) {
        errors.add(error);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void putModule(ModuleBatchResult module) {
        modules.put(module.getModuleName(), module);
    }

    /** Tallies counters, success rate, quality and status from the module slices. */
    void complete(long durationMillis) {
        this.durationMillis = durationMillis;
        double qualitySum = 0.0;
        plotsGenerated = 0;
        plotsFailed = 0;
        skippedItems = 0;
        for (ModuleBatchResult m : modules.values()) {
            plotsGenerated += m.getGenerated();
            plotsFailed += m.getFailed();
            skippedItems += m.getSkipped();
            for (PlotResult r : m.getItems().values()) {
                if (r.isGenerated()) qualitySum += r.getQualityScore();
            }
        }
        int attempted = plotsGenerated + plotsFailed;
        if (attempted == 0) {
            successRate = 0.0;
            qualityScore = 0.0;
            warnings.add("No items were attempted; success rate is 0");
        } else {
            successRate = (double) plotsGenerated / attempted;
            qualityScore = QualityScores.round(qualitySum / attempted);
        }
        if (modulesFound > 0 && modulesFailed >= modulesFound) {
            status = ResultStatus.FAILED;
        } else if (modulesFailed > 0 || plotsFailed > 0 || skippedItems > 0 || attempted == 0) {
            status = ResultStatus.PARTIAL;
        } else {
            status = ResultStatus.SUCCESS;
        }
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("status")
    public ResultStatus getStatus() {
        return status;
    }

    @JsonProperty("modules_found")
    public int getModulesFound() {
        return modulesFound;
    }

    @JsonProperty("modules_loaded")
    public int getModulesLoaded() {
        return modulesLoaded;
    }

    @JsonProperty("modules_failed")
    public int getModulesFailed() {
        return modulesFailed;
    }

    @JsonProperty("plots_generated")
    public int getPlotsGenerated() {
        return plotsGenerated;
    }

    @JsonProperty("plots_failed")
    public int getPlotsFailed() {
        return plotsFailed;
    }

    @JsonProperty("skipped_items")
    public int getSkippedItems() {
        return skippedItems;
    }

    /** generated / (generated + failed); 0 when nothing was attempted. */
    @JsonProperty("success_rate")
    public double getSuccessRate() {
        return successRate;
    }

    /** Mean item quality over attempted items, failed items counting 0. */
    @JsonProperty("quality_score")
    public double getQualityScore() {
        return qualityScore;
    }

    @JsonProperty("duration_ms")
    public long getDurationMillis() {
        return durationMillis;
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @JsonProperty("modules")
    public Map<String, ModuleBatchResult> getModules() {
        return Collections.unmodifiableMap(modules);
    }

    /** module name -> item id -> result. */
    @JsonIgnore
    public Map<String, Map<String, PlotResult>> getResults() {
        Map<String, Map<String, PlotResult>> out = new LinkedHashMap<>();
        modules.forEach((name, m) -> out.put(name, m.getItems()));
        return out;
    }

    /** module name -> load or execution error, for modules that failed. */
    @JsonIgnore
    public Map<String, String> getModuleErrors() {
        Map<String, String> out = new LinkedHashMap<>();
        modules.forEach((name, m) -> {
            if (m.getError() != null) out.put(name, m.getError());
        });
        return out;
    }

    @Override
    public String toString() {
        return "BatchResult{" + status.toValue() + ", modules " + modulesFound + "/" + modulesLoaded + "/" + modulesFailed
                + ", plots " + plotsGenerated + "/" + plotsFailed + "}";
    }
}
