package com.plotline.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotline.module.PlotResult;
import com.plotline.result.ResultStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-module slice of a {@link BatchResult}: how the module loaded and what each item produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ModuleBatchResult {

    private final String moduleName;
    private String version;
    private ResultStatus status = ResultStatus.SUCCESS;
    private String error;
    private final Map<String, PlotResult> items = new LinkedHashMap<>();
    private int generated;
    private int failed;
    private int skipped;
    private long durationMillis;

    ModuleBatchResult(String moduleName) {
        this.moduleName = moduleName;
    }

    void fail(String error) {
        this.status = ResultStatus.FAILED;
        this.error = error;
    }

    void setVersion(String version) {
        this.version = version;
    }

    void addItem(PlotResult result) {
        items.put(result.getItemId(), result);
        if (result.isGenerated()) {
            generated++;
        } else {
            failed++;
            status = ResultStatus.worse(status, ResultStatus.PARTIAL);
        }
    }

    void addSkipped(int count) {
        skipped += count;
        if (count > 0) status = ResultStatus.worse(status, ResultStatus.PARTIAL);
    }

    void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    @JsonProperty("module")
    public String getModuleName() {
        return moduleName;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("status")
    public ResultStatus getStatus() {
        return status;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("items")
    public Map<String, PlotResult> getItems() {
        return Collections.unmodifiableMap(items);
    }

    @JsonProperty("plots_generated")
    public int getGenerated() {
        return generated;
    }

    @JsonProperty("plots_failed")
    public int getFailed() {
        return failed;
    }

    @JsonProperty("skipped_items")
    public int getSkipped() {
        return skipped;
    }

    @JsonProperty("duration_ms")
    public long getDurationMillis() {
        return durationMillis;
    }
}
