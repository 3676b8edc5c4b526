package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotline.result.ResultStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one work item. SUCCESS and PARTIAL count as generated, FAILED as failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PlotResult {

    private final String itemId;
    private final ResultStatus status;
    private final String outputPath;
    private final double qualityScore;
    private final long durationMillis;
    private final String error;
    private final List<String> warnings;

    @JsonCreator
    public PlotResult(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("status") ResultStatus status,
            @JsonProperty("output_path") String outputPath,
            @JsonProperty("quality_score") double qualityScore,
            @JsonProperty("duration_ms") long durationMillis,
            @JsonProperty("error") String error,
            @JsonProperty("warnings") List<String> warnings) {
        this.itemId = Objects.requireNonNull(itemId, "itemId");
        this.status = status != null ? status : ResultStatus.FAILED;
        this.outputPath = outputPath;
        this.qualityScore = Math.max(0.0, Math.min(100.0, qualityScore));
        this.durationMillis = Math.max(0L, durationMillis);
        this.error = error;
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static PlotResult success(String itemId, String outputPath, double qualityScore) {
        return new PlotResult(itemId, ResultStatus.SUCCESS, outputPath, qualityScore, 0L, null, null);
    }

    public static PlotResult partial(String itemId, String outputPath, double qualityScore, String warning) {
        List<String> warnings = new ArrayList<>();
        if (warning != null) warnings.add(warning);
        return new PlotResult(itemId, ResultStatus.PARTIAL, outputPath, qualityScore, 0L, null, warnings);
    }

    public static PlotResult failed(String itemId, String error) {
        return new PlotResult(itemId, ResultStatus.FAILED, null, 0.0, 0L,
                error != null ? error : "unknown error", null);
    }

    /** Copy with the given duration. */
    public PlotResult withDuration(long millis) {
        return new PlotResult(itemId, status, outputPath, qualityScore, millis, error, warnings);
    }

    @JsonProperty("item_id")
    public String getItemId() {
        return itemId;
    }

    @JsonProperty("status")
    public ResultStatus getStatus() {
        return status;
    }

    @JsonProperty("output_path")
    public String getOutputPath() {
        return outputPath;
    }

    @JsonProperty("quality_score")
    public double getQualityScore() {
        return qualityScore;
    }

    @JsonProperty("duration_ms")
    public long getDurationMillis() {
        return durationMillis;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    /** True for SUCCESS and PARTIAL. */
    @JsonIgnore
    public boolean isGenerated() {
        return status.isProductive();
    }

    @Override
    public String toString() {
        return "PlotResult{" + itemId + " " + status.toValue()
                + (error != null ? ", error=" + error : "")
                + (outputPath != null ? ", output=" + outputPath : "") + "}";
    }
}
