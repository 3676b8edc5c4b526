package com.plotline.data;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotline.result.ResultStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of the data-loading collaborator. {@code status == FAILED} is fatal for a pipeline run.
 */
public final class DataLoadResult {

    private final String sourcePath;
    private final Dataset data;
    private final double qualityScore;
    private final QualityMetrics qualityMetrics;
    private final ResultStatus status;
    private final String message;
    private final List<String> warnings;
    private final List<String> errors;
    private final long durationMillis;

    private DataLoadResult(Builder b) {
        this.sourcePath = b.sourcePath;
        this.data = b.data != null ? b.data : Dataset.empty();
        this.qualityScore = b.qualityScore;
        this.qualityMetrics = b.qualityMetrics != null ? b.qualityMetrics : QualityMetrics.none();
        this.status = Objects.requireNonNull(b.status, "status");
        this.message = b.message != null ? b.message : "";
        this.warnings = List.copyOf(b.warnings);
        this.errors = List.copyOf(b.errors);
        this.durationMillis = b.durationMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Failed result with a single error and no data. */
    public static DataLoadResult failed(String sourcePath, String error) {
        return builder().sourcePath(sourcePath).status(ResultStatus.FAILED).message(error).error(error).build();
    }

    @JsonProperty("source_path")
    public String getSourcePath() {
        return sourcePath;
    }

    @JsonIgnore
    public Dataset getData() {
        return data;
    }

    @JsonProperty("row_count")
    public int getRowCount() {
        return data.rowCount();
    }

    @JsonProperty("column_count")
    public int getColumnCount() {
        return data.columnCount();
    }

    @JsonProperty("quality_score")
    public double getQualityScore() {
        return qualityScore;
    }

    @JsonProperty("quality_metrics")
    public QualityMetrics getQualityMetrics() {
        return qualityMetrics;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getErrors() {
        return errors;
    }

    @JsonProperty("duration_ms")
    public long getDurationMillis() {
        return durationMillis;
    }

    public static final class Builder {
        private String sourcePath;
        private Dataset data;
        private double qualityScore;
        private QualityMetrics qualityMetrics;
        private ResultStatus status = ResultStatus.SUCCESS;
        private String message;
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private long durationMillis;

        public Builder sourcePath(String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder data(Dataset data) {
            this.data = data;
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder qualityMetrics(QualityMetrics qualityMetrics) {
            this.qualityMetrics = qualityMetrics;
            return this;
        }

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder warning(String warning) {
            if (warning != null) warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> values) {
            if (values != null) values.forEach(this::warning);
            return this;
        }

        public Builder error(String error) {
            if (error != null) errors.add(error);
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public DataLoadResult build() {
            return new DataLoadResult(this);
        }
    }
}
