package com.plotline.engine;

import com.plotline.module.PlotConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run settings of the batch orchestrator. Immutable; see {@link #builder()}.
 */
public final class BatchOptions {

    private final int dpi;
    private final boolean continueOnError;
    private final Duration itemTimeout;
    private final String runId;
    private final PipelineListener listener;
    private final Map<String, Object> params;

    private BatchOptions(Builder b) {
        this.dpi = b.dpi;
        this.continueOnError = b.continueOnError;
        this.itemTimeout = b.itemTimeout;
        this.runId = b.runId;
        this.listener = b.listener != null ? b.listener : PipelineListener.noOp();
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BatchOptions defaults() {
        return builder().build();
    }

    public int getDpi() {
        return dpi;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public Duration getItemTimeout() {
        return itemTimeout;
    }

    public String getRunId() {
        return runId;
    }

    public PipelineListener getListener() {
        return listener;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /** Module-scoped configuration bundle writing into {@code outputDir}. */
    public PlotConfig toPlotConfig(Path outputDir) {
        PlotConfig.Builder b = PlotConfig.builder()
                .outputDir(outputDir)
                .dpi(dpi)
                .continueOnError(continueOnError)
                .itemTimeout(itemTimeout)
                .runId(runId);
        params.forEach(b::param);
        return b.build();
    }

    public static final class Builder {
        private int dpi = PlotConfig.DEFAULT_DPI;
        private boolean continueOnError = true;
        private Duration itemTimeout;
        private String runId;
        private PipelineListener listener;
        private final Map<String, Object> params = new LinkedHashMap<>();

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder itemTimeout(Duration itemTimeout) {
            this.itemTimeout = itemTimeout;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder listener(PipelineListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder param(String key, Object value) {
            params.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public BatchOptions build() {
            return new BatchOptions(this);
        }
    }
}
