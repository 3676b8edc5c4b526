package com.plotline.module;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration bundle handed to a module for one batch or item: where to write, at what
 * resolution, the error policy, the optional per-item time bound and item parameters.
 * Immutable; use {@link #builder()} or the {@code with*} copies.
 */
public final class PlotConfig {

    public static final int DEFAULT_DPI = 300;

    private final Path outputDir;
    private final int dpi;
    private final boolean continueOnError;
    private final Duration itemTimeout;
    private final String runId;
    private final Map<String, Object> params;

    private PlotConfig(Builder b) {
        this.outputDir = Objects.requireNonNull(b.outputDir, "outputDir");
        if (b.dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive: " + b.dpi);
        }
        this.dpi = b.dpi;
        this.continueOnError = b.continueOnError;
        this.itemTimeout = b.itemTimeout != null && !b.itemTimeout.isZero() && !b.itemTimeout.isNegative()
                ? b.itemTimeout : null;
        this.runId = b.runId;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public int getDpi() {
        return dpi;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    /** Per-item time bound, or null when items run unbounded. */
    public Duration getItemTimeout() {
        return itemTimeout;
    }

    /** Generation group id of the current run; may be null outside a pipeline run. */
    public String getRunId() {
        return runId;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /** String parameter or the fallback when absent. */
    public String getParam(String key, String fallback) {
        Object v = params.get(key);
        return v != null ? v.toString() : fallback;
    }

    public PlotConfig withOutputDir(Path dir) {
        return toBuilder().outputDir(dir).build();
    }

    /** Copy with the given parameters layered over the current ones. */
    public PlotConfig withParams(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) return this;
        Builder b = toBuilder();
        b.params.putAll(extra);
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .outputDir(outputDir)
                .dpi(dpi)
                .continueOnError(continueOnError)
                .itemTimeout(itemTimeout)
                .runId(runId);
        b.params.putAll(params);
        return b;
    }

    @Override
    public String toString() {
        return "PlotConfig{outputDir=" + outputDir + ", dpi=" + dpi + ", continueOnError=" + continueOnError
                + ", itemTimeout=" + itemTimeout + ", runId=" + runId + ", params=" + params.keySet() + "}";
    }

    public static final class Builder {
        private Path outputDir;
        private int dpi = DEFAULT_DPI;
        private boolean continueOnError = true;
        private Duration itemTimeout;
        private String runId;
        private final Map<String, Object> params = new LinkedHashMap<>();

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
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

        public Builder itemTimeout(Duration itemTimeout) {
            this.itemTimeout = itemTimeout;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder param(String key, Object value) {
            params.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public PlotConfig build() {
            return new PlotConfig(this);
        }
    }
}
