package com.plotline.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured outcome shared by every phase boundary (data load, plot generation, reporting) and by
 * the run as a whole. Created at phase start, mutated by the phase handler, finished once.
 * <p>
 * Status only escalates: {@code success -> partial -> failed}. {@link #setStatus(ResultStatus, String)}
 * cannot improve a degraded result and cannot set {@link ResultStatus#FAILED}; use
 * {@link #addError(String)} for that.
 * <p>
 * Not thread-safe; a run is single-threaded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Result {

    private final String name;
    private ResultStatus status = ResultStatus.SUCCESS;
    private String message = "";
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Object> phaseResults = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Instant startedAt;
    private Instant finishedAt;
    private long durationMillis;
    private Double qualityScore;

    private Result(String name, Instant startedAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public static Result create(String name) {
        return new Result(name, Instant.now());
    }

    /** Appends the error and forces the status to {@link ResultStatus#FAILED}. */
    public Result addError(String error) {
        errors.add(Objects.requireNonNull(error, "error"));
        status = ResultStatus.FAILED;
        return this;
    }

    /** Appends the error and degrades the status to at most {@link ResultStatus#PARTIAL}. */
    public Result addRecoverableError(String error) {
        errors.add(Objects.requireNonNull(error, "error"));
        status = ResultStatus.worse(status, ResultStatus.PARTIAL);
        return this;
    }

    /** Appends a warning; the status is unchanged. */
    public Result addWarning(String warning) {
        warnings.add(Objects.requireNonNull(warning, "warning"));
        return this;
    }

    /**
     * Sets status and message. Only {@link ResultStatus#SUCCESS} and {@link ResultStatus#PARTIAL} are
     * accepted; the effective status is the worse of the current and the requested one.
     *
     * @throws IllegalArgumentException for {@link ResultStatus#FAILED} or null
     */
    public Result setStatus(ResultStatus requested, String message) {
        if (requested == null || requested == ResultStatus.FAILED) {
            throw new IllegalArgumentException("setStatus accepts success or partial only; use addError to fail: " + requested);
        }
        this.status = ResultStatus.worse(status, requested);
        this.message = message != null ? message : "";
        return this;
    }

    /** Replaces the message without touching status (e.g. the reason a run failed). */
    public Result setMessage(String message) {
        this.message = message != null ? message : "";
        return this;
    }

    public Result putPhaseResult(String phase, Object phaseResult) {
        phaseResults.put(Objects.requireNonNull(phase, "phase"), phaseResult);
        return this;
    }

    public Result putAttribute(String key, Object value) {
        attributes.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public Result setQualityScore(double qualityScore) {
        this.qualityScore = qualityScore;
        return this;
    }

    /**
     * Stamps end time and duration.
     *
     * @throws IllegalStateException if already finished
     */
    public Result finish() {
        if (finishedAt != null) {
            throw new IllegalStateException("Result already finished: " + name);
        }
        finishedAt = Instant.now();
        durationMillis = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
        return this;
    }

    public String getName() {
        return name;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Map<String, Object> getPhaseResults() {
        return Collections.unmodifiableMap(phaseResults);
    }

    /** Phase result by name, or null if the phase never ran. */
    public Object getPhaseResult(String phase) {
        return phaseResults.get(phase);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    @JsonIgnore
    public boolean isFinished() {
        return finishedAt != null;
    }

    @Override
    public String toString() {
        return "Result{" + name + ", " + status.toValue() + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + "}";
    }
}
