package com.plotline.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the reporting phase. Status is {@code success} when at least one report rendered,
 * {@code failed} when none did, {@code skipped} when reports are disabled or none are configured,
 * {@code unavailable} when the rendering tool is missing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportPhaseResult(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("reports") List<ReportOutcome> reports) {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";
    public static final String UNAVAILABLE = "unavailable";

    public ReportPhaseResult {
        reports = reports != null ? List.copyOf(reports) : List.of();
    }

    static ReportPhaseResult skipped(String message) {
        return new ReportPhaseResult(SKIPPED, message, List.of());
    }

    static ReportPhaseResult unavailable(String tool) {
        return new ReportPhaseResult(UNAVAILABLE, "Report tool '" + tool + "' not available", List.of());
    }

    static ReportPhaseResult of(List<ReportOutcome> reports) {
        long rendered = reports.stream().filter(ReportOutcome::isRendered).count();
        String status = rendered > 0 ? SUCCESS : FAILED;
        return new ReportPhaseResult(status, rendered + "/" + reports.size() + " reports rendered", reports);
    }

    @JsonProperty("rendered")
    public long rendered() {
        return reports.stream().filter(ReportOutcome::isRendered).count();
    }
}
