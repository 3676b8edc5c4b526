package com.plotline.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of rendering one report template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportOutcome(
        @JsonProperty("name") String name,
        @JsonProperty("template") String template,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("error") String error) {

    static ReportOutcome rendered(String name, String template, String outputPath) {
        return new ReportOutcome(name, template, outputPath, null);
    }

    static ReportOutcome failed(String name, String template, String error) {
        return new ReportOutcome(name, template, null, error);
    }

    @JsonProperty("status")
    public String status() {
        return isRendered() ? "success" : "failed";
    }

    @JsonIgnore
    public boolean isRendered() {
        return error == null && outputPath != null;
    }
}
