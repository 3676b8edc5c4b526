package com.plotline.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Findings of {@link RegistryValidator}. Errors make the registry invalid; hash mismatches and
 * dangling dependencies are warnings.
 */
public record RegistryValidationReport(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("missing_types") List<ArtifactType> missingTypes,
        @JsonProperty("missing_files") List<String> missingFiles,
        @JsonProperty("hash_mismatches") List<String> hashMismatches
) {
    public RegistryValidationReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        missingTypes = missingTypes != null ? List.copyOf(missingTypes) : List.of();
        missingFiles = missingFiles != null ? List.copyOf(missingFiles) : List.of();
        hashMismatches = hashMismatches != null ? List.copyOf(hashMismatches) : List.of();
    }
}
