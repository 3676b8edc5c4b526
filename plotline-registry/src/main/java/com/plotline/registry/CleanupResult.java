package com.plotline.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of {@link RegistryCleaner#cleanup}. In a dry run the counts describe what would be deleted.
 */
public record CleanupResult(
        @JsonProperty("type") ArtifactType type,
        @JsonProperty("deleted_count") int deletedCount,
        @JsonProperty("freed_bytes") long freedBytes,
        @JsonProperty("deleted") List<String> deletedNames,
        @JsonProperty("retained_groups") List<String> retainedGroups,
        @JsonProperty("failures") List<String> failures,
        @JsonProperty("dry_run") boolean dryRun
) {
    public CleanupResult {
        deletedNames = deletedNames != null ? List.copyOf(deletedNames) : List.of();
        retainedGroups = retainedGroups != null ? List.copyOf(retainedGroups) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }
}
