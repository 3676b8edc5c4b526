package com.plotline.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pre-render check of a registry: not empty, required types present, files on disk and,
 * optionally, hashes still matching.
 */
public final class RegistryValidator {

    private static final Logger log = LoggerFactory.getLogger(RegistryValidator.class);

    public RegistryValidationReport validate(ArtifactRegistry registry, Collection<ArtifactType> requiredTypes,
                                             boolean checkHashes) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<ArtifactType> missingTypes = new ArrayList<>();
        List<String> missingFiles = new ArrayList<>();
        List<String> mismatches = new ArrayList<>();

        if (registry == null || registry.isEmpty()) {
            errors.add("Registry is empty");
            return new RegistryValidationReport(false, errors, warnings, missingTypes, missingFiles, mismatches);
        }

        Set<ArtifactType> present = EnumSet.noneOf(ArtifactType.class);
        for (Artifact a : registry.getArtifacts().values()) {
            present.add(a.getType());
        }
        if (requiredTypes != null) {
            for (ArtifactType t : requiredTypes) {
                if (!present.contains(t)) {
                    missingTypes.add(t);
                    errors.add("No artifacts of required type: " + t.getValue());
                }
            }
        }

        for (Artifact a : registry.getArtifacts().values()) {
            Path file = a.getFilePath() != null ? Path.of(a.getFilePath()) : null;
            if (file == null || !Files.isRegularFile(file)) {
                missingFiles.add(a.getName());
                errors.add("File not found for artifact '" + a.getName() + "': " + a.getFilePath());
                continue;
            }
            if (checkHashes && !ContentHasher.hashFile(file).equals(a.getContentHash())) {
                mismatches.add(a.getName());
                warnings.add("Hash mismatch for '" + a.getName() + "'");
            }
            for (String input : a.getInputArtifacts()) {
                if (!registry.contains(input)) {
                    warnings.add("Artifact '" + a.getName() + "' depends on missing artifact '" + input + "'");
                }
            }
        }

        boolean valid = errors.isEmpty();
        log.info("Registry validation {}: {} artifacts, {} error(s), {} warning(s)",
                valid ? "passed" : "failed", registry.size(), errors.size(), warnings.size());
        return new RegistryValidationReport(valid, errors, warnings, missingTypes, missingFiles, mismatches);
    }
}
