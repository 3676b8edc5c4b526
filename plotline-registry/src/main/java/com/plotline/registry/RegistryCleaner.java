package com.plotline.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Retention by generation group. Artifacts of one type are grouped by run id; the newest
 * {@code keepCount} groups (by their newest creation time) are kept and the files and entries
 * of all older groups are deleted. An artifact without a run id forms a group of its own.
 * A file that is already gone counts as clean: the stale entry is removed without error. A file
 * that a kept artifact also points to stays on disk.
 */
public final class RegistryCleaner {

    private static final Logger log = LoggerFactory.getLogger(RegistryCleaner.class);

    private static final String UNGROUPED_PREFIX = "ungrouped:";

    /**
     * @param registry  registry to prune in place (untouched on a dry run); the caller persists
     * @param type      artifact type to prune
     * @param keepCount number of newest generation groups to retain; 0 deletes all of the type
     * @param dryRun    report only
     */
    public CleanupResult cleanup(ArtifactRegistry registry, ArtifactType type, int keepCount, boolean dryRun) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount must be >= 0: " + keepCount);
        }
        Map<String, List<Artifact>> groups = new LinkedHashMap<>();
        for (Artifact a : registry.list(type, null)) {
            String key = a.getRunId() != null ? a.getRunId() : UNGROUPED_PREFIX + a.getName();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(a);
        }
        List<Map.Entry<String, List<Artifact>>> ordered = new ArrayList<>(groups.entrySet());
        ordered.sort(Comparator.comparing((Map.Entry<String, List<Artifact>> e) -> newest(e.getValue())).reversed());

        List<String> retained = new ArrayList<>();
        List<Artifact> doomed = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (i < keepCount) {
                retained.add(ordered.get(i).getKey());
            } else {
                doomed.addAll(ordered.get(i).getValue());
            }
        }
        Set<Path> shared = filesStillReferenced(registry, doomed);

        List<String> deleted = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        long freed = 0L;
        for (Artifact artifact : doomed) {
            Path file = artifact.getFilePath() != null ? Path.of(artifact.getFilePath()) : null;
            try {
                boolean keepFile = file != null && shared.contains(normalize(file));
                long size = !keepFile && file != null && Files.isRegularFile(file) ? Files.size(file) : 0L;
                if (!dryRun) {
                    if (keepFile) {
                        log.info("Keeping {} for {}: still referenced by a retained artifact", file, artifact.getName());
                    } else if (file != null && !Files.deleteIfExists(file)) {
                        log.debug("Artifact file already gone: {}", file);
                    }
                    registry.remove(artifact.getName());
                }
                deleted.add(artifact.getName());
                freed += size;
            } catch (IOException e) {
                log.warn("Cannot delete artifact file {} for {}: {}", file, artifact.getName(), e.getMessage());
                failures.add(artifact.getName() + ": " + e.getMessage());
            }
        }
        log.info("Cleanup {}{}: kept {} group(s), {} {} artifact(s), {} bytes",
                type.getValue(), dryRun ? " (dry run)" : "", retained.size(),
                dryRun ? "would delete" : "deleted", deleted.size(), freed);
        return new CleanupResult(type, deleted.size(), freed, deleted, retained, failures, dryRun);
    }

    /** Files of artifacts that survive the cleanup; these are never deleted from disk. */
    private static Set<Path> filesStillReferenced(ArtifactRegistry registry, List<Artifact> doomed) {
        Set<String> doomedNames = new HashSet<>();
        for (Artifact a : doomed) {
            doomedNames.add(a.getName());
        }
        Set<Path> files = new HashSet<>();
        for (Artifact a : registry.getArtifacts().values()) {
            if (!doomedNames.contains(a.getName()) && a.getFilePath() != null) {
                files.add(normalize(Path.of(a.getFilePath())));
            }
        }
        return files;
    }

    private static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }

    private static Instant newest(List<Artifact> group) {
        Instant newest = Instant.MIN;
        for (Artifact a : group) {
            if (a.getCreatedUtc() != null && a.getCreatedUtc().isAfter(newest)) newest = a.getCreatedUtc();
        }
        return newest;
    }
}
