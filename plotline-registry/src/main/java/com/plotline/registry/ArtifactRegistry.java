package com.plotline.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalogue of every artifact a pipeline produced, keyed by unique name. Mutated additively
 * during a run; callers persist it through a {@link RegistryStore}. Not thread-safe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"registry_version", "created_utc", "last_modified_utc", "pipeline_version", "artifacts"})
public final class ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRegistry.class);

    public static final String REGISTRY_VERSION = "1.0";

    private final String registryVersion;
    private final Instant createdUtc;
    private Instant lastModifiedUtc;
    private String pipelineVersion;
    private final Map<String, Artifact> artifacts;
    @JsonIgnore
    private Clock clock = Clock.systemUTC();

    @JsonCreator
    ArtifactRegistry(
            @JsonProperty("registry_version") String registryVersion,
            @JsonProperty("created_utc") Instant createdUtc,
            @JsonProperty("last_modified_utc") Instant lastModifiedUtc,
            @JsonProperty("pipeline_version") String pipelineVersion,
            @JsonProperty("artifacts") Map<String, Artifact> artifacts) {
        this.registryVersion = registryVersion != null ? registryVersion : REGISTRY_VERSION;
        this.createdUtc = createdUtc;
        this.lastModifiedUtc = lastModifiedUtc;
        this.pipelineVersion = pipelineVersion;
        this.artifacts = new LinkedHashMap<>();
        if (artifacts != null) {
            artifacts.forEach((key, artifact) -> {
                if (artifact != null) this.artifacts.put(key, artifact);
            });
        }
    }

    /** Fresh registry with no artifacts. */
    public static ArtifactRegistry empty(String pipelineVersion) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return new ArtifactRegistry(REGISTRY_VERSION, now, now, pipelineVersion, null);
    }

    /** Clock used for registration and modification timestamps. */
    public void useClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Inserts or overwrites the entry under the request's name. Input names that are not in the
     * registry are recorded on the artifact as unresolved and logged; they never block registration.
     *
     * @return the registered artifact
     * @throws RegistryIoException if the artifact file is missing or unreadable
     */
    public Artifact register(ArtifactRequest request) {
        Objects.requireNonNull(request, "request");
        Path file = request.getFile();
        if (!Files.isRegularFile(file)) {
            throw new RegistryIoException("Artifact file not found: " + file, file);
        }
        String hash = request.getContentHash() != null ? request.getContentHash() : ContentHasher.hashFile(file);
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new RegistryIoException("Cannot stat artifact file " + file + ": " + e.getMessage(), file, e);
        }

        List<String> unresolved = new ArrayList<>();
        for (String input : request.getInputArtifacts()) {
            if (!artifacts.containsKey(input)) unresolved.add(input);
        }
        if (!unresolved.isEmpty()) {
            log.warn("Artifact {} references inputs not in the registry: {}", request.getName(), unresolved);
        }

        Instant now = now();
        Artifact artifact = new Artifact(
                request.getName(),
                request.getType(),
                request.getWorkflow(),
                file.toAbsolutePath().normalize().toString(),
                hash,
                size,
                request.getCreatedUtc() != null ? request.getCreatedUtc() : now,
                pipelineVersion,
                request.getRunId(),
                request.getInputArtifacts(),
                unresolved,
                request.getMetadata(),
                request.getDataHash());
        if (artifacts.put(artifact.getName(), artifact) != null) {
            log.debug("Replaced artifact {}", artifact.getName());
        }
        lastModifiedUtc = now;
        log.info("Registered artifact {} ({})", artifact.getName(), artifact.getType().getValue());
        return artifact;
    }

    /** Entry by name, or null. */
    public Artifact get(String name) {
        return name != null ? artifacts.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && artifacts.containsKey(name);
    }

    /**
     * Entries in registration order, filtered by type and workflow; a null filter matches all.
     */
    public List<Artifact> list(ArtifactType type, String workflow) {
        List<Artifact> out = new ArrayList<>();
        for (Artifact a : artifacts.values()) {
            if (type != null && a.getType() != type) continue;
            if (workflow != null && !workflow.equals(a.getWorkflow())) continue;
            out.add(a);
        }
        return out;
    }

    /** Most recently created entry of the type, or null. */
    public Artifact latest(ArtifactType type) {
        return list(type, null).stream()
                .max(Comparator.comparing(a -> a.getCreatedUtc() != null ? a.getCreatedUtc() : Instant.MIN))
                .orElse(null);
    }

    /** Removes the entry (not the file). */
    public Artifact remove(String name) {
        Artifact removed = name != null ? artifacts.remove(name) : null;
        if (removed != null) {
            lastModifiedUtc = now();
        }
        return removed;
    }

    /**
     * Re-hashes the artifact's file and compares with the registered hash.
     *
     * @return false when the entry is unknown, its file is missing, or the hash differs
     */
    public boolean verify(String name) {
        Artifact artifact = get(name);
        if (artifact == null) {
            log.warn("Artifact not found in registry: {}", name);
            return false;
        }
        Path file = Path.of(artifact.getFilePath());
        if (!Files.isRegularFile(file)) {
            log.warn("Artifact file not found: {}", file);
            return false;
        }
        String current = ContentHasher.hashFile(file);
        if (!current.equals(artifact.getContentHash())) {
            log.warn("Hash mismatch for {}: registered {} current {}", name, artifact.getContentHash(), current);
            return false;
        }
        return true;
    }

    @JsonIgnore
    public int size() {
        return artifacts.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return artifacts.isEmpty();
    }

    @JsonProperty("registry_version")
    public String getRegistryVersion() {
        return registryVersion;
    }

    @JsonProperty("created_utc")
    public Instant getCreatedUtc() {
        return createdUtc;
    }

    @JsonProperty("last_modified_utc")
    public Instant getLastModifiedUtc() {
        return lastModifiedUtc;
    }

    @JsonProperty("pipeline_version")
    public String getPipelineVersion() {
        return pipelineVersion;
    }

    /** Version stamped on artifacts registered from now on. */
    public void setPipelineVersion(String pipelineVersion) {
        this.pipelineVersion = pipelineVersion;
    }

    @JsonProperty("artifacts")
    public Map<String, Artifact> getArtifacts() {
        return Collections.unmodifiableMap(artifacts);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
