package com.plotline.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One registry entry: what was produced, by which workflow, from which inputs, when, and with
 * what content hash. Immutable; entries are replaced, never edited.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Artifact {

    private final String name;
    private final ArtifactType type;
    private final String workflow;
    private final String filePath;
    private final String contentHash;
    private final long fileSizeBytes;
    private final Instant createdUtc;
    private final String pipelineVersion;
    private final String runId;
    private final List<String> inputArtifacts;
    private final List<String> unresolvedInputs;
    private final Map<String, Object> metadata;
    private final String dataHash;

    @JsonCreator
    public Artifact(
            @JsonProperty("name") String name,
            @JsonProperty("type") ArtifactType type,
            @JsonProperty("workflow") String workflow,
            @JsonProperty("file_path") String filePath,
            @JsonProperty("file_hash_sha256") String contentHash,
            @JsonProperty("file_size_bytes") long fileSizeBytes,
            @JsonProperty("created_utc") Instant createdUtc,
            @JsonProperty("pipeline_version") String pipelineVersion,
            @JsonProperty("run_id") String runId,
            @JsonProperty("input_artifacts") List<String> inputArtifacts,
            @JsonProperty("unresolved_inputs") List<String> unresolvedInputs,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("data_hash_sha256") String dataHash) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.workflow = workflow;
        this.filePath = filePath;
        this.contentHash = contentHash;
        this.fileSizeBytes = fileSizeBytes;
        this.createdUtc = createdUtc;
        this.pipelineVersion = pipelineVersion;
        this.runId = runId;
        this.inputArtifacts = inputArtifacts != null ? List.copyOf(inputArtifacts) : List.of();
        this.unresolvedInputs = unresolvedInputs != null && !unresolvedInputs.isEmpty()
                ? List.copyOf(unresolvedInputs) : null;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.dataHash = dataHash;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public ArtifactType getType() {
        return type;
    }

    @JsonProperty("workflow")
    public String getWorkflow() {
        return workflow;
    }

    @JsonProperty("file_path")
    public String getFilePath() {
        return filePath;
    }

    @JsonProperty("file_hash_sha256")
    public String getContentHash() {
        return contentHash;
    }

    @JsonProperty("file_size_bytes")
    public long getFileSizeBytes() {
        return fileSizeBytes;
    }

    @JsonProperty("created_utc")
    public Instant getCreatedUtc() {
        return createdUtc;
    }

    @JsonProperty("pipeline_version")
    public String getPipelineVersion() {
        return pipelineVersion;
    }

    /** Generation group: the run that produced this artifact. Null for entries written without one. */
    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("input_artifacts")
    public List<String> getInputArtifacts() {
        return inputArtifacts;
    }

    /** Input names that were not in the registry at registration time; null when all resolved. */
    @JsonProperty("unresolved_inputs")
    public List<String> getUnresolvedInputs() {
        return unresolvedInputs;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("data_hash_sha256")
    public String getDataHash() {
        return dataHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Artifact that = (Artifact) o;
        return fileSizeBytes == that.fileSizeBytes
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(workflow, that.workflow)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(contentHash, that.contentHash)
                && Objects.equals(createdUtc, that.createdUtc)
                && Objects.equals(runId, that.runId)
                && inputArtifacts.equals(that.inputArtifacts)
                && Objects.equals(dataHash, that.dataHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, filePath, contentHash, createdUtc, runId);
    }

    @Override
    public String toString() {
        return "Artifact{" + name + " (" + type.getValue() + "), run=" + runId + ", file=" + filePath + "}";
    }
}
