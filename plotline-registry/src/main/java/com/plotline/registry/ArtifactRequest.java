package com.plotline.registry;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input to {@link ArtifactRegistry#register(ArtifactRequest)}. The content hash is computed from
 * the file when not supplied; the creation time defaults to the registration time.
 */
public final class ArtifactRequest {

    private final String name;
    private final ArtifactType type;
    private final String workflow;
    private final Path file;
    private final List<String> inputArtifacts;
    private final Map<String, Object> metadata;
    private final String contentHash;
    private final String dataHash;
    private final String runId;
    private final Instant createdUtc;

    private ArtifactRequest(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Artifact name must be non-blank");
        }
        this.type = Objects.requireNonNull(b.type, "type");
        this.workflow = b.workflow;
        this.file = Objects.requireNonNull(b.file, "file");
        this.inputArtifacts = List.copyOf(b.inputArtifacts);
        this.metadata = new LinkedHashMap<>(b.metadata);
        this.contentHash = b.contentHash;
        this.dataHash = b.dataHash;
        this.runId = b.runId;
        this.createdUtc = b.createdUtc;
    }

    public static Builder builder(String name, ArtifactType type, Path file) {
        return new Builder().name(name).type(type).file(file);
    }

    public String getName() {
        return name;
    }

    public ArtifactType getType() {
        return type;
    }

    public String getWorkflow() {
        return workflow;
    }

    public Path getFile() {
        return file;
    }

    public List<String> getInputArtifacts() {
        return inputArtifacts;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getDataHash() {
        return dataHash;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getCreatedUtc() {
        return createdUtc;
    }

    public static final class Builder {
        private String name;
        private ArtifactType type;
        private String workflow;
        private Path file;
        private final List<String> inputArtifacts = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String contentHash;
        private String dataHash;
        private String runId;
        private Instant createdUtc;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ArtifactType type) {
            this.type = type;
            return this;
        }

        public Builder workflow(String workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder file(Path file) {
            this.file = file;
            return this;
        }

        public Builder input(String artifactName) {
            if (artifactName != null) inputArtifacts.add(artifactName);
            return this;
        }

        public Builder inputs(List<String> artifactNames) {
            if (artifactNames != null) artifactNames.forEach(this::input);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            if (values != null) metadata.putAll(values);
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder dataHash(String dataHash) {
            this.dataHash = dataHash;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder createdUtc(Instant createdUtc) {
            this.createdUtc = createdUtc;
            return this;
        }

        public ArtifactRequest build() {
            return new ArtifactRequest(this);
        }
    }
}
