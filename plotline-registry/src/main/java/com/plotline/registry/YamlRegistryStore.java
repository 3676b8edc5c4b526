package com.plotline.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Registry persisted as a human-readable YAML document. Writes go to a temporary file in the
 * target directory which is then moved over the old file.
 */
public final class YamlRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(YamlRegistryStore.class);

    private final ObjectMapper mapper;

    public YamlRegistryStore() {
        this.mapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .addModule(new JavaTimeModule())
                .build();
    }

    @Override
    public ArtifactRegistry init(Path path, String pipelineVersion) {
        if (path == null || !Files.exists(path)) {
            log.info("No artifact registry at {}; starting empty", path);
            return ArtifactRegistry.empty(pipelineVersion);
        }
        try {
            ArtifactRegistry registry = Files.size(path) == 0 ? null : mapper.readValue(path.toFile(), ArtifactRegistry.class);
            if (registry == null) {
                log.warn("Artifact registry {} is empty; starting empty", path);
                return ArtifactRegistry.empty(pipelineVersion);
            }
            if (pipelineVersion != null) {
                registry.setPipelineVersion(pipelineVersion);
            }
            log.info("Loaded artifact registry {}: {} artifacts", path, registry.size());
            return registry;
        } catch (IOException | RuntimeException e) {
            Path kept = quarantine(path);
            log.warn("Malformed artifact registry {} ({}); moved to {}, starting empty", path, e.getMessage(), kept);
            return ArtifactRegistry.empty(pipelineVersion);
        }
    }

    /**
     * Moves an unreadable registry file aside so a later persist cannot overwrite it.
     *
     * @throws RegistryIoException if the file cannot be moved
     */
    static Path quarantine(Path path) {
        Path target = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            return Files.move(path, target);
        } catch (IOException e) {
            throw new RegistryIoException("Malformed artifact registry " + path + " could not be moved aside: "
                    + e.getMessage(), path, e);
        }
    }

    @Override
    public void persist(ArtifactRegistry registry, Path path) {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "." + target.getFileName() + "-", ".tmp");
            mapper.writeValue(temp.toFile(), registry);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}; replacing", dir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Persisted artifact registry {} ({} artifacts)", target, registry.size());
        } catch (IOException e) {
            RegistryIoException failure = new RegistryIoException(
                    "Cannot write artifact registry " + target + ": " + e.getMessage(), target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }
}
