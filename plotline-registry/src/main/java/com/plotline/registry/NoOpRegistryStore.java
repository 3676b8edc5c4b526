package com.plotline.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/** Store used when the registry is disabled: always starts empty and never writes. */
public final class NoOpRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpRegistryStore.class);

    @Override
    public ArtifactRegistry init(Path path, String pipelineVersion) {
        log.info("Artifact registry (no-op): in-memory only, persistence skipped");
        return ArtifactRegistry.empty(pipelineVersion);
    }

    @Override
    public void persist(ArtifactRegistry registry, Path path) {
        log.debug("Artifact registry (no-op): persist skipped | artifacts={}", registry.size());
    }
}
