package com.plotline.registry;

import java.nio.file.Path;

/**
 * Durable storage for an {@link ArtifactRegistry}.
 */
public interface RegistryStore {

    /**
     * Loads the registry at {@code path}, or returns a fresh empty one when there is none.
     * A malformed file is moved aside, logged and replaced by an empty registry.
     *
     * @throws RegistryIoException if a malformed file cannot be moved aside
     */
    ArtifactRegistry init(Path path, String pipelineVersion);

    /**
     * Writes the full registry so that a crash mid-write leaves the previous file intact.
     *
     * @throws RegistryIoException on write failure
     */
    void persist(ArtifactRegistry registry, Path path);
}
