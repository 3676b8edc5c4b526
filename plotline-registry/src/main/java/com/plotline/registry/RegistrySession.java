package com.plotline.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Fail-safe facade over the registry for the duration of one run. Each registration is
 * persisted immediately; any registry or storage failure is logged, kept as a warning and
 * never rethrown, so the run continues without that entry's persistence.
 */
public final class RegistrySession {

    private static final Logger log = LoggerFactory.getLogger(RegistrySession.class);

    private final ArtifactRegistry registry;
    private final RegistryStore store;
    private final Path path;
    private final List<String> warnings = new ArrayList<>();
    private int registered;

    private RegistrySession(ArtifactRegistry registry, RegistryStore store, Path path) {
        this.registry = registry;
        this.store = store;
        this.path = path;
    }

    /** Loads the registry through {@code store}; falls back to an empty in-memory one on failure. */
    public static RegistrySession open(RegistryStore store, Path path, String pipelineVersion) {
        RegistryStore s = store != null ? store : new NoOpRegistryStore();
        ArtifactRegistry registry;
        try {
            registry = s.init(path, pipelineVersion);
        } catch (RuntimeException e) {
            log.warn("Artifact registry init failed ({}); execution continues with an empty registry", e.getMessage(), e);
            registry = ArtifactRegistry.empty(pipelineVersion);
        }
        return new RegistrySession(registry, s, path);
    }

    /** Session that keeps artifacts in memory only. */
    public static RegistrySession inMemory(String pipelineVersion) {
        return open(new NoOpRegistryStore(), null, pipelineVersion);
    }

    /**
     * Registers and persists. Returns the artifact, or null when registration failed; a persist
     * failure still returns the in-memory artifact.
     */
    public Artifact register(ArtifactRequest request) {
        Artifact artifact;
        try {
            artifact = registry.register(request);
        } catch (RuntimeException e) {
            String msg = "Artifact " + request.getName() + " not registered: " + e.getMessage();
            log.warn("{}; execution continues", msg, e);
            warnings.add(msg);
            return null;
        }
        registered++;
        if (artifact.getUnresolvedInputs() != null) {
            warnings.add("Artifact " + artifact.getName() + " has unresolved inputs: " + artifact.getUnresolvedInputs());
        }
        persist();
        return artifact;
    }

    /** Persists the current state; failures become warnings. */
    public boolean persist() {
        try {
            store.persist(registry, path);
            return true;
        } catch (RuntimeException e) {
            String msg = "Artifact registry not persisted: " + e.getMessage();
            log.warn("{}; execution continues", msg, e);
            warnings.add(msg);
            return false;
        }
    }

    public ArtifactRegistry getRegistry() {
        return registry;
    }

    public boolean contains(String name) {
        return registry.contains(name);
    }

    public int getRegisteredCount() {
        return registered;
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public Path getPath() {
        return path;
    }
}
