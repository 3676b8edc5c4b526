package com.plotline.registry;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;

/**
 * Out-of-band registry operations run outside a pipeline run: load, act, persist.
 */
public final class RegistryMaintenance {

    private final RegistryStore store;
    private final Path path;
    private final RegistryCleaner cleaner = new RegistryCleaner();
    private final RegistryValidator validator = new RegistryValidator();

    public RegistryMaintenance(RegistryStore store, Path path) {
        this.store = Objects.requireNonNull(store, "store");
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Prunes old generation groups of {@code type}. Persists only when entries were removed and
     * {@code dryRun} is false.
     *
     * @throws RegistryIoException if the pruned registry cannot be written
     */
    public CleanupResult cleanup(ArtifactType type, int keepCount, boolean dryRun) {
        ArtifactRegistry registry = store.init(path, null);
        CleanupResult result = cleaner.cleanup(registry, type, keepCount, dryRun);
        if (!dryRun && result.deletedCount() > 0) {
            store.persist(registry, path);
        }
        return result;
    }

    public RegistryValidationReport validate(Collection<ArtifactType> requiredTypes, boolean checkHashes) {
        return validator.validate(store.init(path, null), requiredTypes, checkHashes);
    }
}
