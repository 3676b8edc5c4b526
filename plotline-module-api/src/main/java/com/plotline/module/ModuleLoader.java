package com.plotline.module;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link ModuleDescriptor} into a {@link LoadResult}. Each call asks the provider for a
 * fresh instance, so modules never share state with each other or with an earlier load.
 * Never throws: an unreadable manifest, an unknown provider, a provider failure and a missing
 * capability all come back as a failed result.
 */
public final class ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final ModuleCatalog catalog;

    public ModuleLoader(ModuleCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public LoadResult load(ModuleDescriptor descriptor) {
        if (descriptor == null) {
            return LoadResult.failed("<unknown>", "No module descriptor");
        }
        String name = descriptor.name();
        if (descriptor.hasManifestError()) {
            log.warn("Module {} not loaded: {}", name, descriptor.manifestError());
            return LoadResult.failed(name, descriptor.manifestError());
        }
        PlotModuleProvider provider = catalog.get(descriptor.providerId());
        if (provider == null) {
            String error = "No module provider registered for id '" + descriptor.providerId()
                    + "' (known: " + catalog.ids() + ")";
            log.warn("Module {} not loaded: {}", name, error);
            return LoadResult.failed(name, error);
        }

        Object instance;
        try {
            instance = provider.createModule(descriptor.settings());
        } catch (Exception | LinkageError e) {
            log.warn("Module {} provider {} failed to create instance", name, descriptor.providerId(), e);
            return LoadResult.failed(name, "Provider '" + descriptor.providerId() + "' failed: "
                    + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (instance == null) {
            return LoadResult.failed(name, "Provider '" + descriptor.providerId() + "' returned no module");
        }

        List<Capability> missing = Capability.missing(instance);
        if (!missing.isEmpty()) {
            LoadResult result = LoadResult.missingCapabilities(name, missing);
            log.warn("{}", result.getError());
            return result;
        }
        log.info("Loaded module {} via provider {} ({})", name, descriptor.providerId(),
                instance.getClass().getName());
        return LoadResult.success(new LoadedModule(descriptor, instance));
    }
}
