package com.plotline.module;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovered module candidate. Built once per discovery pass.
 *
 * @param name                 directory name; the module's key in batch results
 * @param location             module directory
 * @param entryPoint           the {@code module.json} manifest file
 * @param providerId           provider that creates the module instance
 * @param declaredCapabilities capabilities listed in the manifest (informational)
 * @param settings             manifest settings passed to the provider
 * @param discoveredAt         discovery timestamp
 * @param manifestError        why the manifest could not be read, or null
 */
public record ModuleDescriptor(
        String name,
        Path location,
        Path entryPoint,
        String providerId,
        List<Capability> declaredCapabilities,
        Map<String, Object> settings,
        Instant discoveredAt,
        String manifestError
) {
    public ModuleDescriptor {
        Objects.requireNonNull(name, "name");
        providerId = providerId != null && !providerId.isBlank() ? providerId.trim() : name;
        declaredCapabilities = declaredCapabilities != null ? List.copyOf(declaredCapabilities) : List.of();
        settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
        discoveredAt = discoveredAt != null ? discoveredAt : Instant.now();
    }

    /** Descriptor for a module registered without a plugin directory. */
    public static ModuleDescriptor of(String name, String providerId) {
        return new ModuleDescriptor(name, null, null, providerId, List.of(), Map.of(), Instant.now(), null);
    }

    public boolean hasManifestError() {
        return manifestError != null;
    }
}
