package com.plotline.module;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Finds module candidates under a plugin root. Only immediate subdirectories are considered,
 * and a subdirectory is a module iff it contains {@value #ENTRY_POINT}. Discovery reads the
 * manifest as data and never instantiates module code.
 */
public final class ModuleDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ModuleDiscovery.class);

    public static final String ENTRY_POINT = "module.json";

    private final ObjectMapper mapper;

    public ModuleDiscovery() {
        this(new ObjectMapper());
    }

    public ModuleDiscovery(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param pluginRoot directory holding one subdirectory per module
     * @return descriptors sorted by name; empty when the root is missing or holds no modules
     */
    public List<ModuleDescriptor> discover(Path pluginRoot) {
        if (pluginRoot == null || !Files.exists(pluginRoot)) {
            log.warn("Module root does not exist: {}", pluginRoot);
            return List.of();
        }
        if (!Files.isDirectory(pluginRoot)) {
            log.warn("Module root is not a directory: {}", pluginRoot);
            return List.of();
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginRoot, Files::isDirectory)) {
            for (Path dir : stream) {
                if (Files.isRegularFile(dir.resolve(ENTRY_POINT))) {
                    candidates.add(dir);
                } else {
                    log.debug("Skipping {} (no {})", dir.getFileName(), ENTRY_POINT);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list module root {}: {}", pluginRoot, e.getMessage());
            return List.of();
        }
        candidates.sort(Comparator.comparing(p -> p.getFileName().toString()));

        Instant now = Instant.now();
        List<ModuleDescriptor> out = new ArrayList<>(candidates.size());
        for (Path dir : candidates) {
            out.add(describe(dir, now));
        }
        log.info("Discovered {} module(s) under {}", out.size(), pluginRoot);
        return out;
    }

    private ModuleDescriptor describe(Path dir, Instant now) {
        String name = dir.getFileName().toString();
        Path entryPoint = dir.resolve(ENTRY_POINT);
        try {
            ModuleManifest manifest = Files.size(entryPoint) == 0
                    ? new ModuleManifest(null, null, null)
                    : mapper.readValue(entryPoint.toFile(), ModuleManifest.class);
            List<Capability> declared = new ArrayList<>();
            for (String c : manifest.getCapabilities()) {
                Capability cap = Capability.fromValue(c);
                if (cap != null) {
                    declared.add(cap);
                } else {
                    log.warn("Module {} declares unknown capability '{}'", name, c);
                }
            }
            return new ModuleDescriptor(name, dir, entryPoint, manifest.getProvider(), declared,
                    manifest.getSettings(), now, null);
        } catch (IOException e) {
            log.warn("Unreadable manifest {}: {}", entryPoint, e.getMessage());
            return new ModuleDescriptor(name, dir, entryPoint, null, List.of(), Map.of(), now,
                    "Unreadable " + ENTRY_POINT + ": " + e.getMessage());
        }
    }
}
