package com.plotline.module;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleDiscoveryTest {

    @TempDir
    Path root;

    private final ModuleDiscovery discovery = new ModuleDiscovery();

    @Test
    void discover_rootWithoutQualifyingDirectoriesReturnsEmptyList() throws Exception {
        Files.createDirectories(root.resolve("notes"));
        Files.writeString(root.resolve("notes").resolve("readme.txt"), "not a module");
        Files.writeString(root.resolve("module.json"), "{}");

        assertTrue(discovery.discover(root).isEmpty());
    }

    @Test
    void discover_missingRootReturnsEmptyList() {
        assertTrue(discovery.discover(root.resolve("absent")).isEmpty());
        assertTrue(discovery.discover(null).isEmpty());
    }

    @Test
    void discover_returnsModulesSortedByNameWithManifestData() throws Exception {
        module("zeta", "{\"provider\":\"histogram\",\"capabilities\":[\"metadata\",\"generate_batch\"],"
                + "\"settings\":{\"columns\":[\"mass\"]}}");
        module("alpha", "");
        Files.createDirectories(root.resolve("middle"));
        Files.createDirectories(root.resolve("alpha").resolve("nested").resolve("deep"));
        Files.writeString(root.resolve("alpha").resolve("nested").resolve("module.json"), "{}");

        List<ModuleDescriptor> found = discovery.discover(root);

        assertEquals(2, found.size());
        assertEquals("alpha", found.get(0).name());
        assertEquals("alpha", found.get(0).providerId());
        assertEquals("zeta", found.get(1).name());
        assertEquals("histogram", found.get(1).providerId());
        assertEquals(List.of(Capability.METADATA, Capability.GENERATE_BATCH), found.get(1).declaredCapabilities());
        assertEquals(List.of("mass"), found.get(1).settings().get("columns"));
        assertNotNull(found.get(1).discoveredAt());
        assertNull(found.get(1).manifestError());
    }

    @Test
    void discover_malformedManifestYieldsDescriptorWithError() throws Exception {
        module("broken", "{not json");

        List<ModuleDescriptor> found = discovery.discover(root);

        assertEquals(1, found.size());
        assertTrue(found.get(0).hasManifestError());
        assertFalse(found.get(0).manifestError().isBlank());
    }

    private void module(String name, String manifest) throws Exception {
        Path dir = Files.createDirectories(root.resolve(name));
        Files.writeString(dir.resolve(ModuleDiscovery.ENTRY_POINT), manifest);
    }
}
