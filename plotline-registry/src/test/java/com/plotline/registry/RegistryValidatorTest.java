package com.plotline.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistryValidatorTest {

    @TempDir
    Path dir;

    private final RegistryValidator validator = new RegistryValidator();

    @Test
    void validate_emptyRegistryIsInvalid() {
        RegistryValidationReport report = validator.validate(ArtifactRegistry.empty("1.0"), List.of(), false);

        assertFalse(report.valid());
        assertEquals(List.of("Registry is empty"), report.errors());
    }

    @Test
    void validate_reportsMissingTypesFilesAndHashMismatches() throws Exception {
        ArtifactRegistry registry = ArtifactRegistry.empty("1.0");
        Path data = write("data.csv", "a\n1\n");
        Path plot = write("p.png", "png");
        registry.register(ArtifactRequest.builder("raw", ArtifactType.RAW_DATA, data).build());
        registry.register(ArtifactRequest.builder("p", ArtifactType.PLOT, plot).input("raw").build());
        Files.writeString(data, "a\n2\n");
        Files.delete(plot);

        RegistryValidationReport report = validator.validate(registry,
                List.of(ArtifactType.RAW_DATA, ArtifactType.REPORT), true);

        assertFalse(report.valid());
        assertEquals(List.of(ArtifactType.REPORT), report.missingTypes());
        assertEquals(List.of("p"), report.missingFiles());
        assertEquals(List.of("raw"), report.hashMismatches());
    }

    @Test
    void session_failedRegistrationBecomesWarning() throws Exception {
        RegistrySession session = RegistrySession.inMemory("1.0");

        Artifact missing = session.register(ArtifactRequest.builder("ghost", ArtifactType.PLOT, dir.resolve("ghost")).build());
        Artifact ok = session.register(ArtifactRequest.builder("ok", ArtifactType.PLOT, write("ok.png", "x")).build());

        assertNull(missing);
        assertEquals("ok", ok.getName());
        assertEquals(1, session.getRegisteredCount());
        assertEquals(1, session.getWarnings().size());
        assertTrue(session.getWarnings().get(0).contains("ghost"));
    }

    @Test
    void session_persistFailureKeepsArtifactInMemory() throws Exception {
        RegistryStore failing = new RegistryStore() {
            @Override
            public ArtifactRegistry init(Path path, String pipelineVersion) {
                return ArtifactRegistry.empty(pipelineVersion);
            }

            @Override
            public void persist(ArtifactRegistry registry, Path path) {
                throw new RegistryIoException("disk full", path);
            }
        };
        RegistrySession session = RegistrySession.open(failing, dir.resolve("r.yaml"), "1.0");

        Artifact artifact = session.register(ArtifactRequest.builder("p", ArtifactType.PLOT, write("p.png", "x")).build());

        assertEquals("p", artifact.getName());
        assertTrue(session.contains("p"));
        assertTrue(session.getWarnings().get(0).contains("disk full"));
    }

    private Path write(String name, String content) throws Exception {
        Path f = dir.resolve(name);
        Files.writeString(f, content);
        return f;
    }
}
