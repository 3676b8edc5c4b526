package com.plotline.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContentHasherTest {

    @TempDir
    Path dir;

    @Test
    void hashFile_isStableForUnchangedFileAndChangesWithContent() throws Exception {
        Path file = dir.resolve("plot.png");
        Files.write(file, new byte[]{1, 2, 3, 4});

        String first = ContentHasher.hashFile(file);
        String second = ContentHasher.hashFile(file);
        Files.write(file, new byte[]{1, 2, 3, 5});
        String changed = ContentHasher.hashFile(file);

        assertEquals(first, second);
        assertNotEquals(first, changed);
        assertEquals(64, first.length());
    }

    @Test
    void hash_matchesKnownSha256() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", ContentHasher.hash("abc"));
    }

    @Test
    void hashFile_missingFileRaisesRegistryIoException() {
        assertThrows(RegistryIoException.class, () -> ContentHasher.hashFile(dir.resolve("absent")));
    }
}
