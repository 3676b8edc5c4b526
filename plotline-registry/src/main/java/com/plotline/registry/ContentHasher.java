package com.plotline.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashes, lower-case hex.
 */
public final class ContentHasher {

    private static final int BUFFER_SIZE = 64 * 1024;

    private ContentHasher() {
    }

    /**
     * Streams the file through SHA-256.
     *
     * @throws RegistryIoException if the file cannot be read
     */
    public static String hashFile(Path file) {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                digest.update(buffer, 0, n);
            }
        } catch (IOException e) {
            throw new RegistryIoException("Cannot hash " + file + ": " + e.getMessage(), file, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String hash(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }

    public static String hash(String content) {
        return hash(content.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
