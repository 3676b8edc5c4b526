package com.plotline.registry;

import java.nio.file.Path;

/**
 * Registry file or artifact file could not be read or written.
 */
public class RegistryIoException extends RuntimeException {

    private final Path path;

    public RegistryIoException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public RegistryIoException(String message, Path path) {
        this(message, path, null);
    }

    /** File involved, or null. */
    public Path getPath() {
        return path;
    }
}
