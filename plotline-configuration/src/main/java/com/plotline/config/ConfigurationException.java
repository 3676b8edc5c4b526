package com.plotline.config;

import java.nio.file.Path;

/**
 * Configuration file exists but cannot be read or parsed.
 */
public class ConfigurationException extends RuntimeException {

    private final Path source;

    public ConfigurationException(String message, Path source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
