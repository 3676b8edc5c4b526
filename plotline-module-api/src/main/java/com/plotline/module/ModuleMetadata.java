package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Module identity reported by {@link MetadataAccessor}.
 */
public record ModuleMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
) {
    public ModuleMetadata {
        Objects.requireNonNull(name, "name");
        version = version != null ? version : "unknown";
        description = description != null ? description : "";
    }

    public static ModuleMetadata of(String name, String version) {
        return new ModuleMetadata(name, version, "");
    }
}
