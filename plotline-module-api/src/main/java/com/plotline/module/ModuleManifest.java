package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a module directory's {@code module.json}: which provider to use, the capabilities
 * it claims and settings for the provider. Read as data only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class ModuleManifest {

    private final String provider;
    private final List<String> capabilities;
    private final Map<String, Object> settings;

    @JsonCreator
    ModuleManifest(
            @JsonProperty("provider") String provider,
            @JsonProperty("capabilities") List<String> capabilities,
            @JsonProperty("settings") Map<String, Object> settings) {
        this.provider = provider;
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        this.settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
    }

    String getProvider() {
        return provider;
    }

    List<String> getCapabilities() {
        return capabilities;
    }

    Map<String, Object> getSettings() {
        return settings;
    }
}
