package com.plotline.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Artifact type tags as written to the registry file.
 */
public enum ArtifactType {
    RAW_DATA("raw_data"),
    PLOT("plot"),
    REPORT("report"),
    SERIALIZED_OBJECT("serialized_object");

    private final String value;

    ArtifactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the tag or the constant name, case-insensitive.
     *
     * @throws IllegalArgumentException for an unknown tag
     */
    @JsonCreator
    public static ArtifactType fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (ArtifactType t : values()) {
                if (t.value.equals(v)) return t;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + value
                + " (expected raw_data, plot, report or serialized_object)");
    }
}
