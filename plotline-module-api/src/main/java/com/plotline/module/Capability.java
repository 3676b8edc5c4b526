package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The four capabilities a loaded module must expose.
 */
public enum Capability {
    METADATA("metadata", "metadata accessor", MetadataAccessor.class),
    ITEMS("items", "item enumeration", ItemCatalog.class),
    GENERATE("generate", "single-item generation", PlotGenerator.class),
    GENERATE_BATCH("generate_batch", "batch generation", BatchPlotGenerator.class);

    private final String id;
    private final String label;
    private final Class<?> contract;

    Capability(String id, String label, Class<?> contract) {
        this.id = id;
        this.label = label;
        this.contract = contract;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public Class<?> getContract() {
        return contract;
    }

    public boolean isProvidedBy(Object instance) {
        return contract.isInstance(instance);
    }

    /** "batch generation (BatchPlotGenerator)" */
    public String describe() {
        return label + " (" + contract.getSimpleName() + ")";
    }

    /** Capabilities {@code instance} does not implement, in declaration order. */
    public static List<Capability> missing(Object instance) {
        List<Capability> out = new ArrayList<>();
        for (Capability c : values()) {
            if (!c.isProvidedBy(instance)) out.add(c);
        }
        return out;
    }

    /** Lenient lookup by id or constant name; null when unknown. */
    @JsonCreator
    public static Capability fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Capability c : values()) {
            if (c.id.equals(v) || c.name().toLowerCase(Locale.ROOT).equals(v)) return c;
        }
        return null;
    }
}
