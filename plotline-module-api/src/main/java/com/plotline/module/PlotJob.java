package com.plotline.module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A requested unit of work: item id plus the parameters it runs with.
 */
public record PlotJob(String itemId, Map<String, Object> params) {
    public PlotJob {
        Objects.requireNonNull(itemId, "itemId");
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public static PlotJob of(String itemId) {
        return new PlotJob(itemId, Map.of());
    }
}
