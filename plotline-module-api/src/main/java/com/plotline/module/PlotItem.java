package com.plotline.module;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One producible work item.
 *
 * @param id          unique within the module; used as the result key and in artifact names
 * @param group       category tag (e.g. "distribution", "summary")
 * @param displayName human label; defaults to the id
 * @param params      item parameters passed to the generator through {@link PlotConfig#getParams()}
 */
public record PlotItem(
        @JsonProperty("id") String id,
        @JsonProperty("group") String group,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("params") Map<String, Object> params
) {
    public PlotItem {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Item id must be non-blank");
        }
        group = group != null ? group : "default";
        displayName = displayName != null ? displayName : id;
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public static PlotItem of(String id, String group) {
        return new PlotItem(id, group, null, null);
    }
}
