package com.plotline.module;

import java.util.Map;

/**
 * SPI for plot module implementations. Providers are discovered with {@link java.util.ServiceLoader}
 * (META-INF/services/com.plotline.module.PlotModuleProvider) or registered explicitly with a
 * {@link ModuleCatalog}. A plugin directory's {@code module.json} names the provider by id.
 */
public interface PlotModuleProvider {

    /** Provider id referenced by {@code module.json}'s {@code provider} field. */
    String getProviderId();

    /**
     * Creates a new module instance. Called once per load, so instances never share state
     * across modules or runs. The returned object should implement every {@link Capability};
     * the loader rejects it otherwise.
     *
     * @param settings settings from the module's manifest; never null
     */
    Object createModule(Map<String, Object> settings);

    default String getVersion() {
        return "1.0";
    }

    /** Whether the catalog should register this provider. */
    default boolean isEnabled() {
        return true;
    }
}
