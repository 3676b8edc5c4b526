package com.plotline.module;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Providers by id. Built-ins are registered explicitly; further providers come from
 * {@link ServiceLoader}. Disabled providers are skipped and duplicate ids are rejected.
 */
public final class ModuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModuleCatalog.class);

    private final Map<String, PlotModuleProvider> providers = new LinkedHashMap<>();

    /**
     * Registers a provider.
     *
     * @return true if registered, false if the provider is disabled
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public boolean register(PlotModuleProvider provider) {
        Objects.requireNonNull(provider, "provider");
        if (!provider.isEnabled()) {
            log.info("Module provider {} is disabled; not registered", provider.getProviderId());
            return false;
        }
        String id = Objects.requireNonNull(provider.getProviderId(), "providerId").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Provider id must be non-blank");
        }
        if (providers.putIfAbsent(id, provider) != null) {
            throw new IllegalArgumentException("Module provider already registered: " + id);
        }
        log.debug("Registered module provider {} v{}", id, provider.getVersion());
        return true;
    }

    /** Registers providers found by {@link ServiceLoader} on the context class loader. */
    public int loadServiceProviders() {
        return loadServiceProviders(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Registers providers found by {@link ServiceLoader}. Providers that fail to instantiate or
     * clash with an existing id are logged and skipped.
     *
     * @return number of providers registered
     */
    public int loadServiceProviders(ClassLoader classLoader) {
        int n = 0;
        ServiceLoader<PlotModuleProvider> loader = ServiceLoader.load(PlotModuleProvider.class, classLoader);
        var it = loader.iterator();
        while (true) {
            PlotModuleProvider provider;
            try {
                if (!it.hasNext()) break;
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.error("Module provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (providers.containsKey(provider.getProviderId())) {
                log.debug("Provider {} already registered; ServiceLoader entry ignored", provider.getProviderId());
                continue;
            }
            try {
                if (register(provider)) n++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping module provider {}: {}", provider.getClass().getName(), e.getMessage());
            }
        }
        log.info("Module providers: {} registered via ServiceLoader, {} total", n, providers.size());
        return n;
    }

    /** Provider for the id, or null. */
    public PlotModuleProvider get(String providerId) {
        if (providerId == null) return null;
        return providers.get(providerId.trim());
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(providers.keySet());
    }

    public List<PlotModuleProvider> providers() {
        return List.copyOf(providers.values());
    }

    public int size() {
        return providers.size();
    }
}
