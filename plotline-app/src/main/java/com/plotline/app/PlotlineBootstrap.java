package com.plotline.app;

import com.plotline.config.ConfigurationLoader;
import com.plotline.config.PlotlineConfig;
import com.plotline.data.CsvDataLoader;
import com.plotline.engine.BatchOrchestrator;
import com.plotline.engine.PipelineDriver;
import com.plotline.engine.PipelineListener;
import com.plotline.module.ModuleCatalog;
import com.plotline.module.ModuleDiscovery;
import com.plotline.module.ModuleLoader;
import com.plotline.module.PlotModuleProvider;
import com.plotline.module.histogram.HistogramModuleProvider;
import com.plotline.registry.NoOpRegistryStore;
import com.plotline.registry.RegistrySession;
import com.plotline.registry.RegistryStore;
import com.plotline.registry.YamlRegistryStore;
import com.plotline.report.ProcessReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wires configuration, the module catalog, collaborators and the pipeline driver.
 */
public final class PlotlineBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PlotlineBootstrap.class);

    private PlotlineBootstrap() {
    }

    /** Defaults, then {@code configFile} (may be absent), then {@code PLOTLINE_*} environment variables. */
    public static PlotlineConfig loadConfig(Path configFile, Map<String, String> env) {
        log.info("Bootstrap: loading configuration from {}", configFile.toAbsolutePath());
        return new ConfigurationLoader().load(configFile, env);
    }

    /**
     * Built-in providers first, then any provider on the class path via ServiceLoader. Built-in
     * registration failures are fatal; ServiceLoader duplicates are skipped.
     */
    public static ModuleCatalog createCatalog() {
        ModuleCatalog catalog = new ModuleCatalog();
        for (PlotModuleProvider provider : builtInProviders()) {
            catalog.register(provider);
            log.info("Registered built-in module provider {} (version={})", provider.getProviderId(), provider.getVersion());
        }
        int external = catalog.loadServiceProviders();
        if (external > 0) {
            log.info("Registered {} module provider(s) from the class path", external);
        }
        if (catalog.size() == 0) {
            log.warn("No module providers registered; every module directory will fail to load");
        }
        return catalog;
    }

    static List<PlotModuleProvider> builtInProviders() {
        return List.of(new HistogramModuleProvider());
    }

    public static RegistryStore createStore(PlotlineConfig config) {
        return config.isUseRegistry() ? new YamlRegistryStore() : new NoOpRegistryStore();
    }

    public static PipelineDriver createDriver(PlotlineConfig config, ModuleCatalog catalog, PipelineListener listener) {
        RegistrySession registry = RegistrySession.open(createStore(config), config.getRegistryPath(),
                config.getPipelineVersion());
        return PipelineDriver.builder()
                .config(config)
                .dataLoader(new CsvDataLoader(Set.copyOf(config.getNumericColumns()), config.getColumnRanges(),
                        config.getMinRows()))
                .orchestrator(new BatchOrchestrator(new ModuleDiscovery(), new ModuleLoader(catalog)))
                .registry(registry)
                .reportRenderer(new ProcessReportRenderer(config.getReportExecutable(),
                        Duration.ofSeconds(config.getReportTimeoutSeconds())))
                .listener(listener)
                .build();
    }
}
