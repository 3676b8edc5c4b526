package com.plotline.module;

import com.plotline.data.Dataset;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Execution context owned by the orchestrator for one loaded module: the module instance seen
 * through each capability interface, plus the descriptor it was loaded from.
 */
public final class LoadedModule {

    private final ModuleDescriptor descriptor;
    private final Object instance;
    private final MetadataAccessor metadataAccessor;
    private final ItemCatalog itemCatalog;
    private final PlotGenerator generator;
    private final BatchPlotGenerator batchGenerator;

    LoadedModule(ModuleDescriptor descriptor, Object instance) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.instance = Objects.requireNonNull(instance, "instance");
        this.metadataAccessor = (MetadataAccessor) instance;
        this.itemCatalog = (ItemCatalog) instance;
        this.generator = (PlotGenerator) instance;
        this.batchGenerator = (BatchPlotGenerator) instance;
    }

    public ModuleDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.name();
    }

    public Object getInstance() {
        return instance;
    }

    public ModuleMetadata metadata() {
        return metadataAccessor.metadata();
    }

    public List<PlotItem> availableItems() {
        List<PlotItem> items = itemCatalog.availableItems();
        return items != null ? items : List.of();
    }

    public PlotResult generate(Dataset data, String itemId, PlotConfig config) {
        return generator.generate(data, itemId, config);
    }

    public Map<String, PlotResult> generateBatch(Dataset data, List<String> itemIds, PlotConfig config) {
        Map<String, PlotResult> results = batchGenerator.generateBatch(data, itemIds, config);
        return results != null ? results : Map.of();
    }
}
