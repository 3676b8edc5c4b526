package com.plotline.engine;

import com.plotline.data.Dataset;
import com.plotline.module.LoadResult;
import com.plotline.module.LoadedModule;
import com.plotline.module.ModuleDescriptor;
import com.plotline.module.ModuleDiscovery;
import com.plotline.module.ModuleLoader;
import com.plotline.module.ModuleMetadata;
import com.plotline.module.PlotItem;
import com.plotline.module.PlotResult;
import com.plotline.result.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers, loads and runs every plot module under a root, one module at a time in discovery
 * order. A module that fails to load, or whose catalog or batch call throws, is recorded and
 * skipped; the remaining modules still run.
 */
public final class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ModuleDiscovery discovery;
    private final ModuleLoader loader;

    public BatchOrchestrator(ModuleDiscovery discovery, ModuleLoader loader) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public BatchResult orchestrate(Dataset data, Path modulesRoot, Path outputRoot, BatchOptions options) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(outputRoot, "outputRoot");
        BatchOptions opts = options != null ? options : BatchOptions.defaults();
        long start = System.nanoTime();
        BatchResult result = new BatchResult(opts.getRunId(), Instant.now());

        List<ModuleDescriptor> descriptors;
        try {
            descriptors = discovery.discover(modulesRoot);
        } catch (RuntimeException e) {
            log.warn("Module discovery under {} failed; continuing with no modules", modulesRoot, e);
            result.addWarning(ErrorKind.MODULE_DISCOVERY.format("Discovery failed under " + modulesRoot + ": " + e.getMessage()));
            descriptors = List.of();
        }
        result.setModulesFound(descriptors.size());
        if (descriptors.isEmpty()) {
            result.addWarning(ErrorKind.MODULE_DISCOVERY.format("No modules found under " + modulesRoot));
        }
        log.info("Found {} module(s) under {}", descriptors.size(), modulesRoot);

        for (ModuleDescriptor descriptor : descriptors) {
            ModuleBatchResult moduleResult = new ModuleBatchResult(descriptor.name());
            long moduleStart = System.nanoTime();
            LoadResult load = loadModule(descriptor);
            opts.getListener().onModuleLoaded(load);
            if (!load.isSuccess()) {
                result.moduleFailed();
                String msg = ErrorKind.MODULE_LOAD.format("Failed to load module '" + descriptor.name() + "': " + load.getError());
                result.addError(msg);
                moduleResult.fail(load.getError());
                log.warn("{}", msg);
            } else {
                result.moduleLoaded();
                runModule(load.getModule(), data, outputRoot, opts, result, moduleResult);
            }
            moduleResult.setDurationMillis(millisSince(moduleStart));
            result.putModule(moduleResult);
        }

        result.complete(millisSince(start));
        log.info("Plot generation {}: modules {} found, {} loaded, {} failed; items {} generated, {} failed",
                result.getStatus().toValue(), result.getModulesFound(), result.getModulesLoaded(),
                result.getModulesFailed(), result.getPlotsGenerated(), result.getPlotsFailed());
        return result;
    }

    private LoadResult loadModule(ModuleDescriptor descriptor) {
        try {
            return loader.load(descriptor);
        } catch (RuntimeException e) {
            log.warn("Loader raised for module {}", descriptor.name(), e);
            return LoadResult.failed(descriptor.name(), "Loader error: " + e.getMessage());
        }
    }

    private void runModule(LoadedModule module, Dataset data, Path outputRoot, BatchOptions opts,
                           BatchResult result, ModuleBatchResult moduleResult) {
        String name = module.getName();
        try {
            ModuleMetadata metadata = module.metadata();
            if (metadata != null) moduleResult.setVersion(metadata.version());

            List<PlotItem> items = module.availableItems();
            List<String> itemIds = new ArrayList<>(items.size());
            for (PlotItem item : items) {
                itemIds.add(item.id());
            }
            if (itemIds.isEmpty()) {
                result.addWarning(ErrorKind.ITEM_GENERATION.format("Module '" + name + "' offers no items"));
                return;
            }

            Path moduleOut = Files.createDirectories(outputRoot.resolve(name));
            log.info("Module {}: generating {} item(s) into {}", name, itemIds.size(), moduleOut);
            Map<String, PlotResult> produced = module.generateBatch(data, itemIds, opts.toPlotConfig(moduleOut));

            int missing = 0;
            for (String id : itemIds) {
                PlotResult r = produced.get(id);
                if (r == null) {
                    if (opts.isContinueOnError()) {
                        r = PlotResult.failed(id, "No result returned by module");
                    } else {
                        missing++;
                        continue;
                    }
                }
                record(name, r, result, moduleResult, opts.getListener());
            }
            for (Map.Entry<String, PlotResult> extra : produced.entrySet()) {
                if (!itemIds.contains(extra.getKey()) && extra.getValue() != null) {
                    record(name, extra.getValue(), result, moduleResult, opts.getListener());
                }
            }
            if (missing > 0) {
                moduleResult.addSkipped(missing);
                result.addWarning(ErrorKind.ITEM_GENERATION.format(
                        "Module '" + name + "': " + missing + " item(s) skipped after an earlier failure"));
            }
        } catch (IOException e) {
            moduleExecutionFailed(name, "cannot create output directory: " + e.getMessage(), e, result, moduleResult);
        } catch (RuntimeException | LinkageError e) {
            moduleExecutionFailed(name, e.getMessage() != null ? e.getMessage() : e.getClass().getName(), e,
                    result, moduleResult);
        }
    }

    private static void record(String moduleName, PlotResult r, BatchResult result, ModuleBatchResult moduleResult,
                               PipelineListener listener) {
        moduleResult.addItem(r);
        if (!r.isGenerated()) {
            result.addError(ErrorKind.ITEM_GENERATION.format(moduleName + "/" + r.getItemId() + ": " + r.getError()));
        }
        for (String w : r.getWarnings()) {
            result.addWarning(ErrorKind.ITEM_GENERATION.format(moduleName + "/" + r.getItemId() + ": " + w));
        }
        listener.onItemCompleted(moduleName, r);
    }

    private static void moduleExecutionFailed(String name, String reason, Throwable cause, BatchResult result,
                                              ModuleBatchResult moduleResult) {
        String msg = ErrorKind.MODULE_LOAD.format("Error executing module '" + name + "': " + reason);
        log.warn("{}", msg, cause);
        result.moduleFailed();
        result.addError(msg);
        moduleResult.fail(reason);
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
