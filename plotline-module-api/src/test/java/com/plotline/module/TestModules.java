package com.plotline.module;

import com.plotline.data.Dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Small module doubles shared by the module tests. */
final class TestModules {

    private TestModules() {
    }

    /** Produces items item-1..item-n; ids in {@code failing} fail, ids in {@code throwing} throw. */
    static class CountingModule implements PlotModule {
        final int itemCount;
        final Set<String> failing;
        final Set<String> throwing;
        final List<String> attempted = new ArrayList<>();

        CountingModule(int itemCount, Set<String> failing, Set<String> throwing) {
            this.itemCount = itemCount;
            this.failing = failing;
            this.throwing = throwing;
        }

        @Override
        public ModuleMetadata metadata() {
            return ModuleMetadata.of("counting", "1.0");
        }

        @Override
        public List<PlotItem> availableItems() {
            List<PlotItem> items = new ArrayList<>();
            for (int i = 1; i <= itemCount; i++) {
                items.add(new PlotItem("item-" + i, "test", null, Map.of("index", i)));
            }
            return items;
        }

        @Override
        public PlotResult generate(Dataset data, String itemId, PlotConfig config) {
            attempted.add(itemId);
            if (throwing.contains(itemId)) {
                throw new IllegalStateException("boom " + itemId);
            }
            if (failing.contains(itemId)) {
                return PlotResult.failed(itemId, "cannot draw " + itemId);
            }
            return PlotResult.success(itemId, config.getOutputDir().resolve(itemId + ".png").toString(), 100.0);
        }
    }

    /** Implements only metadata and item enumeration. */
    static final class HalfModule implements MetadataAccessor, ItemCatalog {
        @Override
        public ModuleMetadata metadata() {
            return ModuleMetadata.of("half", "0.1");
        }

        @Override
        public List<PlotItem> availableItems() {
            return List.of();
        }
    }

    static PlotModuleProvider provider(String id, java.util.function.Supplier<Object> factory) {
        return new PlotModuleProvider() {
            @Override
            public String getProviderId() {
                return id;
            }

            @Override
            public Object createModule(Map<String, Object> settings) {
                return factory.get();
            }
        };
    }
}
