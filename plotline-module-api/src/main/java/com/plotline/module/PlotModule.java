package com.plotline.module;

import com.plotline.data.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Convenience contract for modules that implement all four capabilities. The default batch
 * entry point runs {@link #generate} for each item through {@link PlotBatches#generateEach},
 * passing each item's catalog parameters along.
 */
public interface PlotModule extends MetadataAccessor, ItemCatalog, PlotGenerator, BatchPlotGenerator {

    @Override
    default Map<String, PlotResult> generateBatch(Dataset data, List<String> itemIds, PlotConfig config) {
        Map<String, Map<String, Object>> paramsById = new HashMap<>();
        try {
            for (PlotItem item : availableItems()) {
                paramsById.put(item.id(), item.params());
            }
        } catch (RuntimeException e) {
            Logger log = LoggerFactory.getLogger(getClass());
            log.warn("Item catalog unavailable during batch; running items without catalog params: {}", e.getMessage());
        }
        List<PlotJob> jobs = new ArrayList<>(itemIds.size());
        for (String id : itemIds) {
            jobs.add(new PlotJob(id, paramsById.getOrDefault(id, Map.of())));
        }
        return PlotBatches.generateEach(this, data, jobs, config);
    }
}
