package com.plotline.module;

import com.plotline.data.Dataset;

/**
 * Capability: produces one item.
 * <p>
 * Expected per-item problems (missing column, nothing to draw) are reported as a
 * {@link PlotResult#failed(String, String) failed} result rather than thrown. Callers still
 * guard the call, so an exception is recorded as a failed item.
 */
public interface PlotGenerator {

    /**
     * @param data   input dataset
     * @param itemId one of the ids from {@link ItemCatalog#availableItems()}
     * @param config output directory, resolution and item parameters
     * @return outcome for the item; never null
     */
    PlotResult generate(Dataset data, String itemId, PlotConfig config);
}
