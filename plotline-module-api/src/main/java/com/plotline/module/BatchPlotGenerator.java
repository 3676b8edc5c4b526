package com.plotline.module;

import com.plotline.data.Dataset;

import java.util.List;
import java.util.Map;

/**
 * Capability: produces a list of items in one call.
 * <p>
 * Implementations must keep going when one item fails: the failure becomes that item's
 * result and the remaining items are still attempted, unless {@link PlotConfig#isContinueOnError()}
 * is false, in which case the batch stops after the first failed item.
 */
public interface BatchPlotGenerator {

    /**
     * @return results keyed by item id, in attempt order
     */
    Map<String, PlotResult> generateBatch(Dataset data, List<String> itemIds, PlotConfig config);
}
