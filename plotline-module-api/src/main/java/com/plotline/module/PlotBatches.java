package com.plotline.module;

import com.plotline.data.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resilient batch execution over a {@link PlotGenerator}: each item runs inside its own error
 * boundary, so a thrown exception, a timeout or a null result becomes that item's FAILED result.
 * With {@code continueOnError=false} the batch stops after the first failed item and the
 * remaining items get no result.
 */
public final class PlotBatches {

    private static final Logger log = LoggerFactory.getLogger(PlotBatches.class);

    private PlotBatches() {
    }

    /**
     * @return results keyed by item id in attempt order
     */
    public static Map<String, PlotResult> generateEach(PlotGenerator generator, Dataset data,
                                                       List<PlotJob> jobs, PlotConfig config) {
        Map<String, PlotResult> results = new LinkedHashMap<>();
        BoundedCall bounded = config.getItemTimeout() != null ? new BoundedCall(config.getItemTimeout()) : null;
        try {
            for (PlotJob job : jobs) {
                PlotResult result = runOne(generator, data, job, config, bounded);
                results.put(job.itemId(), result);
                if (!result.isGenerated()) {
                    log.warn("Item {} failed: {}", job.itemId(), result.getError());
                    if (!config.isContinueOnError()) {
                        log.warn("Stopping batch after {} of {} items (continueOnError=false)",
                                results.size(), jobs.size());
                        break;
                    }
                }
            }
        } finally {
            if (bounded != null) bounded.close();
        }
        return results;
    }

    private static PlotResult runOne(PlotGenerator generator, Dataset data, PlotJob job,
                                     PlotConfig config, BoundedCall bounded) {
        long start = System.nanoTime();
        PlotConfig itemConfig = config.withParams(job.params());
        PlotResult result;
        try {
            result = bounded != null
                    ? bounded.call(job.itemId(), () -> generator.generate(data, job.itemId(), itemConfig))
                    : generator.generate(data, job.itemId(), itemConfig);
            if (result == null) {
                result = PlotResult.failed(job.itemId(), "generator returned no result");
            }
        } catch (ItemTimeoutException e) {
            result = PlotResult.failed(job.itemId(), e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Item {} threw", job.itemId(), e);
            result = PlotResult.failed(job.itemId(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result.getDurationMillis() == 0L) {
            result = result.withDuration((System.nanoTime() - start) / 1_000_000L);
        }
        return result;
    }
}
