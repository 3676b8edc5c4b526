package com.plotline.module;

import com.plotline.data.Dataset;
import com.plotline.result.ResultStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlotBatchesTest {

    private static final List<String> FIVE = List.of("item-1", "item-2", "item-3", "item-4", "item-5");

    @TempDir
    Path out;

    @Test
    void generateBatch_failuresDoNotStopRemainingItems() {
        TestModules.CountingModule module = new TestModules.CountingModule(5, Set.of("item-2"), Set.of("item-4"));

        Map<String, PlotResult> results = module.generateBatch(Dataset.empty(), FIVE, config(true));

        assertEquals(FIVE, List.copyOf(results.keySet()));
        assertEquals(ResultStatus.FAILED, results.get("item-2").getStatus());
        assertEquals(ResultStatus.FAILED, results.get("item-4").getStatus());
        assertTrue(results.get("item-4").getError().contains("boom item-4"));
        long generated = results.values().stream().filter(PlotResult::isGenerated).count();
        assertEquals(3, generated);
    }

    @Test
    void generateBatch_stopsAfterFirstFailureWhenContinueOnErrorIsFalse() {
        TestModules.CountingModule module = new TestModules.CountingModule(5, Set.of("item-2"), Set.of());

        Map<String, PlotResult> results = module.generateBatch(Dataset.empty(), FIVE, config(false));

        assertEquals(List.of("item-1", "item-2"), List.copyOf(results.keySet()));
        assertEquals(List.of("item-1", "item-2"), module.attempted);
    }

    @Test
    void generateBatch_passesCatalogParamsToEachItem() {
        TestModules.CountingModule module = new TestModules.CountingModule(1, Set.of(), Set.of()) {
            @Override
            public PlotResult generate(Dataset data, String itemId, PlotConfig config) {
                return PlotResult.success(itemId, config.getParam("index", "none"), 100.0);
            }
        };

        Map<String, PlotResult> results = module.generateBatch(Dataset.empty(), List.of("item-1"), config(true));

        assertEquals("1", results.get("item-1").getOutputPath());
    }

    @Test
    void generateEach_hungItemTimesOutAndBatchContinues() {
        PlotGenerator generator = (data, itemId, config) -> {
            if (itemId.equals("slow")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return PlotResult.success(itemId, null, 90.0);
        };
        PlotConfig config = config(true).toBuilder().itemTimeout(Duration.ofMillis(200)).build();

        Map<String, PlotResult> results = PlotBatches.generateEach(generator, Dataset.empty(),
                List.of(PlotJob.of("slow"), PlotJob.of("fast")), config);

        assertEquals(ResultStatus.FAILED, results.get("slow").getStatus());
        assertTrue(results.get("slow").getError().contains("timed out"));
        assertEquals(ResultStatus.SUCCESS, results.get("fast").getStatus());
    }

    @Test
    void generateEach_nullResultCountsAsFailed() {
        PlotGenerator generator = (data, itemId, config) -> null;

        Map<String, PlotResult> results = PlotBatches.generateEach(generator, Dataset.empty(),
                List.of(PlotJob.of("x")), config(true));

        assertEquals(ResultStatus.FAILED, results.get("x").getStatus());
    }

    private PlotConfig config(boolean continueOnError) {
        return PlotConfig.builder().outputDir(out).dpi(72).continueOnError(continueOnError).build();
    }
}
