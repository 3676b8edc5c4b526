package com.plotline.module.histogram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plotline.data.Dataset;
import com.plotline.module.Capability;
import com.plotline.module.ModuleCatalog;
import com.plotline.module.PlotConfig;
import com.plotline.module.PlotItem;
import com.plotline.module.PlotResult;
import com.plotline.result.ResultStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistogramPlotModuleTest {

    @TempDir
    Path tempDir;

    private static Dataset dataset() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("x", String.valueOf(i));
            row.put("mixed", i <= 3 ? String.valueOf(i) : "n/a-" + i);
            row.put("text", "label" + i);
            rows.add(row);
        }
        return new Dataset(List.of("x", "mixed", "text"), rows);
    }

    private PlotConfig config() {
        return PlotConfig.builder().outputDir(tempDir).dpi(50).build();
    }

    @Test
    void availableItems_listsHistogramAndSummaryPerColumn() {
        List<PlotItem> items = new HistogramPlotModule(List.of("x", "mixed"), 10).availableItems();

        assertEquals(List.of("histogram_x", "summary_x", "histogram_mixed", "summary_mixed"),
                items.stream().map(PlotItem::id).toList());
        assertEquals("distribution", items.get(0).group());
        assertEquals("summary", items.get(1).group());
        assertEquals(10, items.get(0).params().get("bins"));
    }

    @Test
    void generateBatch_writesPngSizedByDpiAndSummaryJson() throws Exception {
        HistogramPlotModule module = new HistogramPlotModule(List.of("x"), 5);

        Map<String, PlotResult> results = module.generateBatch(dataset(), List.of("histogram_x", "summary_x"), config());

        PlotResult hist = results.get("histogram_x");
        assertEquals(ResultStatus.SUCCESS, hist.getStatus());
        assertEquals(100.0, hist.getQualityScore(), 0.001);
        BufferedImage image = ImageIO.read(Path.of(hist.getOutputPath()).toFile());
        assertEquals(320, image.getWidth());
        assertEquals(240, image.getHeight());

        JsonNode summary = new ObjectMapper().readTree(Path.of(results.get("summary_x").getOutputPath()).toFile());
        assertEquals(10, summary.get("count").asInt());
        assertEquals(5.5, summary.get("mean").asDouble(), 1e-9);
        assertEquals(5.5, summary.get("median").asDouble(), 1e-9);
        assertEquals(10.0, summary.get("max").asDouble(), 1e-9);
    }

    @Test
    void generate_mostlyNonNumericColumnIsPartial() {
        PlotResult result = new HistogramPlotModule(List.of("mixed"), 5).generate(dataset(), "summary_mixed", config());

        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals(30.0, result.getQualityScore(), 0.001);
        assertTrue(result.getWarnings().get(0).contains("3 of 10"));
    }

    @Test
    void generate_missingOrTextColumnFails() {
        HistogramPlotModule module = new HistogramPlotModule(List.of("absent", "text"), 5);

        PlotResult missing = module.generate(dataset(), "histogram_absent", config());
        PlotResult text = module.generate(dataset(), "histogram_text", config());

        assertEquals(ResultStatus.FAILED, missing.getStatus());
        assertTrue(missing.getError().contains("not found"));
        assertEquals(ResultStatus.FAILED, text.getStatus());
        assertTrue(text.getError().contains("no numeric values"));
    }

    @Test
    void bins_maximumFallsInLastBinAndConstantColumnInFirst() {
        assertArrayEquals(new int[]{2, 1, 2}, HistogramBins.count(new double[]{0, 1, 3, 5, 6}, 3));
        assertArrayEquals(new int[]{3, 0}, HistogramBins.count(new double[]{4, 4, 4}, 2));
    }

    @Test
    void provider_isDiscoveredAndImplementsEveryCapability() {
        ModuleCatalog catalog = new ModuleCatalog();
        catalog.loadServiceProviders();

        Object module = catalog.get(HistogramModuleProvider.PROVIDER_ID)
                .createModule(Map.of("columns", List.of("x"), "bins", 8));

        assertTrue(Capability.missing(module).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> new HistogramModuleProvider().createModule(Map.of()));
        assertEquals(4, ((HistogramPlotModule) new HistogramModuleProvider()
                .createModule(Map.of("columns", "x, y"))).availableItems().size());
    }
}
