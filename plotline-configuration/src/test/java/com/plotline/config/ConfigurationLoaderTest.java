package com.plotline.config;

import com.plotline.data.ColumnRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationLoaderTest {

    @TempDir
    Path dir;

    private final ConfigurationLoader loader = new ConfigurationLoader();

    @Test
    void load_missingFileYieldsDefaults() {
        PlotlineConfig config = loader.load(dir.resolve("absent.json"), Map.of());

        assertEquals(Paths.get(PlotlineConfig.DEFAULT_DATA_PATH), config.getDataPath());
        assertEquals(300, config.getDpi());
        assertTrue(config.isContinueOnError());
        assertTrue(config.isUseRegistry());
        assertEquals(90.0, config.getSuccessQualityThreshold(), 0.0);
        assertEquals(PlotlineConfig.DEFAULT_REPORT_TEMPLATES, config.getReportTemplates());
        assertNull(config.getItemTimeout());
    }

    @Test
    void load_fileOverridesDefaultsAndEnvironmentOverridesFile() throws Exception {
        Path file = dir.resolve("plotline.json");
        Files.writeString(file, """
                {
                  "dataPath": "study/birds.csv",
                  "requiredColumns": ["mass", "year", "dispersed"],
                  "numericColumns": ["mass", "year"],
                  "columnRanges": {"mass": {"min": 0, "max": 1000}},
                  "dpi": 150,
                  "itemTimeoutSeconds": 30,
                  "includeReports": false,
                  "somethingElse": true
                }
                """);

        PlotlineConfig config = loader.load(file, Map.of(
                "PLOTLINE_DPI", "72",
                "PLOTLINE_CONTINUE_ON_ERROR", "false",
                "PLOTLINE_ITEM_TIMEOUT_SECONDS", "not-a-number"));

        assertEquals(Paths.get("study/birds.csv"), config.getDataPath());
        assertEquals(List.of("mass", "year", "dispersed"), config.getRequiredColumns());
        assertEquals(new ColumnRange(0, 1000), config.getColumnRanges().get("mass"));
        assertEquals(72, config.getDpi());
        assertFalse(config.isContinueOnError());
        assertEquals(Duration.ofSeconds(30), config.getItemTimeout());
        assertFalse(config.isIncludeReports());
    }

    @Test
    void load_malformedFileRaisesConfigurationException() throws Exception {
        Path file = dir.resolve("plotline.json");
        Files.writeString(file, "{\"dpi\": ");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(file, Map.of()));
        assertEquals(file, e.getSource());
    }

    @Test
    void withEnvironment_splitsRequiredColumnsAndIgnoresBlankValues() {
        PlotlineConfig config = PlotlineConfig.defaults().withEnvironment(Map.of(
                "PLOTLINE_REQUIRED_COLUMNS", " mass, year ,,",
                "PLOTLINE_MODULES_ROOT", "  ",
                "PLOTLINE_USE_REGISTRY", "0"));

        assertEquals(List.of("mass", "year"), config.getRequiredColumns());
        assertEquals(Paths.get(PlotlineConfig.DEFAULT_MODULES_ROOT), config.getModulesRoot());
        assertFalse(config.isUseRegistry());
    }
}
