package com.plotline.data;

import com.plotline.result.ResultStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvDataLoaderTest {

    private static final String CLEAN_CSV = """
            mass,year,dispersed
            310,2001,yes
            325,2002,no
            290,2003,yes
            301,2004,no
            333,2005,yes
            298,2006,no
            312,2007,yes
            305,2008,no
            320,2009,yes
            315,2010,no
            """;

    @TempDir
    Path tempDir;

    @Test
    void load_cleanFileSucceedsWithFullScore() throws Exception {
        Path file = write("clean.csv", CLEAN_CSV);
        CsvDataLoader loader = new CsvDataLoader(Set.of("mass", "year"), Map.of("mass", new ColumnRange(0, 1000)), 10);

        DataLoadResult result = loader.load(file, List.of("mass", "year", "dispersed"));

        assertEquals(ResultStatus.SUCCESS, result.getStatus());
        assertEquals(100.0, result.getQualityScore(), 0.001);
        assertEquals(10, result.getRowCount());
        assertEquals(3, result.getColumnCount());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(List.of("mass", "year", "dispersed"), result.getData().getColumns());
    }

    @Test
    void load_missingFileFails() {
        DataLoadResult result = new CsvDataLoader().load(tempDir.resolve("absent.csv"), List.of("mass"));

        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertFalse(result.getErrors().isEmpty());
        assertTrue(result.getErrors().get(0).contains("absent.csv"));
    }

    @Test
    void load_missingRequiredColumnFailsAndNamesIt() throws Exception {
        Path file = write("clean.csv", CLEAN_CSV);

        DataLoadResult result = new CsvDataLoader().load(file, List.of("mass", "origin"));

        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertTrue(result.getErrors().get(0).contains("origin"));
    }

    @Test
    void load_outliersAndShortFileDegradeToPartial() throws Exception {
        Path file = write("short.csv", """
                mass,year
                310,2001
                5000,2002
                290,2003
                301,2004
                333,2005
                298,2006
                312,2007
                305,2008
                """);
        CsvDataLoader loader = new CsvDataLoader(Set.of(), Map.of("mass", new ColumnRange(0, 1000)), 10);

        DataLoadResult result = loader.load(file, List.of("mass", "year"));

        // completeness 100, schema 100, rows 8/10 -> 80, outliers 1/8 -> 87.5
        assertEquals(93.5, result.getQualityScore(), 0.001);
        assertEquals(ResultStatus.SUCCESS, result.getStatus());
        assertEquals(1, result.getQualityMetrics().outliers());
        assertFalse(result.getQualityMetrics().rowCountOk());
    }

    @Test
    void load_nonNumericDeclaredColumnLowersSchemaMatch() throws Exception {
        Path file = write("typed.csv", """
                mass,year
                heavy,2001
                light,2002
                """);
        CsvDataLoader loader = new CsvDataLoader(Set.of("mass", "year"), Map.of(), 2);

        DataLoadResult result = loader.load(file, List.of("mass", "year"));

        assertEquals(50.0, result.getQualityMetrics().schemaMatch(), 0.001);
        // 100*0.3 + 50*0.3 + 100*0.2 + 100*0.2
        assertEquals(85.0, result.getQualityScore(), 0.001);
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertFalse(result.getWarnings().isEmpty());
    }

    @Test
    void load_sparseMistypedFileFails() throws Exception {
        Path file = write("sparse.csv", """
                mass,year
                abc,NA
                NA,def
                """);
        CsvDataLoader loader = new CsvDataLoader(Set.of("mass", "year"), Map.of(), 10);

        DataLoadResult result = loader.load(file, List.of("mass", "year"));

        // 50*0.3 + 0*0.3 + 20*0.2 + 100*0.2
        assertEquals(39.0, result.getQualityScore(), 0.001);
        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertTrue(result.getErrors().get(0).startsWith("Data quality too low"));
    }

    @Test
    void dataset_numericValuesSkipMissingAndText() {
        Dataset dataset = new Dataset(List.of("x"), List.of(
                Map.of("x", "1.5"), Map.of("x", "NA"), Map.of("x", "abc"), Map.of("x", "3")));

        assertArrayEquals(new double[]{1.5, 3.0}, dataset.numericValues("x"), 0.0);
        assertEquals(1, dataset.missingCellCount());
    }

    @Test
    void dataset_contentHashTracksCellValues() {
        Dataset a = new Dataset(List.of("x"), List.of(Map.of("x", "1")));
        Dataset b = new Dataset(List.of("x"), List.of(Map.of("x", "1")));
        Dataset c = new Dataset(List.of("x"), List.of(Map.of("x", "2")));

        assertEquals(a.contentHash(), b.contentHash());
        assertNotEquals(a.contentHash(), c.contentHash());
        assertEquals(64, a.contentHash().length());
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
