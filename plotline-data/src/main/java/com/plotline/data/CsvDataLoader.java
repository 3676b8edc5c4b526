package com.plotline.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.plotline.result.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a CSV file with a header row and scores its quality.
 * <p>
 * Score = completeness x 0.3 + schema match x 0.3 + row count x 0.2 + outliers x 0.2,
 * clamped to 0..100 and rounded to one decimal. At or above 90 the load succeeds, at or above 50
 * it is partial and carries the quality findings as warnings, below 50 it fails.
 */
public final class CsvDataLoader implements DataLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvDataLoader.class);

    public static final int DEFAULT_MIN_ROWS = 10;
    static final double SUCCESS_THRESHOLD = 90.0;
    static final double PARTIAL_THRESHOLD = 50.0;

    private static final double COMPLETENESS_WEIGHT = 0.30;
    private static final double SCHEMA_WEIGHT = 0.30;
    private static final double ROW_COUNT_WEIGHT = 0.20;
    private static final double OUTLIER_WEIGHT = 0.20;

    private final CsvMapper mapper;
    private final Set<String> numericColumns;
    private final Map<String, ColumnRange> columnRanges;
    private final int minRows;

    public CsvDataLoader() {
        this(Set.of(), Map.of(), DEFAULT_MIN_ROWS);
    }

    /**
     * @param numericColumns columns whose non-missing values must all parse as numbers
     * @param columnRanges   plausible ranges; numeric values outside count as outliers
     * @param minRows        minimum acceptable row count
     */
    public CsvDataLoader(Set<String> numericColumns, Map<String, ColumnRange> columnRanges, int minRows) {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.numericColumns = numericColumns != null ? Set.copyOf(numericColumns) : Set.of();
        this.columnRanges = columnRanges != null ? Map.copyOf(columnRanges) : Map.of();
        this.minRows = Math.max(1, minRows);
    }

    @Override
    public DataLoadResult load(Path file, List<String> requiredColumns) {
        long start = System.nanoTime();
        String source = file != null ? file.toAbsolutePath().toString() : null;
        List<String> required = requiredColumns != null ? requiredColumns : List.of();
        log.info("Loading data from {}", source);

        if (file == null || !Files.isRegularFile(file)) {
            String error = "File not found: " + (file != null ? file.getFileName() : "<none>");
            log.warn("{}", error);
            return DataLoadResult.failed(source, error);
        }

        Dataset dataset;
        try {
            dataset = read(file);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read CSV {}: {}", source, e.getMessage());
            return DataLoadResult.failed(source, "Failed to read CSV " + file.getFileName() + ": " + e.getMessage());
        }
        log.info("Read {} rows, {} columns", dataset.rowCount(), dataset.columnCount());

        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!dataset.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            String error = "Missing required columns: " + String.join(", ", missing)
                    + " (file must contain: " + String.join(", ", required) + ")";
            log.warn("{}", error);
            return DataLoadResult.builder()
                    .sourcePath(source)
                    .data(dataset)
                    .status(ResultStatus.FAILED)
                    .message(error)
                    .error(error)
                    .durationMillis(elapsedMillis(start))
                    .build();
        }

        QualityMetrics metrics = computeMetrics(dataset, required);
        double score = score(metrics);
        log.info("Data quality score {}/100", score);

        DataLoadResult.Builder builder = DataLoadResult.builder()
                .sourcePath(source)
                .data(dataset)
                .qualityScore(score)
                .qualityMetrics(metrics);
        if (score >= SUCCESS_THRESHOLD) {
            builder.status(ResultStatus.SUCCESS)
                    .message(String.format("Data loaded successfully (quality: %.0f/100)", score));
        } else if (score >= PARTIAL_THRESHOLD) {
            builder.status(ResultStatus.PARTIAL)
                    .message(String.format("Data loaded with warnings (quality: %.0f/100)", score))
                    .warnings(metrics.warnings());
        } else {
            String findings = String.join("; ", metrics.warnings().subList(0, Math.min(2, metrics.warnings().size())));
            String error = String.format("Data quality too low (%.0f/100)", score)
                    + (findings.isEmpty() ? "" : ": " + findings);
            builder.status(ResultStatus.FAILED).message(error).error(error);
        }
        return builder.durationMillis(elapsedMillis(start)).build();
    }

    Dataset read(Path file) throws IOException {
        List<String> columns = new ArrayList<>();
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(file.toFile())) {
            if (it.hasNext()) {
                for (String header : it.next()) {
                    columns.add(header.trim());
                }
            }
            while (it.hasNext()) {
                String[] cells = it.next();
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), i < cells.length ? cells[i] : null);
                }
                rows.add(row);
            }
        }
        return new Dataset(columns, rows);
    }

    QualityMetrics computeMetrics(Dataset dataset, List<String> required) {
        List<String> warnings = new ArrayList<>();

        long totalCells = (long) dataset.rowCount() * dataset.columnCount();
        long missingCells = dataset.missingCellCount();
        double completeness = totalCells == 0 ? 0.0 : (totalCells - missingCells) * 100.0 / totalCells;
        if (missingCells > 0) {
            warnings.add(String.format("%d missing values (%.1f%% complete)", missingCells, completeness));
        }

        double schemaMatch;
        if (required.isEmpty()) {
            schemaMatch = 100.0;
        } else {
            int correct = 0;
            for (String column : required) {
                if (!dataset.hasColumn(column)) continue;
                if (numericColumns.contains(column) && !isNumeric(dataset, column)) {
                    warnings.add("Column " + column + " is declared numeric but has non-numeric values");
                    continue;
                }
                correct++;
            }
            schemaMatch = correct * 100.0 / required.size();
        }

        if (dataset.rowCount() < minRows) {
            warnings.add(String.format("Only %d rows found, minimum %d required", dataset.rowCount(), minRows));
        }

        int outliers = 0;
        for (Map.Entry<String, ColumnRange> e : columnRanges.entrySet()) {
            if (!dataset.hasColumn(e.getKey())) continue;
            int issues = 0;
            for (double v : dataset.numericValues(e.getKey())) {
                if (!e.getValue().contains(v)) issues++;
            }
            if (issues > 0) {
                warnings.add(String.format("%d %s values outside %s-%s range",
                        issues, e.getKey(), format(e.getValue().min()), format(e.getValue().max())));
            }
            outliers += issues;
        }

        return new QualityMetrics(completeness, schemaMatch, dataset.rowCount(), minRows, outliers, warnings);
    }

    /** Weighted quality score, clamped to 0..100 and rounded to one decimal. */
    static double score(QualityMetrics m) {
        double rowCountScore = m.rowCountOk() ? 100.0 : m.rowCount() * 100.0 / Math.max(1, m.minRows());
        double outlierPercent = m.outliers() * 100.0 / Math.max(1, m.rowCount());
        double outlierScore = Math.max(0.0, 100.0 - outlierPercent);
        double overall = m.completeness() * COMPLETENESS_WEIGHT
                + m.schemaMatch() * SCHEMA_WEIGHT
                + rowCountScore * ROW_COUNT_WEIGHT
                + outlierScore * OUTLIER_WEIGHT;
        overall = Math.max(0.0, Math.min(100.0, overall));
        return Math.round(overall * 10.0) / 10.0;
    }

    private static boolean isNumeric(Dataset dataset, String column) {
        for (String v : dataset.values(column)) {
            if (v != null && Dataset.parseDouble(v) == null) return false;
        }
        return true;
    }

    private static String format(double d) {
        return d == Math.rint(d) ? Long.toString((long) d) : Double.toString(d);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
