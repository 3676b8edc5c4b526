package com.plotline.data;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tabular input handed to plot modules: ordered column names and rows of raw cell text.
 * Cells are kept as text; numeric access parses on demand and skips missing values.
 * Immutable.
 */
public final class Dataset {

    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "nan", "null");

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public Dataset(List<String> columns, List<Map<String, String>> rows) {
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        List<Map<String, String>> copy = new ArrayList<>(rows != null ? rows.size() : 0);
        if (rows != null) {
            for (Map<String, String> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Raw cell values of a column in row order; missing cells are returned as null. */
    public List<String> values(String column) {
        Objects.requireNonNull(column, "column");
        List<String> out = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            String v = row.get(column);
            out.add(isMissing(v) ? null : v);
        }
        return out;
    }

    /** Numeric values of a column; missing and unparseable cells are skipped. */
    public double[] numericValues(String column) {
        List<String> raw = values(column);
        double[] buffer = new double[raw.size()];
        int n = 0;
        for (String v : raw) {
            Double d = parseDouble(v);
            if (d != null) {
                buffer[n++] = d;
            }
        }
        double[] out = new double[n];
        System.arraycopy(buffer, 0, out, 0, n);
        return out;
    }

    /** Number of missing cells over all columns. */
    public long missingCellCount() {
        long missing = 0;
        for (Map<String, String> row : rows) {
            for (String column : columns) {
                if (isMissing(row.get(column))) missing++;
            }
        }
        return missing;
    }

    /**
     * Canonical byte form (header line, then one line per row, cells joined by a unit separator)
     * used to hash the data snapshot independently of the source file's formatting.
     */
    public byte[] canonicalBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join("\u001f", columns)).append('\n');
        for (Map<String, String> row : rows) {
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) sb.append('\u001f');
                String v = row.get(columns.get(i));
                sb.append(isMissing(v) ? "" : v);
            }
            sb.append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /** SHA-256 hex of {@link #canonicalBytes()}; stored as the data hash of the raw-data artifact. */
    public String contentHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalBytes()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isMissing(String value) {
        return value == null || MISSING_TOKENS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /** Parses a cell as a finite double, or null when missing or not numeric. */
    public static Double parseDouble(String value) {
        if (isMissing(value)) return null;
        try {
            double d = Double.parseDouble(value.trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
