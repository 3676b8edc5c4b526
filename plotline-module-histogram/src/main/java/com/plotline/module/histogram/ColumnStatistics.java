package com.plotline.module.histogram;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Descriptive statistics of one numeric column, as written to {@code summary_<column>.json}.
 */
record ColumnStatistics(
        @JsonProperty("column") String column,
        @JsonProperty("count") int count,
        @JsonProperty("missing_or_non_numeric") int missing,
        @JsonProperty("mean") double mean,
        @JsonProperty("sd") double sd,
        @JsonProperty("min") double min,
        @JsonProperty("q1") double q1,
        @JsonProperty("median") double median,
        @JsonProperty("q3") double q3,
        @JsonProperty("max") double max) {

    /** @param values at least one finite value */
    static ColumnStatistics of(String column, double[] values, int totalRows) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double sum = 0.0;
        for (double v : sorted) sum += v;
        double mean = sum / n;
        double ss = 0.0;
        for (double v : sorted) ss += (v - mean) * (v - mean);
        double sd = n > 1 ? Math.sqrt(ss / (n - 1)) : 0.0;
        return new ColumnStatistics(column, n, totalRows - n, mean, sd, sorted[0],
                quantile(sorted, 0.25), quantile(sorted, 0.5), quantile(sorted, 0.75), sorted[n - 1]);
    }

    /** Linear interpolation between closest ranks. */
    static double quantile(double[] sorted, double p) {
        if (sorted.length == 1) return sorted[0];
        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }
}
