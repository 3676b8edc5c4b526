package com.plotline.data;

/**
 * Plausible value range for a numeric column; values outside count as outliers.
 */
public record ColumnRange(double min, double max) {
    public ColumnRange {
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max: " + min + " > " + max);
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
