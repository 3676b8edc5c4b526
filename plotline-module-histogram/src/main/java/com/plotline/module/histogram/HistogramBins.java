package com.plotline.module.histogram;

/**
 * Equal-width binning over the value range.
 */
final class HistogramBins {

    private HistogramBins() {
    }

    /** Counts per bin; the maximum value falls into the last bin. A constant column fills bin 0. */
    static int[] count(double[] values, int binCount) {
        int[] counts = new int[binCount];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double width = (max - min) / binCount;
        for (double v : values) {
            int bin = width == 0.0 ? 0 : (int) ((v - min) / width);
            counts[Math.min(bin, binCount - 1)]++;
        }
        return counts;
    }
}
