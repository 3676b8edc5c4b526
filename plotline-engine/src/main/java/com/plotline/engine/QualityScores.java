package com.plotline.engine;

/**
 * Run-level quality blending.
 */
public final class QualityScores {

    public static final double DATA_WEIGHT = 0.4;
    public static final double PLOT_WEIGHT = 0.6;

    private QualityScores() {
    }

    /** data×0.4 + plot×0.6, each clamped to 0..100, rounded to one decimal. */
    public static double overall(double dataQuality, double plotQuality) {
        return round(clamp(dataQuality) * DATA_WEIGHT + clamp(plotQuality) * PLOT_WEIGHT);
    }

    static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(100.0, v));
    }
}
