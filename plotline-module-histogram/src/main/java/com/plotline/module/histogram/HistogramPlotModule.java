package com.plotline.module.histogram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.plotline.data.Dataset;
import com.plotline.module.ModuleMetadata;
import com.plotline.module.PlotConfig;
import com.plotline.module.PlotItem;
import com.plotline.module.PlotModule;
import com.plotline.module.PlotResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in module: for each configured column a histogram image ({@code histogram_<column>},
 * group {@code distribution}) and a JSON statistics summary ({@code summary_<column>}, group
 * {@code summary}). Item quality is the share of the column's rows holding a numeric value.
 */
public final class HistogramPlotModule implements PlotModule {

    private static final Logger log = LoggerFactory.getLogger(HistogramPlotModule.class);

    public static final String NAME = "histogram";
    public static final String VERSION = "1.0.0";
    public static final int DEFAULT_BINS = 20;
    static final String HISTOGRAM_PREFIX = "histogram_";
    static final String SUMMARY_PREFIX = "summary_";
    static final String PARAM_COLUMN = "column";
    static final String PARAM_BINS = "bins";
    static final double PARTIAL_BELOW = 50.0;

    /** Figure size in inches; pixels = inches × dpi. */
    static final double WIDTH_INCHES = 6.4;
    static final double HEIGHT_INCHES = 4.8;

    private final List<String> columns;
    private final int bins;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public HistogramPlotModule(List<String> columns, int bins) {
        Objects.requireNonNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be positive: " + bins);
        }
        this.columns = List.copyOf(columns);
        this.bins = bins;
    }

    @Override
    public ModuleMetadata metadata() {
        return new ModuleMetadata(NAME, VERSION, "Histograms and summary statistics of numeric columns");
    }

    @Override
    public List<PlotItem> availableItems() {
        List<PlotItem> items = new ArrayList<>();
        for (String column : columns) {
            Map<String, Object> histParams = new LinkedHashMap<>();
            histParams.put(PARAM_COLUMN, column);
            histParams.put(PARAM_BINS, bins);
            items.add(new PlotItem(HISTOGRAM_PREFIX + column, "distribution", "Histogram of " + column, histParams));
            items.add(new PlotItem(SUMMARY_PREFIX + column, "summary", "Summary of " + column, Map.of(PARAM_COLUMN, column)));
        }
        return items;
    }

    @Override
    public PlotResult generate(Dataset data, String itemId, PlotConfig config) {
        boolean histogram = itemId.startsWith(HISTOGRAM_PREFIX);
        if (!histogram && !itemId.startsWith(SUMMARY_PREFIX)) {
            return PlotResult.failed(itemId, "Unknown item: " + itemId);
        }
        String fallbackColumn = itemId.substring(histogram ? HISTOGRAM_PREFIX.length() : SUMMARY_PREFIX.length());
        String column = config.getParam(PARAM_COLUMN, fallbackColumn);
        if (!data.hasColumn(column)) {
            return PlotResult.failed(itemId, "Column '" + column + "' not found");
        }
        double[] values = data.numericValues(column);
        if (values.length == 0) {
            return PlotResult.failed(itemId, "Column '" + column + "' has no numeric values");
        }
        double quality = data.rowCount() == 0 ? 0.0 : values.length * 100.0 / data.rowCount();

        Path out;
        try {
            out = histogram
                    ? writeHistogram(column, values, binCount(config), config)
                    : writeSummary(column, values, data.rowCount(), config);
        } catch (IOException e) {
            log.warn("Writing {} failed: {}", itemId, e.getMessage());
            return PlotResult.failed(itemId, "Cannot write output: " + e.getMessage());
        }
        if (quality < PARTIAL_BELOW) {
            return PlotResult.partial(itemId, out.toString(), quality,
                    String.format("Only %d of %d values in '%s' are numeric", values.length, data.rowCount(), column));
        }
        return PlotResult.success(itemId, out.toString(), quality);
    }

    private int binCount(PlotConfig config) {
        String raw = config.getParam(PARAM_BINS, String.valueOf(bins));
        try {
            int n = Integer.parseInt(raw.trim());
            return n > 0 ? n : bins;
        } catch (NumberFormatException e) {
            return bins;
        }
    }

    Path writeHistogram(String column, double[] values, int binCount, PlotConfig config) throws IOException {
        int[] counts = HistogramBins.count(values, binCount);
        int width = (int) Math.round(WIDTH_INCHES * config.getDpi());
        int height = (int) Math.round(HEIGHT_INCHES * config.getDpi());
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);

            int margin = Math.max(10, width / 12);
            int plotWidth = width - 2 * margin;
            int plotHeight = height - 2 * margin;
            int max = 1;
            for (int c : counts) max = Math.max(max, c);

            g.setColor(new Color(70, 130, 180));
            double barWidth = (double) plotWidth / counts.length;
            for (int i = 0; i < counts.length; i++) {
                int barHeight = (int) Math.round((double) counts[i] / max * plotHeight);
                int x = margin + (int) Math.round(i * barWidth);
                int w = Math.max(1, (int) Math.round(barWidth) - 1);
                g.fillRect(x, margin + plotHeight - barHeight, w, barHeight);
            }

            g.setColor(Color.DARK_GRAY);
            g.setStroke(new BasicStroke(Math.max(1f, config.getDpi() / 150f)));
            g.drawLine(margin, margin + plotHeight, margin + plotWidth, margin + plotHeight);
            g.drawLine(margin, margin, margin, margin + plotHeight);
        } finally {
            g.dispose();
        }

        Path out = config.getOutputDir().resolve(HISTOGRAM_PREFIX + column + ".png");
        if (!ImageIO.write(image, "png", out.toFile())) {
            throw new IOException("No PNG writer available");
        }
        return out;
    }

    Path writeSummary(String column, double[] values, int totalRows, PlotConfig config) throws IOException {
        Path out = config.getOutputDir().resolve(SUMMARY_PREFIX + column + ".json");
        mapper.writeValue(out.toFile(), ColumnStatistics.of(column, values, totalRows));
        return out;
    }
}
