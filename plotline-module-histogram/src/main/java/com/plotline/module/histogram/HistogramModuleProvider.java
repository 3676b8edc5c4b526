package com.plotline.module.histogram;

import com.plotline.module.PlotModuleProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Provider {@code histogram}. Manifest settings: {@code columns} (list or comma-separated string,
 * required) and {@code bins} (optional, default {@value HistogramPlotModule#DEFAULT_BINS}).
 */
public final class HistogramModuleProvider implements PlotModuleProvider {

    public static final String PROVIDER_ID = "histogram";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getVersion() {
        return HistogramPlotModule.VERSION;
    }

    @Override
    public Object createModule(Map<String, Object> settings) {
        List<String> columns = columns(settings.get("columns"));
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("histogram module requires a non-empty 'columns' setting");
        }
        return new HistogramPlotModule(columns, bins(settings.get("bins")));
    }

    private static List<String> columns(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object o : (Collection<?>) raw) {
                if (o != null && !o.toString().isBlank()) out.add(o.toString().trim());
            }
        } else if (raw != null) {
            for (String s : raw.toString().split(",")) {
                if (!s.isBlank()) out.add(s.trim());
            }
        }
        return out;
    }

    private static int bins(Object raw) {
        if (raw instanceof Number) return ((Number) raw).intValue();
        if (raw == null) return HistogramPlotModule.DEFAULT_BINS;
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bins must be an integer: " + raw, e);
        }
    }
}
