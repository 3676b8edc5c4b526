package com.plotline.features.metrics;

import com.plotline.engine.PipelineListener;
import com.plotline.module.LoadResult;
import com.plotline.module.PlotResult;
import com.plotline.result.Result;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Records pipeline metrics into a Micrometer registry:
 * <ul>
 *   <li>{@code plotline.modules.loaded{status}} counter per load attempt</li>
 *   <li>{@code plotline.items{module,status}} counter and {@code plotline.item.duration{module}} timer per item</li>
 *   <li>{@code plotline.phase.duration{phase,status}} timer per phase</li>
 *   <li>{@code plotline.runs{status}} counter and {@code plotline.run.quality} summary per run</li>
 * </ul>
 * A one-shot run reads the values back through {@link #snapshot()} before the process exits.
 */
public final class MetricsPipelineListener implements PipelineListener {

    private final MeterRegistry registry;

    public MetricsPipelineListener() {
        this(new SimpleMeterRegistry());
    }

    public MetricsPipelineListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onModuleLoaded(LoadResult result) {
        registry.counter("plotline.modules.loaded", "status", result.getStatus().toValue()).increment();
    }

    @Override
    public void onItemCompleted(String moduleName, PlotResult result) {
        String module = nullToUnknown(moduleName);
        registry.counter("plotline.items", "module", module, "status", result.getStatus().toValue()).increment();
        Timer.builder("plotline.item.duration")
                .tag("module", module)
                .register(registry)
                .record(result.getDurationMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void onPhaseCompleted(String phase, String status, long durationMillis) {
        Timer.builder("plotline.phase.duration")
                .tag("phase", nullToUnknown(phase))
                .tag("status", nullToUnknown(status))
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void onRunFinished(Result result) {
        registry.counter("plotline.runs", "status", result.getStatus().toValue()).increment();
        if (result.getQualityScore() != null) {
            DistributionSummary.builder("plotline.run.quality")
                    .baseUnit("percent")
                    .register(registry)
                    .record(result.getQualityScore());
        }
    }

    /**
     * Current meter values keyed by {@code name{tag=value,...}}, sorted by key. Counters map to
     * their count; timers to count, total and max in milliseconds; summaries to count, mean and max.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> values = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            Object value = valueOf(meter);
            if (value != null) {
                values.put(key(meter.getId()), value);
            }
        }
        return values;
    }

    private static Object valueOf(Meter meter) {
        if (meter instanceof Counter counter) {
            return counter.count();
        }
        if (meter instanceof Timer timer) {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("count", timer.count());
            t.put("total_ms", timer.totalTime(TimeUnit.MILLISECONDS));
            t.put("max_ms", timer.max(TimeUnit.MILLISECONDS));
            return t;
        }
        if (meter instanceof DistributionSummary summary) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("count", summary.count());
            d.put("mean", summary.mean());
            d.put("max", summary.max());
            return d;
        }
        return null;
    }

    private static String key(Meter.Id id) {
        if (id.getTags().isEmpty()) {
            return id.getName();
        }
        StringJoiner tags = new StringJoiner(",", "{", "}");
        for (Tag tag : id.getTags()) {
            tags.add(tag.getKey() + "=" + tag.getValue());
        }
        return id.getName() + tags;
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
