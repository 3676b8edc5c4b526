package com.plotline.features.metrics;

import com.plotline.module.LoadResult;
import com.plotline.module.PlotResult;
import com.plotline.result.Result;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MetricsPipelineListenerTest {

    @Test
    void onItemCompleted_countsByModuleAndStatus() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsPipelineListener listener = new MetricsPipelineListener(registry);

        listener.onItemCompleted("histogram", PlotResult.success("a", "/tmp/a.png", 90).withDuration(40));
        listener.onItemCompleted("histogram", PlotResult.success("b", "/tmp/b.png", 80).withDuration(60));
        listener.onItemCompleted("histogram", PlotResult.failed("c", "no data"));

        assertEquals(2.0, registry.get("plotline.items").tags("module", "histogram", "status", "success").counter().count());
        assertEquals(1.0, registry.get("plotline.items").tags("module", "histogram", "status", "failed").counter().count());
        assertEquals(3L, registry.get("plotline.item.duration").tag("module", "histogram").timer().count());
        assertEquals(100.0, registry.get("plotline.item.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void snapshot_exposesCountersTimersAndQuality() {
        MetricsPipelineListener listener = new MetricsPipelineListener();
        listener.onModuleLoaded(LoadResult.failed("broken", "no provider"));
        listener.onItemCompleted("histogram", PlotResult.success("a", "/tmp/a.png", 90).withDuration(40));
        Result result = Result.create("plotline").setQualityScore(88.0);

        listener.onRunFinished(result);
        Map<String, Object> snapshot = listener.snapshot();

        assertEquals(1.0, snapshot.get("plotline.modules.loaded{status=failed}"));
        assertEquals(1.0, snapshot.get("plotline.items{module=histogram,status=success}"));
        Map<?, ?> timer = (Map<?, ?>) snapshot.get("plotline.item.duration{module=histogram}");
        assertEquals(1L, timer.get("count"));
        assertEquals(40.0, (Double) timer.get("total_ms"), 0.001);
        Map<?, ?> quality = (Map<?, ?>) snapshot.get("plotline.run.quality");
        assertEquals(88.0, (Double) quality.get("mean"), 0.001);
        assertEquals(1.0, snapshot.get("plotline.runs{status=success}"));
    }

    @Test
    void onModuleLoaded_tagsLoadStatus() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsPipelineListener(registry).onModuleLoaded(LoadResult.failed("broken", "no provider"));

        assertEquals(1.0, registry.get("plotline.modules.loaded").tag("status", "failed").counter().count());
    }

    @Test
    void onRunFinished_recordsStatusAndQuality() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsPipelineListener listener = new MetricsPipelineListener(registry);
        Result result = Result.create("plotline").setQualityScore(86.0);
        result.finish();

        listener.onRunFinished(result);
        listener.onPhaseCompleted("reporting", "skipped", 5);

        assertEquals(1.0, registry.get("plotline.runs").tag("status", "success").counter().count());
        assertEquals(86.0, registry.get("plotline.run.quality").summary().totalAmount(), 0.001);
        assertEquals(1L, registry.get("plotline.phase.duration").tags("phase", "reporting", "status", "skipped").timer().count());
    }

    @Test
    void onRunFinished_withoutQualitySkipsSummary() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsPipelineListener(registry).onRunFinished(Result.create("plotline"));

        assertNull(registry.find("plotline.run.quality").summary());
    }
}
