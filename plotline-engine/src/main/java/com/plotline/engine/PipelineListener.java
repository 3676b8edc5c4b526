package com.plotline.engine;

import com.plotline.module.LoadResult;
import com.plotline.module.PlotResult;
import com.plotline.result.Result;

import java.util.List;

/**
 * Reporting capability handed to the orchestrator and the driver. All callbacks default to no-op;
 * implementations override what they observe. Callbacks run on the pipeline thread.
 */
public interface PipelineListener {

    default void onRunStarted(String runId) {
    }

    default void onStateChanged(PipelineState from, PipelineState to) {
    }

    default void onModuleLoaded(LoadResult result) {
    }

    default void onItemCompleted(String moduleName, PlotResult result) {
    }

    /**
     * @param phase  phase name (data_load, plot_generation, reporting)
     * @param status phase status value (success, partial, failed, skipped, unavailable)
     */
    default void onPhaseCompleted(String phase, String status, long durationMillis) {
    }

    default void onRunFinished(Result result) {
    }

    static PipelineListener noOp() {
        return NoOpListener.INSTANCE;
    }

    /** Fans out to each listener; a listener that throws is logged and skipped. */
    static PipelineListener composite(List<PipelineListener> listeners) {
        return new CompositePipelineListener(listeners);
    }

    final class NoOpListener implements PipelineListener {
        private static final NoOpListener INSTANCE = new NoOpListener();

        private NoOpListener() {
        }
    }
}
