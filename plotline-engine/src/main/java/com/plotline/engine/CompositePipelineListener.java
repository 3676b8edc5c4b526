package com.plotline.engine;

import com.plotline.module.LoadResult;
import com.plotline.module.PlotResult;
import com.plotline.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Dispatches every callback to each delegate. Listener failures are logged at warn and never
 * reach the pipeline.
 */
final class CompositePipelineListener implements PipelineListener {

    private static final Logger log = LoggerFactory.getLogger(CompositePipelineListener.class);

    private final List<PipelineListener> delegates;

    CompositePipelineListener(List<PipelineListener> listeners) {
        List<PipelineListener> copy = new ArrayList<>();
        if (listeners != null) {
            for (PipelineListener l : listeners) {
                if (l != null) copy.add(l);
            }
        }
        this.delegates = List.copyOf(copy);
    }

    @Override
    public void onRunStarted(String runId) {
        dispatch("onRunStarted", l -> l.onRunStarted(runId));
    }

    @Override
    public void onStateChanged(PipelineState from, PipelineState to) {
        dispatch("onStateChanged", l -> l.onStateChanged(from, to));
    }

    @Override
    public void onModuleLoaded(LoadResult result) {
        dispatch("onModuleLoaded", l -> l.onModuleLoaded(result));
    }

    @Override
    public void onItemCompleted(String moduleName, PlotResult result) {
        dispatch("onItemCompleted", l -> l.onItemCompleted(moduleName, result));
    }

    @Override
    public void onPhaseCompleted(String phase, String status, long durationMillis) {
        dispatch("onPhaseCompleted", l -> l.onPhaseCompleted(phase, status, durationMillis));
    }

    @Override
    public void onRunFinished(Result result) {
        dispatch("onRunFinished", l -> l.onRunFinished(result));
    }

    private void dispatch(String callback, Consumer<PipelineListener> call) {
        for (PipelineListener l : delegates) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Pipeline listener {} failed in {}; execution continues: {}",
                        l.getClass().getName(), callback, e.getMessage(), e);
            }
        }
    }
}
