package com.plotline.app;

import com.plotline.engine.PipelineListener;
import com.plotline.engine.PipelineState;
import com.plotline.module.LoadResult;
import com.plotline.module.PlotResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console progress for command-line runs.
 */
final class LoggingPipelineListener implements PipelineListener {

    private static final Logger log = LoggerFactory.getLogger("plotline.progress");

    @Override
    public void onRunStarted(String runId) {
        log.info("Run {} started", runId);
    }

    @Override
    public void onStateChanged(PipelineState from, PipelineState to) {
        log.info("{} -> {}", from.toValue(), to.toValue());
    }

    @Override
    public void onModuleLoaded(LoadResult result) {
        if (result.isSuccess()) {
            log.info("Module {} loaded", result.getModuleName());
        } else {
            log.warn("Module {} not loaded: {}", result.getModuleName(), result.getError());
        }
    }

    @Override
    public void onItemCompleted(String moduleName, PlotResult result) {
        log.debug("{}/{}: {} ({} ms)", moduleName, result.getItemId(), result.getStatus().toValue(),
                result.getDurationMillis());
    }

    @Override
    public void onPhaseCompleted(String phase, String status, long durationMillis) {
        log.info("Phase {} {} in {} ms", phase, status, durationMillis);
    }
}
