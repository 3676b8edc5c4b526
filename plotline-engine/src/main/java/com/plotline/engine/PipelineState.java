package com.plotline.engine;

import java.util.Locale;

/**
 * States of one pipeline run. {@link #FAILED} is reachable from any non-terminal state; only a
 * fatal condition (data load, or no items produced at all) leads there.
 */
public enum PipelineState {
    INITIALIZED,
    DATA_LOADED,
    PLOTS_GENERATED,
    REPORTS_RENDERED,
    FINALIZED,
    FAILED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED;
    }

    /** Whether {@code next} may follow this state. */
    public boolean canMoveTo(PipelineState next) {
        if (isTerminal() || next == null) return false;
        if (next == FAILED) return true;
        return next.ordinal() == ordinal() + 1;
    }

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
