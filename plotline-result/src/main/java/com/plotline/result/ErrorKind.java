package com.plotline.result;

/**
 * Error taxonomy of a pipeline run. Every recorded message carries the kind's tag as prefix so a
 * partial run can be diagnosed from the final {@link Result} alone. Only {@link #DATA_LOAD} aborts
 * a run; every other kind degrades the run to at most {@link ResultStatus#PARTIAL}.
 */
public enum ErrorKind {
    DATA_LOAD("DATA", true),
    MODULE_DISCOVERY("DISCOVERY", false),
    MODULE_LOAD("MODULE", false),
    ITEM_GENERATION("ITEM", false),
    REGISTRY_IO("REGISTRY", false),
    REPORT_RENDER("REPORT", false);

    private final String tag;
    private final boolean fatal;

    ErrorKind(String tag, boolean fatal) {
        this.tag = tag;
        this.fatal = fatal;
    }

    public String tag() {
        return tag;
    }

    public boolean isFatal() {
        return fatal;
    }

    /** {@code "[TAG] message"}. */
    public String format(String message) {
        return "[" + tag + "] " + (message != null ? message : "");
    }
}
