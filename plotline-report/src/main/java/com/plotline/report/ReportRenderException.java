package com.plotline.report;

import java.nio.file.Path;

/**
 * A report template could not be rendered.
 */
public class ReportRenderException extends RuntimeException {

    private final Path template;

    public ReportRenderException(String message, Path template) {
        this(message, template, null);
    }

    public ReportRenderException(String message, Path template, Throwable cause) {
        super(message, cause);
        this.template = template;
    }

    public Path getTemplate() {
        return template;
    }
}
