package com.plotline.report;

import java.nio.file.Path;

/**
 * Renders report templates into documents. An unavailable renderer makes the reporting phase a
 * skip, not a failure.
 */
public interface ReportRenderer {

    /** Whether the renderer can run at all (tool installed, etc.). */
    boolean isAvailable();

    /**
     * Renders one template.
     *
     * @param template  template file
     * @param outputDir directory for the rendered document; created if needed
     * @return the rendered document
     * @throws ReportRenderException when rendering fails or produces no document
     */
    Path render(Path template, Path outputDir);

    /** Short name for logs and phase results. */
    default String name() {
        return getClass().getSimpleName();
    }
}
