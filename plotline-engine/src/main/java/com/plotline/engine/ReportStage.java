package com.plotline.engine;

import com.plotline.report.ReportRenderException;
import com.plotline.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders each configured template ({@code <templatesDir>/<name>.qmd}) into the report output
 * directory. Never throws; each failure becomes a failed {@link ReportOutcome}.
 */
final class ReportStage {

    private static final Logger log = LoggerFactory.getLogger(ReportStage.class);

    static final String TEMPLATE_EXTENSION = ".qmd";

    private final ReportRenderer renderer;
    private final Path templatesDir;
    private final List<String> templates;
    private final Path outputDir;

    ReportStage(ReportRenderer renderer, Path templatesDir, List<String> templates, Path outputDir) {
        this.renderer = renderer;
        this.templatesDir = templatesDir;
        this.templates = templates != null ? List.copyOf(templates) : List.of();
        this.outputDir = outputDir;
    }

    ReportPhaseResult run() {
        if (templates.isEmpty()) {
            return ReportPhaseResult.skipped("No report templates configured");
        }
        if (renderer == null || !renderer.isAvailable()) {
            String tool = renderer != null ? renderer.name() : "none";
            log.warn("Report tool '{}' not available; skipping {} report(s)", tool, templates.size());
            return ReportPhaseResult.unavailable(tool);
        }
        List<ReportOutcome> outcomes = new ArrayList<>();
        for (String name : templates) {
            outcomes.add(renderOne(name));
        }
        return ReportPhaseResult.of(outcomes);
    }

    private ReportOutcome renderOne(String name) {
        String fileName = name.endsWith(TEMPLATE_EXTENSION) ? name : name + TEMPLATE_EXTENSION;
        String reportName = fileName.substring(0, fileName.length() - TEMPLATE_EXTENSION.length());
        Path template = templatesDir.resolve(fileName).toAbsolutePath().normalize();
        if (!Files.isRegularFile(template)) {
            log.warn("Report template not found: {}", template);
            return ReportOutcome.failed(reportName, template.toString(), "Template not found: " + template);
        }
        try {
            Path out = renderer.render(template, outputDir.toAbsolutePath().normalize());
            log.info("Report {} rendered: {}", reportName, out);
            return ReportOutcome.rendered(reportName, template.toString(), out.toString());
        } catch (ReportRenderException e) {
            log.warn("Report {} failed: {}", reportName, e.getMessage(), e);
            return ReportOutcome.failed(reportName, template.toString(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Report renderer raised for {}", reportName, e);
            return ReportOutcome.failed(reportName, template.toString(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }
}
