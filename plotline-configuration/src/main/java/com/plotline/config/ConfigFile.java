package com.plotline.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.plotline.data.ColumnRange;

import java.util.List;
import java.util.Map;

/**
 * Shape of {@code plotline.json}. Every key is optional; absent keys keep the default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ConfigFile(
        String dataPath,
        List<String> requiredColumns,
        List<String> numericColumns,
        Map<String, ColumnRange> columnRanges,
        Integer minRows,
        String modulesRoot,
        String outputRoot,
        String registryPath,
        Boolean useRegistry,
        Integer dpi,
        Boolean continueOnError,
        Integer itemTimeoutSeconds,
        Boolean includeReports,
        String reportTemplatesDir,
        List<String> reportTemplates,
        String reportOutputDir,
        String reportExecutable,
        Integer reportTimeoutSeconds,
        String dataArtifactName,
        Double successQualityThreshold,
        String pipelineVersion,
        String pipelineName
) {
}
