package com.plotline.data;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Data quality measurements behind {@link DataLoadResult#getQualityScore()}.
 *
 * @param completeness percentage of non-missing cells (0-100)
 * @param schemaMatch  percentage of required columns present with the declared type (0-100)
 * @param rowCount     number of data rows
 * @param minRows      minimum acceptable row count
 * @param outliers     numeric values outside their configured range
 * @param warnings     human-readable findings
 */
public record QualityMetrics(
        @JsonProperty("completeness") double completeness,
        @JsonProperty("schema_match") double schemaMatch,
        @JsonProperty("row_count") int rowCount,
        @JsonProperty("min_rows") int minRows,
        @JsonProperty("outliers") int outliers,
        @JsonProperty("warnings") List<String> warnings
) {
    public QualityMetrics {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean rowCountOk() {
        return rowCount >= minRows;
    }

    public static QualityMetrics none() {
        return new QualityMetrics(0, 0, 0, 0, 0, List.of());
    }
}
