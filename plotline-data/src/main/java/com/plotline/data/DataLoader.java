package com.plotline.data;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads and validates the study dataset. Implementations report problems in the returned
 * {@link DataLoadResult} instead of throwing.
 */
public interface DataLoader {

    /**
     * @param file            data file
     * @param requiredColumns columns that must be present; a missing one fails the load
     * @return load outcome with data, quality score and metrics; never null
     */
    DataLoadResult load(Path file, List<String> requiredColumns);
}
