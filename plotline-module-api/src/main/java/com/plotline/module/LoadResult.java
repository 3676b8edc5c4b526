package com.plotline.module;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one load attempt. Failures are data: the orchestrator records {@link #getError()}
 * and moves on to the next module.
 */
public final class LoadResult {

    private final String moduleName;
    private final LoadStatus status;
    private final LoadedModule module;
    private final String error;
    private final List<Capability> missingCapabilities;

    private LoadResult(String moduleName, LoadStatus status, LoadedModule module, String error,
                       List<Capability> missingCapabilities) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.status = status;
        this.module = module;
        this.error = error;
        this.missingCapabilities = missingCapabilities != null ? List.copyOf(missingCapabilities) : List.of();
    }

    static LoadResult success(LoadedModule module) {
        return new LoadResult(module.getName(), LoadStatus.SUCCESS, module, null, null);
    }

    public static LoadResult failed(String moduleName, String error) {
        return new LoadResult(moduleName, LoadStatus.FAILED, null, error, null);
    }

    static LoadResult missingCapabilities(String moduleName, List<Capability> missing) {
        StringBuilder sb = new StringBuilder("Module '").append(moduleName)
                .append("' is missing required capabilities: ");
        for (int i = 0; i < missing.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(missing.get(i).describe());
        }
        return new LoadResult(moduleName, LoadStatus.FAILED, null, sb.toString(), missing);
    }

    public String getModuleName() {
        return moduleName;
    }

    public LoadStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == LoadStatus.SUCCESS;
    }

    /** Loaded module; null when the load failed. */
    public LoadedModule getModule() {
        return module;
    }

    public String getError() {
        return error;
    }

    public List<Capability> getMissingCapabilities() {
        return missingCapabilities;
    }

    @Override
    public String toString() {
        return "LoadResult{" + moduleName + " " + status.toValue() + (error != null ? ", " + error : "") + "}";
    }
}
