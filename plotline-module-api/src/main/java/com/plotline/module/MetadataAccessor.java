package com.plotline.module;

/**
 * Capability: module name and version.
 */
public interface MetadataAccessor {

    ModuleMetadata metadata();
}
