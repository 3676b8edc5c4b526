package com.plotline.module;

import java.util.List;

/**
 * Capability: enumerates the work items a module can produce.
 */
public interface ItemCatalog {

    /**
     * @return item descriptors in generation order; never null
     */
    List<PlotItem> availableItems();
}
