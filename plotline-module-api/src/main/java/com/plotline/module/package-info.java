/**
 * Plot module contract, discovery and loading.
 * <ul>
 *   <li>{@link com.plotline.module.MetadataAccessor}, {@link com.plotline.module.ItemCatalog},
 *       {@link com.plotline.module.PlotGenerator}, {@link com.plotline.module.BatchPlotGenerator} – the four
 *       capabilities every module exposes; {@link com.plotline.module.PlotModule} combines them</li>
 *   <li>{@link com.plotline.module.PlotModuleProvider} – SPI for module implementations (ServiceLoader or explicit registration)</li>
 *   <li>{@link com.plotline.module.ModuleCatalog} – providers by id</li>
 *   <li>{@link com.plotline.module.ModuleDiscovery} – scans a plugin root for {@code module.json} directories</li>
 *   <li>{@link com.plotline.module.ModuleLoader} – creates a fresh module instance and checks its capabilities</li>
 *   <li>{@link com.plotline.module.PlotBatches} – resilient per-item batch execution with optional time bound</li>
 * </ul>
 */
package com.plotline.module;
