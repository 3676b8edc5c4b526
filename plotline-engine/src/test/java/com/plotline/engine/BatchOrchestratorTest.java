package com.plotline.engine;

import com.plotline.module.LoadResult;
import com.plotline.module.ModuleCatalog;
import com.plotline.module.ModuleDiscovery;
import com.plotline.module.ModuleLoader;
import com.plotline.module.PlotResult;
import com.plotline.result.ResultStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.plotline.engine.EngineFixtures.FileWritingModule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchOrchestratorTest {

    @TempDir
    Path tempDir;

    private BatchOrchestrator orchestrator(ModuleCatalog catalog) {
        return new BatchOrchestrator(new ModuleDiscovery(), new ModuleLoader(catalog));
    }

    @Test
    void orchestrate_oneModuleFailsToLoadOtherProducesAllItems() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "writer");
        EngineFixtures.moduleDir(modules, "beta", "not-registered");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("writer", () -> new FileWritingModule(5, Set.of())));

        BatchResult result = orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(2, result.getModulesFound());
        assertEquals(1, result.getModulesLoaded());
        assertEquals(1, result.getModulesFailed());
        assertEquals(5, result.getPlotsGenerated());
        assertEquals(0, result.getPlotsFailed());
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals(1.0, result.getSuccessRate(), 1e-9);
        assertTrue(result.getModuleErrors().containsKey("beta"));
        assertTrue(result.getErrors().get(0).startsWith("[MODULE]"));
        assertTrue(Files.isRegularFile(tempDir.resolve("out").resolve("alpha").resolve("item-3.txt")));
        assertEquals("2.1", result.getModules().get("alpha").getVersion());
    }

    @Test
    void orchestrate_independentItemFailuresAreCountedAndPenaliseQuality() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "writer");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("writer", () -> new FileWritingModule(5, Set.of("item-2", "item-4"))));

        BatchResult result = orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(3, result.getPlotsGenerated());
        assertEquals(2, result.getPlotsFailed());
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals(0.6, result.getSuccessRate(), 1e-9);
        assertEquals(60.0, result.getQualityScore(), 0.01);
        assertEquals(2, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("alpha/item-2"));
    }

    @Test
    void orchestrate_allItemsSucceedIsSuccess() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "writer");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("writer", () -> new FileWritingModule(4, Set.of())));

        BatchResult result = orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(ResultStatus.SUCCESS, result.getStatus());
        assertEquals(4, result.getPlotsGenerated());
        assertEquals(100.0, result.getQualityScore(), 0.01);
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void orchestrate_stopOnErrorSkipsRemainingItemsOfThatModuleOnly() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "stopper");
        EngineFixtures.moduleDir(modules, "beta", "writer");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("stopper", () -> new FileWritingModule(5, Set.of("item-2"))),
                EngineFixtures.provider("writer", () -> new FileWritingModule(2, Set.of())));
        BatchOptions options = BatchOptions.builder().continueOnError(false).build();

        BatchResult result = orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), options);

        assertEquals(3, result.getPlotsGenerated());
        assertEquals(1, result.getPlotsFailed());
        assertEquals(3, result.getSkippedItems());
        assertEquals(3, result.getModules().get("alpha").getSkipped());
        assertEquals(2, result.getModules().get("beta").getGenerated());
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
    }

    @Test
    void orchestrate_noModulesIsWarningNotError() {
        BatchResult result = orchestrator(new ModuleCatalog()).orchestrate(EngineFixtures.dataset(),
                tempDir.resolve("absent"), tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(0, result.getModulesFound());
        assertEquals(0.0, result.getSuccessRate(), 1e-9);
        assertTrue(result.getErrors().isEmpty());
        assertFalse(result.getWarnings().isEmpty());
        assertTrue(result.getWarnings().get(0).startsWith("[DISCOVERY]"));
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
    }

    @Test
    void orchestrate_throwingBatchFailsModuleAndOthersContinue() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "exploding");
        EngineFixtures.moduleDir(modules, "beta", "writer");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("exploding", EngineFixtures.ExplodingModule::new),
                EngineFixtures.provider("writer", () -> new FileWritingModule(3, Set.of())));

        BatchResult result = orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(2, result.getModulesLoaded());
        assertEquals(1, result.getModulesFailed());
        assertEquals(3, result.getPlotsGenerated());
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertTrue(result.getModuleErrors().get("alpha").contains("renderer crashed"));
    }

    @Test
    void orchestrate_everyModuleFailingIsFailed() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "ghost");
        EngineFixtures.moduleDir(modules, "beta", "phantom");

        BatchResult result = orchestrator(new ModuleCatalog()).orchestrate(EngineFixtures.dataset(), modules,
                tempDir.resolve("out"), BatchOptions.defaults());

        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertEquals(2, result.getErrors().size());
    }

    @Test
    void orchestrate_notifiesListenerOfLoadsAndItems() throws Exception {
        Path modules = tempDir.resolve("modules");
        EngineFixtures.moduleDir(modules, "alpha", "writer");
        ModuleCatalog catalog = EngineFixtures.catalog(
                EngineFixtures.provider("writer", () -> new FileWritingModule(2, Set.of("item-1"))));
        List<String> events = new ArrayList<>();
        PipelineListener listener = new PipelineListener() {
            @Override
            public void onModuleLoaded(LoadResult result) {
                events.add("load:" + result.getModuleName());
            }

            @Override
            public void onItemCompleted(String moduleName, PlotResult result) {
                events.add(moduleName + ":" + result.getItemId() + ":" + result.getStatus().toValue());
            }
        };

        orchestrator(catalog).orchestrate(EngineFixtures.dataset(), modules, tempDir.resolve("out"),
                BatchOptions.builder().listener(listener).build());

        assertEquals(List.of("load:alpha", "alpha:item-1:failed", "alpha:item-2:success"), events);
    }
}
