package com.plotline.module;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleLoaderTest {

    @Test
    void load_moduleMissingCapabilitiesFailsNamingEachOne() {
        ModuleCatalog catalog = new ModuleCatalog();
        catalog.register(TestModules.provider("half", TestModules.HalfModule::new));
        ModuleLoader loader = new ModuleLoader(catalog);

        LoadResult result = assertDoesNotThrow(() -> loader.load(ModuleDescriptor.of("half", "half")));

        assertFalse(result.isSuccess());
        assertEquals(LoadStatus.FAILED, result.getStatus());
        assertNull(result.getModule());
        assertEquals(List.of(Capability.GENERATE, Capability.GENERATE_BATCH), result.getMissingCapabilities());
        assertTrue(result.getError().contains("single-item generation"));
        assertTrue(result.getError().contains("batch generation"));
    }

    @Test
    void load_unknownProviderFails() {
        LoadResult result = new ModuleLoader(new ModuleCatalog()).load(ModuleDescriptor.of("ghost", "ghost"));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("ghost"));
    }

    @Test
    void load_providerThatThrowsFails() {
        ModuleCatalog catalog = new ModuleCatalog();
        catalog.register(TestModules.provider("bad", () -> {
            throw new IllegalStateException("no config");
        }));

        LoadResult result = new ModuleLoader(catalog).load(ModuleDescriptor.of("bad", "bad"));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("no config"));
    }

    @Test
    void load_manifestErrorFailsWithoutConsultingCatalog() {
        ModuleDescriptor broken = new ModuleDescriptor("broken", null, null, null, List.of(), Map.of(), null,
                "Unreadable module.json");

        LoadResult result = new ModuleLoader(new ModuleCatalog()).load(broken);

        assertFalse(result.isSuccess());
        assertEquals("Unreadable module.json", result.getError());
    }

    @Test
    void load_createsFreshInstancePerLoad() {
        ModuleCatalog catalog = new ModuleCatalog();
        catalog.register(TestModules.provider("counting",
                () -> new TestModules.CountingModule(2, Set.of(), Set.of())));
        ModuleLoader loader = new ModuleLoader(catalog);

        LoadResult first = loader.load(ModuleDescriptor.of("a", "counting"));
        LoadResult second = loader.load(ModuleDescriptor.of("b", "counting"));

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertNotSame(first.getModule().getInstance(), second.getModule().getInstance());
        assertEquals("counting", first.getModule().metadata().name());
        assertEquals(2, first.getModule().availableItems().size());
    }

    @Test
    void catalog_rejectsDuplicateIdsAndSkipsDisabledProviders() {
        ModuleCatalog catalog = new ModuleCatalog();
        catalog.register(TestModules.provider("dup", TestModules.HalfModule::new));

        assertThrows(IllegalArgumentException.class,
                () -> catalog.register(TestModules.provider("dup", TestModules.HalfModule::new)));

        PlotModuleProvider disabled = new PlotModuleProvider() {
            @Override
            public String getProviderId() {
                return "off";
            }

            @Override
            public Object createModule(Map<String, Object> settings) {
                return new TestModules.HalfModule();
            }

            @Override
            public boolean isEnabled() {
                return false;
            }
        };
        assertFalse(catalog.register(disabled));
        assertEquals(Set.of("dup"), catalog.ids());
    }
}
