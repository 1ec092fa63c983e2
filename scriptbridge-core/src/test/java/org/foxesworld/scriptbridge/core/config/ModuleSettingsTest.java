package org.foxesworld.scriptbridge.core.config;

import org.foxesworld.scriptbridge.core.document.DocumentAccessFlag;
import org.foxesworld.scriptbridge.core.document.DocumentCategory;
import org.foxesworld.scriptbridge.core.document.DocumentFlag;
import org.foxesworld.scriptbridge.core.document.DocumentInfo;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ModuleSettings.PROP_SEARCH_PATH);
        System.clearProperty(ModuleSettings.PROP_IMPORT_MAP);
        System.clearProperty(ModuleSettings.PROP_CASE_SENSITIVE);
        System.clearProperty(ModuleSettings.PROP_LEGACY_PATHLESS);
        System.clearProperty(ModuleSettings.PROP_ACCESS_FLAGS);
    }

    @Test
    void defaults() {
        ModuleSettings s = ModuleSettings.defaults();

        assertTrue(s.searchPath().isEmpty());
        assertTrue(s.importMap().isEmpty());
        assertTrue(s.caseSensitiveKeys());
        assertFalse(s.legacyPathlessFromModules());
        assertTrue(s.accessFlags().isEmpty());
        assertEquals(ModuleFlavor.COMMONJS, s.globalRequireFlavor());
    }

    @Test
    void readsSystemProperties() {
        System.setProperty(ModuleSettings.PROP_SEARCH_PATH, "Root, lib ,,vendor");
        System.setProperty(ModuleSettings.PROP_IMPORT_MAP, "lodash=vendor/lodash.js,@core/=Scripts/core,broken");
        System.setProperty(ModuleSettings.PROP_CASE_SENSITIVE, "false");
        System.setProperty(ModuleSettings.PROP_LEGACY_PATHLESS, "true");
        System.setProperty(ModuleSettings.PROP_ACCESS_FLAGS, "enable_file_loading, NO_SUCH_FLAG");

        ModuleSettings s = ModuleSettings.fromSystemProperties();

        assertEquals(List.of("Root", "lib", "vendor"), s.searchPath());
        assertEquals(Map.of("lodash", "vendor/lodash.js", "@core/", "Scripts/core"), s.importMap());
        assertFalse(s.caseSensitiveKeys());
        assertTrue(s.legacyPathlessFromModules());
        assertEquals(EnumSet.of(DocumentAccessFlag.ENABLE_FILE_LOADING), s.accessFlags());
    }

    @Test
    void globalRequireMustBeSynchronous() {
        ModuleSettings s = ModuleSettings.defaults();

        assertThrows(IllegalArgumentException.class, () -> s.globalRequireFlavor(ModuleFlavor.STANDARD));
        assertEquals(ModuleFlavor.LEGACY_COMMONJS, s.globalRequireFlavor(ModuleFlavor.LEGACY_COMMONJS).globalRequireFlavor());
    }

    @Test
    void defaultDocumentInfoFollowsKeyAndFlavor() {
        ModuleSettings s = ModuleSettings.defaults();

        DocumentInfo standard = s.documentInfoFor("Root/Geometry.js", ModuleFlavor.STANDARD);
        assertEquals("Geometry.js", standard.name());
        assertEquals(DocumentCategory.STANDARD_MODULE, standard.category());
        assertTrue(standard.hasFlag(DocumentFlag.IS_MODULE));
        assertNull(standard.uri());

        DocumentInfo json = s.documentInfoFor("data/config.json", ModuleFlavor.COMMONJS);
        assertEquals(DocumentCategory.JSON, json.category());
        assertFalse(json.hasFlag(DocumentFlag.IS_MODULE));

        DocumentInfo remote = s.documentInfoFor("https://example.com/lib/a.js", ModuleFlavor.COMMONJS);
        assertEquals(URI.create("https://example.com/lib/a.js"), remote.uri());
        assertEquals(DocumentCategory.COMMONJS_MODULE, remote.category());
    }

    @Test
    void providerOverridesDefaults() {
        ModuleSettings s = ModuleSettings.defaults()
                .documentInfoProvider((key, flavor) -> key.startsWith("gen/") ? DocumentInfo.named("generated") : null);

        assertEquals("generated", s.documentInfoFor("gen/a.js", ModuleFlavor.STANDARD).name());
        assertEquals("b.js", s.documentInfoFor("b.js", ModuleFlavor.STANDARD).name());
    }
}
