package org.foxesworld.scriptbridge.engine;

import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LegacyCommonJsModuleTest {

    private final InMemoryDocumentLoader docs = new InMemoryDocumentLoader();
    private GraalScriptRuntime runtime;

    private GraalScriptRuntime runtime(ModuleSettings settings) {
        runtime = new GraalScriptRuntime(docs, settings.globalRequireFlavor(ModuleFlavor.LEGACY_COMMONJS));
        return runtime;
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) runtime.close();
    }

    @Test
    void moduleObjectCarriesIdAndMeta() {
        docs.put("tools.js", "module.exports = { id: module.id, tag: module.meta.tag, version: module.meta.version };");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults()
                .contextCallback(info -> Map.of("tag", "legacy", "version", 3)));

        Value tools = rt.require("tools");

        assertEquals("tools.js", tools.getMember("id").asString());
        assertEquals("legacy", tools.getMember("tag").asString());
        assertEquals(3, tools.getMember("version").asInt());
    }

    @Test
    void moduleIdIsReadOnly() {
        docs.put("ro.js", "try { module.id = 'other'; exports.writable = true; } catch (e) { exports.writable = false; }\n"
                + "exports.id = module.id;");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Value ro = rt.require("ro");

        assertFalse(ro.getMember("writable").asBoolean());
        assertEquals("ro.js", ro.getMember("id").asString());
    }

    @Test
    void exportsObjectIsSharedUntilReplaced() {
        docs.put("counter.js", "exports.count = 1;\nexports.count++;");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        assertEquals(2, rt.eval("require('counter').count").asInt());
    }

    @Test
    @DisplayName("pathless requests are only allowed from the host by default")
    void pathlessRequestFromModule() {
        docs.put("util.js", "exports.x = 'util';");
        docs.put("main.js", "exports.util = require('util').x;");
        docs.put("rel.js", "exports.util = require('./util').x;");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        assertEquals("util", rt.require("util").getMember("x").asString());
        assertEquals("util", rt.require("rel").getMember("util").asString());
        assertThrows(ModuleResolutionException.class, () -> rt.require("main"));
    }

    @Test
    void pathlessRequestFromModuleWhenEnabled() {
        docs.put("util.js", "exports.x = 'util';");
        docs.put("main.js", "exports.util = require('util').x;");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults().legacyPathlessFromModules(true));

        assertEquals("util", rt.require("main").getMember("util").asString());
    }

    @Test
    void legacyAndCommonJsKeysDoNotMix() {
        docs.put("shared.js", "exports.v = 1;");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        rt.require("shared");

        assertThrows(ModuleResolutionException.class, () -> rt.require("./shared.js", ModuleFlavor.COMMONJS));
    }
}
