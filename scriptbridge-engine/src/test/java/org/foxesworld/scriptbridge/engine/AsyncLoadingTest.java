package org.foxesworld.scriptbridge.engine;

import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.error.ModuleCancelledException;
import org.foxesworld.scriptbridge.core.error.ModuleFetchException;
import org.foxesworld.scriptbridge.core.error.ModuleLoadException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;
import org.foxesworld.scriptbridge.core.module.ModuleHandle;
import org.foxesworld.scriptbridge.core.module.ModuleState;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class AsyncLoadingTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final InMemoryDocumentLoader docs = new InMemoryDocumentLoader();
    private GraalScriptRuntime rt;

    @BeforeEach
    void setUp() {
        rt = new GraalScriptRuntime(docs, ModuleSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        rt.close();
    }

    private void pumpUntil(BooleanSupplier done) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!done.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not reached within " + TIMEOUT);
            if (rt.jobs().drain(64) == 0) LockSupport.parkNanos(1_000_000L);
        }
    }

    @Test
    @DisplayName("concurrent loads of one key share a single fetch")
    void singleFlight() throws TimeoutException {
        docs.holdAsync(true).put("shared.js", "export const v = 1;\n");

        ModuleHandle h1 = rt.importModule("./shared.js");
        ModuleHandle h2 = rt.importModule("./x/../shared.js");
        assertEquals(h1.key(), h2.key());
        assertFalse(h1.isDone());
        assertEquals(1, docs.loadCount("shared.js"));

        docs.release("shared.js");
        Object first = rt.await(h1, TIMEOUT);
        Object second = rt.await(h2, TIMEOUT);

        assertSame(first, second);
        assertEquals(1, docs.loadCount("shared.js"));
    }

    @Test
    void sharedDependencyIsFetchedOnce() throws TimeoutException {
        docs.put("dep.js", "export const d = 'dep';\n")
                .put("r1.js", "import { d } from './dep.js';\nexport const r = d + 1;\n")
                .put("r2.js", "import { d } from './dep.js';\nexport const r = d + 2;\n");

        ModuleHandle r1 = rt.importModule("./r1.js");
        ModuleHandle r2 = rt.importModule("./r2.js");

        assertEquals("dep1", rt.eval("m.r", Map.of("m", rt.await(r1, TIMEOUT))).asString());
        assertEquals("dep2", rt.eval("m.r", Map.of("m", rt.await(r2, TIMEOUT))).asString());
        assertEquals(1, docs.loadCount("dep.js"));
    }

    @Test
    void cancellationFailsEveryWaiter() {
        docs.holdAsync(true).put("slow.js", "export const v = 1;\n");

        ModuleHandle h1 = rt.importModule("./slow.js");
        ModuleHandle h2 = rt.importModule("./slow.js");

        assertTrue(h1.cancel());
        assertTrue(h1.isFailed());
        assertTrue(h2.isFailed());
        ModuleCancelledException e = assertThrows(ModuleCancelledException.class, h2::exports);
        assertEquals(ModuleState.FAILED, rt.loader().state("slow.js"));

        ModuleHandle later = rt.importModule("./slow.js");
        assertSame(e, assertThrows(ModuleLoadException.class, later::exports));
        assertFalse(later.cancel());

        rt.jobs().drain(64);
        assertEquals(1, docs.loadCount("slow.js"));
    }

    @Test
    void awaitTimesOut() {
        docs.holdAsync(true).put("never.js", "export const v = 1;\n");

        ModuleHandle h = rt.importModule("./never.js");

        assertThrows(TimeoutException.class, () -> rt.await(h, Duration.ofMillis(50)));
        assertFalse(h.isDone());
        assertThrows(IllegalStateException.class, h::exports);
    }

    @Test
    @DisplayName("synchronous require of a key being fetched asynchronously fails without failing the module")
    void syncRequireDuringAsyncFetch() throws TimeoutException {
        docs.holdAsync(true).put("x.js", "export const v = 7;\n");

        ModuleHandle h = rt.importModule("./x.js");
        assertThrows(ModuleFetchException.class, () -> rt.require("./x.js", ModuleFlavor.STANDARD));
        assertEquals(ModuleState.PENDING, rt.loader().state("x.js"));

        docs.release("x.js");
        Object ns = rt.await(h, TIMEOUT);
        assertEquals(7, rt.eval("x.v", Map.of("x", ns)).asInt());
    }

    @Test
    @DisplayName("dynamic import resolves later, after the owner thread pumps jobs")
    void dynamicImportIsAsynchronous() throws TimeoutException {
        docs.put("lazy.js", "export const value = 42;\n");
        docs.put("main.js", "export let loaded = null;\n"
                + "export function load() { return import('./lazy.js').then(function (m) { loaded = m.value; return m.value; }); }\n");

        Object main = rt.await(rt.importModule("./main.js"), TIMEOUT);
        Map<String, Object> bindings = Map.of("main", main);

        Value promise = rt.eval("main.load()", bindings);
        assertTrue(rt.eval("p instanceof Promise", Map.of("p", promise)).asBoolean());
        assertTrue(rt.eval("main.loaded", bindings).isNull());
        assertEquals(ModuleState.PENDING, rt.loader().state("lazy.js"));

        pumpUntil(() -> !rt.eval("main.loaded", bindings).isNull());
        assertEquals(42, rt.eval("main.loaded", bindings).asInt());
        assertEquals(ModuleState.READY, rt.loader().state("lazy.js"));
    }

    @Test
    void failedDynamicImportRejects() throws TimeoutException {
        docs.put("main.js", "export let outcome = null;\n"
                + "export function tryLoad() {\n"
                + "  return import('./nope.js').then(function () { outcome = 'loaded'; }, function (e) { outcome = e.name; });\n"
                + "}\n");

        Object main = rt.await(rt.importModule("./main.js"), TIMEOUT);
        Map<String, Object> bindings = Map.of("main", main);

        rt.eval("main.tryLoad()", bindings);
        pumpUntil(() -> !rt.eval("main.outcome", bindings).isNull());

        assertEquals("ModuleFetchException", rt.eval("main.outcome", bindings).asString());
    }
}
