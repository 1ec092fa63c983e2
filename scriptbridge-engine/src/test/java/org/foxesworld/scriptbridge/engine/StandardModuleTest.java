package org.foxesworld.scriptbridge.engine;

import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.error.CycleIntegrityException;
import org.foxesworld.scriptbridge.core.error.ModuleExecutionException;
import org.foxesworld.scriptbridge.core.error.ModuleFetchException;
import org.foxesworld.scriptbridge.core.error.ModuleLoadException;
import org.foxesworld.scriptbridge.core.module.ModuleHandle;
import org.foxesworld.scriptbridge.core.module.ModuleNamespace;
import org.foxesworld.scriptbridge.core.module.ModuleState;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandardModuleTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    static final String ARITHMETIC = "import * as Geometry from './Geometry.js';\n"
            + "export function Add(a, b) { return a + b; }\n"
            + "export function Multiply(a, b) { return a * b; }\n"
            + "export function Area(side) { return new Geometry.Square(side).Area; }\n";

    static final String GEOMETRY = "import * as Arithmetic from './Arithmetic.js';\n"
            + "export class Rectangle {\n"
            + "    constructor(width, height) { this.width = width; this.height = height; }\n"
            + "    get Area() { return Arithmetic.Multiply(this.width, this.height); }\n"
            + "}\n"
            + "export class Square extends Rectangle {\n"
            + "    constructor(side) { super(side, side); }\n"
            + "}\n";

    private final InMemoryDocumentLoader docs = new InMemoryDocumentLoader();
    private GraalScriptRuntime runtime;

    private GraalScriptRuntime runtime(ModuleSettings settings) {
        runtime = new GraalScriptRuntime(docs, settings);
        return runtime;
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) runtime.close();
    }

    @Test
    @DisplayName("cyclic modules under a search root link and evaluate")
    void cyclicModulesUnderSearchRoot() throws TimeoutException {
        docs.put("Root/Arithmetic.js", ARITHMETIC).put("Root/Geometry.js", GEOMETRY);
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults().searchPath(List.of("Root")));

        ModuleHandle geometry = rt.importModule("Geometry");
        assertEquals("Root/Geometry.js", geometry.key());
        Object ns = rt.await(geometry, TIMEOUT);

        assertInstanceOf(ModuleNamespace.class, ns);
        assertEquals(625, rt.eval("new Geometry.Square(25).Area", Map.of("Geometry", ns)).asInt());

        ModuleHandle arithmetic = rt.importModule("Arithmetic");
        assertTrue(arithmetic.isDone(), "already loaded through the cycle");
        assertEquals(36, rt.eval("Arithmetic.Area(6)", Map.of("Arithmetic", arithmetic.exports())).asInt());
        assertEquals(1, docs.loadCount("Root/Geometry.js"));
        assertEquals(1, docs.loadCount("Root/Arithmetic.js"));
    }

    @Test
    void defaultAndNamedImports() throws TimeoutException {
        docs.put("lib.js", "export default function greet(n) { return 'hi ' + n; }\n"
                + "export const a = 1;\n"
                + "export let counter = 0;\n"
                + "export function bump() { counter++; }\n");
        docs.put("main.js", "import greet, { a } from './lib.js';\n"
                + "import * as lib from './lib.js';\n"
                + "export const text = greet('x') + a;\n"
                + "export function read() { lib.bump(); return lib.counter; }\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Object main = rt.await(rt.importModule("./main.js"), TIMEOUT);

        assertEquals("hi x1", rt.eval("main.text", Map.of("main", main)).asString());
        assertEquals(1, rt.eval("main.read()", Map.of("main", main)).asInt());
        assertEquals(2, rt.eval("main.read()", Map.of("main", main)).asInt());
        assertEquals(1, docs.loadCount("lib.js"));
    }

    @Test
    @DisplayName("named imports read the exporter's current value")
    void namedImportsAreLive() throws TimeoutException {
        docs.put("counter.js", "export let count = 0;\nexport function inc() { count++; }\n");
        docs.put("main.js", "import { count, inc } from './counter.js';\n"
                + "inc();\n"
                + "export const seen = count;\n"
                + "export function current() { return count; }\n"
                + "export function snapshot() { return { count }; }\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Object main = rt.await(rt.importModule("./main.js"), TIMEOUT);
        Object counter = rt.await(rt.importModule("./counter.js"), TIMEOUT);

        assertEquals(1, rt.eval("main.seen", Map.of("main", main)).asInt());
        rt.eval("counter.inc()", Map.of("counter", counter));
        assertEquals(2, rt.eval("main.current()", Map.of("main", main)).asInt());
        assertEquals(2, rt.eval("main.snapshot().count", Map.of("main", main)).asInt());
    }

    @Test
    @DisplayName("a cycle joined by named imports loads when bindings are only read later")
    void cycleThroughNamedImports() throws TimeoutException {
        docs.put("a.js", "import { b } from './b.js';\n"
                + "export const A = 'a';\n"
                + "export function callB() { return b(); }\n");
        docs.put("b.js", "import { A } from './a.js';\nexport function b() { return A; }\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Object a = rt.await(rt.importModule("./a.js"), TIMEOUT);

        assertEquals("a", rt.eval("a.callB()", Map.of("a", a)).asString());
        assertEquals(ModuleState.READY, rt.loader().state("b.js"));
    }

    @Test
    void declaratorListsAndDestructuringAreExported() throws TimeoutException {
        docs.put("m.js", "const obj = { x: 3, y: 4, rest: [5, 6] };\n"
                + "export const a = 1, b = 2;\n"
                + "export const { x, y: why, rest: [first, ...others] } = obj;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleNamespace m = (ModuleNamespace) rt.await(rt.importModule("./m.js"), TIMEOUT);

        assertTrue(m.keys().containsAll(List.of("a", "b", "x", "why", "first", "others")));
        assertEquals(2, rt.eval("m.b", Map.of("m", m)).asInt());
        assertEquals(4, rt.eval("m.why", Map.of("m", m)).asInt());
        assertEquals(14, rt.eval("m.x + m.first + m.others[0]", Map.of("m", m)).asInt());
    }

    @Test
    void moduleSyntaxInsideStringsAndCommentsIsKept() throws TimeoutException {
        docs.put("text.js", "export const s = 'import(x)';\n"
                + "export const t = `import.meta\nexport const z = 1;`;\n"
                + "/*\nimport { q } from './nowhere.js';\n*/\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleNamespace text = (ModuleNamespace) rt.await(rt.importModule("./text.js"), TIMEOUT);

        assertEquals("import(x)", rt.eval("t.s", Map.of("t", text)).asString());
        assertEquals("import.meta\nexport const z = 1;", rt.eval("t.t", Map.of("t", text)).asString());
        assertFalse(text.has("z"));
        assertEquals(1, rt.loader().moduleCount());
    }

    @Test
    void reexports() throws TimeoutException {
        docs.put("lib.js", "export default function greet(n) { return 'hi ' + n; }\nexport const a = 1;\n");
        docs.put("mid.js", "export * from './lib.js';\n"
                + "export { default as greet } from './lib.js';\n"
                + "export * as lib from './lib.js';\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleNamespace mid = (ModuleNamespace) rt.await(rt.importModule("./mid.js"), TIMEOUT);

        assertTrue(mid.keys().containsAll(List.of("a", "greet", "lib")));
        assertFalse(mid.has("default"));
        assertEquals("hi x11", rt.eval("mid.greet('x') + mid.a + mid.lib.a", Map.of("mid", mid)).asString());
    }

    @Test
    void namespaceIsReadOnlyFromScript() throws TimeoutException {
        docs.put("lib.js", "export const a = 1;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Object lib = rt.await(rt.importModule("./lib.js"), TIMEOUT);

        assertEquals("threw", rt.eval("(function () { try { lib.a = 5; return 'wrote'; } catch (e) { return 'threw'; } })()",
                Map.of("lib", lib)).asString());
        assertEquals(1, rt.eval("lib.a", Map.of("lib", lib)).asInt());
    }

    @Test
    @DisplayName("import.meta comes from the context callback and is built once")
    void importMeta() throws TimeoutException {
        AtomicInteger calls = new AtomicInteger();
        docs.put("meta.js", "export const url = import.meta.url;\n"
                + "export function again() { return import.meta.url; }\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults().contextCallback(info -> {
            calls.incrementAndGet();
            return Map.of("url", "mem://" + info.name());
        }));

        Object meta = rt.await(rt.importModule("./meta.js"), TIMEOUT);

        assertEquals("mem://meta.js", rt.eval("m.url", Map.of("m", meta)).asString());
        assertEquals("mem://meta.js", rt.eval("m.again()", Map.of("m", meta)).asString());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("reading a binding of a module that has not run yet is a cycle integrity error")
    void uninitializedBindingInCycle() {
        docs.put("A.js", "import { y } from './B.js';\nexport const x = 'a';\n");
        docs.put("B.js", "import * as A from './A.js';\nexport const y = A.x;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleHandle h = rt.importModule("./A.js");
        CycleIntegrityException e = assertThrows(CycleIntegrityException.class, () -> rt.await(h, TIMEOUT));

        assertEquals("x", e.bindingName());
        assertEquals("A.js", e.moduleKey());
        assertEquals(ModuleState.FAILED, rt.loader().state("A.js"));
        assertEquals(ModuleState.FAILED, rt.loader().state("B.js"));
    }

    @Test
    void evaluationFailureIsTerminal() throws TimeoutException {
        docs.put("boom.js", "export const a = 1;\nthrow new Error('boom');\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleHandle first = rt.importModule("./boom.js");
        ModuleExecutionException e = assertThrows(ModuleExecutionException.class, () -> rt.await(first, TIMEOUT));

        ModuleHandle again = rt.importModule("./boom.js");
        assertTrue(again.isFailed());
        ModuleLoadException second = assertThrows(ModuleLoadException.class, again::exports);
        assertSame(e, second);
        assertEquals(1, docs.loadCount("boom.js"));
    }

    @Test
    void missingDependencyFailsTheImporter() {
        docs.put("main.js", "import { x } from './missing.js';\nexport const y = x;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        ModuleHandle h = rt.importModule("./main.js");
        ModuleFetchException e = assertThrows(ModuleFetchException.class, () -> rt.await(h, TIMEOUT));

        assertEquals("missing.js", e.moduleKey());
        assertEquals(ModuleState.FAILED, rt.loader().state("main.js"));
        assertEquals(ModuleState.FAILED, rt.loader().state("missing.js"));
    }

    @Test
    void jsonImportBindsDefault() throws TimeoutException {
        docs.put("config.json", "{\"side\": 4}");
        docs.put("main.js", "import config from './config.json';\nexport const area = config.side * config.side;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults());

        Object main = rt.await(rt.importModule("./main.js"), TIMEOUT);

        assertEquals(16, rt.eval("main.area", Map.of("main", main)).asInt());
    }

    @Test
    void importMapAppliesToStaticImports() throws TimeoutException {
        docs.put("vendor/math/index.js", "export const pi = 3;\n");
        docs.put("app.js", "import { pi } from 'math';\nexport const tau = pi * 2;\n");
        GraalScriptRuntime rt = runtime(ModuleSettings.defaults().importMap(Map.of("math", "vendor/math/index.js")));

        Object app = rt.await(rt.importModule("./app.js"), TIMEOUT);

        Value tau = rt.eval("app.tau", Map.of("app", app));
        assertEquals(6, tau.asInt());
    }
}
