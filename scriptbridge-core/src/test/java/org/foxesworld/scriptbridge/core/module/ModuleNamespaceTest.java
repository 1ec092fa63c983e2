package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.error.CycleIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleNamespaceTest {

    @Test
    @DisplayName("bindings are live: every read sees the current value")
    void liveBindings() {
        AtomicInteger counter = new AtomicInteger();
        ModuleNamespace ns = new ModuleNamespace("counter.js");
        ns.bind("count", () -> counter.get());

        assertEquals(0, ns.get("count"));
        counter.set(7);
        assertEquals(7, ns.get("count"));
    }

    @Test
    void readingUninitializedBindingFails() {
        ModuleNamespace ns = new ModuleNamespace("a.js");
        ns.bind("late", () -> Binding.UNINITIALIZED);

        CycleIntegrityException e = assertThrows(CycleIntegrityException.class, () -> ns.get("late"));
        assertEquals("late", e.bindingName());
        assertEquals("a.js", e.moduleKey());
        assertTrue(ns.has("late"));
    }

    @Test
    void namespaceIsReadOnly() {
        ModuleNamespace ns = new ModuleNamespace("a.js");
        ns.bind("x", () -> 1);

        assertThrows(UnsupportedOperationException.class, () -> ns.put("x", 2));
        assertThrows(UnsupportedOperationException.class, () -> ns.put("y", 2));
        assertEquals(1, ns.get("x"));
    }

    @Test
    void missingMembersReadAsNull() {
        ModuleNamespace ns = new ModuleNamespace("a.js");

        assertNull(ns.get("nothing"));
        assertFalse(ns.has("nothing"));
    }

    @Test
    @DisplayName("star sources contribute everything but default; own bindings win")
    void starSources() {
        ModuleNamespace lib = new ModuleNamespace("lib.js");
        lib.bind("a", () -> "lib-a");
        lib.bind("shared", () -> "lib-shared");
        lib.bind("default", () -> "lib-default");

        ModuleNamespace mid = new ModuleNamespace("mid.js");
        mid.bind("shared", () -> "mid-shared");
        mid.addStarSource(lib);

        assertEquals("lib-a", mid.get("a"));
        assertEquals("mid-shared", mid.get("shared"));
        assertNull(mid.get("default"));
        assertFalse(mid.has("default"));
        assertEquals(Set.of("shared", "a"), mid.keys());
    }

    @Test
    void cyclicStarSourcesTerminate() {
        ModuleNamespace a = new ModuleNamespace("a.js");
        ModuleNamespace b = new ModuleNamespace("b.js");
        a.bind("fromA", () -> 1);
        b.bind("fromB", () -> 2);
        a.addStarSource(b);
        b.addStarSource(a);

        assertEquals(2, a.get("fromB"));
        assertEquals(1, b.get("fromA"));
        assertNull(a.get("neither"));
        assertEquals(Set.of("fromA", "fromB"), a.keys());
    }
}
