// FILE: ModuleNamespace.java
package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.error.CycleIntegrityException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Exports of a standard module: named live bindings plus {@code export *} sources.
 *
 * <p>The namespace object exists from the moment the module record is created, so cyclic
 * importers can hold it before the module has run. Reading a binding whose local is not
 * initialized yet raises {@link CycleIntegrityException}. Script cannot write to it.</p>
 */
public final class ModuleNamespace implements PropertyBag {

    private final String moduleKey;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final List<ModuleNamespace> starSources = new ArrayList<>();

    public ModuleNamespace(String moduleKey) {
        this.moduleKey = Objects.requireNonNull(moduleKey, "moduleKey");
    }

    public String moduleKey() {
        return moduleKey;
    }

    void bind(String exportName, Binding binding) {
        bindings.put(Objects.requireNonNull(exportName, "exportName"), Objects.requireNonNull(binding, "binding"));
    }

    void addStarSource(ModuleNamespace source) {
        if (source != this && !starSources.contains(source)) starSources.add(source);
    }

    @Override
    public Object get(String name) {
        return read(name, new LinkedHashSet<>());
    }

    @Override
    public boolean has(String name) {
        return has(name, new LinkedHashSet<>());
    }

    @Override
    public void put(String name, Object value) {
        throw new UnsupportedOperationException("Cannot assign to '" + name + "': module namespace of '" + moduleKey + "' is read-only");
    }

    @Override
    public Set<String> keys() {
        Set<String> out = new LinkedHashSet<>();
        collectKeys(out, new LinkedHashSet<>());
        return out;
    }

    private Object read(String name, Set<ModuleNamespace> seen) {
        if (!seen.add(this)) return null;

        Binding b = bindings.get(name);
        if (b != null) {
            Object v = b.read();
            if (v == Binding.UNINITIALIZED) throw new CycleIntegrityException(moduleKey, name);
            return v;
        }
        if ("default".equals(name)) return null;

        for (ModuleNamespace src : starSources) {
            if (src.has(name, new LinkedHashSet<>(seen))) return src.read(name, seen);
        }
        return null;
    }

    private boolean has(String name, Set<ModuleNamespace> seen) {
        if (!seen.add(this)) return false;
        if (bindings.containsKey(name)) return true;
        if ("default".equals(name)) return false;
        for (ModuleNamespace src : starSources) {
            if (src.has(name, seen)) return true;
        }
        return false;
    }

    private void collectKeys(Set<String> out, Set<ModuleNamespace> seen) {
        if (!seen.add(this)) return;
        out.addAll(bindings.keySet());
        for (ModuleNamespace src : starSources) {
            Set<String> nested = new LinkedHashSet<>();
            src.collectKeys(nested, seen);
            nested.remove("default");
            out.addAll(nested);
        }
    }

    @Override
    public String toString() {
        return "ModuleNamespace{" + moduleKey + ", " + bindings.keySet() + '}';
    }
}
