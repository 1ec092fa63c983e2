package org.foxesworld.scriptbridge.core.module;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Writable bag backed by an insertion-ordered map. */
public final class MapPropertyBag implements PropertyBag {

    private final Map<String, Object> values;

    public MapPropertyBag(Map<String, ?> initial) {
        this.values = new LinkedHashMap<>(initial);
    }

    @Override
    public Object get(String name) {
        return values.get(name);
    }

    @Override
    public boolean has(String name) {
        return values.containsKey(name);
    }

    @Override
    public void put(String name, Object value) {
        values.put(name, value);
    }

    @Override
    public Set<String> keys() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "MapPropertyBag" + values.keySet();
    }
}
