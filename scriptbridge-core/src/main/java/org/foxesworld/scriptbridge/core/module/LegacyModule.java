package org.foxesworld.scriptbridge.core.module;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Host-backed {@code module} object of legacy CommonJS modules: {@code id} and {@code uri} are
 * fixed, {@code exports} is writable, {@code meta} is the module context as a bag.
 */
public final class LegacyModule implements PropertyBag {

    private static final Set<String> KEYS = Set.of("id", "uri", "exports", "meta");

    private final String id;
    private final String uri;
    private final Supplier<Object> meta;
    private Object exports;

    public LegacyModule(String id, String uri, Object exports, Supplier<Object> meta) {
        this.id = id;
        this.uri = uri;
        this.exports = exports;
        this.meta = meta;
    }

    public Object exports() {
        return exports;
    }

    @Override
    public Object get(String name) {
        switch (name) {
            case "id": return id;
            case "uri": return uri;
            case "exports": return exports;
            case "meta": return meta.get();
            default: return null;
        }
    }

    @Override
    public boolean has(String name) {
        return KEYS.contains(name) && (!"uri".equals(name) || uri != null);
    }

    @Override
    public void put(String name, Object value) {
        if (!"exports".equals(name)) {
            throw new UnsupportedOperationException("module." + name + " is read-only");
        }
        this.exports = value;
    }

    @Override
    public Set<String> keys() {
        Set<String> out = new LinkedHashSet<>();
        out.add("id");
        if (uri != null) out.add("uri");
        out.add("exports");
        out.add("meta");
        return out;
    }
}
