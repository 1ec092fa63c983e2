package org.foxesworld.scriptbridge.core.module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Canonical key to record, in first-load order. One record per key. */
final class ModuleCache {

    private final Map<String, ModuleRecord> records = new LinkedHashMap<>();

    ModuleRecord get(String key) {
        return records.get(key);
    }

    void put(ModuleRecord rec) {
        ModuleRecord prev = records.putIfAbsent(rec.key(), rec);
        if (prev != null) throw new IllegalStateException("Duplicate module record for '" + rec.key() + "'");
    }

    int size() {
        return records.size();
    }

    List<ModuleRecord> snapshot() {
        return new ArrayList<>(records.values());
    }

    void clear() {
        records.clear();
    }
}
