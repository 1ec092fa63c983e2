package org.foxesworld.scriptbridge.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SystemProps {
    private SystemProps() {}

    /** Comma separated values in declaration order; blank entries are skipped. */
    public static List<String> readCsvProperty(String key, List<String> defaults) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return defaults;

        List<String> out = new ArrayList<>();
        for (String s : raw.split(",")) {
            String v = s.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? defaults : List.copyOf(out);
    }

    /** Comma separated {@code name=value} pairs; malformed pairs are skipped. */
    public static Map<String, String> readMapProperty(String key, Map<String, String> defaults) {
        List<String> pairs = readCsvProperty(key, List.of());
        if (pairs.isEmpty()) return defaults;

        Map<String, String> out = new LinkedHashMap<>();
        for (String p : pairs) {
            int eq = p.indexOf('=');
            if (eq <= 0 || eq == p.length() - 1) continue;
            out.put(p.substring(0, eq).trim(), p.substring(eq + 1).trim());
        }
        return out.isEmpty() ? defaults : out;
    }

    public static boolean readBooleanProperty(String key, boolean defaultValue) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
