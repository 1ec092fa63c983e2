// FILE: ImportMapResolver.java
package org.foxesworld.scriptbridge.core.resolve;

// Author: Calista Verner

import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Host-configured specifier remapping: exact entries first, then the longest {@code prefix/}
 * entry.
 */
public final class ImportMapResolver implements ResolverStrategy {

    private final Map<String, String> entries;

    public ImportMapResolver(Map<String, String> entries) {
        this.entries = Map.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    @Override
    public Optional<List<String>> resolve(String referrerKey, String specifier, ModuleFlavor flavor) {
        if (RelativeResolver.hasRelativePrefix(specifier)) return Optional.empty();

        if (entries.isEmpty()) return Optional.empty();

        String exact = entries.get(specifier);
        if (exact != null) return Optional.of(List.of(PathNorm.normalizeKey(exact)));

        // match longest prefix
        String best = null;
        for (String k : entries.keySet()) {
            String prefix = k.endsWith("/") ? k.substring(0, k.length() - 1) : k;
            if (!prefix.isEmpty() && specifier.startsWith(prefix + "/")) {
                if (best == null || k.length() > best.length()) best = k;
            }
        }
        if (best == null) return Optional.empty();

        String prefix = best.endsWith("/") ? best.substring(0, best.length() - 1) : best;
        String tail = specifier.substring(prefix.length() + 1);
        return Optional.of(List.of(PathNorm.normalizeKey(PathNorm.join(entries.get(best), tail))));
    }
}
