package org.foxesworld.scriptbridge.core.document;

// Author: Calista Verner

import java.util.HashMap;
import java.util.Map;

/**
 * Disambiguates display names in load order: {@code Geometry.js}, {@code Geometry [2].js},
 * {@code Geometry [3].js}. The extension stays last so tooling still recognises the file type.
 */
public final class UniqueNameManager {

    private final Map<String, Integer> counts = new HashMap<>();

    public synchronized String uniqueName(String name, String alternate) {
        String input = (name == null || name.isBlank()) ? alternate : name;
        if (input == null || input.isBlank()) input = DocumentInfo.DEFAULT_NAME;

        String base = input;
        String ext = "";
        int slash = input.lastIndexOf('/');
        int dot = input.lastIndexOf('.');
        if (dot > slash + 1) {
            base = input.substring(0, dot);
            ext = input.substring(dot);
        }

        int count = counts.merge(base + ext, 1, Integer::sum);
        return count < 2 ? base + ext : base + " [" + count + "]" + ext;
    }
}
