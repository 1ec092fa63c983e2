// FILE: ClasspathDocumentLoader.java
package org.foxesworld.scriptbridge.core.document;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serves built-in modules from class path resources: key {@code builtin/paths.js} with base
 * {@code scriptbridge/} reads {@code scriptbridge/builtin/paths.js}.
 *
 * Author: Calista Verner
 */
public final class ClasspathDocumentLoader implements DocumentLoader {

    private final ClassLoader classLoader;
    private final String resourceBasePath;
    private final String keyPrefix;

    public ClasspathDocumentLoader(ClassLoader classLoader, String resourceBasePath) {
        this(classLoader, resourceBasePath, "");
    }

    /**
     * @param keyPrefix only keys starting with this prefix are served; the prefix is stripped
     *                  before the resource lookup
     */
    public ClasspathDocumentLoader(ClassLoader classLoader, String resourceBasePath, String keyPrefix) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        String base = Objects.requireNonNull(resourceBasePath, "resourceBasePath");
        this.resourceBasePath = base.isEmpty() || base.endsWith("/") ? base : base + "/";
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public String load(String key, UniqueDocumentInfo document) throws IOException {
        String res = resourcePath(key);
        if (res == null) throw new FileNotFoundException("Not a class path document: '" + key + "'");

        try (InputStream in = classLoader.getResourceAsStream(res)) {
            if (in == null) throw new FileNotFoundException("Resource not found: " + res);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public boolean exists(String key) {
        String res = resourcePath(key);
        return res != null && classLoader.getResource(res) != null;
    }

    private String resourcePath(String key) {
        if (key == null || !key.startsWith(keyPrefix)) return null;
        String rel = key.substring(keyPrefix.length());
        while (rel.startsWith("/")) rel = rel.substring(1);
        return rel.isBlank() ? null : resourceBasePath + rel;
    }
}
