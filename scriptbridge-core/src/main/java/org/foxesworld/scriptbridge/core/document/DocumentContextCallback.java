package org.foxesworld.scriptbridge.core.document;

import java.util.Map;

/**
 * Host hook that produces the context properties of a module the first time the
 * module asks for them ({@code import.meta} / {@code module.meta}).
 *
 * <p>May return {@code null}; that is treated as an empty property set.</p>
 */
@FunctionalInterface
public interface DocumentContextCallback {
    Map<String, Object> createContext(DocumentInfo info);
}
