// FILE: DocumentLoader.java
package org.foxesworld.scriptbridge.core.document;

// Author: Calista Verner

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Host callback that turns a canonical module key into source text.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>{@link #load} is used by synchronous {@code require}; it may block.</li>
 *   <li>{@link #loadAsync} is used by standard modules and dynamic import. Completion may happen
 *   on any thread; the module loader marshals the continuation back to the engine thread.</li>
 *   <li>{@link #exists} is a cheap check used only when resolution produced several candidates.</li>
 * </ul>
 *
 * <p>The module loader calls {@code load}/{@code loadAsync} at most once per key.</p>
 */
public interface DocumentLoader {

    String load(String key, UniqueDocumentInfo document) throws IOException;

    default CompletionStage<String> loadAsync(String key, UniqueDocumentInfo document) {
        try {
            return CompletableFuture.completedFuture(load(key, document));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    default boolean exists(String key) {
        return true;
    }
}
