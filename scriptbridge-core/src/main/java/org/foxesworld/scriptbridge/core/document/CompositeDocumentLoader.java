// FILE: CompositeDocumentLoader.java
package org.foxesworld.scriptbridge.core.document;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ForkJoinPool;

/**
 * Tries loaders in order; the first one whose {@link DocumentLoader#exists} accepts the key
 * serves it.
 *
 * Author: Calista Verner
 */
public final class CompositeDocumentLoader implements DocumentLoader {

    private final List<DocumentLoader> loaders;

    public CompositeDocumentLoader(List<DocumentLoader> loaders) {
        this.loaders = List.copyOf(Objects.requireNonNull(loaders, "loaders"));
    }

    /**
     * File system documents under {@code root}, then {@code http:}/{@code https:} documents.
     * Each side only serves keys while its access flag is in {@code accessFlags}.
     */
    public static CompositeDocumentLoader fileAndWeb(Path root, Set<DocumentAccessFlag> accessFlags) {
        return new CompositeDocumentLoader(List.of(
                new FileSystemDocumentLoader(root, accessFlags, FileSystemDocumentLoader.DEFAULT_MAX_CACHE_SIZE,
                        ForkJoinPool.commonPool()),
                new WebDocumentLoader(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(),
                        accessFlags, FileSystemDocumentLoader.DEFAULT_MAX_CACHE_SIZE, WebDocumentLoader.DEFAULT_TIMEOUT)));
    }

    @Override
    public String load(String key, UniqueDocumentInfo document) throws IOException {
        DocumentLoader l = pick(key);
        if (l == null) throw new FileNotFoundException("No loader accepts '" + key + "'");
        return l.load(key, document);
    }

    @Override
    public CompletionStage<String> loadAsync(String key, UniqueDocumentInfo document) {
        DocumentLoader l = pick(key);
        if (l == null) {
            return CompletableFuture.failedFuture(new FileNotFoundException("No loader accepts '" + key + "'"));
        }
        return l.loadAsync(key, document);
    }

    @Override
    public boolean exists(String key) {
        return pick(key) != null;
    }

    private DocumentLoader pick(String key) {
        for (DocumentLoader l : loaders) {
            if (l.exists(key)) return l;
        }
        return null;
    }
}
