package org.foxesworld.scriptbridge.core.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Loads documents from a root directory. Keys are root-relative ({@code Root/Geometry.js}) or
 * {@code file:} URIs.
 *
 * <p>Loaded text is kept in a bounded Caffeine cache so that repeated loads of the same key
 * across loader resets do not hit the disk again.</p>
 *
 * Author: Calista Verner
 */
public final class FileSystemDocumentLoader implements DocumentLoader {

    private static final Logger log = LogManager.getLogger(FileSystemDocumentLoader.class);

    public static final int DEFAULT_MAX_CACHE_SIZE = 1024;

    private final Path root;
    private final Set<DocumentAccessFlag> accessFlags;
    private final Cache<String, String> documents;
    private final Executor executor;

    public FileSystemDocumentLoader(Path root) {
        this(root, EnumSet.of(DocumentAccessFlag.ENABLE_FILE_LOADING), DEFAULT_MAX_CACHE_SIZE, ForkJoinPool.commonPool());
    }

    public FileSystemDocumentLoader(Path root, Set<DocumentAccessFlag> accessFlags, int maxCacheSize, Executor executor) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.accessFlags = accessFlags == null || accessFlags.isEmpty()
                ? EnumSet.noneOf(DocumentAccessFlag.class)
                : EnumSet.copyOf(accessFlags);
        this.documents = Caffeine.newBuilder()
                .maximumSize(Math.max(0, maxCacheSize))
                .build();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Path root() {
        return root;
    }

    @Override
    public String load(String key, UniqueDocumentInfo document) throws IOException {
        if (!accessFlags.contains(DocumentAccessFlag.ENABLE_FILE_LOADING)) {
            throw new IOException("File loading is disabled; cannot load '" + key + "'");
        }

        String cached = documents.getIfPresent(key);
        if (cached != null) {
            log.debug("[modules] fs: cache hit {}", key);
            return cached;
        }

        Path path = toPath(key);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Document not found: '" + key + "' (" + path + ")");
        }

        String text = Files.readString(path, StandardCharsets.UTF_8);
        documents.put(key, text);
        log.debug("[modules] fs: loaded {} ({} chars)", key, text.length());
        return text;
    }

    @Override
    public CompletionStage<String> loadAsync(String key, UniqueDocumentInfo document) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return load(key, document);
            } catch (IOException e) {
                throw new CompletionException(new UncheckedIOException(e));
            }
        }, executor);
    }

    @Override
    public boolean exists(String key) {
        try {
            return documents.getIfPresent(key) != null || Files.isRegularFile(toPath(key));
        } catch (IOException e) {
            return false;
        }
    }

    /** Drops cached text so the next load reads the file again. */
    public void invalidate(String key) {
        documents.invalidate(key);
    }

    public void invalidateAll() {
        documents.invalidateAll();
    }

    private Path toPath(String key) throws IOException {
        Path path;
        if (key.startsWith("file:")) {
            try {
                path = Path.of(URI.create(key)).toAbsolutePath().normalize();
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed file URI '" + key + "'", e);
            }
        } else if (key.indexOf(':') > 1) {
            throw new IOException("Unsupported document scheme in '" + key + "'");
        } else {
            path = root.resolve(key).normalize();
        }
        if (!path.startsWith(root)) {
            throw new IOException("Document '" + key + "' is outside of " + root);
        }
        return path;
    }
}
