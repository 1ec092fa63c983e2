package org.foxesworld.scriptbridge.core.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Downloads documents whose keys are {@code http:} or {@code https:} URIs. Requests are refused
 * unless {@link DocumentAccessFlag#ENABLE_WEB_LOADING} is set.
 *
 * <p>{@link #exists} sends a {@code HEAD} request; loads send {@code GET}. Only 2xx responses
 * count. Downloaded text is cached like {@link FileSystemDocumentLoader} does.</p>
 *
 * Author: Calista Verner
 */
public final class WebDocumentLoader implements DocumentLoader {

    private static final Logger log = LogManager.getLogger(WebDocumentLoader.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Set<DocumentAccessFlag> accessFlags;
    private final Cache<String, String> documents;
    private final Duration timeout;

    public WebDocumentLoader() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(),
                EnumSet.of(DocumentAccessFlag.ENABLE_WEB_LOADING),
                FileSystemDocumentLoader.DEFAULT_MAX_CACHE_SIZE, DEFAULT_TIMEOUT);
    }

    public WebDocumentLoader(HttpClient client, Set<DocumentAccessFlag> accessFlags, int maxCacheSize, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.accessFlags = accessFlags == null || accessFlags.isEmpty()
                ? EnumSet.noneOf(DocumentAccessFlag.class)
                : EnumSet.copyOf(accessFlags);
        this.documents = Caffeine.newBuilder()
                .maximumSize(Math.max(0, maxCacheSize))
                .build();
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String load(String key, UniqueDocumentInfo document) throws IOException {
        URI uri = checkedUri(key);
        String cached = documents.getIfPresent(key);
        if (cached != null) {
            log.debug("[modules] web: cache hit {}", key);
            return cached;
        }

        HttpResponse<String> response;
        try {
            response = client.send(get(uri), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while downloading '" + key + "'");
        }
        return accept(key, response);
    }

    @Override
    public CompletionStage<String> loadAsync(String key, UniqueDocumentInfo document) {
        URI uri;
        try {
            uri = checkedUri(key);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        String cached = documents.getIfPresent(key);
        if (cached != null) {
            log.debug("[modules] web: cache hit {}", key);
            return CompletableFuture.completedFuture(cached);
        }
        return client.sendAsync(get(uri), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenCompose(response -> {
                    try {
                        return CompletableFuture.completedFuture(accept(key, response));
                    } catch (IOException e) {
                        return CompletableFuture.failedFuture(e);
                    }
                });
    }

    /** Web keys only, and only while web loading is enabled; then a {@code HEAD} request decides. */
    @Override
    public boolean exists(String key) {
        if (!isWebKey(key) || !accessFlags.contains(DocumentAccessFlag.ENABLE_WEB_LOADING)) return false;
        if (documents.getIfPresent(key) != null) return true;
        try {
            HttpRequest head = HttpRequest.newBuilder(URI.create(key))
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .timeout(timeout)
                    .build();
            int status = client.send(head, HttpResponse.BodyHandlers.discarding()).statusCode();
            log.debug("[modules] web: HEAD {} -> {}", key, status);
            return status / 100 == 2;
        } catch (IllegalArgumentException | IOException e) {
            log.debug("[modules] web: HEAD {} failed: {}", key, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void invalidate(String key) {
        documents.invalidate(key);
    }

    public void invalidateAll() {
        documents.invalidateAll();
    }

    static boolean isWebKey(String key) {
        if (key == null) return false;
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.startsWith("http:") || lower.startsWith("https:");
    }

    private URI checkedUri(String key) throws IOException {
        if (!accessFlags.contains(DocumentAccessFlag.ENABLE_WEB_LOADING)) {
            throw new IOException("Web loading is disabled; cannot download '" + key + "'");
        }
        if (!isWebKey(key)) {
            throw new IOException("Unsupported document scheme in '" + key + "'");
        }
        try {
            return URI.create(key);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed web URI '" + key + "'", e);
        }
    }

    private HttpRequest get(URI uri) {
        return HttpRequest.newBuilder(uri).GET().timeout(timeout).build();
    }

    private String accept(String key, HttpResponse<String> response) throws IOException {
        int status = response.statusCode();
        if (status == 404 || status == 410) {
            throw new FileNotFoundException("Document not found: '" + key + "' (HTTP " + status + ")");
        }
        if (status / 100 != 2) {
            throw new IOException("Download of '" + key + "' failed with HTTP " + status);
        }
        String text = response.body();
        documents.put(key, text);
        log.debug("[modules] web: loaded {} ({} chars)", key, text.length());
        return text;
    }
}
