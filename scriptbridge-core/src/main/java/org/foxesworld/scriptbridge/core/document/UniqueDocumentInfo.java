package org.foxesworld.scriptbridge.core.document;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DocumentInfo} plus the identity a document receives the first time its canonical key
 * is loaded. Ids come from a process-wide counter and are never reused.
 */
public final class UniqueDocumentInfo {

    private static final AtomicLong IDS = new AtomicLong(0);

    private final DocumentInfo info;
    private final long uniqueId;
    private final String uniqueName;

    private UniqueDocumentInfo(DocumentInfo info, long uniqueId, String uniqueName) {
        this.info = Objects.requireNonNull(info, "info");
        this.uniqueId = uniqueId;
        this.uniqueName = Objects.requireNonNull(uniqueName, "uniqueName");
    }

    /**
     * Assigns a fresh id and a name disambiguated by {@code names}.
     */
    public static UniqueDocumentInfo assign(DocumentInfo info, UniqueNameManager names) {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(names, "names");
        String uniqueName = names.uniqueName(info.name(), info.category().defaultName());
        return new UniqueDocumentInfo(info, IDS.incrementAndGet(), uniqueName);
    }

    public DocumentInfo info() { return info; }

    public String name() { return info.name(); }

    public URI uri() { return info.uri(); }

    public URI sourceMapUri() { return info.sourceMapUri(); }

    public DocumentCategory category() { return info.category(); }

    public DocumentContextCallback contextCallback() { return info.contextCallback(); }

    public long uniqueId() { return uniqueId; }

    public String uniqueName() { return uniqueName; }

    @Override
    public String toString() {
        return "UniqueDocumentInfo{" + uniqueName + " #" + uniqueId + '}';
    }
}
