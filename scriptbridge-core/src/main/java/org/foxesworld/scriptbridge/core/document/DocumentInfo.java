// FILE: DocumentInfo.java
package org.foxesworld.scriptbridge.core.document;

import java.net.URI;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Host-supplied metadata of a script document.
 *
 * <p>The name is a display name only: several documents may share it. Loaded modules get a
 * unique identity on top of this record, see {@link UniqueDocumentInfo}.</p>
 *
 * <p>Immutable; the {@code with*} methods return modified copies.</p>
 */
public record DocumentInfo(
        String name,
        URI uri,
        URI sourceMapUri,
        DocumentCategory category,
        Set<DocumentFlag> flags,
        DocumentContextCallback contextCallback
) {

    public static final String DEFAULT_NAME = "Script Document";

    public DocumentInfo {
        name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
        category = (category == null) ? DocumentCategory.SCRIPT : category;
        flags = (flags == null || flags.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(DocumentFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static DocumentInfo named(String name) {
        return new DocumentInfo(name, null, null, DocumentCategory.SCRIPT, null, null);
    }

    /**
     * Document identified by URI; the display name is the last path segment.
     */
    public static DocumentInfo of(URI uri) {
        Objects.requireNonNull(uri, "uri");
        return new DocumentInfo(lastSegment(uri), uri, null, DocumentCategory.SCRIPT, null, null);
    }

    public DocumentInfo withName(String name) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public DocumentInfo withUri(URI uri) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public DocumentInfo withSourceMapUri(URI sourceMapUri) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public DocumentInfo withCategory(DocumentCategory category) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public DocumentInfo withFlags(Set<DocumentFlag> flags) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public DocumentInfo withContextCallback(DocumentContextCallback contextCallback) {
        return new DocumentInfo(name, uri, sourceMapUri, category, flags, contextCallback);
    }

    public boolean hasFlag(DocumentFlag flag) {
        return flags.contains(flag);
    }

    private static String lastSegment(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty()) path = uri.getSchemeSpecificPart();
        if (path == null) return DEFAULT_NAME;
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
