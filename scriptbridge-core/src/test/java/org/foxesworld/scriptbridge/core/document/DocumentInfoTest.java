package org.foxesworld.scriptbridge.core.document;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentInfoTest {

    @Test
    void defaultsForMissingFields() {
        DocumentInfo info = new DocumentInfo(null, null, null, null, null, null);

        assertEquals(DocumentInfo.DEFAULT_NAME, info.name());
        assertEquals(DocumentCategory.SCRIPT, info.category());
        assertTrue(info.flags().isEmpty());
        assertNull(info.contextCallback());
    }

    @Test
    void uriDocumentIsNamedByLastSegment() {
        DocumentInfo info = DocumentInfo.of(URI.create("https://example.com/lib/Geometry.js"));

        assertEquals("Geometry.js", info.name());
        assertEquals(URI.create("https://example.com/lib/Geometry.js"), info.uri());
    }

    @Test
    void flagsAreCopiedAndReadOnly() {
        Set<DocumentFlag> flags = EnumSet.of(DocumentFlag.IS_MODULE);
        DocumentInfo info = DocumentInfo.named("a.js").withFlags(flags);
        flags.add(DocumentFlag.IS_TRANSIENT);

        assertTrue(info.hasFlag(DocumentFlag.IS_MODULE));
        assertFalse(info.hasFlag(DocumentFlag.IS_TRANSIENT));
        assertThrows(UnsupportedOperationException.class, () -> info.flags().add(DocumentFlag.IS_TRANSIENT));
    }

    @Test
    void withersKeepOtherFields() {
        DocumentInfo info = DocumentInfo.named("a.js")
                .withCategory(DocumentCategory.COMMONJS_MODULE)
                .withSourceMapUri(URI.create("file:///maps/a.js.map"))
                .withName("b.js");

        assertEquals("b.js", info.name());
        assertEquals(DocumentCategory.COMMONJS_MODULE, info.category());
        assertEquals(URI.create("file:///maps/a.js.map"), info.sourceMapUri());
    }
}
