package org.foxesworld.scriptbridge.core.module;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.document.DocumentContextCallback;
import org.foxesworld.scriptbridge.core.document.UniqueDocumentInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes module context properties ({@code import.meta}, {@code module.meta}) from the
 * document's callback, falling back to the settings callback.
 */
public final class ContextBuilder {

    private static final Logger log = LogManager.getLogger(ContextBuilder.class);

    private final ModuleSettings settings;

    public ContextBuilder(ModuleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Map<String, Object> build(UniqueDocumentInfo document) {
        DocumentContextCallback cb = document.contextCallback();
        if (cb == null) cb = settings.contextCallback();
        if (cb == null) return Map.of();

        Map<String, Object> raw = cb.createContext(document.info());
        log.debug("[modules] context: built for {} ({} entries)", document.uniqueName(), raw == null ? 0 : raw.size());
        return raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    /** Memoized on the record: the callback runs at most once per module. */
    public Map<String, Object> contextOf(ModuleRecord rec) {
        if (rec.context == null) {
            rec.context = build(rec.document());
        }
        return rec.context;
    }
}
