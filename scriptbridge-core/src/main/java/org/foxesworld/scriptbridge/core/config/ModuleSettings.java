// FILE: ModuleSettings.java
package org.foxesworld.scriptbridge.core.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.document.DocumentAccessFlag;
import org.foxesworld.scriptbridge.core.document.DocumentCategory;
import org.foxesworld.scriptbridge.core.document.DocumentContextCallback;
import org.foxesworld.scriptbridge.core.document.DocumentFlag;
import org.foxesworld.scriptbridge.core.document.DocumentInfo;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;
import org.foxesworld.scriptbridge.core.resolve.PathNorm;

import java.net.URI;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Module loading configuration. Fluent setters; read once when a
 * {@link org.foxesworld.scriptbridge.core.module.ModuleLoader} is created.
 *
 * Author: Calista Verner
 */
public final class ModuleSettings {

    private static final Logger log = LogManager.getLogger(ModuleSettings.class);

    public static final String PROP_PREFIX = "scriptbridge.modules.";
    public static final String PROP_SEARCH_PATH = PROP_PREFIX + "searchPath";
    public static final String PROP_IMPORT_MAP = PROP_PREFIX + "importMap";
    public static final String PROP_CASE_SENSITIVE = PROP_PREFIX + "caseSensitive";
    public static final String PROP_LEGACY_PATHLESS = PROP_PREFIX + "legacyPathlessFromModules";
    public static final String PROP_ACCESS_FLAGS = PROP_PREFIX + "accessFlags";

    /** Produces the display metadata of a module on first load of its key. */
    @FunctionalInterface
    public interface DocumentInfoProvider {
        DocumentInfo create(String key, ModuleFlavor flavor);
    }

    private List<String> searchPath = List.of();
    private Map<String, String> importMap = Map.of();
    private boolean caseSensitiveKeys = true;
    private boolean legacyPathlessFromModules = false;
    private EnumSet<DocumentAccessFlag> accessFlags = EnumSet.noneOf(DocumentAccessFlag.class);
    private DocumentContextCallback contextCallback;
    private DocumentInfoProvider documentInfoProvider;
    private ModuleFlavor globalRequireFlavor = ModuleFlavor.COMMONJS;

    public static ModuleSettings defaults() {
        return new ModuleSettings();
    }

    /**
     * Defaults overridden by {@code scriptbridge.modules.*} system properties.
     */
    public static ModuleSettings fromSystemProperties() {
        ModuleSettings s = new ModuleSettings()
                .searchPath(SystemProps.readCsvProperty(PROP_SEARCH_PATH, List.of()))
                .importMap(SystemProps.readMapProperty(PROP_IMPORT_MAP, Map.of()))
                .caseSensitiveKeys(SystemProps.readBooleanProperty(PROP_CASE_SENSITIVE, true))
                .legacyPathlessFromModules(SystemProps.readBooleanProperty(PROP_LEGACY_PATHLESS, false));

        EnumSet<DocumentAccessFlag> flags = EnumSet.noneOf(DocumentAccessFlag.class);
        for (String name : SystemProps.readCsvProperty(PROP_ACCESS_FLAGS, List.of())) {
            try {
                flags.add(DocumentAccessFlag.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("[modules] settings: unknown access flag '{}' in {}", name, PROP_ACCESS_FLAGS);
            }
        }
        s.accessFlags(flags);

        log.debug("[modules] settings: searchPath={} importMap={} caseSensitive={} flags={}",
                s.searchPath, s.importMap.keySet(), s.caseSensitiveKeys, s.accessFlags);
        return s;
    }

    public ModuleSettings searchPath(List<String> roots) {
        this.searchPath = List.copyOf(Objects.requireNonNull(roots, "roots"));
        return this;
    }

    public ModuleSettings importMap(Map<String, String> entries) {
        this.importMap = Map.copyOf(Objects.requireNonNull(entries, "entries"));
        return this;
    }

    public ModuleSettings caseSensitiveKeys(boolean v) {
        this.caseSensitiveKeys = v;
        return this;
    }

    public ModuleSettings legacyPathlessFromModules(boolean v) {
        this.legacyPathlessFromModules = v;
        return this;
    }

    public ModuleSettings accessFlags(Set<DocumentAccessFlag> flags) {
        this.accessFlags = (flags == null || flags.isEmpty())
                ? EnumSet.noneOf(DocumentAccessFlag.class)
                : EnumSet.copyOf(flags);
        return this;
    }

    public ModuleSettings contextCallback(DocumentContextCallback callback) {
        this.contextCallback = callback;
        return this;
    }

    public ModuleSettings documentInfoProvider(DocumentInfoProvider provider) {
        this.documentInfoProvider = provider;
        return this;
    }

    public ModuleSettings globalRequireFlavor(ModuleFlavor flavor) {
        Objects.requireNonNull(flavor, "flavor");
        if (!flavor.policy().syncImport()) {
            throw new IllegalArgumentException("Global require needs a synchronous flavor, got " + flavor);
        }
        this.globalRequireFlavor = flavor;
        return this;
    }

    public List<String> searchPath() { return searchPath; }

    public Map<String, String> importMap() { return importMap; }

    public boolean caseSensitiveKeys() { return caseSensitiveKeys; }

    public boolean legacyPathlessFromModules() { return legacyPathlessFromModules; }

    public Set<DocumentAccessFlag> accessFlags() { return EnumSet.copyOf(accessFlags); }

    public boolean hasAccessFlag(DocumentAccessFlag flag) { return accessFlags.contains(flag); }

    public DocumentContextCallback contextCallback() { return contextCallback; }

    public ModuleFlavor globalRequireFlavor() { return globalRequireFlavor; }

    public DocumentInfo documentInfoFor(String key, ModuleFlavor flavor) {
        DocumentInfoProvider p = documentInfoProvider;
        DocumentInfo info = p != null ? p.create(key, flavor) : null;
        return info != null ? info : defaultDocumentInfo(key, flavor);
    }

    private DocumentInfo defaultDocumentInfo(String key, ModuleFlavor flavor) {
        DocumentCategory category = key.toLowerCase(Locale.ROOT).endsWith(".json")
                ? DocumentCategory.JSON
                : flavor.policy().category();
        Set<DocumentFlag> flags = category.isModule()
                ? EnumSet.of(DocumentFlag.IS_MODULE)
                : EnumSet.noneOf(DocumentFlag.class);
        URI uri = PathNorm.isAbsoluteUri(key) ? URI.create(key) : null;
        return new DocumentInfo(PathNorm.lastSegment(key), uri, null, category, flags, contextCallback);
    }
}
