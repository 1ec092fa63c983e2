// FILE: ModuleResolver.java
package org.foxesworld.scriptbridge.core.resolve;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.document.DocumentAccessFlag;
import org.foxesworld.scriptbridge.core.document.DocumentLoader;
import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns {@code (referrer, specifier, flavor)} into a canonical key.
 *
 * <p>Pure apart from the {@link DocumentLoader#exists} check, which is consulted only when the
 * chain and extension expansion produce more than one candidate.</p>
 *
 * Author: Calista Verner
 */
public final class ModuleResolver {

    private static final Logger log = LogManager.getLogger(ModuleResolver.class);

    private final ResolverChain chain;
    private final DocumentLoader documents;
    private final boolean caseSensitiveKeys;

    public ModuleResolver(ResolverChain chain, DocumentLoader documents, boolean caseSensitiveKeys) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.caseSensitiveKeys = caseSensitiveKeys;
    }

    /**
     * Default chain: absolute URIs, import map, relative paths, search roots.
     */
    public static ModuleResolver fromSettings(ModuleSettings settings, DocumentLoader documents) {
        ResolverChain chain = new ResolverChain()
                .add(new AbsoluteUriResolver())
                .add(new ImportMapResolver(settings.importMap()))
                .add(new RelativeResolver(settings.hasAccessFlag(DocumentAccessFlag.ENFORCE_RELATIVE_PREFIX)))
                .add(new SearchPathResolver(settings.searchPath(), settings.legacyPathlessFromModules()));
        return new ModuleResolver(chain, documents, settings.caseSensitiveKeys());
    }

    public String resolve(String referrerKey, String specifier, ModuleFlavor flavor) {
        Objects.requireNonNull(flavor, "flavor");
        if (specifier == null || specifier.isBlank()) {
            throw new ModuleResolutionException(specifier, "Blank module specifier");
        }
        String req = specifier.trim();

        List<String> bases = chain.resolveOrThrow(referrerKey, req, flavor);

        Set<String> candidates = new LinkedHashSet<>();
        for (String base : bases) {
            for (String c : PathNorm.expandCandidates(PathNorm.normalizeKey(base), flavor.policy().extensions())) {
                candidates.add(canonical(c));
            }
        }
        if (candidates.isEmpty()) {
            throw new ModuleResolutionException(req, "Specifier '" + req + "' resolved to an empty key");
        }

        if (candidates.size() == 1) {
            String key = candidates.iterator().next();
            log.debug("[modules] resolve '{}' from '{}' -> {}", req, referrerKey, key);
            return key;
        }

        for (String c : candidates) {
            if (documents.exists(c)) {
                log.debug("[modules] resolve '{}' from '{}' -> {} (of {})", req, referrerKey, c, candidates.size());
                return c;
            }
        }

        List<String> tried = new ArrayList<>(candidates);
        throw new ModuleResolutionException(req,
                "Module '" + req + "' not found from '" + (referrerKey == null ? "<host>" : referrerKey) + "'; tried " + tried);
    }

    /** Applies key normalization only (used for host-supplied keys). */
    public String canonical(String key) {
        String k = PathNorm.normalizeKey(key);
        return caseSensitiveKeys ? k : k.toLowerCase(Locale.ROOT);
    }
}
