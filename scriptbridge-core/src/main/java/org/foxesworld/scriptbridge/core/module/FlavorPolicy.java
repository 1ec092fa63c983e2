package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.document.DocumentCategory;

import java.util.List;

/**
 * Behaviour knobs of a module flavor. Everything that differs between flavors lives here so
 * that the loader only branches on data.
 *
 * @param exportShape        what importers receive
 * @param syncImport         whether {@code require} may load the flavor synchronously
 * @param pathless           how bare specifiers are resolved
 * @param extensions         suffixes tried when the last key segment has no extension
 * @param contextSource      how module context properties are exposed
 * @param category           document category assigned to modules of this flavor
 */
public record FlavorPolicy(
        ExportShape exportShape,
        boolean syncImport,
        PathlessPolicy pathless,
        List<String> extensions,
        ContextSource contextSource,
        DocumentCategory category
) {

    public FlavorPolicy {
        extensions = List.copyOf(extensions);
    }

    public enum ExportShape {
        /** Read-only namespace of live bindings. */
        NAMESPACE,
        /** The {@code module.exports} value. */
        EXPORTS
    }

    public enum PathlessPolicy {
        /** Only the import map and the host-supplied search roots. */
        HOST_BASE_ONLY,
        /** Search roots, falling back to the referrer directory. */
        SEARCH_ROOTS,
        /** Search roots, and only for requests without a referring module. */
        TOP_LEVEL_ONLY
    }

    public enum ContextSource {
        /** A script object populated once from the context map. */
        ENGINE_OBJECT,
        /** A host-backed property bag. */
        HOST_BAG
    }
}
