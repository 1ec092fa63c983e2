package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.document.DocumentCategory;

import java.util.List;

/**
 * Module conventions understood by the loader, each carrying its {@link FlavorPolicy}.
 */
public enum ModuleFlavor {

    STANDARD(new FlavorPolicy(
            FlavorPolicy.ExportShape.NAMESPACE,
            false,
            FlavorPolicy.PathlessPolicy.HOST_BASE_ONLY,
            List.of(".js"),
            FlavorPolicy.ContextSource.ENGINE_OBJECT,
            DocumentCategory.STANDARD_MODULE)),

    COMMONJS(new FlavorPolicy(
            FlavorPolicy.ExportShape.EXPORTS,
            true,
            FlavorPolicy.PathlessPolicy.SEARCH_ROOTS,
            List.of(".js", ".json", "/index.js"),
            FlavorPolicy.ContextSource.ENGINE_OBJECT,
            DocumentCategory.COMMONJS_MODULE)),

    LEGACY_COMMONJS(new FlavorPolicy(
            FlavorPolicy.ExportShape.EXPORTS,
            true,
            FlavorPolicy.PathlessPolicy.TOP_LEVEL_ONLY,
            List.of(".js"),
            FlavorPolicy.ContextSource.HOST_BAG,
            DocumentCategory.COMMONJS_MODULE));

    private final FlavorPolicy policy;

    ModuleFlavor(FlavorPolicy policy) {
        this.policy = policy;
    }

    public FlavorPolicy policy() {
        return policy;
    }
}
