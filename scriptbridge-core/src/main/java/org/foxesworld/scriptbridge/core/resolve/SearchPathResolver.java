package org.foxesworld.scriptbridge.core.resolve;

import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bare specifiers, applied per flavor pathless policy:
 * <ul>
 *   <li>host base only: configured roots, otherwise an error;</li>
 *   <li>search roots: configured roots, otherwise the referrer directory;</li>
 *   <li>top level only: configured roots (or the root directory) for host-level requests;
 *   module-level requests fail unless {@code legacyPathlessFromModules} is set.</li>
 * </ul>
 */
public final class SearchPathResolver implements ResolverStrategy {

    private final List<String> roots;
    private final boolean legacyPathlessFromModules;

    public SearchPathResolver(List<String> roots, boolean legacyPathlessFromModules) {
        List<String> normalized = new ArrayList<>();
        for (String r : roots) normalized.add(PathNorm.normalizeKey(r));
        this.roots = List.copyOf(normalized);
        this.legacyPathlessFromModules = legacyPathlessFromModules;
    }

    @Override
    public Optional<List<String>> resolve(String referrerKey, String specifier, ModuleFlavor flavor) {
        switch (flavor.policy().pathless()) {
            case HOST_BASE_ONLY:
                if (roots.isEmpty()) {
                    throw new ModuleResolutionException(specifier,
                            "Bare specifier '" + specifier + "' has no import map entry and no search path is configured");
                }
                return Optional.of(underRoots(specifier));

            case SEARCH_ROOTS:
                if (roots.isEmpty()) {
                    return Optional.of(List.of(PathNorm.resolveAgainst(PathNorm.dirnameOf(referrerKey), specifier)));
                }
                return Optional.of(underRoots(specifier));

            case TOP_LEVEL_ONLY:
                if (referrerKey != null && !legacyPathlessFromModules) {
                    throw new ModuleResolutionException(specifier,
                            "Pathless specifier '" + specifier + "' is only allowed at top level (referrer '" + referrerKey + "')");
                }
                if (roots.isEmpty()) {
                    return Optional.of(List.of(PathNorm.resolveAgainst("", specifier)));
                }
                return Optional.of(underRoots(specifier));

            default:
                return Optional.empty();
        }
    }

    private List<String> underRoots(String specifier) {
        List<String> out = new ArrayList<>(roots.size());
        for (String root : roots) {
            out.add(PathNorm.resolveAgainst(root, specifier));
        }
        return out;
    }
}
