package org.foxesworld.scriptbridge.core.resolve;

// Author: Calista Verner

import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Path-like specifiers resolve against the referrer's directory; {@code /x} resolves against the
 * root. With {@code enforceRelativePrefix} off, any specifier containing {@code /} is path-like.
 */
public final class RelativeResolver implements ResolverStrategy {

    private final boolean enforceRelativePrefix;

    public RelativeResolver(boolean enforceRelativePrefix) {
        this.enforceRelativePrefix = enforceRelativePrefix;
    }

    public static boolean hasRelativePrefix(String specifier) {
        return specifier.startsWith("./") || specifier.startsWith("../") || specifier.startsWith("/");
    }

    @Override
    public Optional<List<String>> resolve(String referrerKey, String specifier, ModuleFlavor flavor) {
        String req = specifier.replace('\\', '/');
        boolean pathLike = hasRelativePrefix(req) || (!enforceRelativePrefix && req.indexOf('/') >= 0);
        if (!pathLike) return Optional.empty();

        if (referrerKey != null && PathNorm.isAbsoluteUri(referrerKey)) {
            try {
                return Optional.of(List.of(URI.create(referrerKey).resolve(req).normalize().toString()));
            } catch (IllegalArgumentException e) {
                throw new ModuleResolutionException(specifier,
                        "Cannot resolve '" + specifier + "' against '" + referrerKey + "'", e);
            }
        }

        String out = PathNorm.resolveAgainst(PathNorm.dirnameOf(referrerKey), req);
        return out.isEmpty() ? Optional.empty() : Optional.of(List.of(out));
    }
}
