package org.foxesworld.scriptbridge.core.resolve;

import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;

/** {@code scheme:...} specifiers are used as keys after URI normalization. */
public final class AbsoluteUriResolver implements ResolverStrategy {

    @Override
    public Optional<List<String>> resolve(String referrerKey, String specifier, ModuleFlavor flavor) {
        if (!PathNorm.isAbsoluteUri(specifier)) return Optional.empty();
        try {
            URI uri = new URI(specifier).normalize();
            return Optional.of(List.of(uri.toString()));
        } catch (URISyntaxException e) {
            throw new ModuleResolutionException(specifier, "Malformed module URI '" + specifier + "'", e);
        }
    }
}
