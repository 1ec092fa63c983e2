package org.foxesworld.scriptbridge.core.resolve;

// Author: Calista Verner

import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class ResolverChain {

    private final List<ResolverStrategy> chain = new ArrayList<>();

    public ResolverChain add(ResolverStrategy r) {
        chain.add(Objects.requireNonNull(r));
        return this;
    }

    /**
     * Returns base keys from the first applicable strategy, without extension expansion.
     */
    public List<String> resolveOrThrow(String referrerKey, String specifier, ModuleFlavor flavor) {
        for (ResolverStrategy r : chain) {
            Optional<List<String>> out = r.resolve(referrerKey, specifier, flavor);
            if (out.isPresent() && !out.get().isEmpty()) {
                return out.get();
            }
        }
        throw new ModuleResolutionException(specifier,
                "Unresolved specifier '" + specifier + "' from '" + (referrerKey == null ? "<host>" : referrerKey) + "'");
    }
}
