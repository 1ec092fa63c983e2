// FILE: ResolverStrategy.java
package org.foxesworld.scriptbridge.core.resolve;

// Author: Calista Verner

import org.foxesworld.scriptbridge.core.module.ModuleFlavor;

import java.util.List;
import java.util.Optional;

/**
 * One step of specifier resolution.
 *
 * Contract:
 *  - Implementations MUST be pure: no I/O, no caching, no side effects.
 *  - Return Optional.empty() if not applicable; the chain moves on.
 *  - Return base keys (before extension expansion) in preference order if applicable.
 *  - Throw {@link org.foxesworld.scriptbridge.core.error.ModuleResolutionException} when the
 *    specifier is recognised but not allowed; the chain stops.
 *
 * Notes:
 *  - referrerKey is {@code null} for host-level requests.
 */
@FunctionalInterface
public interface ResolverStrategy {

    Optional<List<String>> resolve(String referrerKey, String specifier, ModuleFlavor flavor);
}
