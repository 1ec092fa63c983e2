package org.foxesworld.scriptbridge.core.module;

import java.util.List;

/**
 * Standard module source turned into a wrapper function expression.
 *
 * @param code                function expression taking the linker callbacks
 * @param requestedSpecifiers static import and re-export specifiers in source order
 */
public record RewrittenModule(String code, List<String> requestedSpecifiers) {

    public RewrittenModule {
        requestedSpecifiers = List.copyOf(requestedSpecifiers);
    }
}
