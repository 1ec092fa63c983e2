// FILE: ModuleLoadException.java
package org.foxesworld.scriptbridge.core.error;

// Author: Calista Verner

/**
 * Base of every failure raised while resolving, fetching or executing a module.
 *
 * <p>A failure is recorded on the module record and the same instance is rethrown to every
 * later caller that asks for the same key.</p>
 */
public class ModuleLoadException extends RuntimeException {

    public enum Kind {
        RESOLUTION,
        FETCH,
        EXECUTION,
        CYCLE_INTEGRITY,
        CANCELLED
    }

    private final String moduleKey;
    private final Kind kind;

    public ModuleLoadException(Kind kind, String moduleKey, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.moduleKey = moduleKey;
    }

    public ModuleLoadException(Kind kind, String moduleKey, String message) {
        this(kind, moduleKey, message, null);
    }

    /** Canonical key of the failing module; may be {@code null} when resolution itself failed. */
    public String moduleKey() {
        return moduleKey;
    }

    public Kind kind() {
        return kind;
    }
}
