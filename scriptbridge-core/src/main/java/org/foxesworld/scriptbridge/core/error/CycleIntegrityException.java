package org.foxesworld.scriptbridge.core.error;

/**
 * A live binding of a module that is still executing was read before its declaration ran.
 */
public final class CycleIntegrityException extends ModuleLoadException {

    private final String bindingName;

    public CycleIntegrityException(String moduleKey, String bindingName) {
        super(Kind.CYCLE_INTEGRITY, moduleKey,
                "Binding '" + bindingName + "' of module '" + moduleKey + "' is not initialized yet (cyclic import)");
        this.bindingName = bindingName;
    }

    public String bindingName() {
        return bindingName;
    }
}
