package org.foxesworld.scriptbridge.core.error;

public final class ModuleCancelledException extends ModuleLoadException {

    public ModuleCancelledException(String moduleKey) {
        super(Kind.CANCELLED, moduleKey, "Loading of module '" + moduleKey + "' was cancelled");
    }
}
