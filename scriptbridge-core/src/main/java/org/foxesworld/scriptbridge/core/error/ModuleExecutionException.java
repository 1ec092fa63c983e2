package org.foxesworld.scriptbridge.core.error;

/** Module body threw while executing; the engine exception is the cause. */
public final class ModuleExecutionException extends ModuleLoadException {

    public ModuleExecutionException(String moduleKey, String message, Throwable cause) {
        super(Kind.EXECUTION, moduleKey, message, cause);
    }
}
