package org.foxesworld.scriptbridge.core.error;

/** The document loader failed to produce source for a resolved key. */
public final class ModuleFetchException extends ModuleLoadException {

    public ModuleFetchException(String moduleKey, String message, Throwable cause) {
        super(Kind.FETCH, moduleKey, message, cause);
    }

    public ModuleFetchException(String moduleKey, String message) {
        super(Kind.FETCH, moduleKey, message);
    }
}
