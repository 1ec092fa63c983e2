package org.foxesworld.scriptbridge.core.error;

/**
 * Specifier could not be turned into a canonical key: malformed URI, pathless request the
 * flavor does not allow, no candidate found, or a key already loaded under another flavor.
 */
public final class ModuleResolutionException extends ModuleLoadException {

    private final String specifier;

    public ModuleResolutionException(String specifier, String moduleKey, String message) {
        super(Kind.RESOLUTION, moduleKey, message);
        this.specifier = specifier;
    }

    public ModuleResolutionException(String specifier, String message, Throwable cause) {
        super(Kind.RESOLUTION, null, message, cause);
        this.specifier = specifier;
    }

    public ModuleResolutionException(String specifier, String message) {
        this(specifier, null, message);
    }

    public String specifier() {
        return specifier;
    }
}
