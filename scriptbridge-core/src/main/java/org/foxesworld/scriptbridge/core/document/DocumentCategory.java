package org.foxesworld.scriptbridge.core.document;

// Author: Calista Verner

/**
 * Kind of content a document holds. Module categories also decide the default
 * display name used when a document has none.
 */
public enum DocumentCategory {

    SCRIPT("Script", "Script"),
    JSON("JSON Document", "JSON"),
    STANDARD_MODULE("ECMAScript Module", "Module"),
    COMMONJS_MODULE("CommonJS Module", "Module");

    private final String displayName;
    private final String defaultName;

    DocumentCategory(String displayName, String defaultName) {
        this.displayName = displayName;
        this.defaultName = defaultName;
    }

    public String defaultName() {
        return defaultName;
    }

    public boolean isModule() {
        return this == STANDARD_MODULE || this == COMMONJS_MODULE;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
