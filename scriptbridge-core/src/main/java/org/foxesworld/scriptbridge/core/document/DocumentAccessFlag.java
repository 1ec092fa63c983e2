package org.foxesworld.scriptbridge.core.document;

/**
 * Access switches for document loading and resolution.
 */
public enum DocumentAccessFlag {
    /** File system loaders refuse to read unless this is set. */
    ENABLE_FILE_LOADING,
    /** Web loaders refuse {@code http:} and {@code https:} requests unless this is set. */
    ENABLE_WEB_LOADING,
    /** Only {@code ./}, {@code ../} and {@code /} specifiers resolve against the referrer. */
    ENFORCE_RELATIVE_PREFIX,
    /** A key already loaded under another flavor is returned as-is instead of failing. */
    ALLOW_CATEGORY_MISMATCH
}
