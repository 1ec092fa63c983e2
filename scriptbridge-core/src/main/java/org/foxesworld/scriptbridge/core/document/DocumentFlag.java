package org.foxesworld.scriptbridge.core.document;

/**
 * Optional document attributes. Kept in an {@link java.util.EnumSet} on {@link DocumentInfo}.
 */
public enum DocumentFlag {
    /** Document is loaded as a module rather than a plain script. */
    IS_MODULE,
    /** Document is not retained by engine-side caches once evaluated. */
    IS_TRANSIENT,
    /** Engine should pause before the first statement when a debugger is attached. */
    AWAIT_DEBUGGER_AND_PAUSE
}
