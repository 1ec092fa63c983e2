package org.foxesworld.scriptbridge.core.module;

/**
 * Live export binding: every read observes the current value of the exporting module's local.
 */
@FunctionalInterface
public interface Binding {

    /**
     * Returned by a read whose local is still in its temporal dead zone. Passed to script so the
     * generated getters can hand it back.
     */
    Object UNINITIALIZED = new Object() {
        @Override
        public String toString() {
            return "<uninitialized>";
        }
    };

    Object read();
}
