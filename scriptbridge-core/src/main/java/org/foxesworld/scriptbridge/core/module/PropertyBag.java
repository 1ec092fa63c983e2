package org.foxesworld.scriptbridge.core.module;

import java.util.Set;

/**
 * Host-side object exposed to script with dynamic members.
 */
public interface PropertyBag {

    /** Member value, or {@code null} when absent. */
    Object get(String name);

    boolean has(String name);

    /**
     * @throws UnsupportedOperationException when the bag is read-only
     */
    void put(String name, Object value);

    Set<String> keys();
}
