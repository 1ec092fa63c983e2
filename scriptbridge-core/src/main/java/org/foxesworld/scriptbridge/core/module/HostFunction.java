package org.foxesworld.scriptbridge.core.module;

/**
 * Host callback exposed to script as a function. Arguments arrive converted by the engine:
 * strings as {@link String}, host objects unwrapped, everything else as engine values.
 */
@FunctionalInterface
public interface HostFunction {
    Object apply(Object[] args);
}
