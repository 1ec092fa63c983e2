package org.foxesworld.scriptbridge.core.module;

public enum ModuleState {
    /** Identity assigned; source being fetched or fetched; body not started. */
    PENDING,
    /** Body executing. A request that finds this state is a cycle. */
    LOADING,
    READY,
    FAILED
}
