package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.error.ModuleLoadException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Result of {@link ModuleLoader#loadModule}: either complete now or pending on an asynchronous
 * fetch. Exports are the {@link ModuleNamespace} for standard modules and the engine exports
 * value for the CommonJS family.
 */
public final class ModuleHandle {

    private final String key;
    private final CompletableFuture<Object> future;
    private final ModuleLoader loader;

    ModuleHandle(String key, CompletableFuture<Object> future, ModuleLoader loader) {
        this.key = Objects.requireNonNull(key, "key");
        this.future = Objects.requireNonNull(future, "future");
        this.loader = loader;
    }

    public String key() {
        return key;
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isFailed() {
        return future.isCompletedExceptionally();
    }

    /**
     * @throws IllegalStateException when still pending
     * @throws ModuleLoadException   the recorded failure
     */
    public Object exports() {
        if (!future.isDone()) throw new IllegalStateException("Module '" + key + "' is still loading");
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ModuleLoadException) throw (ModuleLoadException) e.getCause();
            throw e;
        }
    }

    /** Read-only view; completes on the engine thread. */
    public CompletableFuture<Object> future() {
        return future.copy();
    }

    /**
     * Cancels the load if the module is still being fetched.
     *
     * @return whether the record was cancelled
     */
    public boolean cancel() {
        return loader != null && loader.cancel(key);
    }

    @Override
    public String toString() {
        return "ModuleHandle{" + key + (future.isDone() ? ", done" : ", pending") + '}';
    }
}
