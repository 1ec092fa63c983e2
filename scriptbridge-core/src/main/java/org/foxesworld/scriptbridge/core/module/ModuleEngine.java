package org.foxesworld.scriptbridge.core.module;

import java.util.concurrent.CompletionStage;

/**
 * The script engine as seen by the module loader. Values are opaque {@link Object}s owned by
 * the engine; strings and host objects round-trip as themselves.
 *
 * <p>Every method must be called on the engine's owner thread. Exceptions thrown by script
 * surface as {@link RuntimeException}s; a host exception thrown through script is rethrown
 * as the original instance.</p>
 */
public interface ModuleEngine {

    /** Evaluates a script and returns its completion value. */
    Object evaluate(String sourceName, String code);

    Object invoke(Object function, Object... args);

    Object createObject();

    Object getProperty(Object target, String name);

    void setProperty(Object target, String name, Object value);

    Object createFunction(HostFunction function);

    /** Script object whose members are served by {@code bag}. */
    Object exposeBag(PropertyBag bag);

    Object parseJson(String json);

    /**
     * Promise settled by {@code stage}. The stage is expected to complete on the owner thread.
     */
    Object createPromise(CompletionStage<?> stage);
}
