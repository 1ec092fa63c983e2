// FILE: GraalModuleEngine.java
package org.foxesworld.scriptbridge.engine;

import org.foxesworld.scriptbridge.core.module.HostFunction;
import org.foxesworld.scriptbridge.core.module.ModuleEngine;
import org.foxesworld.scriptbridge.core.module.PropertyBag;
import org.foxesworld.scriptbridge.engine.cache.ScriptCaches;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * {@link ModuleEngine} over a GraalVM polyglot JavaScript {@link Context}.
 *
 * <p>Conversions: strings come back as {@link String}, {@code null}/{@code undefined} as
 * {@code null}, host objects unwrapped; everything else stays a {@link Value}. A host exception
 * thrown through script is rethrown as the original Java exception.</p>
 *
 * Author: Calista Verner
 */
public final class GraalModuleEngine implements ModuleEngine {

    private static final String PROMISE_FACTORY =
            "(function (register) { return new Promise(function (resolve, reject) { register(resolve, reject); }); })";

    private final Context ctx;
    private final ScriptCaches caches;

    private Value promiseFactory;
    private Value jsonParse;
    private Value objectCtor;
    private Value errorCtor;

    public GraalModuleEngine(Context ctx, ScriptCaches caches) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.caches = Objects.requireNonNull(caches, "caches");
    }

    public Context ctx() {
        return ctx;
    }

    @Override
    public Object evaluate(String sourceName, String code) {
        return guard(() -> fromGuest(ctx.eval(caches.source(sourceName, code))));
    }

    @Override
    public Object invoke(Object function, Object... args) {
        Value fn = toValue(function);
        return guard(() -> fromGuest(fn.execute(args)));
    }

    @Override
    public Object createObject() {
        if (objectCtor == null) objectCtor = ctx.getBindings("js").getMember("Object");
        return guard(() -> objectCtor.newInstance());
    }

    @Override
    public Object getProperty(Object target, String name) {
        Value v = toValue(target);
        return guard(() -> fromGuest(v.getMember(name)));
    }

    @Override
    public void setProperty(Object target, String name, Object value) {
        Value v = toValue(target);
        guard(() -> {
            v.putMember(name, value);
            return null;
        });
    }

    @Override
    public Object createFunction(HostFunction function) {
        Objects.requireNonNull(function, "function");
        ProxyExecutable exec = args -> {
            Object[] converted = new Object[args.length];
            for (int i = 0; i < args.length; i++) converted[i] = fromGuest(args[i]);
            return function.apply(converted);
        };
        return ctx.asValue(exec);
    }

    @Override
    public Object exposeBag(PropertyBag bag) {
        return ctx.asValue(new BagProxy(bag, this));
    }

    @Override
    public Object parseJson(String json) {
        if (jsonParse == null) jsonParse = ctx.eval("js", "JSON.parse");
        return guard(() -> fromGuest(jsonParse.execute(json)));
    }

    @Override
    public Object createPromise(CompletionStage<?> stage) {
        Objects.requireNonNull(stage, "stage");
        if (promiseFactory == null) promiseFactory = ctx.eval("js", PROMISE_FACTORY);

        ProxyExecutable register = args -> {
            Value resolve = args[0];
            Value reject = args[1];
            stage.whenComplete((value, err) -> {
                if (err == null) {
                    resolve.execute(value);
                } else {
                    reject.execute(toScriptError(err));
                }
            });
            return null;
        };
        return guard(() -> promiseFactory.execute(register));
    }

    // ---------------------------------------------------------------------
    // Conversions
    // ---------------------------------------------------------------------

    Object fromGuest(Value v) {
        if (v == null || v.isNull()) return null;
        if (v.isHostObject()) return v.asHostObject();
        if (v.isString()) return v.asString();
        return v;
    }

    private Value toValue(Object o) {
        return (o instanceof Value) ? (Value) o : ctx.asValue(o);
    }

    private Value toScriptError(Throwable err) {
        Throwable cause = err;
        while (cause instanceof CompletionException && cause.getCause() != null) cause = cause.getCause();

        if (errorCtor == null) errorCtor = ctx.getBindings("js").getMember("Error");
        Value error = errorCtor.newInstance(String.valueOf(cause.getMessage()));
        error.putMember("name", cause.getClass().getSimpleName());
        return error;
    }

    /**
     * Runs a polyglot call; host exceptions that crossed script come back unwrapped.
     */
    private static <T> T guard(Supplier<T> call) {
        try {
            return call.get();
        } catch (PolyglotException e) {
            if (e.isHostException()) {
                Throwable host = e.asHostException();
                if (host instanceof RuntimeException) throw (RuntimeException) host;
                if (host instanceof Error) throw (Error) host;
            }
            throw e;
        }
    }
}
