// FILE: GraalScriptRuntime.java
package org.foxesworld.scriptbridge.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.ScriptJobQueue;
import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.document.DocumentLoader;
import org.foxesworld.scriptbridge.core.module.ModuleFlavor;
import org.foxesworld.scriptbridge.core.module.ModuleHandle;
import org.foxesworld.scriptbridge.core.module.ModuleLoader;
import org.foxesworld.scriptbridge.core.module.PropertyBag;
import org.foxesworld.scriptbridge.engine.cache.ScriptCaches;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;

/**
 * GraalScriptRuntime owns a GraalVM {@link Context} and a {@link ModuleLoader} over it. It
 * installs the global {@code require}, evaluates host code and pumps the job queue through
 * which asynchronous module loads complete.
 *
 * <p>Thread confined: first thread that touches this runtime becomes the owner.
 * All subsequent interactions must occur on the same thread.</p>
 *
 * <p>Security: host class lookup is disabled; host access is restricted to
 * members annotated with {@link HostAccess.Export}.</p>
 *
 * Author: Calista Verner
 */
public final class GraalScriptRuntime implements Closeable {

    private static final Logger log = LogManager.getLogger(GraalScriptRuntime.class);

    private static final String HOST_SOURCE_NAME = "host-eval.js";

    private final Context ctx;
    private final ScriptCaches caches;
    private final ScriptJobQueue jobs = new ScriptJobQueue();
    private final GraalModuleEngine engine;
    private final ModuleLoader loader;

    private volatile Thread ownerThread;
    private boolean closed;

    public GraalScriptRuntime(DocumentLoader documents) {
        this(documents, ModuleSettings.fromSystemProperties(), ScriptCaches.defaults());
    }

    public GraalScriptRuntime(DocumentLoader documents, ModuleSettings settings) {
        this(documents, settings, ScriptCaches.defaults());
    }

    public GraalScriptRuntime(DocumentLoader documents, ModuleSettings settings, ScriptCaches caches) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(settings, "settings");
        this.caches = Objects.requireNonNull(caches, "caches");
        assertOwnerThread();

        this.ctx = Context.newBuilder("js")
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .allowHostAccess(HostAccess.newBuilder(HostAccess.NONE)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .build())
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();

        this.engine = new GraalModuleEngine(ctx, caches);
        this.loader = new ModuleLoader(engine, documents, settings, jobs);

        // global require(): host-level request, no referrer
        ModuleFlavor globalFlavor = settings.globalRequireFlavor();
        ProxyExecutable req = args -> {
            String request = args.length > 0 && args[0].isString() ? args[0].asString() : "";
            return loader.require(null, request, globalFlavor);
        };
        ctx.getBindings("js").putMember("require", req);

        log.debug("[modules] runtime: created (global require={})", globalFlavor);
    }

    public ScriptJobQueue jobs() {
        return jobs;
    }

    public ModuleLoader loader() {
        return loader;
    }

    public Context ctx() {
        return ctx;
    }

    // ---------------------------------------------------------------------
    // Thread ownership
    // ---------------------------------------------------------------------

    private void assertOwnerThread() {
        Thread t = Thread.currentThread();
        Thread owner = ownerThread;
        if (owner == null) {
            ownerThread = t;
            return;
        }
        if (owner != t) {
            throw new IllegalStateException("GraalScriptRuntime is thread confined. Owner=" + owner.getName()
                    + ", current=" + t.getName());
        }
    }

    private void assertOpen() {
        if (closed) throw new IllegalStateException("GraalScriptRuntime is closed");
    }

    // ---------------------------------------------------------------------
    // Modules
    // ---------------------------------------------------------------------

    /** Host-level {@code require} with the configured global flavor. */
    public Value require(String specifier) {
        return require(specifier, loader.settings().globalRequireFlavor());
    }

    public Value require(String specifier, ModuleFlavor flavor) {
        assertOwnerThread();
        assertOpen();
        return ctx.asValue(loader.require(null, specifier, flavor));
    }

    /** Host-level standard module import; completes through {@link #await} or {@link #jobs()}. */
    public ModuleHandle importModule(String specifier) {
        return loadModule(specifier, ModuleFlavor.STANDARD);
    }

    public ModuleHandle loadModule(String specifier, ModuleFlavor flavor) {
        assertOwnerThread();
        assertOpen();
        return loader.loadModule(null, specifier, flavor);
    }

    /**
     * Pumps the job queue until {@code handle} completes.
     *
     * @return the module exports, see {@link ModuleHandle#exports()}
     * @throws TimeoutException when the handle is still pending after {@code timeout}
     */
    public Object await(ModuleHandle handle, Duration timeout) throws TimeoutException {
        assertOwnerThread();
        Objects.requireNonNull(handle, "handle");
        long deadline = System.nanoTime() + timeout.toNanos();

        while (!handle.isDone()) {
            int n = jobs.drainBudgeted(256, Math.max(1L, deadline - System.nanoTime()));
            if (handle.isDone()) break;
            if (System.nanoTime() >= deadline) {
                throw new TimeoutException("Module '" + handle.key() + "' did not load within " + timeout);
            }
            if (n == 0) LockSupport.parkNanos(1_000_000L);
        }
        return handle.exports();
    }

    // ---------------------------------------------------------------------
    // Host code
    // ---------------------------------------------------------------------

    public Value eval(String code) {
        assertOwnerThread();
        assertOpen();
        return ctx.eval(caches.source(HOST_SOURCE_NAME, code));
    }

    /**
     * Evaluates an expression with {@code bindings} visible as local names. Module namespaces
     * may be passed directly.
     */
    public Value eval(String expression, Map<String, ?> bindings) {
        assertOwnerThread();
        assertOpen();

        List<String> names = new ArrayList<>(bindings.keySet());
        Object[] values = new Object[names.size()];
        for (int i = 0; i < names.size(); i++) {
            Object v = bindings.get(names.get(i));
            values[i] = (v instanceof PropertyBag) ? engine.exposeBag((PropertyBag) v) : v;
        }

        String fnCode = "(function (" + String.join(", ", names) + ") {\nreturn (" + expression + "\n);\n})";
        Value fn = ctx.eval(caches.source(HOST_SOURCE_NAME, fnCode));
        return fn.execute(values);
    }

    // ---------------------------------------------------------------------
    // Reset / Close
    // ---------------------------------------------------------------------

    /** Drops every module record and queued job. The context and its globals stay. */
    public void reset() {
        assertOwnerThread();
        loader.reset();
        jobs.clear();
    }

    @Override
    public void close() {
        if (closed) return;
        log.info("Closing GraalScriptRuntime");
        try {
            reset();
        } catch (RuntimeException e) {
            log.warn("Error during GraalScriptRuntime reset", e);
        }
        closed = true;
        try {
            ctx.close(true);
        } catch (RuntimeException e) {
            log.warn("Error closing Graal context", e);
        }
    }
}
