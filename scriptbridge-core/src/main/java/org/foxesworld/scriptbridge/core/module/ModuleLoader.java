// FILE: ModuleLoader.java
package org.foxesworld.scriptbridge.core.module;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.config.ModuleSettings;
import org.foxesworld.scriptbridge.core.document.DocumentAccessFlag;
import org.foxesworld.scriptbridge.core.document.DocumentInfo;
import org.foxesworld.scriptbridge.core.document.DocumentLoader;
import org.foxesworld.scriptbridge.core.document.UniqueDocumentInfo;
import org.foxesworld.scriptbridge.core.document.UniqueNameManager;
import org.foxesworld.scriptbridge.core.error.ModuleCancelledException;
import org.foxesworld.scriptbridge.core.error.ModuleExecutionException;
import org.foxesworld.scriptbridge.core.error.ModuleFetchException;
import org.foxesworld.scriptbridge.core.error.ModuleLoadException;
import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.resolve.ModuleResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point of module loading: resolves specifiers, keeps one record per canonical key and
 * drives records through fetch and execution.
 *
 * <p>Thread confined to the engine thread. Asynchronous fetch completions are re-entered through
 * {@code engineThread}, normally the engine's {@code ScriptJobQueue::post}.</p>
 *
 * <p>Cycles: a request for a key whose record is {@code LOADING} returns the current, possibly
 * partial, exports. Failures are terminal and the recorded exception is rethrown to every
 * later caller; the document loader is never asked twice for the same key.</p>
 *
 * Author: Calista Verner
 */
public final class ModuleLoader {

    private static final Logger log = LogManager.getLogger(ModuleLoader.class);

    private final ModuleEngine engine;
    private final DocumentLoader documents;
    private final ModuleSettings settings;
    private final Executor engineThread;

    private final ModuleResolver resolver;
    private final ModuleCache cache = new ModuleCache();
    private final UniqueNameManager names = new UniqueNameManager();
    private final ContextBuilder contexts;
    private final ModuleExecutor executor;

    public ModuleLoader(ModuleEngine engine, DocumentLoader documents, ModuleSettings settings, Executor engineThread) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.engineThread = Objects.requireNonNull(engineThread, "engineThread");
        this.resolver = ModuleResolver.fromSettings(settings, documents);
        this.contexts = new ContextBuilder(settings);
        this.executor = new ModuleExecutor(engine, this, contexts, new ModuleSyntaxRewriter());
    }

    public ModuleSettings settings() {
        return settings;
    }

    public ModuleResolver resolver() {
        return resolver;
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * Loads a module. The CommonJS family always completes synchronously (or throws); standard
     * modules complete immediately only when already {@code READY} or in a cycle.
     *
     * @param referrerKey key of the requesting module, {@code null} for host-level requests
     * @throws ModuleLoadException for synchronous failures
     */
    public ModuleHandle loadModule(String referrerKey, String specifier, ModuleFlavor flavor) {
        Objects.requireNonNull(flavor, "flavor");
        String key = resolver.resolve(referrerKey, specifier, flavor);
        if (flavor.policy().syncImport()) {
            return new ModuleHandle(key, CompletableFuture.completedFuture(requireResolved(key, specifier, flavor)), this);
        }

        ModuleRecord rec = cache.get(key);
        if (rec != null) {
            checkFlavor(rec, flavor, specifier);
            switch (rec.state) {
                case READY:
                case LOADING:
                    return new ModuleHandle(key, CompletableFuture.completedFuture(rec.exportValue()), this);
                case FAILED:
                    return new ModuleHandle(key, CompletableFuture.failedFuture(rec.error), this);
                default:
                    break;
            }
        } else {
            rec = createRecord(key, flavor);
        }

        CompletableFuture<Object> waiter = new CompletableFuture<>();
        rec.waiters.add(waiter);
        if (!rec.graphLoading) {
            startGraph(rec);
        }
        return new ModuleHandle(key, waiter, this);
    }

    /**
     * Synchronous load for the CommonJS family.
     *
     * @return the exports value (engine object); for a standard module already loaded, its
     *         namespace object
     * @throws ModuleLoadException on any failure
     */
    public Object require(String referrerKey, String specifier, ModuleFlavor flavor) {
        Objects.requireNonNull(flavor, "flavor");
        return requireResolved(resolver.resolve(referrerKey, specifier, flavor), specifier, flavor);
    }

    private Object requireResolved(String key, String specifier, ModuleFlavor flavor) {
        ModuleRecord rec = cache.get(key);
        if (rec == null) {
            if (!flavor.policy().syncImport()) {
                throw new ModuleResolutionException(specifier, key,
                        "Module '" + key + "' (" + flavor + ") cannot be loaded synchronously; use import()");
            }
            rec = createRecord(key, flavor);
        } else {
            checkFlavor(rec, flavor, specifier);
        }

        return namespaceObjectOf(ensureExecuted(rec));
    }

    /**
     * Cancels a record that is still being fetched: the record fails with
     * {@link ModuleCancelledException} and every waiter is failed.
     *
     * @return {@code false} when the record is unknown or no longer {@code PENDING}
     */
    public boolean cancel(String key) {
        ModuleRecord rec = cache.get(resolver.canonical(key));
        if (rec == null || rec.state != ModuleState.PENDING) return false;

        fail(rec, new ModuleCancelledException(rec.key()));
        if (rec.rawFetch != null) rec.rawFetch.cancel(true);
        return true;
    }

    /** Drops every record. Pending loads are cancelled. Name disambiguation counters survive. */
    public void reset() {
        int cancelled = 0;
        for (ModuleRecord rec : cache.snapshot()) {
            if (rec.state == ModuleState.PENDING && cancel(rec.key())) cancelled++;
        }
        int count = cache.size();
        cache.clear();
        log.info("[modules] reset: dropped {} module(s), cancelled {}", count, cancelled);
    }

    public int moduleCount() {
        return cache.size();
    }

    /** State of a key, or {@code null} when it was never requested. */
    public ModuleState state(String key) {
        ModuleRecord rec = cache.get(resolver.canonical(key));
        return rec == null ? null : rec.state;
    }

    /** Identity of a loaded key, or {@code null}. */
    public UniqueDocumentInfo documentOf(String key) {
        ModuleRecord rec = cache.get(resolver.canonical(key));
        return rec == null ? null : rec.document();
    }

    // ---------------------------------------------------------------------
    // Linker callbacks (engine thread, from executing modules)
    // ---------------------------------------------------------------------

    /** Static import from a standard module: dependencies are fetched by the graph walk. */
    ModuleRecord importSync(String referrerKey, String specifier) {
        String key = resolver.resolve(referrerKey, specifier, ModuleFlavor.STANDARD);
        ModuleRecord rec = cache.get(key);
        if (rec == null) {
            rec = createRecord(key, ModuleFlavor.STANDARD);
        } else {
            checkFlavor(rec, ModuleFlavor.STANDARD, specifier);
        }
        return ensureExecuted(rec);
    }

    ModuleRecord recordOf(String key) {
        return cache.get(key);
    }

    /** Script value importers receive; namespace objects are created once per record. */
    Object namespaceObjectOf(ModuleRecord rec) {
        if (rec.namespace == null) return rec.exports;
        if (rec.namespaceObject == null) {
            rec.namespaceObject = engine.exposeBag(rec.namespace);
        }
        return rec.namespaceObject;
    }

    // ---------------------------------------------------------------------
    // Record lifecycle
    // ---------------------------------------------------------------------

    private ModuleRecord createRecord(String key, ModuleFlavor flavor) {
        DocumentInfo info = settings.documentInfoFor(key, flavor);
        UniqueDocumentInfo doc = UniqueDocumentInfo.assign(info, names);
        ModuleRecord rec = new ModuleRecord(key, flavor, doc);
        if (rec.namespace == null) {
            rec.exports = engine.createObject();
        }
        cache.put(rec);
        log.debug("[modules] record: {} as {} ({}) id={}", key, flavor, doc.uniqueName(), doc.uniqueId());
        return rec;
    }

    /**
     * Brings a record to {@code READY} synchronously, or returns it as is when it is
     * {@code LOADING} (cycle) or already {@code READY}.
     */
    private ModuleRecord ensureExecuted(ModuleRecord rec) {
        switch (rec.state) {
            case READY:
            case LOADING:
                return rec;
            case FAILED:
                throw rec.error;
            default:
                break;
        }

        if (rec.fetch != null && !rec.fetch.isDone()) {
            // not recorded: the asynchronous fetch still owns the record
            throw new ModuleFetchException(rec.key(),
                    "Module '" + rec.key() + "' is being fetched asynchronously and cannot be required synchronously");
        }
        if (rec.source == null) {
            fetchSync(rec);
        }
        execute(rec);
        return rec;
    }

    private void fetchSync(ModuleRecord rec) {
        String src;
        try {
            src = documents.load(rec.key(), rec.document());
        } catch (IOException | RuntimeException e) {
            ModuleFetchException x = new ModuleFetchException(rec.key(), "Failed to load module '" + rec.key() + "'", e);
            fail(rec, x);
            throw x;
        }
        if (src == null) {
            ModuleFetchException x = new ModuleFetchException(rec.key(), "Document loader returned no source for '" + rec.key() + "'");
            fail(rec, x);
            throw x;
        }
        rec.source = src;
        rec.fetch = CompletableFuture.completedFuture(src);
        log.debug("[modules] fetch: {} ({} chars)", rec.key(), src.length());
    }

    private void execute(ModuleRecord rec) {
        rec.state = ModuleState.LOADING;
        long t0 = System.nanoTime();
        try {
            executor.execute(rec);
        } catch (ModuleLoadException e) {
            fail(rec, e);
            throw e;
        } catch (RuntimeException e) {
            ModuleExecutionException x = new ModuleExecutionException(rec.key(),
                    "Failed to evaluate module '" + rec.key() + "': " + e.getMessage(), e);
            fail(rec, x);
            throw x;
        }
        rec.state = ModuleState.READY;
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        log.debug("[modules] ready: {} ({} ms)", rec.key(), ms);

        Object value = rec.exportValue();
        for (CompletableFuture<Object> w : drainWaiters(rec)) {
            w.complete(value);
        }
    }

    private void fail(ModuleRecord rec, ModuleLoadException e) {
        if (rec.state == ModuleState.FAILED) return;
        rec.state = ModuleState.FAILED;
        rec.error = e;
        if (e instanceof ModuleCancelledException) {
            log.debug("[modules] cancelled: {}", rec.key());
        } else {
            log.error("[modules] failed: {} ({})", rec.key(), e.kind(), e);
        }
        for (CompletableFuture<Object> w : drainWaiters(rec)) {
            w.completeExceptionally(e);
        }
    }

    private static List<CompletableFuture<Object>> drainWaiters(ModuleRecord rec) {
        List<CompletableFuture<Object>> out = new ArrayList<>(rec.waiters);
        rec.waiters.clear();
        return out;
    }

    private void checkFlavor(ModuleRecord rec, ModuleFlavor requested, String specifier) {
        if (rec.flavor() == requested) return;
        if (settings.hasAccessFlag(DocumentAccessFlag.ALLOW_CATEGORY_MISMATCH)) return;
        throw new ModuleResolutionException(specifier, rec.key(),
                "Module '" + rec.key() + "' is already loaded as " + rec.flavor() + ", requested as " + requested);
    }

    // ---------------------------------------------------------------------
    // Asynchronous graph loading (standard modules)
    // ---------------------------------------------------------------------

    private void startGraph(ModuleRecord root) {
        root.graphLoading = true;
        log.debug("[modules] graph: start {}", root.key());

        fetchGraph(root, new HashSet<>()).whenCompleteAsync((ignored, err) -> {
            root.graphLoading = false;
            if (err != null) {
                ModuleLoadException x = asLoadException(root.key(), err);
                if (root.state == ModuleState.PENDING) fail(root, x);
                return;
            }
            if (root.state == ModuleState.PENDING) {
                try {
                    ensureExecuted(root);
                } catch (ModuleLoadException e) {
                    // recorded on the record and delivered to its waiters
                    log.debug("[modules] graph: {} failed during evaluation", root.key());
                }
            } else if (root.state == ModuleState.READY && !root.waiters.isEmpty()) {
                Object value = root.exportValue();
                for (CompletableFuture<Object> w : drainWaiters(root)) w.complete(value);
            }
        }, engineThread);
    }

    /**
     * Fetches {@code rec} and every reachable static dependency. Completes on the engine thread.
     */
    private CompletableFuture<Void> fetchGraph(ModuleRecord rec, Set<String> visited) {
        if (!visited.add(rec.key())) return CompletableFuture.completedFuture(null);

        return fetchAsync(rec).thenComposeAsync(src -> {
            if (rec.state == ModuleState.FAILED) return CompletableFuture.failedFuture(rec.error);
            if (rec.state != ModuleState.PENDING || rec.namespace == null) {
                return CompletableFuture.completedFuture(null);
            }

            List<CompletableFuture<Void>> deps = new ArrayList<>();
            for (String spec : executor.rewrittenOf(rec).requestedSpecifiers()) {
                ModuleRecord dep;
                try {
                    String key = resolver.resolve(rec.key(), spec, ModuleFlavor.STANDARD);
                    dep = cache.get(key);
                    if (dep == null) {
                        dep = createRecord(key, ModuleFlavor.STANDARD);
                    } else {
                        checkFlavor(dep, ModuleFlavor.STANDARD, spec);
                    }
                } catch (ModuleLoadException e) {
                    return CompletableFuture.failedFuture(e);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(
                            new ModuleExecutionException(rec.key(), "Cannot link module '" + rec.key() + "'", e));
                }
                if (dep.state == ModuleState.FAILED) return CompletableFuture.failedFuture(dep.error);
                if (dep.state == ModuleState.PENDING) deps.add(fetchGraph(dep, visited));
            }
            return CompletableFuture.allOf(deps.toArray(new CompletableFuture[0]));
        }, engineThread);
    }

    /** Single-flight: the document loader is asked once per record. */
    private CompletableFuture<String> fetchAsync(ModuleRecord rec) {
        if (rec.fetch != null) return rec.fetch;

        CompletableFuture<String> raw;
        try {
            raw = documents.loadAsync(rec.key(), rec.document()).toCompletableFuture();
        } catch (RuntimeException e) {
            raw = CompletableFuture.failedFuture(e);
        }
        rec.rawFetch = raw;
        log.debug("[modules] fetch: async {}", rec.key());

        rec.fetch = raw.handleAsync((src, err) -> {
            if (rec.state == ModuleState.FAILED) throw rec.error;
            if (err != null || src == null) {
                Throwable cause = unwrap(err);
                ModuleFetchException x = cause == null
                        ? new ModuleFetchException(rec.key(), "Document loader returned no source for '" + rec.key() + "'")
                        : new ModuleFetchException(rec.key(), "Failed to load module '" + rec.key() + "'", cause);
                fail(rec, x);
                throw x;
            }
            if (rec.source == null) rec.source = src;
            log.debug("[modules] fetch: {} ({} chars)", rec.key(), src.length());
            return rec.source;
        }, engineThread);
        return rec.fetch;
    }

    private static ModuleLoadException asLoadException(String key, Throwable err) {
        Throwable cause = unwrap(err);
        if (cause instanceof ModuleLoadException) return (ModuleLoadException) cause;
        if (cause instanceof CancellationException) return new ModuleCancelledException(key);
        return new ModuleFetchException(key, "Failed to load module graph of '" + key + "'", cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof UncheckedIOException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
