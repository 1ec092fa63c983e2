// FILE: ModuleRecord.java
package org.foxesworld.scriptbridge.core.module;

import org.foxesworld.scriptbridge.core.document.UniqueDocumentInfo;
import org.foxesworld.scriptbridge.core.error.ModuleLoadException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Loader-side state of one canonical key. Created once per key, before fetch and execution,
 * and kept until the loader is reset.
 *
 * <p>State moves forward only: {@code PENDING -> LOADING -> READY | FAILED}, or
 * {@code PENDING -> FAILED} on fetch failure and cancellation. Mutated on the engine thread
 * only.</p>
 */
public final class ModuleRecord {

    private final String key;
    private final ModuleFlavor flavor;
    private final UniqueDocumentInfo document;

    ModuleState state = ModuleState.PENDING;
    ModuleLoadException error;

    /** Engine exports object (CommonJS family). Replaced at most once, when the body completes. */
    Object exports;
    /** Module object handed to the CommonJS wrapper. */
    Object moduleObject;
    final ModuleNamespace namespace;
    /** Script view of {@link #namespace}, created on first import. */
    Object namespaceObject;

    String source;
    RewrittenModule rewritten;
    CompletableFuture<String> rawFetch;
    CompletableFuture<String> fetch;
    boolean graphLoading;

    Map<String, Object> context;
    Object meta;

    final List<CompletableFuture<Object>> waiters = new ArrayList<>();

    ModuleRecord(String key, ModuleFlavor flavor, UniqueDocumentInfo document) {
        this.key = Objects.requireNonNull(key, "key");
        this.flavor = Objects.requireNonNull(flavor, "flavor");
        this.document = Objects.requireNonNull(document, "document");
        this.namespace = flavor.policy().exportShape() == FlavorPolicy.ExportShape.NAMESPACE
                ? new ModuleNamespace(key)
                : null;
    }

    public String key() { return key; }

    public ModuleFlavor flavor() { return flavor; }

    public UniqueDocumentInfo document() { return document; }

    public ModuleState state() { return state; }

    public ModuleLoadException error() { return error; }

    public ModuleNamespace namespace() { return namespace; }

    /** What importers receive: the namespace for standard modules, the exports value otherwise. */
    public Object exportValue() {
        return namespace != null ? namespace : exports;
    }

    @Override
    public String toString() {
        return "ModuleRecord{" + key + ", " + flavor + ", " + state + '}';
    }
}
