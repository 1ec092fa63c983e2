// FILE: ModuleExecutor.java
package org.foxesworld.scriptbridge.core.module;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.scriptbridge.core.document.DocumentCategory;
import org.foxesworld.scriptbridge.core.error.ModuleLoadException;
import org.foxesworld.scriptbridge.core.error.ModuleResolutionException;
import org.foxesworld.scriptbridge.core.resolve.PathNorm;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a fetched module body according to its flavor. Called by {@link ModuleLoader} with the
 * record in {@code LOADING}; on return the record's exports are final.
 *
 * Author: Calista Verner
 */
final class ModuleExecutor {

    private static final Logger log = LogManager.getLogger(ModuleExecutor.class);

    static final String COMMONJS_PREFIX = "(function (module, exports, require, __filename, __dirname) {\n";
    static final String COMMONJS_SUFFIX = "\n})";

    private static final String MODULE_FACTORY =
            "(function (id, uri, exports, initializeContext) {\n" +
            "  var module = {};\n" +
            "  Object.defineProperty(module, 'id', { value: id, enumerable: true });\n" +
            "  if (uri !== null && uri !== undefined) Object.defineProperty(module, 'uri', { value: uri, enumerable: true });\n" +
            "  module.exports = exports;\n" +
            "  var meta;\n" +
            "  Object.defineProperty(module, 'meta', { enumerable: true, get: function () {\n" +
            "    if (meta === undefined) { meta = {}; initializeContext(meta); }\n" +
            "    return meta;\n" +
            "  } });\n" +
            "  return module;\n" +
            "})";

    private final ModuleEngine engine;
    private final ModuleLoader loader;
    private final ContextBuilder contexts;
    private final ModuleSyntaxRewriter rewriter;

    private Object moduleFactory;

    ModuleExecutor(ModuleEngine engine, ModuleLoader loader, ContextBuilder contexts, ModuleSyntaxRewriter rewriter) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    }

    void execute(ModuleRecord rec) {
        if (rec.document().category() == DocumentCategory.JSON) {
            executeJson(rec);
            return;
        }
        switch (rec.flavor()) {
            case STANDARD:
                executeStandard(rec);
                break;
            case COMMONJS:
                executeCommonJs(rec);
                break;
            case LEGACY_COMMONJS:
                executeLegacy(rec);
                break;
            default:
                throw new IllegalStateException("Unknown flavor " + rec.flavor());
        }
    }

    RewrittenModule rewrittenOf(ModuleRecord rec) {
        if (rec.rewritten == null) {
            rec.rewritten = rewriter.rewrite(rec.source);
        }
        return rec.rewritten;
    }

    /** Script view of the module context, created once per record. */
    Object metaOf(ModuleRecord rec) {
        if (rec.meta == null) {
            if (rec.flavor().policy().contextSource() == FlavorPolicy.ContextSource.HOST_BAG) {
                rec.meta = engine.exposeBag(new MapPropertyBag(contexts.contextOf(rec)));
            } else {
                Object obj = engine.createObject();
                populate(obj, contexts.contextOf(rec));
                rec.meta = obj;
            }
        }
        return rec.meta;
    }

    // ---------------------------------------------------------------------
    // Flavors
    // ---------------------------------------------------------------------

    private void executeJson(ModuleRecord rec) {
        Object parsed = engine.parseJson(rec.source);
        if (rec.namespace != null) {
            rec.namespace.bind("default", () -> parsed);
        } else {
            rec.exports = parsed;
        }
        log.debug("[modules] exec: json {}", rec.key());
    }

    private void executeCommonJs(ModuleRecord rec) {
        String uri = rec.document().uri() == null ? null : rec.document().uri().toString();
        Object initializeContext = engine.createFunction(args -> {
            Object target = args.length > 0 ? args[0] : null;
            if (rec.meta == null && target != null) {
                populate(target, contexts.contextOf(rec));
                rec.meta = target;
            }
            return null;
        });
        rec.moduleObject = engine.invoke(moduleFactory(), rec.key(), uri, rec.exports, initializeContext);

        Object fn = engine.evaluate(rec.key(), COMMONJS_PREFIX + rec.source + COMMONJS_SUFFIX);
        engine.invoke(fn, rec.moduleObject, rec.exports, requireFor(rec), rec.key(), PathNorm.dirnameOf(rec.key()));

        rec.exports = engine.getProperty(rec.moduleObject, "exports");
        log.debug("[modules] exec: commonjs {}", rec.key());
    }

    private void executeLegacy(ModuleRecord rec) {
        String uri = rec.document().uri() == null ? null : rec.document().uri().toString();
        LegacyModule module = new LegacyModule(rec.key(), uri, rec.exports, () -> metaOf(rec));
        rec.moduleObject = engine.exposeBag(module);

        Object fn = engine.evaluate(rec.key(), COMMONJS_PREFIX + rec.source + COMMONJS_SUFFIX);
        engine.invoke(fn, rec.moduleObject, rec.exports, requireFor(rec), rec.key(), PathNorm.dirnameOf(rec.key()));

        rec.exports = module.exports();
        log.debug("[modules] exec: legacy commonjs {}", rec.key());
    }

    private void executeStandard(ModuleRecord rec) {
        RewrittenModule rw = rewrittenOf(rec);
        ModuleNamespace ns = rec.namespace;

        Object bind = engine.createFunction(args -> {
            Object getter = args[1];
            ns.bind(String.valueOf(args[0]), () -> engine.invoke(getter));
            return null;
        });
        Object importFn = engine.createFunction(args ->
                loader.namespaceObjectOf(loader.importSync(rec.key(), specifierOf(args))));
        Object reexport = engine.createFunction(args -> {
            ModuleRecord dep = loader.importSync(rec.key(), specifierOf(args));
            String importName = args.length > 1 && args[1] != null ? String.valueOf(args[1]) : null;
            String exportName = args.length > 2 && args[2] != null ? String.valueOf(args[2]) : null;
            if (dep.namespace == null) {
                // CommonJS dependency admitted through ALLOW_CATEGORY_MISMATCH
                if (exportName == null) {
                    throw new ModuleResolutionException(specifierOf(args), dep.key(),
                            "Cannot re-export all bindings of non-standard module '" + dep.key() + "'");
                }
                ns.bind(exportName, "*".equals(importName)
                        ? () -> dep.exports
                        : () -> engine.getProperty(dep.exports, importName));
            } else if ("*".equals(importName)) {
                if (exportName == null) {
                    ns.addStarSource(dep.namespace);
                } else {
                    Object depObject = loader.namespaceObjectOf(dep);
                    ns.bind(exportName, () -> depObject);
                }
            } else {
                ModuleNamespace depNs = dep.namespace;
                ns.bind(exportName, () -> depNs.get(importName));
            }
            return null;
        });
        Object meta = engine.createFunction(args -> metaOf(rec));
        Object dynamicImport = engine.createFunction(args -> {
            ModuleHandle handle;
            try {
                handle = loader.loadModule(rec.key(), specifierOf(args), ModuleFlavor.STANDARD);
            } catch (ModuleLoadException e) {
                return engine.createPromise(CompletableFuture.failedFuture(e));
            }
            return engine.createPromise(handle.future()
                    .thenApply(ignored -> loader.namespaceObjectOf(loader.recordOf(handle.key()))));
        });

        Object fn = engine.evaluate(rec.key(), rw.code());
        engine.invoke(fn, bind, importFn, reexport, meta, dynamicImport, Binding.UNINITIALIZED);
        log.debug("[modules] exec: standard {} exports={}", rec.key(), ns.keys());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Object requireFor(ModuleRecord rec) {
        return engine.createFunction(args -> loader.require(rec.key(), specifierOf(args), rec.flavor()));
    }

    private Object moduleFactory() {
        if (moduleFactory == null) {
            moduleFactory = engine.evaluate("scriptbridge-commonjs-module.js", MODULE_FACTORY);
        }
        return moduleFactory;
    }

    private void populate(Object target, Map<String, Object> context) {
        for (Map.Entry<String, Object> e : context.entrySet()) {
            engine.setProperty(target, e.getKey(), e.getValue());
        }
    }

    private static String specifierOf(Object[] args) {
        return args.length > 0 && args[0] != null ? String.valueOf(args[0]) : "";
    }
}
