package org.foxesworld.scriptbridge.engine.cache;

// Author: Calista Verner

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.graalvm.polyglot.Source;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded cache of parsed GraalVM {@link Source}s, keyed by source name and content hash.
 *
 * <p>Does NOT replace the module record cache; it only saves re-building sources when the same
 * wrapped text is evaluated again (runtime resets, several contexts over the same files).</p>
 */
public final class ScriptCaches {

    private final Cache<SourceKey, Source> sources;

    private ScriptCaches(Cache<SourceKey, Source> sources) {
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    public static ScriptCaches defaults() {
        return new ScriptCaches(Caffeine.newBuilder()
                .maximumSize(512)
                .expireAfterAccess(Duration.ofMinutes(5))
                .build());
    }

    public Source source(String name, String code) {
        return sources.get(SourceKey.of(name, code),
                k -> Source.newBuilder("js", code, name).buildLiteral());
    }

    public long size() {
        return sources.estimatedSize();
    }

    public void invalidateModule(String name) {
        if (name == null) return;
        ConcurrentMap<SourceKey, Source> map = sources.asMap();
        map.keySet().removeIf(k -> name.equals(k.name));
    }

    public void invalidateAll() {
        sources.invalidateAll();
    }

    /**
     * Source name plus a stable hash of the content; the hash avoids holding large strings in
     * the key.
     */
    static final class SourceKey {
        final String name;
        final long contentHash;

        private SourceKey(String name, long contentHash) {
            this.name = name;
            this.contentHash = contentHash;
        }

        static SourceKey of(String name, String content) {
            return new SourceKey(Objects.requireNonNull(name, "name"), fnv1a64(content));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SourceKey)) return false;
            SourceKey that = (SourceKey) o;
            return contentHash == that.contentHash && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Long.hashCode(contentHash);
        }

        @Override
        public String toString() {
            return "SourceKey{" + name + ", hash=" + Long.toHexString(contentHash) + '}';
        }
    }

    private static long fnv1a64(String s) {
        if (s == null) return 0L;
        long h = 0xcbf29ce484222325L;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L;
        }
        return h;
    }
}
