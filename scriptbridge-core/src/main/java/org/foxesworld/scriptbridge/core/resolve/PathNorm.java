// FILE: PathNorm.java
package org.foxesworld.scriptbridge.core.resolve;

// Author: Calista Verner

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String helpers for canonical module keys. Keys use {@code /} separators, never start with
 * {@code /} or {@code ./} and never contain {@code //}. Absolute URI keys are left to
 * {@link java.net.URI}.
 */
public final class PathNorm {
    private PathNorm() {}

    /** Scheme of at least two characters, so {@code C:/x} stays a path. */
    private static final Pattern URI_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]+:");

    public static boolean isAbsoluteUri(String s) {
        return s != null && URI_SCHEME.matcher(s).find();
    }

    public static String normalizeKey(String key) {
        if (key == null) return "";
        String id = key.trim().replace('\\', '/');
        if (isAbsoluteUri(id)) return id;

        while (id.startsWith("./")) id = id.substring(2);
        while (id.startsWith("/")) id = id.substring(1);

        id = collapseSlashes(id);
        while (id.endsWith("/")) id = id.substring(0, id.length() - 1);

        return id;
    }

    public static String dirnameOf(String key) {
        if (key == null) return "";
        String id = key.replace('\\', '/');
        int idx = id.lastIndexOf('/');
        return idx < 0 ? "" : id.substring(0, idx);
    }

    public static String lastSegment(String key) {
        if (key == null) return "";
        String id = key.replace('\\', '/');
        int idx = id.lastIndexOf('/');
        return idx < 0 ? id : id.substring(idx + 1);
    }

    /** "has extension" only if '.' is in the last segment and not its first character. */
    public static boolean hasExtension(String key) {
        if (key == null) return false;
        String id = key.replace('\\', '/');
        int slash = id.lastIndexOf('/');
        int dot = id.lastIndexOf('.');
        return dot > slash + 1;
    }

    /** Join path segments and normalize slashes. Does NOT strip trailing slash. */
    public static String join(String a, String b) {
        String aa = (a == null) ? "" : a.replace('\\', '/');
        String bb = (b == null) ? "" : b.replace('\\', '/');

        if (aa.endsWith("/")) aa = aa.substring(0, aa.length() - 1);
        while (bb.startsWith("/")) bb = bb.substring(1);

        String out = aa.isEmpty() ? bb : (aa + "/" + bb);
        return collapseSlashes(out);
    }

    /**
     * Resolves {@code request} against directory {@code baseDir}, applying {@code .} and
     * {@code ..} segments. {@code ..} never climbs above the root.
     */
    public static String resolveAgainst(String baseDir, String request) {
        Deque<String> parts = new ArrayDeque<>();
        String req = request == null ? "" : request.replace('\\', '/');

        if (!req.startsWith("/") && baseDir != null) {
            for (String p : baseDir.replace('\\', '/').split("/")) {
                if (!p.isEmpty() && !".".equals(p)) parts.addLast(p);
            }
        }

        for (String p : req.split("/")) {
            if (p.isEmpty() || ".".equals(p)) continue;
            if ("..".equals(p)) {
                if (!parts.isEmpty()) parts.removeLast();
            } else {
                parts.addLast(p);
            }
        }

        StringBuilder sb = new StringBuilder();
        Iterator<String> it = parts.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append('/');
        }
        return sb.toString();
    }

    /**
     * Expands a base key into lookup candidates: the key itself when its last segment has an
     * extension, otherwise one candidate per extension in order.
     */
    public static List<String> expandCandidates(String base, List<String> extensions) {
        if (base == null || base.isEmpty()) return List.of();
        if (hasExtension(base) || extensions.isEmpty()) return List.of(base);

        List<String> out = new ArrayList<>(extensions.size());
        for (String ext : extensions) {
            out.add(ext.startsWith("/") ? join(base, ext) : base + ext);
        }
        return out;
    }

    private static String collapseSlashes(String s) {
        if (s.indexOf("//") < 0) return s;
        StringBuilder out = new StringBuilder(s.length());
        char prev = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' && prev == '/') continue;
            out.append(c);
            prev = c;
        }
        return out.toString();
    }
}
