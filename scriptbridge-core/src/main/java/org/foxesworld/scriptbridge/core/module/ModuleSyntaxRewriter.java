// FILE: ModuleSyntaxRewriter.java
package org.foxesworld.scriptbridge.core.module;

// Author: Calista Verner

import org.foxesworld.scriptbridge.core.module.ScriptLexer.Kind;
import org.foxesworld.scriptbridge.core.module.ScriptLexer.Token;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites standard module source into a function expression the loader links by hand:
 *
 * <pre>
 * (function (__bind, __import, __reexport, __meta, __dynamicImport, __uninitialized) { 'use strict'; ...header... body
 * })
 * </pre>
 *
 * <ul>
 *   <li>exports become {@code __bind(name, getter)} calls; getters read the local on every
 *   access and return {@code __uninitialized} while it is in its temporal dead zone;</li>
 *   <li>every import statement becomes one {@code const} over {@code __import(specifier)} in the
 *   header, in source order together with re-exports; each use of an imported name in the body
 *   becomes a member read on that namespace, so importers always see the exporter's current
 *   value;</li>
 *   <li>{@code import.meta} becomes {@code __meta()}, {@code import(x)} becomes
 *   {@code __dynamicImport(x)}.</li>
 * </ul>
 *
 * <p>Works on {@link ScriptLexer} tokens: strings, template text, regular expressions and
 * comments are never rewritten. The header sits on line 1 and removed statements keep their
 * line breaks, so body line numbers are unchanged.</p>
 *
 * <p>Imported names shadowed by a local declaration, a parameter or a {@code catch} binding
 * are left alone inside that scope. Scopes are block-based; a {@code var} is scoped to its
 * enclosing block.</p>
 */
public final class ModuleSyntaxRewriter {

    static final String PARAMS = "__bind, __import, __reexport, __meta, __dynamicImport, __uninitialized";

    private static final Set<String> NOT_A_FUNCTION_HEAD = Set.of("if", "while", "for", "switch", "with");

    private static final Set<String> OBJECT_AFTER_WORDS = Set.of(
            "return", "typeof", "yield", "await", "void", "in", "of", "delete", "case", "throw", "default");

    private static final Set<String> NOT_EXPRESSION_END = Set.of(
            "in", "of", "instanceof", "typeof", "new", "delete", "void", "return", "throw",
            "yield", "await", "case", "else", "do", "extends");

    private static final Set<String> BINARY_WORDS = Set.of("in", "of", "instanceof");

    public RewrittenModule rewrite(String source) {
        String src = source == null ? "" : source;
        Unit unit = new Unit(src, ScriptLexer.tokenize(src));
        unit.run();

        String code = "(function (" + PARAMS + ") { 'use strict'; "
                + unit.header() + unit.body() + "\n})";
        return new RewrittenModule(code, new ArrayList<>(unit.requested));
    }

    /** One rewrite: statement parsing, import use rewriting and output assembly. */
    private static final class Unit {

        private final String src;
        private final List<Token> toks;

        private final List<Edit> edits = new ArrayList<>();
        /** Tokens of removed statements; never rewritten again. */
        private final BitSet consumed = new BitSet();

        private final StringBuilder imports = new StringBuilder();
        private final Set<String> requested = new LinkedHashSet<>();
        /** Export name to local name, resolved against imports when the header is built. */
        private final Map<String, String> exports = new LinkedHashMap<>();
        /** Imported local name to the expression that reads it. */
        private final Map<String, String> importLocals = new HashMap<>();
        private int temp;

        private final Set<Integer> classBodies = new HashSet<>();
        private final Map<String, List<int[]>> shadows = new HashMap<>();

        Unit(String src, List<Token> toks) {
            this.src = src;
            this.toks = toks;
        }

        void run() {
            for (int i = 0; i < toks.size(); ) {
                Token t = toks.get(i);
                if (t.depth == 0 && t.isIdent() && !afterMemberDot(i)) {
                    if (t.is("import") && !(peekIs(i + 1, "(") || peekIs(i + 1, "."))) {
                        i = importStatement(i);
                        continue;
                    }
                    if (t.is("export")) {
                        i = exportStatement(i);
                        continue;
                    }
                }
                i++;
            }

            for (int i = 0; i < toks.size(); i++) {
                Token t = toks.get(i);
                if (consumed.get(i) || !t.is("import") || afterMemberDot(i)) continue;
                if (peekIs(i + 1, ".") && peekIs(i + 2, "meta")) {
                    edits.add(new Edit(t.start, toks.get(i + 2).end, "__meta()"));
                    consumed.set(i, i + 3);
                } else if (peekIs(i + 1, "(")) {
                    edits.add(new Edit(t.start, toks.get(i + 1).end, "__dynamicImport("));
                    consumed.set(i, i + 2);
                }
            }

            if (!importLocals.isEmpty()) {
                markClassBodies();
                collectShadows();
                rewriteImportUses();
            }
        }

        String header() {
            StringBuilder binds = new StringBuilder();
            for (Map.Entry<String, String> e : exports.entrySet()) {
                String local = e.getValue();
                appendBind(binds, e.getKey(), importLocals.getOrDefault(local, local));
            }
            return binds.toString() + imports;
        }

        String body() {
            edits.sort(Comparator.comparingInt(e -> e.start));
            StringBuilder out = new StringBuilder(src.length() + 64);
            int pos = 0;
            for (Edit e : edits) {
                out.append(src, pos, e.start).append(e.replacement);
                pos = e.end;
            }
            return out.append(src, pos, src.length()).toString();
        }

        // -----------------------------------------------------------------
        // import / export statements
        // -----------------------------------------------------------------

        private int importStatement(int i) {
            int j = i + 1;
            if (kindAt(j) == Kind.STRING) {
                String spec = specifier(j);
                requested.add(spec);
                imports.append("__import(").append(jsString(spec)).append("); ");
                return removeStatement(i, afterAttributes(j + 1));
            }

            String defaultName = null;
            String nsName = null;
            List<String[]> named = null;

            if (identAt(j) && !peekIs(j, "from")) {
                defaultName = toks.get(j).text;
                j++;
                if (peekIs(j, ",")) j++;
            } else if (peekIs(j, "from") && peekIs(j + 1, "from")) {
                defaultName = "from";
                j++;
            }
            if (peekIs(j, "*")) {
                if (!peekIs(j + 1, "as") || !identAt(j + 2)) throw unsupported(i, "import");
                nsName = toks.get(j + 2).text;
                j += 3;
            } else if (peekIs(j, "{")) {
                named = clauseList(j, false);
                j = toks.get(j).match + 1;
            }
            if (!peekIs(j, "from") || kindAt(j + 1) != Kind.STRING) throw unsupported(i, "import");
            String spec = specifier(j + 1);
            int end = afterAttributes(j + 2);

            String source = "__import(" + jsString(spec) + ")";
            String ns;
            if (nsName != null) {
                imports.append("const ").append(nsName).append(" = ").append(source).append("; ");
                ns = nsName;
            } else if (defaultName != null || (named != null && !named.isEmpty())) {
                ns = "__m" + (temp++);
                imports.append("const ").append(ns).append(" = ").append(source).append("; ");
            } else {
                imports.append(source).append("; ");
                ns = null;
            }
            if (defaultName != null) importLocals.put(defaultName, member(ns, "default"));
            if (named != null) {
                for (String[] p : named) importLocals.put(p[1], member(ns, p[0]));
            }
            requested.add(spec);
            return removeStatement(i, end);
        }

        private int exportStatement(int i) {
            int j = i + 1;

            if (peekIs(j, "*")) {
                String as = null;
                j++;
                if (peekIs(j, "as")) {
                    as = nameAt(j + 1);
                    if (as == null) throw unsupported(i, "export");
                    j += 2;
                }
                if (!peekIs(j, "from") || kindAt(j + 1) != Kind.STRING) throw unsupported(i, "export");
                String spec = specifier(j + 1);
                requested.add(spec);
                imports.append("__reexport(").append(jsString(spec)).append(", '*', ")
                        .append(as == null ? "null" : jsString(as)).append("); ");
                return removeStatement(i, afterAttributes(j + 2));
            }

            if (peekIs(j, "{")) {
                List<String[]> pairs = clauseList(j, true);
                j = toks.get(j).match + 1;
                if (peekIs(j, "from") && kindAt(j + 1) == Kind.STRING) {
                    String spec = specifier(j + 1);
                    requested.add(spec);
                    for (String[] p : pairs) {
                        imports.append("__reexport(").append(jsString(spec)).append(", ")
                                .append(jsString(p[0])).append(", ").append(jsString(p[1])).append("); ");
                    }
                    return removeStatement(i, afterAttributes(j + 2));
                }
                for (String[] p : pairs) {
                    if (!isIdentifierName(p[0])) throw unsupported(i, "export");
                    exports.put(p[1], p[0]);
                }
                return removeStatement(i, j);
            }

            if (peekIs(j, "default")) {
                int k = j + 1;
                String declared = null;
                if (peekIs(k, "function") || (peekIs(k, "async") && peekIs(k + 1, "function") && !toks.get(k + 1).newlineBefore)) {
                    int f = peekIs(k, "async") ? k + 2 : k + 1;
                    if (peekIs(f, "*")) f++;
                    if (identAt(f)) declared = toks.get(f).text;
                } else if (peekIs(k, "class")) {
                    if (identAt(k + 1) && !peekIs(k + 1, "extends")) declared = toks.get(k + 1).text;
                }
                consumed.set(i, k);
                String gap = lineBreaksOf(src.substring(toks.get(i).start, tokStart(k)));
                if (declared != null) {
                    exports.put("default", declared);
                    edits.add(new Edit(toks.get(i).start, tokStart(k), gap));
                } else {
                    exports.put("default", "__default");
                    edits.add(new Edit(toks.get(i).start, tokStart(k), gap + "const __default = "));
                }
                return k;
            }

            List<String> names = new ArrayList<>();
            if (peekIs(j, "function") || (peekIs(j, "async") && peekIs(j + 1, "function"))) {
                int f = peekIs(j, "async") ? j + 2 : j + 1;
                if (peekIs(f, "*")) f++;
                if (!identAt(f)) throw unsupported(i, "export");
                names.add(toks.get(f).text);
            } else if (peekIs(j, "class")) {
                if (!identAt(j + 1)) throw unsupported(i, "export");
                names.add(toks.get(j + 1).text);
            } else if (peekIs(j, "const") || peekIs(j, "let") || peekIs(j, "var")) {
                declarators(j + 1, names);
            } else {
                throw unsupported(i, "export");
            }
            for (String name : names) exports.put(name, name);
            consumed.set(i);
            edits.add(new Edit(toks.get(i).start, tokStart(j),
                    lineBreaksOf(src.substring(toks.get(i).start, tokStart(j)))));
            return j;
        }

        /**
         * {@code { a, b as c }} of an import (pairs of imported, local) or an export (pairs of
         * local, exported). Names may be string literals where the syntax allows it.
         */
        private List<String[]> clauseList(int open, boolean export) {
            int close = toks.get(open).match;
            if (close < 0) throw unsupported(open, export ? "export" : "import");
            List<String[]> out = new ArrayList<>();
            int k = open + 1;
            while (k < close) {
                String first = nameAt(k);
                if (first == null) throw unsupported(open, export ? "export" : "import");
                String second = first;
                k++;
                if (peekIs(k, "as")) {
                    second = nameAt(k + 1);
                    if (second == null) throw unsupported(open, export ? "export" : "import");
                    k += 2;
                }
                if (!export && !isIdentifierName(second)) throw unsupported(open, "import");
                out.add(new String[]{first, second});
                if (k < close) {
                    if (!peekIs(k, ",")) throw unsupported(open, export ? "export" : "import");
                    k++;
                }
            }
            return out;
        }

        private int removeStatement(int from, int endExclusive) {
            int end = endExclusive;
            if (peekIs(end, ";")) end++;
            consumed.set(from, end);
            int startPos = toks.get(from).start;
            int endPos = toks.get(end - 1).end;
            edits.add(new Edit(startPos, endPos, lineBreaksOf(src.substring(startPos, endPos))));
            return end;
        }

        /** Skips {@code with { type: 'json' }} after a module specifier. */
        private int afterAttributes(int j) {
            if ((peekIs(j, "with") || peekIs(j, "assert")) && !toks.get(j).newlineBefore && peekIs(j + 1, "{")) {
                int close = toks.get(j + 1).match;
                if (close > 0) return close + 1;
            }
            return j;
        }

        // -----------------------------------------------------------------
        // binding patterns
        // -----------------------------------------------------------------

        /** Collects every name bound by a declarator list; returns the index after it. */
        private int declarators(int j, List<String> names) {
            int k = j;
            while (k < toks.size()) {
                k = pattern(k, names);
                if (peekIs(k, "=")) k = skipExpression(k + 1);
                if (peekIs(k, ",")) {
                    k++;
                    continue;
                }
                break;
            }
            return k;
        }

        private int pattern(int k, List<String> names) {
            Token t = tok(k);
            if (t == null) throw unsupported(k - 1, "declaration");
            if (t.isIdent()) {
                names.add(t.text);
                return k + 1;
            }
            if ((t.is("{") || t.is("[")) && t.match > k) {
                if (t.is("{")) objectPattern(k + 1, t.match, names);
                else elementList(k + 1, t.match, names);
                return t.match + 1;
            }
            throw unsupported(k, "declaration");
        }

        private void objectPattern(int from, int close, List<String> names) {
            int k = from;
            while (k < close) {
                if (peekIs(k, "...")) {
                    k = pattern(k + 1, names);
                } else {
                    Token key = toks.get(k);
                    if (key.is("[") && key.match > k) {
                        k = key.match + 1;
                    } else {
                        k++;
                    }
                    if (peekIs(k, ":")) {
                        k = pattern(k + 1, names);
                    } else if (key.isIdent()) {
                        names.add(key.text);
                    } else {
                        throw unsupported(k, "declaration");
                    }
                }
                if (peekIs(k, "=")) k = skipExpression(k + 1);
                if (k < close) {
                    if (!peekIs(k, ",")) throw unsupported(k, "declaration");
                    k++;
                }
            }
        }

        /** Array pattern elements or a parameter list. */
        private void elementList(int from, int close, List<String> names) {
            int k = from;
            while (k < close) {
                if (peekIs(k, ",")) {
                    k++;
                    continue;
                }
                k = pattern(peekIs(k, "...") ? k + 1 : k, names);
                if (peekIs(k, "=")) k = skipExpression(k + 1);
                if (k < close) {
                    if (!peekIs(k, ",")) throw unsupported(k, "declaration");
                    k++;
                }
            }
        }

        /**
         * Index of the first token after an assignment expression: a {@code ,} or {@code ;} at
         * the same nesting, the enclosing closer, or an automatic semicolon.
         */
        private int skipExpression(int from) {
            if (from >= toks.size()) return from;
            int base = toks.get(from).depth;
            int k = from;
            while (k < toks.size()) {
                Token t = toks.get(k);
                if (t.depth < base) return k;
                if (t.depth == base && (t.is(",") || t.is(";"))) return k;
                if (k > from && t.newlineBefore && t.depth == base && asiBoundary(toks.get(k - 1), t)) return k;
                if (t.opens() && t.match > k) {
                    k = t.match;
                    if (!toks.get(k).opens()) k++;
                    continue;
                }
                k++;
            }
            return k;
        }

        private boolean asiBoundary(Token prev, Token next) {
            boolean prevEnds;
            switch (prev.kind) {
                case IDENT:
                    prevEnds = !NOT_EXPRESSION_END.contains(prev.text);
                    break;
                case NUMBER:
                case STRING:
                case REGEX:
                    prevEnds = true;
                    break;
                case TEMPLATE:
                    prevEnds = !prev.opens();
                    break;
                default:
                    prevEnds = prev.is(")") || prev.is("]") || prev.is("}") || prev.is("++") || prev.is("--");
            }
            if (!prevEnds) return false;
            if (next.kind == Kind.IDENT) return !BINARY_WORDS.contains(next.text);
            return next.kind == Kind.NUMBER || next.kind == Kind.STRING
                    || (next.kind == Kind.TEMPLATE && next.text.startsWith("`"))
                    || next.is("++") || next.is("--");
        }

        // -----------------------------------------------------------------
        // imported name uses
        // -----------------------------------------------------------------

        private void markClassBodies() {
            for (int i = 0; i < toks.size(); i++) {
                if (!toks.get(i).is("class") || afterMemberDot(i)) continue;
                int depth = toks.get(i).depth;
                for (int k = i + 1; k < toks.size(); k++) {
                    Token t = toks.get(k);
                    if (t.depth < depth) break;
                    if (t.depth == depth && t.is("{")) {
                        classBodies.add(k);
                        break;
                    }
                    if (t.opens() && t.match > k) k = t.match;
                }
            }
        }

        private void collectShadows() {
            for (int i = 0; i < toks.size(); i++) {
                Token t = toks.get(i);
                if (consumed.get(i) || afterMemberDot(i)) continue;

                if ((t.is("let") || t.is("const") || t.is("var")) && t.depth > 0) {
                    List<String> names = new ArrayList<>();
                    int end;
                    try {
                        end = declarators(i + 1, names);
                    } catch (IllegalArgumentException e) {
                        // not a declaration the pattern reader understands; nothing is shadowed
                        continue;
                    }
                    int[] scope = declarationScope(i, end);
                    for (String n : names) shadow(n, scope);
                } else if ((t.is("function") || t.is("class")) && t.depth > 0) {
                    int f = i + 1;
                    if (peekIs(f, "*")) f++;
                    if (identAt(f) && !peekIs(f, "extends")) {
                        int[] scope = enclosingBlock(i);
                        if (scope != null) shadow(toks.get(f).text, scope);
                    }
                } else if (t.is("(") && t.match > i && peekIs(t.match + 1, "{") && isFunctionHead(i)) {
                    List<String> names = new ArrayList<>();
                    try {
                        elementList(i + 1, t.match, names);
                    } catch (IllegalArgumentException e) {
                        continue; // not a parameter list
                    }
                    int[] scope = {i, toks.get(t.match + 1).match};
                    for (String n : names) shadow(n, scope);
                } else if (t.is("=>") && i > 0) {
                    List<String> names = new ArrayList<>();
                    Token p = toks.get(i - 1);
                    int from;
                    if (p.isIdent()) {
                        names.add(p.text);
                        from = i - 1;
                    } else if (p.is(")") && p.match >= 0) {
                        from = p.match;
                        try {
                            elementList(p.match + 1, i - 1, names);
                        } catch (IllegalArgumentException e) {
                            continue; // parenthesized expression, not parameters
                        }
                    } else {
                        continue;
                    }
                    int to = peekIs(i + 1, "{") && toks.get(i + 1).match > i
                            ? toks.get(i + 1).match
                            : skipExpression(i + 1) - 1;
                    int[] scope = {from, to};
                    for (String n : names) shadow(n, scope);
                }
            }
        }

        private boolean isFunctionHead(int paren) {
            if (paren == 0) return false;
            Token before = toks.get(paren - 1);
            if (before.isIdent()) return !NOT_A_FUNCTION_HEAD.contains(before.text);
            return before.is("]") || before.is("*");
        }

        private int[] declarationScope(int decl, int end) {
            if (decl >= 2 && toks.get(decl - 1).is("(") && toks.get(decl - 2).is("for")) {
                int close = toks.get(decl - 1).match;
                if (close < 0) return new int[]{decl, end};
                int stop = peekIs(close + 1, "{") && toks.get(close + 1).match > 0
                        ? toks.get(close + 1).match
                        : skipExpression(close + 1);
                return new int[]{decl - 1, stop};
            }
            int[] block = enclosingBlock(decl);
            return block != null ? block : new int[]{decl, end};
        }

        /** Innermost {@code {...}} holding token {@code k}, as token indices. */
        private int[] enclosingBlock(int k) {
            int depth = toks.get(k).depth;
            for (int i = k - 1; i >= 0 && depth > 0; i--) {
                Token t = toks.get(i);
                if (t.opens() && t.depth < depth) {
                    if (t.is("{") && t.match > k) return new int[]{i, t.match};
                    depth = t.depth;
                }
            }
            return null;
        }

        private void shadow(String name, int[] scope) {
            if (!importLocals.containsKey(name)) return;
            shadows.computeIfAbsent(name, n -> new ArrayList<>()).add(scope);
        }

        private boolean shadowed(String name, int k) {
            List<int[]> scopes = shadows.get(name);
            if (scopes == null) return false;
            for (int[] s : scopes) {
                if (k >= s[0] && k <= s[1]) return true;
            }
            return false;
        }

        private void rewriteImportUses() {
            for (int i = 0; i < toks.size(); i++) {
                Token t = toks.get(i);
                if (consumed.get(i) || !t.isIdent()) continue;
                String read = importLocals.get(t.text);
                if (read == null || afterMemberDot(i) || shadowed(t.text, i)) continue;

                Token prev = i > 0 ? toks.get(i - 1) : null;
                Token next = tok(i + 1);
                if (prev != null && (prev.is("break") || prev.is("continue"))) continue;

                int container = enclosingOpener(i);
                boolean keyPosition = prev != null && (prev.is("{") || prev.is(","));
                if (container >= 0 && toks.get(container).is("{")) {
                    if (classBodies.contains(container)) {
                        if (isClassMemberName(prev, next)) continue;
                    } else if (isObjectLiteral(container)) {
                        if (keyPosition && next != null && (next.is(":") || next.is("("))) continue;
                        if (prev != null && (prev.is("get") || prev.is("set") || prev.is("async") || prev.is("*"))
                                && next != null && next.is("(")) continue;
                        if (keyPosition && next != null && (next.is(",") || next.is("}"))) {
                            edits.add(new Edit(t.start, t.end, t.text + ": " + read));
                            continue;
                        }
                    }
                }
                if (next != null && next.is(":") && (prev == null || prev.is(";") || prev.is("{") || prev.is("}"))
                        && (container < 0 || !isObjectLiteral(container))) {
                    continue; // label
                }
                // a call through the namespace must not pass it as `this`
                boolean call = next != null && (next.is("(") || (next.kind == Kind.TEMPLATE && next.text.startsWith("`")))
                        && (prev == null || !prev.is("new"));
                edits.add(new Edit(t.start, t.end, call ? "(0, " + read + ")" : read));
            }
        }

        private boolean isClassMemberName(Token prev, Token next) {
            boolean memberStart = prev == null || prev.is("{") || prev.is(";") || prev.is("}")
                    || prev.is("static") || prev.is("get") || prev.is("set") || prev.is("async") || prev.is("*");
            return memberStart && (next == null || next.is("(") || next.is("=") || next.is(";")
                    || next.is("}") || next.newlineBefore);
        }

        private boolean isObjectLiteral(int brace) {
            if (classBodies.contains(brace)) return false;
            Token p = brace > 0 ? toks.get(brace - 1) : null;
            if (p == null) return false;
            switch (p.kind) {
                case IDENT:
                    return OBJECT_AFTER_WORDS.contains(p.text);
                case TEMPLATE:
                    return p.opens();
                case PUNCT:
                    return !(p.is(")") || p.is("{") || p.is("}") || p.is(";") || p.is("=>"));
                default:
                    return false;
            }
        }

        private int enclosingOpener(int k) {
            int depth = toks.get(k).depth;
            if (depth == 0) return -1;
            for (int i = k - 1; i >= 0; i--) {
                Token t = toks.get(i);
                if (t.opens() && t.depth == depth - 1 && t.match > k) return i;
                if (t.opens() && t.depth == depth - 1 && t.kind == Kind.TEMPLATE) return i;
            }
            return -1;
        }

        // -----------------------------------------------------------------
        // helpers
        // -----------------------------------------------------------------

        private Token tok(int k) {
            return k >= 0 && k < toks.size() ? toks.get(k) : null;
        }

        private boolean peekIs(int k, String text) {
            Token t = tok(k);
            return t != null && t.is(text);
        }

        private boolean identAt(int k) {
            Token t = tok(k);
            return t != null && t.isIdent();
        }

        private Kind kindAt(int k) {
            Token t = tok(k);
            return t == null ? null : t.kind;
        }

        private int tokStart(int k) {
            Token t = tok(k);
            return t == null ? src.length() : t.start;
        }

        private boolean afterMemberDot(int k) {
            return k > 0 && (toks.get(k - 1).is(".") || toks.get(k - 1).is("?."));
        }

        /** Identifier or string literal name in an import/export clause. */
        private String nameAt(int k) {
            Token t = tok(k);
            if (t == null) return null;
            if (t.isIdent()) return t.text;
            if (t.kind == Kind.STRING) return unquote(t.text);
            return null;
        }

        private String specifier(int k) {
            return unquote(toks.get(k).text);
        }

        private IllegalArgumentException unsupported(int k, String what) {
            Token t = tok(Math.max(0, Math.min(k, toks.size() - 1)));
            int line = 1;
            int upTo = t == null ? 0 : t.start;
            for (int i = 0; i < upTo; i++) {
                if (src.charAt(i) == '\n') line++;
            }
            return new IllegalArgumentException("Unsupported " + what + " syntax at line " + line
                    + (t == null ? "" : " near '" + t.text + "'"));
        }
    }

    private static final class Edit {
        final int start;
        final int end;
        final String replacement;

        Edit(int start, int end, String replacement) {
            this.start = start;
            this.end = end;
            this.replacement = replacement;
        }
    }

    private static String member(String ns, String name) {
        return isIdentifierName(name) ? ns + "." + name : ns + "[" + jsString(name) + "]";
    }

    static boolean isIdentifierName(String s) {
        if (s == null || s.isEmpty() || !Character.isJavaIdentifierStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); i++) {
            if (!Character.isJavaIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }

    private static void appendBind(StringBuilder binds, String exportName, String local) {
        binds.append("__bind(").append(jsString(exportName))
                .append(", function () { try { return ").append(local)
                .append("; } catch (e) { if (e instanceof ReferenceError) return __uninitialized; throw e; } }); ");
    }

    private static String lineBreaksOf(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') sb.append('\n');
        }
        return sb.toString();
    }

    private static String unquote(String literal) {
        if (literal.length() < 2) return literal;
        String inner = literal.substring(1, literal.length() - 1);
        if (inner.indexOf('\\') < 0) return inner;
        StringBuilder sb = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                char n = inner.charAt(++i);
                sb.append(n == 'n' ? '\n' : n == 't' ? '\t' : n);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String jsString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                default: sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
