// FILE: ScriptLexer.java
package org.foxesworld.scriptbridge.core.module;

// Author: Calista Verner

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Splits JavaScript source into significant tokens. Comments and whitespace are skipped;
 * strings, template chunks and regular expression literals are opaque tokens, so nothing inside
 * them is taken for code.
 *
 * <p>Brackets are paired through {@link Token#match}: an opener points at its closer and a
 * closer back at its opener. Template literals with substitutions are split into chunks at
 * each substitution; a chunk that opens a substitution points forward at the chunk that
 * closes it.</p>
 *
 * <p>{@link Token#depth} is the bracket nesting outside the token; an opener and its closer
 * share the same depth.</p>
 */
final class ScriptLexer {

    enum Kind { IDENT, NUMBER, STRING, TEMPLATE, REGEX, PUNCT }

    static final class Token {
        final Kind kind;
        final int start;
        final int end;
        final String text;
        final boolean newlineBefore;
        final int depth;
        int match = -1;

        Token(Kind kind, int start, int end, String text, boolean newlineBefore, int depth) {
            this.kind = kind;
            this.start = start;
            this.end = end;
            this.text = text;
            this.newlineBefore = newlineBefore;
            this.depth = depth;
        }

        boolean is(String s) {
            return (kind == Kind.PUNCT || kind == Kind.IDENT) && text.equals(s);
        }

        boolean isIdent() {
            return kind == Kind.IDENT;
        }

        /** An opening bracket, or a template chunk that opens a substitution. */
        boolean opens() {
            if (kind == Kind.TEMPLATE) return text.endsWith("${");
            return kind == Kind.PUNCT && (text.equals("{") || text.equals("(") || text.equals("["));
        }

        boolean closes() {
            if (kind == Kind.TEMPLATE) return text.startsWith("}");
            return kind == Kind.PUNCT && (text.equals("}") || text.equals(")") || text.equals("]"));
        }

        @Override
        public String toString() {
            return kind + "(" + text + ")@" + start;
        }
    }

    private static final String[] OPERATORS = {
            ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
            "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "**",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>"
    };

    private static final Set<String> REGEX_AFTER_WORDS = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw",
            "case", "do", "else", "yield", "await");

    private ScriptLexer() {
    }

    static List<Token> tokenize(String src) {
        List<Token> out = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();
        int n = src.length();
        int i = 0;
        boolean newline = false;

        if (src.startsWith("#!")) i = lineEnd(src, 0);

        while (i < n) {
            char c = src.charAt(i);

            if (isLineBreak(c)) {
                newline = true;
                i++;
                continue;
            }
            if (Character.isWhitespace(c) || c == (char) 0xA0 || c == (char) 0xFEFF) {
                i++;
                continue;
            }
            if (c == '/' && i + 1 < n && src.charAt(i + 1) == '/') {
                i = lineEnd(src, i);
                continue;
            }
            if (c == '/' && i + 1 < n && src.charAt(i + 1) == '*') {
                int close = src.indexOf("*/", i + 2);
                int stop = close < 0 ? n : close + 2;
                for (int k = i; k < stop; k++) {
                    if (isLineBreak(src.charAt(k))) newline = true;
                }
                i = stop;
                continue;
            }

            int start = i;
            Token prev = out.isEmpty() ? null : out.get(out.size() - 1);
            int depth = open.size();

            if (c == '\'' || c == '"') {
                i = skipString(src, i, c);
                out.add(new Token(Kind.STRING, start, i, src.substring(start, i), newline, depth));
            } else if (c == '`') {
                i = skipTemplate(src, i + 1);
                Token t = new Token(Kind.TEMPLATE, start, i, src.substring(start, i), newline, depth);
                out.add(t);
                if (t.opens()) open.push(out.size() - 1);
            } else if (c == '}' && !open.isEmpty() && out.get(open.peek()).kind == Kind.TEMPLATE) {
                i = skipTemplate(src, i + 1);
                int opener = open.pop();
                Token t = new Token(Kind.TEMPLATE, start, i, src.substring(start, i), newline, open.size());
                out.add(t);
                out.get(opener).match = out.size() - 1;
                if (t.opens()) open.push(out.size() - 1);
            } else if (c == '/' && regexAllowed(prev)) {
                i = skipRegex(src, i);
                out.add(new Token(Kind.REGEX, start, i, src.substring(start, i), newline, depth));
            } else if (Character.isJavaIdentifierStart(c) || c == '\\' || c == '#') {
                i++;
                while (i < n && (Character.isJavaIdentifierPart(src.charAt(i)) || src.charAt(i) == '\\')) i++;
                out.add(new Token(Kind.IDENT, start, i, src.substring(start, i), newline, depth));
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(src.charAt(i + 1)))) {
                i++;
                while (i < n && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '.' || src.charAt(i) == '_')) i++;
                out.add(new Token(Kind.NUMBER, start, i, src.substring(start, i), newline, depth));
            } else {
                String op = operatorAt(src, i);
                i += op.length();
                if (op.equals("{") || op.equals("(") || op.equals("[")) {
                    out.add(new Token(Kind.PUNCT, start, i, op, newline, depth));
                    open.push(out.size() - 1);
                } else if (op.equals("}") || op.equals(")") || op.equals("]")) {
                    int opener = open.isEmpty() ? -1 : open.pop();
                    Token t = new Token(Kind.PUNCT, start, i, op, newline, open.size());
                    out.add(t);
                    if (opener >= 0) {
                        out.get(opener).match = out.size() - 1;
                        t.match = opener;
                    }
                } else {
                    out.add(new Token(Kind.PUNCT, start, i, op, newline, depth));
                }
            }
            newline = false;
        }
        return out;
    }

    static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r' || c == (char) 0x2028 || c == (char) 0x2029;
    }

    private static int lineEnd(String src, int from) {
        int i = from;
        while (i < src.length() && !isLineBreak(src.charAt(i))) i++;
        return i;
    }

    private static int skipString(String src, int from, char quote) {
        int i = from + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (c == '\n') return i;
            i++;
        }
        return src.length();
    }

    /** Scans template text; stops after the closing backtick or after a substitution opener. */
    private static int skipTemplate(String src, int from) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '`') return i + 1;
            if (c == '$' && i + 1 < src.length() && src.charAt(i + 1) == '{') return i + 2;
            i++;
        }
        return src.length();
    }

    private static int skipRegex(String src, int from) {
        int i = from + 1;
        boolean inClass = false;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (isLineBreak(c)) break;
            if (c == '[') inClass = true;
            else if (c == ']') inClass = false;
            else if (c == '/' && !inClass) {
                i++;
                break;
            }
            i++;
        }
        while (i < src.length() && Character.isJavaIdentifierPart(src.charAt(i))) i++;
        return Math.min(i, src.length());
    }

    private static boolean regexAllowed(Token prev) {
        if (prev == null) return true;
        switch (prev.kind) {
            case PUNCT:
                return !(prev.text.equals(")") || prev.text.equals("]")
                        || prev.text.equals("++") || prev.text.equals("--"));
            case IDENT:
                return REGEX_AFTER_WORDS.contains(prev.text);
            case TEMPLATE:
                return prev.opens();
            default:
                return false;
        }
    }

    private static String operatorAt(String src, int i) {
        for (String op : OPERATORS) {
            if (src.startsWith(op, i)) {
                if (op.equals("?.") && i + 2 < src.length() && Character.isDigit(src.charAt(i + 2))) continue;
                return op;
            }
        }
        return String.valueOf(src.charAt(i));
    }
}
