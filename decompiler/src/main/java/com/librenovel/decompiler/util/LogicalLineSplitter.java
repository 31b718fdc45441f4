package com.librenovel.decompiler.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits embedded Python source into logical lines.
 * A newline ends a logical line only outside brackets, string literals and
 * comments, and when it is not escaped by a backslash. The newline itself is
 * not part of the returned line. Lines are produced on demand.
 */
public final class LogicalLineSplitter implements Iterator<String> {

    private static final String STRING_PREFIX_CHARS = "rRuUbBfF";

    private final String source;
    private final int length;
    private int pos;
    private int depth;
    private boolean finished;

    public LogicalLineSplitter(String source) {
        this.source = source;
        this.length = source.length();
    }

    /**
     * Lazily iterate over the logical lines of the source.
     */
    public static Iterable<String> lines(String source) {
        return () -> new LogicalLineSplitter(source);
    }

    /**
     * Split the source into a list of logical lines.
     */
    public static List<String> split(String source) {
        List<String> result = new ArrayList<>();
        new LogicalLineSplitter(source).forEachRemaining(result::add);
        return result;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public String next() {
        if (finished) {
            throw new NoSuchElementException();
        }

        int start = pos;
        boolean afterComment = false;
        while (pos < length) {
            char c = source.charAt(pos);

            if (c == '\n' && depth == 0 && (afterComment || pos == 0 || source.charAt(pos - 1) != '\\')) {
                String line = source.substring(start, pos);
                pos++;
                return line;
            }

            // A backslash at the end of a comment does not continue the line
            afterComment = c == '#';
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                pos++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (skipStringLiteral()) {
                // pos is already past the literal
            } else if (isWordChar(c)) {
                while (pos < length && isWordChar(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos++;
            }
        }

        finished = true;
        return source.substring(start);
    }

    private void skipComment() {
        while (pos < length && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    /**
     * Skip a string literal starting at pos, including an optional prefix
     * such as r or br. Returns false if no literal starts here.
     */
    private boolean skipStringLiteral() {
        int p = pos;
        while (p < length && p - pos < 2 && STRING_PREFIX_CHARS.indexOf(source.charAt(p)) >= 0) {
            p++;
        }
        if (p >= length) return false;

        char quote = source.charAt(p);
        if (quote != '"' && quote != '\'') return false;

        String delimiter = String.valueOf(quote);
        boolean triple = source.startsWith(delimiter.repeat(3), p);
        if (triple) {
            delimiter = delimiter.repeat(3);
        }
        p += delimiter.length();

        while (p < length) {
            char c = source.charAt(p);
            if (c == '\\') {
                p += 2;
            } else if (source.startsWith(delimiter, p)) {
                pos = p + delimiter.length();
                return true;
            } else if (c == '\n' && !triple) {
                // Unterminated literal, let the newline end the line
                break;
            } else {
                p++;
            }
        }
        pos = Math.min(p, length);
        return true;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
